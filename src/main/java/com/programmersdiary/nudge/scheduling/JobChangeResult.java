package com.programmersdiary.nudge.scheduling;

import java.io.IOException;

/**
 * Outcome of a registry mutation. The in-memory change always happened; {@code persistenceFailure}
 * is set when the new state could not be written, in which case the change is lost on restart.
 */
public record JobChangeResult(String jobId, IOException persistenceFailure) {

    static JobChangeResult persisted(String jobId) {
        return new JobChangeResult(jobId, null);
    }

    public boolean isPersisted() {
        return persistenceFailure == null;
    }
}
