package com.programmersdiary.nudge.scheduling;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.programmersdiary.nudge.storage.PrivateJsonFile;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and writes the scheduler snapshot as indented JSON. Every write replaces the whole file.
 */
@Repository
public class JobStore {

    private final PrivateJsonFile jobsFile;

    public JobStore(
            @Value("${nudge.scheduler.jobs-file:${nudge.config-dir:${user.home}/.nudge}/cron_jobs.json}") String jobsFile) {
        this.jobsFile = new PrivateJsonFile(Path.of(jobsFile), new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public Path file() {
        return jobsFile.path();
    }

    /**
     * @return the stored snapshot, or empty when no file has been written yet
     * @throws JobStoreException if the file exists but cannot be read or parsed
     */
    public Optional<PersistedState> load() {
        if (!jobsFile.exists()) {
            return Optional.empty();
        }
        try {
            return Optional.of(jobsFile.read(PersistedState.class));
        } catch (IOException e) {
            throw new JobStoreException("Failed to load jobs from " + jobsFile.path(), e);
        }
    }

    public void save(PersistedState state) throws IOException {
        jobsFile.write(state);
    }
}
