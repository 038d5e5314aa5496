package com.programmersdiary.nudge.scheduling;

import org.springframework.scheduling.TaskScheduler;

import java.util.concurrent.ScheduledFuture;

/**
 * Fires one job on the shared task scheduler until cancelled. Fires of the same job never
 * overlap; a fire already in progress when the runner is cancelled runs to completion.
 */
final class JobRunner implements Runnable {

    private final Job job;
    private final FireDispatcher dispatcher;
    private volatile boolean cancelled;
    private volatile ScheduledFuture<?> future;

    JobRunner(Job job, FireDispatcher dispatcher) {
        this.job = job;
        this.dispatcher = dispatcher;
    }

    void start(Schedule schedule, TaskScheduler taskScheduler) {
        future = schedule.scheduleOn(taskScheduler, this);
    }

    @Override
    public void run() {
        if (cancelled) {
            return;
        }
        dispatcher.fire(job);
    }

    void cancel() {
        cancelled = true;
        var current = future;
        if (current != null) {
            current.cancel(false);
        }
    }
}
