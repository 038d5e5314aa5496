package com.programmersdiary.nudge.scheduling;

import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Fixed-rate schedule. The first fire happens one interval after scheduling; a fire that overruns
 * the interval delays the next one but never runs concurrently with it.
 */
public record IntervalSchedule(Duration interval) implements Schedule {

    @Override
    public ScheduledFuture<?> scheduleOn(TaskScheduler taskScheduler, Runnable task) {
        var firstFire = taskScheduler.getClock().instant().plus(interval);
        return taskScheduler.scheduleAtFixedRate(task, firstFire, interval);
    }
}
