package com.programmersdiary.nudge.scheduling;

import org.springframework.scheduling.TaskScheduler;

import java.util.concurrent.ScheduledFuture;

/**
 * A parsed job schedule. Implementations know how to register a task on a {@link TaskScheduler}
 * so that it fires at the occurrences they describe.
 */
public interface Schedule {

    ScheduledFuture<?> scheduleOn(TaskScheduler taskScheduler, Runnable task);
}
