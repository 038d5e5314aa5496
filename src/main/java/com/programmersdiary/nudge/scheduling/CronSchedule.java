package com.programmersdiary.nudge.scheduling;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;

/**
 * Calendar schedule. The next occurrence is recomputed after every fire from the later of the
 * current time and the last scheduled time, so a fire never repeats its own occurrence.
 */
public record CronSchedule(CronFields fields) implements Schedule {

    @Override
    public ScheduledFuture<?> scheduleOn(TaskScheduler taskScheduler, Runnable task) {
        return taskScheduler.schedule(task, new CronFieldsTrigger(fields));
    }

    static final class CronFieldsTrigger implements Trigger {

        private final CronFields fields;

        CronFieldsTrigger(CronFields fields) {
            this.fields = fields;
        }

        @Override
        public Instant nextExecution(TriggerContext triggerContext) {
            var clock = triggerContext.getClock();
            var base = clock.instant();
            // a fire that ran slightly early must not match its own minute again
            var lastScheduled = triggerContext.lastScheduledExecution();
            if (lastScheduled != null && lastScheduled.isAfter(base)) {
                base = lastScheduled;
            }
            return fields.nextAfter(ZonedDateTime.ofInstant(base, clock.getZone())).toInstant();
        }
    }
}
