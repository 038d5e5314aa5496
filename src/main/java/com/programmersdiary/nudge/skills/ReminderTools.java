package com.programmersdiary.nudge.skills;

import com.programmersdiary.nudge.scheduling.InvalidScheduleException;
import com.programmersdiary.nudge.scheduling.JobNotFoundException;
import com.programmersdiary.nudge.scheduling.ProactiveScheduler;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

/**
 * Lets the assistant manage proactive reminders. Failures are returned as text for the model to read.
 */
@Component
public class ReminderTools {

    private final ProactiveScheduler scheduler;

    public ReminderTools(ProactiveScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Tool(description = "Create a recurring proactive reminder. When it fires, the instruction is sent to the AI and the answer is delivered to the given chat.")
    public String addReminder(
            @ToolParam(description = "Cron expression (e.g. '*/5 * * * *', '0 9 * * 1-5') or interval (e.g. '@every 5m', '@every 1h')") String schedule,
            @ToolParam(description = "What the reminder should do when it fires. This becomes the AI prompt.") String instruction,
            @ToolParam(description = "The channel to send the reminder to, e.g. 'telegram' or 'cli'") String channel,
            @ToolParam(description = "The chat/conversation ID to send the reminder to") String chatId) {
        try {
            var result = scheduler.addJob(schedule, instruction, channel, chatId);
            var reply = "Reminder added (ID: " + result.jobId() + "). Schedule: " + schedule;
            if (!result.isPersisted()) {
                reply += "\nWarning: the reminder could not be saved and will be lost on restart.";
            }
            return reply;
        } catch (InvalidScheduleException e) {
            return "Invalid schedule: " + e.getMessage();
        }
    }

    @Tool(description = "Remove a proactive reminder by its ID.")
    public String removeReminder(
            @ToolParam(description = "The reminder ID to remove") String jobId) {
        try {
            var result = scheduler.removeJob(jobId);
            if (!result.isPersisted()) {
                return "Reminder " + jobId + " removed, but the change could not be saved.";
            }
            return "Reminder " + jobId + " removed.";
        } catch (JobNotFoundException e) {
            return "Reminder not found: " + jobId;
        }
    }

    @Tool(description = "List all active proactive reminders.")
    public String listReminders() {
        var jobs = scheduler.listJobs();
        if (jobs.isEmpty()) {
            return "No active reminders.";
        }
        var sb = new StringBuilder("Active reminders:\n\n");
        for (var job : jobs) {
            sb.append("- ID: ").append(job.id())
                    .append(" | Schedule: ").append(job.schedule())
                    .append(" | Channel: ").append(job.channel())
                    .append(" | Chat: ").append(job.chatId())
                    .append("\n  Instruction: ").append(job.instruction())
                    .append('\n');
        }
        return sb.toString();
    }
}
