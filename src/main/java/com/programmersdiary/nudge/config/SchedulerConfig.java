package com.programmersdiary.nudge.config;

import com.programmersdiary.nudge.skills.ReminderTools;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ThreadPoolTaskScheduler jobTaskScheduler(@Value("${nudge.scheduler.pool-size:4}") int poolSize) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("nudge-job-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public ToolCallbackProvider reminderToolCallbacks(ReminderTools reminderTools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(reminderTools)
                .build();
    }
}
