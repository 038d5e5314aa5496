package com.programmersdiary.nudge.scheduling;

import com.programmersdiary.nudge.bus.MessageBus;
import com.programmersdiary.nudge.bus.OutboundMessage;
import com.programmersdiary.nudge.provider.ChatModelResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Runs one occurrence of a job: asks the model what to tell the user and publishes the answer.
 * A failed call or a blank answer drops the occurrence; there is no retry.
 */
@Component
public class FireDispatcher {

    private static final Logger log = LoggerFactory.getLogger(FireDispatcher.class);
    private static final DateTimeFormatter PROMPT_TIME =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss z", Locale.ENGLISH);

    private final ChatModelResolver chatModelResolver;
    private final MessageBus messageBus;
    private final Clock clock;
    private final String model;
    private final int maxTokens;
    private final double temperature;

    public FireDispatcher(ChatModelResolver chatModelResolver,
                          MessageBus messageBus,
                          Clock clock,
                          @Value("${nudge.scheduler.model:}") String model,
                          @Value("${nudge.scheduler.max-tokens:512}") int maxTokens,
                          @Value("${nudge.scheduler.temperature:0.7}") double temperature) {
        this.chatModelResolver = chatModelResolver;
        this.messageBus = messageBus;
        this.clock = clock;
        this.model = model;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
    }

    public void fire(Job job) {
        log.debug("Firing job {} ({})", job.id(), job.schedule());
        String content;
        try {
            var prompt = new Prompt(List.of(new UserMessage(buildPrompt(job))), chatOptions());
            content = responseText(chatModelResolver.resolve().call(prompt));
        } catch (Exception e) {
            log.warn("Job {} fire failed: {}", job.id(), e.getMessage());
            return;
        }
        if (content == null || content.isBlank()) {
            log.debug("Job {} produced an empty response, nothing sent", job.id());
            return;
        }
        messageBus.publishOutbound(new OutboundMessage(job.channel(), job.chatId(), content));
    }

    String buildPrompt(Job job) {
        var now = PROMPT_TIME.format(ZonedDateTime.now(clock));
        return "It is now " + now + ". Based on your instruction: " + job.instruction()
                + "\nWhat should you tell the user?";
    }

    private ChatOptions chatOptions() {
        var builder = ChatOptions.builder()
                .maxTokens(maxTokens)
                .temperature(temperature);
        if (model != null && !model.isBlank()) {
            builder.model(model);
        }
        return builder.build();
    }

    private static String responseText(ChatResponse response) {
        var result = response != null ? response.getResult() : null;
        var output = result != null ? result.getOutput() : null;
        return output != null ? output.getText() : null;
    }
}
