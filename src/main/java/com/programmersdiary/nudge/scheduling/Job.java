package com.programmersdiary.nudge.scheduling;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Job(
        String id,
        String schedule,
        String instruction,
        String channel,
        @JsonProperty("chat_id") String chatId) {
}
