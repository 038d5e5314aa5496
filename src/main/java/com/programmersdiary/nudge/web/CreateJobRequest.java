package com.programmersdiary.nudge.web;

public record CreateJobRequest(
        String schedule,
        String instruction,
        String channel,
        String chatId) {
}
