package com.programmersdiary.nudge.bus;

public record OutboundMessage(String channel, String chatId, String content) {
}
