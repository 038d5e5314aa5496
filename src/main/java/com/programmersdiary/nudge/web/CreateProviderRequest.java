package com.programmersdiary.nudge.web;

import com.programmersdiary.nudge.provider.ProviderType;

public record CreateProviderRequest(
        String name,
        ProviderType type,
        String apiKey,
        String baseUrl,
        String model) {
}
