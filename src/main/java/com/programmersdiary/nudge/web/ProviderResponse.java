package com.programmersdiary.nudge.web;

import com.programmersdiary.nudge.provider.ProviderConfig;
import com.programmersdiary.nudge.provider.ProviderType;

public record ProviderResponse(String id, String name, ProviderType type, String baseUrl, String model) {

    static ProviderResponse from(ProviderConfig config) {
        return new ProviderResponse(config.id(), config.name(), config.type(), config.baseUrl(), config.model());
    }
}
