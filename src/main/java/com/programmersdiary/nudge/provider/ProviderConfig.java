package com.programmersdiary.nudge.provider;

/**
 * A configured LLM provider. Stored in {@code providers.json}; the active one answers job fires.
 */
public record ProviderConfig(
        String id,
        String name,
        ProviderType type,
        String apiKey,
        String baseUrl,
        String model) {
}
