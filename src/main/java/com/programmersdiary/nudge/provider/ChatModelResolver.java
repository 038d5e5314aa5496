package com.programmersdiary.nudge.provider;

import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Picks the chat model used by scheduled jobs: the provider named by
 * {@code nudge.scheduler.provider-id}, or the first configured provider when none is named.
 * Models are built once per provider configuration.
 */
@Component
public class ChatModelResolver {

    private final ProviderConfigRepository providerRepository;
    private final ChatModelFactory chatModelFactory;
    private final String providerId;
    private final Map<ProviderConfig, ChatModel> models = new ConcurrentHashMap<>();

    public ChatModelResolver(ProviderConfigRepository providerRepository,
                             ChatModelFactory chatModelFactory,
                             @Value("${nudge.scheduler.provider-id:}") String providerId) {
        this.providerRepository = providerRepository;
        this.chatModelFactory = chatModelFactory;
        this.providerId = providerId;
    }

    public Optional<ProviderConfig> activeProvider() {
        if (providerId == null || providerId.isBlank()) {
            return providerRepository.findAll().stream().findFirst();
        }
        return providerRepository.findById(providerId);
    }

    /**
     * @throws IllegalStateException if the configured provider does not exist or none is configured
     */
    public ChatModel resolve() {
        var config = activeProvider().orElseThrow(() -> new IllegalStateException(
                providerId == null || providerId.isBlank()
                        ? "No provider configured"
                        : "Provider not found: " + providerId));
        return models.computeIfAbsent(config, chatModelFactory::create);
    }
}
