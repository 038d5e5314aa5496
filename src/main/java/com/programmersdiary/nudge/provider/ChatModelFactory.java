package com.programmersdiary.nudge.provider;

import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaChatOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.stereotype.Component;

@Component
public class ChatModelFactory {

    public ChatModel create(ProviderConfig config) {
        return switch (config.type()) {
            case OPENAI -> createOpenAi(config);
            case ANTHROPIC -> createAnthropic(config);
            case OLLAMA -> createOllama(config);
            case GEMINI -> createGemini(config);
        };
    }

    private ChatModel createOpenAi(ProviderConfig config) {
        var apiBuilder = OpenAiApi.builder()
                .apiKey(config.apiKey() != null ? config.apiKey() : "unused");
        if (config.baseUrl() != null) {
            apiBuilder.baseUrl(config.baseUrl());
        }
        var options = OpenAiChatOptions.builder()
                .model(config.model() != null ? config.model() : "gpt-4o")
                .build();
        return OpenAiChatModel.builder()
                .openAiApi(apiBuilder.build())
                .defaultOptions(options)
                .build();
    }

    private ChatModel createAnthropic(ProviderConfig config) {
        var api = AnthropicApi.builder()
                .apiKey(config.apiKey())
                .build();
        var options = AnthropicChatOptions.builder()
                .model(config.model() != null ? config.model() : "claude-sonnet-4-20250514")
                .maxTokens(1024)
                .build();
        return AnthropicChatModel.builder()
                .anthropicApi(api)
                .defaultOptions(options)
                .build();
    }

    // Gemini is reached through its OpenAI-compatible endpoint.
    private ChatModel createGemini(ProviderConfig config) {
        var api = OpenAiApi.builder()
                .apiKey(config.apiKey())
                .baseUrl(config.baseUrl() != null ? config.baseUrl() : "https://generativelanguage.googleapis.com/v1beta/openai")
                .build();
        var options = OpenAiChatOptions.builder()
                .model(config.model() != null ? config.model() : "gemini-2.0-flash")
                .build();
        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(options)
                .build();
    }

    private ChatModel createOllama(ProviderConfig config) {
        var api = OllamaApi.builder()
                .baseUrl(config.baseUrl() != null ? config.baseUrl() : "http://localhost:11434")
                .build();
        var options = OllamaChatOptions.builder()
                .model(config.model() != null ? config.model() : "llama3.2")
                .build();
        return OllamaChatModel.builder()
                .ollamaApi(api)
                .defaultOptions(options)
                .build();
    }
}
