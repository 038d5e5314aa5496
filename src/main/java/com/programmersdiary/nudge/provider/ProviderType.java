package com.programmersdiary.nudge.provider;

public enum ProviderType {
    OPENAI,
    ANTHROPIC,
    OLLAMA,
    GEMINI
}
