package com.programmersdiary.nudge.provider;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.model.ChatModel;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChatModelResolverTest {

    private static final ProviderConfig OLLAMA =
            new ProviderConfig("p1", "local", ProviderType.OLLAMA, null, null, "llama3.2");
    private static final ProviderConfig OPENAI =
            new ProviderConfig("p2", "openai", ProviderType.OPENAI, "key", null, "gpt-4o");

    @Mock
    private ProviderConfigRepository repository;
    @Mock
    private ChatModelFactory factory;
    @Mock
    private ChatModel chatModel;

    @Test
    void usesFirstProviderWhenNoneConfigured() {
        when(repository.findAll()).thenReturn(List.of(OLLAMA, OPENAI));
        when(factory.create(OLLAMA)).thenReturn(chatModel);

        assertThat(new ChatModelResolver(repository, factory, "").resolve()).isSameAs(chatModel);
    }

    @Test
    void usesConfiguredProviderAndCachesModel() {
        when(repository.findById("p2")).thenReturn(Optional.of(OPENAI));
        when(factory.create(OPENAI)).thenReturn(chatModel);
        var resolver = new ChatModelResolver(repository, factory, "p2");

        resolver.resolve();
        resolver.resolve();

        verify(factory, times(1)).create(OPENAI);
    }

    @Test
    void failsWhenProviderMissing() {
        when(repository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> new ChatModelResolver(repository, factory, "nope").resolve())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("nope");
    }
}
