package com.programmersdiary.nudge.scheduling;

import com.programmersdiary.nudge.bus.MessageBus;
import com.programmersdiary.nudge.bus.OutboundMessage;
import com.programmersdiary.nudge.provider.ChatModelResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FireDispatcherTest {

    private static final Job JOB = new Job("7", "0 9 * * *", "remind me to drink water", "telegram", "42");

    @Mock
    private ChatModelResolver chatModelResolver;
    @Mock
    private ChatModel chatModel;
    @Mock
    private MessageBus messageBus;

    private FireDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        var clock = Clock.fixed(Instant.parse("2025-06-15T07:00:00Z"), ZoneId.of("UTC"));
        dispatcher = new FireDispatcher(chatModelResolver, messageBus, clock, "test-model", 512, 0.7);
    }

    private static ChatResponse response(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    void publishesNonEmptyResponseToJobDestination() {
        when(chatModelResolver.resolve()).thenReturn(chatModel);
        when(chatModel.call(any(Prompt.class))).thenReturn(response("Time for a glass of water!"));

        dispatcher.fire(JOB);

        verify(messageBus).publishOutbound(new OutboundMessage("telegram", "42", "Time for a glass of water!"));
    }

    @Test
    void sendsSinglePromptWithTimeInstructionAndFixedOptions() {
        when(chatModelResolver.resolve()).thenReturn(chatModel);
        when(chatModel.call(any(Prompt.class))).thenReturn(response("ok"));

        dispatcher.fire(JOB);

        var captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        var prompt = captor.getValue();
        assertThat(prompt.getInstructions()).hasSize(1);
        assertThat(prompt.getInstructions().get(0).getText()).isEqualTo(
                "It is now Sun, 15 Jun 2025 07:00:00 UTC. Based on your instruction: remind me to drink water"
                        + "\nWhat should you tell the user?");
        assertThat(prompt.getOptions().getModel()).isEqualTo("test-model");
        assertThat(prompt.getOptions().getMaxTokens()).isEqualTo(512);
        assertThat(prompt.getOptions().getTemperature()).isEqualTo(0.7);
    }

    @Test
    void blankResponseIsDropped() {
        when(chatModelResolver.resolve()).thenReturn(chatModel);
        when(chatModel.call(any(Prompt.class))).thenReturn(response("  \n "));

        dispatcher.fire(JOB);

        verifyNoInteractions(messageBus);
    }

    @Test
    void responseWithoutResultIsDropped() {
        when(chatModelResolver.resolve()).thenReturn(chatModel);
        when(chatModel.call(any(Prompt.class))).thenReturn(new ChatResponse(List.of()));

        dispatcher.fire(JOB);

        verifyNoInteractions(messageBus);
    }

    @Test
    void providerFailureIsAbsorbedWithoutRetry() {
        when(chatModelResolver.resolve()).thenReturn(chatModel);
        when(chatModel.call(any(Prompt.class))).thenThrow(new RuntimeException("rate limited"));

        dispatcher.fire(JOB);

        verify(chatModel, times(1)).call(any(Prompt.class));
        verifyNoInteractions(messageBus);
    }

    @Test
    void missingProviderIsAbsorbed() {
        when(chatModelResolver.resolve()).thenThrow(new IllegalStateException("No provider configured"));

        dispatcher.fire(JOB);

        verifyNoInteractions(messageBus);
    }
}
