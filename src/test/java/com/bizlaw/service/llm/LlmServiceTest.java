package com.bizlaw.service.llm;

import com.bizlaw.exception.LlmException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.api.OllamaOptions;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmServiceTest {

    @Mock
    private ChatModel chatModel;

    private LlmService llmService;

    @BeforeEach
    void setUp() {
        OllamaOptions options = OllamaOptions.builder()
                .model("llama3.1:8b")
                .temperature(0.7)
                .build();
        llmService = new LlmService(chatModel, options);
    }

    @Test
    @DisplayName("sends system and user messages with the configured temperature")
    void sendsPrompt() {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("{\"ok\":true}")))));

        String output = llmService.generate("system rules", "user question");

        ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel, times(1)).call(prompt.capture());
        assertThat(output).isEqualTo("{\"ok\":true}");
        assertThat(prompt.getValue().getInstructions())
                .extracting(message -> message.getMessageType())
                .containsExactly(MessageType.SYSTEM, MessageType.USER);
        assertThat(prompt.getValue().getOptions().getTemperature()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("an empty response is an LlmException")
    void emptyResponse() {
        when(chatModel.call(any(Prompt.class))).thenReturn(new ChatResponse(List.of()));

        assertThatThrownBy(() -> llmService.generate("s", "u"))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("no output");
    }

    @Test
    @DisplayName("transport failures are wrapped in LlmException")
    void wrapsFailures() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("connection refused"));

        assertThatThrownBy(() -> llmService.generate("s", "u"))
                .isInstanceOf(LlmException.class)
                .hasRootCauseMessage("connection refused");
    }
}
