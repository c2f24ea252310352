package com.bizlaw.service.llm;

import java.util.List;

import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.stereotype.Service;

import com.bizlaw.exception.LlmException;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-shot calls to the generative model with the configured sampling options.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmService {

    private final ChatModel chatModel;
    private final OllamaOptions defaultOptions;

    /**
     * Generate text with system and user messages
     */
    @CircuitBreaker(name = "llm")
    public String generate(String systemPrompt, String userPrompt) {
        try {
            log.debug("Calling model (temperature {})", defaultOptions.getTemperature());

            List<Message> messages = List.of(
                    new SystemMessage(systemPrompt),
                    new UserMessage(userPrompt)
            );

            ChatResponse response = chatModel.call(new Prompt(messages, defaultOptions));

            if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                throw new LlmException("Model returned no output");
            }

            String content = response.getResult().getOutput().getText();
            if (content == null) {
                throw new LlmException("Model returned empty content");
            }

            log.debug("Model response received ({} chars)", content.length());
            return content;

        } catch (LlmException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error generating model response: {}", e.getMessage());
            throw new LlmException("Failed to generate model response", e);
        }
    }
}
