package com.bizlaw.config;

import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.ollama.management.ModelManagementOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
public class OllamaConfig {

    @Value("${spring.ai.ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${spring.ai.ollama.chat.options.model}")
    private String model;

    @Value("${bizlaw.synthesis.temperature:0.7}")
    private Double temperature;

    @Value("${spring.ai.ollama.chat.options.num-predict:4096}")
    private Integer numPredict;

    @Value("${spring.ai.ollama.chat.options.top-k:40}")
    private Integer topK;

    @Value("${spring.ai.ollama.chat.options.top-p:0.9}")
    private Double topP;

    @Value("${spring.ai.ollama.chat.options.repeat-penalty:1.1}")
    private Double repeatPenalty;

    @Bean
    public OllamaApi ollamaApi() {
        log.info("Initializing Ollama API with base URL: {}", baseUrl);
        return OllamaApi.builder()
                .baseUrl(baseUrl)
                .build();
    }

    @Bean
    public OllamaOptions defaultOllamaOptions() {
        log.info("Synthesis model: {} (temperature {})", model, temperature);
        return OllamaOptions.builder()
                .model(model)
                .temperature(temperature)
                .numPredict(numPredict) // Max output tokens
                .topK(topK)
                .topP(topP)
                .repeatPenalty(repeatPenalty)
                .build();
    }

    @Bean
    public ModelManagementOptions modelManagementOptions() {
        return ModelManagementOptions.builder().build();
    }

    @Bean
    public OllamaChatModel ollamaChatModel(
            OllamaApi ollamaApi,
            OllamaOptions defaultOllamaOptions,
            ModelManagementOptions modelManagementOptions) {

        return OllamaChatModel.builder()
                .ollamaApi(ollamaApi)
                .defaultOptions(defaultOllamaOptions)
                .modelManagementOptions(modelManagementOptions)
                .build();
    }
}
