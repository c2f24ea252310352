package com.bizlaw.service.synthesis;

import org.springframework.stereotype.Service;

import com.bizlaw.model.BusinessContext;
import com.bizlaw.service.llm.LlmService;
import com.bizlaw.util.PromptBuilder;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Extracts a business context from a free-text description using the model.
 * Fields the model reports as "None" (or leaves blank) come back as null.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextExtractionService {

    private final LlmService llmService;
    private final PromptBuilder promptBuilder;
    private final LlmOutputParser outputParser;

    public BusinessContext extract(String userInput) {
        log.info("Extracting business context from: '{}'", truncate(userInput, 50));

        String raw = llmService.generate(
                promptBuilder.buildSystemPrompt(),
                promptBuilder.buildContextExtractionPrompt(userInput));

        JsonNode node = outputParser.decodeObject(raw);

        BusinessContext context = new BusinessContext(
                valueOf(node, "city"),
                valueOf(node, "state"),
                valueOf(node, "business_type"),
                valueOf(node, "area_of_law"),
                valueOf(node, "statute_of_law")
        );

        log.info("Extracted context: {}", context);
        return context;
    }

    private static String valueOf(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        if (text.isEmpty() || text.equalsIgnoreCase("none") || text.equalsIgnoreCase("null")) {
            return null;
        }
        return text;
    }

    private static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
