package com.bizlaw.service.search;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import com.bizlaw.config.AdvisorProperties;
import com.bizlaw.dto.internal.OrganicResult;
import com.bizlaw.exception.ProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Google results through the Serper API ({@code POST /search}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SerperSearchProvider implements SearchProvider {

    private final WebClient searchWebClient;
    private final ObjectMapper objectMapper;
    private final AdvisorProperties properties;

    @Override
    @CircuitBreaker(name = "search")
    public List<OrganicResult> search(String query) {
        String body;
        try {
            log.debug("Calling search provider: {}", query);

            body = searchWebClient.post()
                    .uri("/search")
                    .bodyValue(Map.of("q", query))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(properties.getSearch().getTimeoutSeconds()));

        } catch (Exception e) {
            throw new ProviderException("Search provider call failed: " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new ProviderException("Empty response from search provider");
        }

        try {
            return parseOrganicResults(objectMapper.readTree(body));
        } catch (JsonProcessingException e) {
            throw new ProviderException("Search provider returned invalid JSON", e);
        }
    }

    List<OrganicResult> parseOrganicResults(JsonNode root) {
        JsonNode organic = root == null ? null : root.get("organic");

        if (organic == null || organic.isNull()) {
            // Serper omits the array when nothing matched
            if (root != null && root.isObject()) {
                return List.of();
            }
            throw new ProviderException("Search provider payload is not an object");
        }
        if (!organic.isArray()) {
            throw new ProviderException("Search provider payload has a non-array 'organic' field");
        }

        List<OrganicResult> results = new ArrayList<>();
        for (JsonNode item : organic) {
            String link = item.path("link").asText("");
            if (link.isBlank()) {
                log.debug("Skipping organic result without link");
                continue;
            }
            results.add(OrganicResult.builder()
                    .url(link)
                    .title(item.path("title").asText(""))
                    .snippet(item.path("snippet").asText(""))
                    .rawJson(item.toString())
                    .build());
        }
        return results;
    }
}
