package com.bizlaw.config;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import com.bizlaw.exception.ConfigurationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.netty.http.client.HttpClient;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class SearchClientConfig {

    static final String API_KEY_HEADER = "X-API-KEY";

    private final AdvisorProperties properties;

    @Bean
    public WebClient searchWebClient() {
        AdvisorProperties.Search search = properties.getSearch();

        if (search.getApiKey() == null || search.getApiKey().isBlank()) {
            throw new ConfigurationException(
                    "Search provider API key is missing: set bizlaw.search.api-key (SERPER_API_KEY)");
        }

        log.info("==============================================");
        log.info("SEARCH PROVIDER CONFIGURATION");
        log.info("==============================================");
        log.info("  Base URL    : {}", search.getBaseUrl());
        log.info("  Timeout     : {}s", search.getTimeoutSeconds());
        log.info("  Concurrency : {} federal sub-queries", search.getFederalConcurrency());
        log.info("==============================================");

        return WebClient.builder()
                .baseUrl(search.getBaseUrl())
                .defaultHeader(API_KEY_HEADER, search.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(
                        new ReactorClientHttpConnector(
                                HttpClient.create()
                                        .responseTimeout(Duration.ofSeconds(search.getTimeoutSeconds()))
                        )
                )
                .build();
    }
}
