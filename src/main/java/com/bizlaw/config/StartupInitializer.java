package com.bizlaw.config;

import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs the effective source registry and model settings once the context is up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInitializer implements ApplicationRunner {

    private final SourceRegistry sourceRegistry;
    private final AdvisorProperties properties;
    private final OllamaOptions defaultOllamaOptions;

    @Override
    public void run(ApplicationArguments args) {
        log.info("\n{}", "=".repeat(70));
        log.info("BIZLAW ADVISOR CONFIGURATION");
        log.info("{}\n", "=".repeat(70));

        log.info("Trusted suffixes   : {}", sourceRegistry.trustedSuffixes());
        log.info("Federal domains    : {} {}", sourceRegistry.federalDomains().size(), sourceRegistry.federalDomains());
        log.info("Law categories     : {}", sourceRegistry.lawCategories().size());
        log.info("Domain restriction : {}", properties.getSearch().getDomainRestriction());
        log.info("Federal concurrency: {}", properties.getSearch().getFederalConcurrency());
        log.info("Model              : {} (temperature {})",
                defaultOllamaOptions.getModel(), defaultOllamaOptions.getTemperature());
        log.info("Synthesis deadline : {}s", properties.getSynthesis().getTimeoutSeconds());

        if (Boolean.TRUE.equals(properties.getArtifacts().getEnabled())) {
            log.info("Artifacts          : {}", properties.getArtifacts().getDirectory());
        } else {
            log.info("Artifacts          : disabled");
        }

        log.info("\n{}", "=".repeat(70));
        log.info("SYSTEM READY");
        log.info("{}\n", "=".repeat(70));
    }
}
