package com.bizlaw.config;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import lombok.extern.slf4j.Slf4j;

/**
 * Trusted domain suffixes, known federal regulatory domains and the closed set of law categories.
 */
@Slf4j
@Component
public class SourceRegistry {

    private final List<String> trustedSuffixes;
    private final List<String> federalDomains;
    private final List<String> lawCategories;

    public SourceRegistry(AdvisorProperties properties) {
        AdvisorProperties.Sources sources = properties.getSources();
        this.trustedSuffixes = sources.getTrustedSuffixes().stream()
                .map(SourceRegistry::normalizeSuffix)
                .toList();
        this.federalDomains = List.copyOf(sources.getFederalDomains());
        this.lawCategories = List.copyOf(sources.getLawCategories());
    }

    /**
     * True iff the URL's lower-cased host ends with one of the trusted suffixes on a label boundary.
     * Path and query are never inspected.
     */
    public boolean isTrustedDomain(String url) {
        String host = extractHost(url);
        if (host == null) {
            return false;
        }
        for (String suffix : trustedSuffixes) {
            if (host.endsWith(suffix) && host.length() > suffix.length()) {
                return true;
            }
        }
        return false;
    }

    public List<String> federalDomains() {
        return federalDomains;
    }

    public List<String> lawCategories() {
        return lawCategories;
    }

    public List<String> trustedSuffixes() {
        return trustedSuffixes;
    }

    public boolean isKnownLawCategory(String category) {
        return category != null && lawCategories.stream().anyMatch(c -> c.equalsIgnoreCase(category.trim()));
    }

    static String extractHost(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String candidate = url.trim();
        if (!candidate.contains("://")) {
            candidate = "http://" + candidate;
        }
        try {
            String host = UriComponentsBuilder.fromUriString(candidate).build().getHost();
            if (host == null || host.isBlank() || host.chars().anyMatch(Character::isWhitespace)) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable source URL: {}", url);
            return null;
        }
    }

    // "gov" and ".gov" both mean "a label ending in gov"
    private static String normalizeSuffix(String suffix) {
        String s = suffix.trim().toLowerCase(Locale.ROOT);
        return s.startsWith(".") ? s : "." + s;
    }
}
