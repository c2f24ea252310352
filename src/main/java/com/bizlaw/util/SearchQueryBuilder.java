package com.bizlaw.util;

import java.util.StringJoiner;

import org.springframework.stereotype.Component;

import com.bizlaw.config.AdvisorProperties;
import com.bizlaw.model.Jurisdiction;

/**
 * Builds the jurisdiction-scoped query strings sent to the search provider.
 */
@Component
public class SearchQueryBuilder {

    private final String domainRestriction;

    public SearchQueryBuilder(AdvisorProperties properties) {
        this.domainRestriction = properties.getSearch().getDomainRestriction();
    }

    /**
     * State and Local scoping need a state; without one the query goes out unscoped.
     */
    public String scope(String query, Jurisdiction jurisdiction, String state) {
        String base = query == null ? "" : query.trim();

        if (jurisdiction == null) {
            return base;
        }

        switch (jurisdiction) {
            case FEDERAL:
                return join(base, domainRestriction);
            case STATE:
                return hasText(state) ? join(base, state.trim(), "state law", domainRestriction) : base;
            case LOCAL:
                return hasText(state) ? join(base, "local law", domainRestriction) : base;
            default:
                return base;
        }
    }

    public String federalDomainQuery(String query, String domain) {
        return join(query, "site:" + domain);
    }

    public String localQuery(String query, String city, String state) {
        return join(query, city, state);
    }

    private static String join(String... parts) {
        StringJoiner joiner = new StringJoiner(" ");
        for (String part : parts) {
            if (hasText(part)) {
                joiner.add(part.trim());
            }
        }
        return joiner.toString();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
