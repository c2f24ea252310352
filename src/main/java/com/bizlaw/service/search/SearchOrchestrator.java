package com.bizlaw.service.search;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.bizlaw.config.ExecutorConfig;
import com.bizlaw.config.SourceRegistry;
import com.bizlaw.dto.internal.OrganicResult;
import com.bizlaw.model.Jurisdiction;
import com.bizlaw.model.JurisdictionSources;
import com.bizlaw.model.LegalSourceRecord;
import com.bizlaw.model.ScopedSearchOutcome;
import com.bizlaw.util.SearchQueryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Issues jurisdiction-scoped provider searches, keeps trusted-domain hits only and tags
 * every record with the jurisdiction it was requested under.
 *
 * <p>A failed provider call never escapes: it becomes an empty, failed {@link ScopedSearchOutcome}
 * and the surrounding aggregation carries on with the other scoped queries.
 */
@Slf4j
@Service
public class SearchOrchestrator {

    private final SearchProvider searchProvider;
    private final SourceRegistry sourceRegistry;
    private final RelevanceScorer relevanceScorer;
    private final SearchQueryBuilder queryBuilder;
    private final ObjectMapper objectMapper;
    private final Executor federalSearchExecutor;

    public SearchOrchestrator(SearchProvider searchProvider,
                              SourceRegistry sourceRegistry,
                              RelevanceScorer relevanceScorer,
                              SearchQueryBuilder queryBuilder,
                              ObjectMapper objectMapper,
                              @Qualifier(ExecutorConfig.FEDERAL_SEARCH_EXECUTOR) Executor federalSearchExecutor) {
        this.searchProvider = searchProvider;
        this.sourceRegistry = sourceRegistry;
        this.relevanceScorer = relevanceScorer;
        this.queryBuilder = queryBuilder;
        this.objectMapper = objectMapper;
        this.federalSearchExecutor = federalSearchExecutor;
    }

    public List<LegalSourceRecord> search(String query, Jurisdiction jurisdiction, String state) {
        return searchScoped(query, jurisdiction, state).records();
    }

    /**
     * Exactly one provider call for the scoped form of {@code query}.
     */
    public ScopedSearchOutcome searchScoped(String query, Jurisdiction jurisdiction, String state) {
        String scopedQuery = queryBuilder.scope(query, jurisdiction, state);

        try {
            List<OrganicResult> hits = searchProvider.search(scopedQuery);

            List<LegalSourceRecord> records = hits.stream()
                    .filter(hit -> isTrusted(hit, jurisdiction))
                    .map(hit -> toRecord(scopedQuery, hit, jurisdiction))
                    .toList();

            log.debug("[{}] '{}' -> {} hits, {} trusted",
                    jurisdiction.getDisplayName(), scopedQuery, hits.size(), records.size());

            return ScopedSearchOutcome.success(scopedQuery, records);

        } catch (Exception e) {
            log.warn("[{}] Search failed for '{}': {}",
                    jurisdiction.getDisplayName(), scopedQuery, e.getMessage());
            return ScopedSearchOutcome.failure(scopedQuery, describe(e));
        }
    }

    // ============================================================
    // Jurisdiction aggregations
    // ============================================================

    public List<LegalSourceRecord> getFederalLaws(String query) {
        return federalSources(query).records();
    }

    public List<LegalSourceRecord> getStateLaws(String query, String state) {
        return stateSources(query, state).records();
    }

    public List<LegalSourceRecord> getLocalLaws(String query, String city, String state) {
        return localSources(query, city, state).records();
    }

    /**
     * One scoped query per configured federal domain, fanned out on the bounded federal pool.
     * Records are concatenated in domain-list order whatever order the calls complete in.
     */
    public JurisdictionSources federalSources(String query) {
        List<String> domains = sourceRegistry.federalDomains();

        List<CompletableFuture<ScopedSearchOutcome>> futures = domains.stream()
                .map(domain -> {
                    String domainQuery = queryBuilder.federalDomainQuery(query, domain);
                    return submit(() -> searchScoped(domainQuery, Jurisdiction.FEDERAL, null))
                            .exceptionally(ex -> ScopedSearchOutcome.failure(domainQuery, String.valueOf(ex.getMessage())));
                })
                .toList();

        List<ScopedSearchOutcome> outcomes = futures.stream()
                .map(CompletableFuture::join)
                .toList();

        JurisdictionSources sources = JurisdictionSources.of(Jurisdiction.FEDERAL, outcomes);
        logAggregate(sources);
        return sources;
    }

    public JurisdictionSources stateSources(String query, String state) {
        JurisdictionSources sources = JurisdictionSources.of(
                Jurisdiction.STATE, List.of(searchScoped(query, Jurisdiction.STATE, state)));
        logAggregate(sources);
        return sources;
    }

    public JurisdictionSources localSources(String query, String city, String state) {
        String localQuery = queryBuilder.localQuery(query, city, state);
        JurisdictionSources sources = JurisdictionSources.of(
                Jurisdiction.LOCAL, List.of(searchScoped(localQuery, Jurisdiction.LOCAL, state)));
        logAggregate(sources);
        return sources;
    }

    // ============================================================
    // Helpers
    // ============================================================

    private CompletableFuture<ScopedSearchOutcome> submit(Supplier<ScopedSearchOutcome> task) {
        try {
            return CompletableFuture.supplyAsync(task, federalSearchExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Federal search pool saturated, running sub-query on caller thread");
            return CompletableFuture.supplyAsync(task, Runnable::run);
        }
    }

    private boolean isTrusted(OrganicResult hit, Jurisdiction jurisdiction) {
        boolean trusted = sourceRegistry.isTrustedDomain(hit.getUrl());
        if (!trusted) {
            log.debug("[{}] Dropping untrusted source: {}", jurisdiction.getDisplayName(), hit.getUrl());
        }
        return trusted;
    }

    private LegalSourceRecord toRecord(String scopedQuery, OrganicResult hit, Jurisdiction jurisdiction) {
        return new LegalSourceRecord(
                hit.getUrl(),
                jurisdiction,
                hit.getTitle(),
                hit.getSnippet(),
                clamp(relevanceScorer.score(scopedQuery, hit, jurisdiction)),
                snapshot(hit)
        );
    }

    private String snapshot(OrganicResult hit) {
        if (hit.getRawJson() != null) {
            return hit.getRawJson();
        }
        try {
            return objectMapper.writeValueAsString(hit);
        } catch (JsonProcessingException e) {
            return hit.toString();
        }
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void logAggregate(JurisdictionSources sources) {
        if (sources.isDegraded()) {
            log.warn("{} search degraded: {}/{} scoped queries failed, {} records kept",
                    sources.jurisdiction().getDisplayName(),
                    sources.failedQueries(),
                    sources.attemptedQueries(),
                    sources.records().size());
        } else {
            log.info("{} search: {} records from {} scoped queries",
                    sources.jurisdiction().getDisplayName(),
                    sources.records().size(),
                    sources.attemptedQueries());
        }
    }
}
