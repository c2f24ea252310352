package com.bizlaw.service.search;

import com.bizlaw.config.AdvisorProperties;
import com.bizlaw.config.SourceRegistry;
import com.bizlaw.dto.internal.OrganicResult;
import com.bizlaw.exception.ProviderException;
import com.bizlaw.model.Jurisdiction;
import com.bizlaw.model.JurisdictionSources;
import com.bizlaw.model.LegalSourceRecord;
import com.bizlaw.model.ScopedSearchOutcome;
import com.bizlaw.util.SearchQueryBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchOrchestratorTest {

    @Mock
    private SearchProvider searchProvider;

    private SourceRegistry sourceRegistry;
    private ExecutorService federalPool;
    private SearchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        AdvisorProperties properties = new AdvisorProperties();
        sourceRegistry = new SourceRegistry(properties);
        federalPool = Executors.newFixedThreadPool(4);

        orchestrator = new SearchOrchestrator(
                searchProvider,
                sourceRegistry,
                new FixedRelevanceScorer(),
                new SearchQueryBuilder(properties),
                new ObjectMapper(),
                federalPool
        );
    }

    @AfterEach
    void tearDown() {
        federalPool.shutdownNow();
    }

    private static OrganicResult hit(String url) {
        return OrganicResult.builder()
                .url(url)
                .title("Title of " + url)
                .snippet("Snippet of " + url)
                .rawJson("{\"link\":\"" + url + "\"}")
                .build();
    }

    @Nested
    @DisplayName("single scoped search")
    class ScopedSearch {

        @Test
        @DisplayName("makes exactly one provider call with the scoped query")
        void oneProviderCall() {
            when(searchProvider.search("overtime rules site:.gov")).thenReturn(List.of());

            orchestrator.search("overtime rules", Jurisdiction.FEDERAL, null);

            verify(searchProvider, times(1)).search("overtime rules site:.gov");
            verifyNoMoreInteractions(searchProvider);
        }

        @Test
        @DisplayName("keeps trusted hosts only and tags them with the requested jurisdiction")
        void filtersAndTags() {
            when(searchProvider.search("overtime rules Texas state law site:.gov")).thenReturn(List.of(
                    hit("https://www.twc.texas.gov/overtime"),
                    hit("https://www.lawfirm-blog.com/overtime.gov"),
                    hit("https://www.texasbar.org/employment")
            ));

            List<LegalSourceRecord> records = orchestrator.search("overtime rules", Jurisdiction.STATE, "Texas");

            assertThat(records).extracting(LegalSourceRecord::url)
                    .containsExactly("https://www.twc.texas.gov/overtime", "https://www.texasbar.org/employment");
            assertThat(records).allSatisfy(record -> {
                assertThat(record.jurisdiction()).isEqualTo(Jurisdiction.STATE);
                assertThat(record.relevanceScore()).isEqualTo(1.0);
            });
        }

        @Test
        @DisplayName("content is a snapshot of the raw provider result")
        void contentSnapshot() {
            when(searchProvider.search(anyString())).thenReturn(List.of(hit("https://www.dol.gov/flsa")));

            LegalSourceRecord record = orchestrator.search("overtime", Jurisdiction.FEDERAL, null).get(0);

            assertThat(record.title()).isEqualTo("Title of https://www.dol.gov/flsa");
            assertThat(record.description()).isEqualTo("Snippet of https://www.dol.gov/flsa");
            assertThat(record.content()).isEqualTo("{\"link\":\"https://www.dol.gov/flsa\"}");
        }

        @Test
        @DisplayName("a provider failure becomes an empty, failed outcome instead of an exception")
        void providerFailureRecovered() {
            when(searchProvider.search(anyString())).thenThrow(new ProviderException("HTTP 503"));

            ScopedSearchOutcome outcome = orchestrator.searchScoped("overtime", Jurisdiction.FEDERAL, null);

            assertThat(outcome.failed()).isTrue();
            assertThat(outcome.records()).isEmpty();
            assertThat(outcome.error()).contains("HTTP 503");
            assertThat(orchestrator.search("overtime", Jurisdiction.FEDERAL, null)).isEmpty();
        }

        @Test
        @DisplayName("scores from a custom scorer are clamped to [0, 1]")
        void clampsScores() {
            AdvisorProperties properties = new AdvisorProperties();
            SearchOrchestrator generous = new SearchOrchestrator(searchProvider, sourceRegistry,
                    (query, result, jurisdiction) -> result.getUrl().contains("irs") ? 7.5 : Double.NaN,
                    new SearchQueryBuilder(properties), new ObjectMapper(), Runnable::run);
            when(searchProvider.search(anyString()))
                    .thenReturn(List.of(hit("https://www.irs.gov/a"), hit("https://www.sba.gov/b")));

            List<LegalSourceRecord> records = generous.search("tax", Jurisdiction.FEDERAL, null);

            assertThat(records).extracting(LegalSourceRecord::relevanceScore).containsExactly(1.0, 0.0);
        }
    }

    @Nested
    @DisplayName("federal aggregation")
    class Federal {

        @Test
        @DisplayName("issues one scoped query per configured domain")
        void oneQueryPerDomain() {
            when(searchProvider.search(anyString())).thenReturn(List.of());

            JurisdictionSources sources = orchestrator.federalSources("sales tax");

            for (String domain : sourceRegistry.federalDomains()) {
                verify(searchProvider).search("sales tax site:" + domain + " site:.gov");
            }
            verifyNoMoreInteractions(searchProvider);
            assertThat(sources.attemptedQueries()).isEqualTo(10);
            assertThat(sources.isDegraded()).isFalse();
        }

        @Test
        @DisplayName("concatenates records in domain-list order whatever order calls finish in")
        void domainOrder() {
            List<String> domains = sourceRegistry.federalDomains();
            when(searchProvider.search(anyString())).thenAnswer(invocation -> {
                String query = invocation.getArgument(0);
                String domain = domains.stream().filter(d -> query.contains("site:" + d + " ")).findFirst().orElseThrow();
                // earlier domains answer last
                Thread.sleep((domains.size() - domains.indexOf(domain)) * 15L);
                return List.of(hit("https://www." + domain + "/result"));
            });

            List<LegalSourceRecord> records = orchestrator.getFederalLaws("sales tax");

            assertThat(records).extracting(LegalSourceRecord::url)
                    .containsExactlyElementsOf(domains.stream().map(d -> "https://www." + d + "/result").toList());
            assertThat(records).extracting(LegalSourceRecord::jurisdiction).containsOnly(Jurisdiction.FEDERAL);
        }

        @Test
        @DisplayName("failed domains are skipped and reported, the rest still contribute")
        void failureIsolation() {
            Set<String> failing = Set.of("osha.gov", "dol.gov", "hhs.gov");
            when(searchProvider.search(anyString())).thenAnswer(invocation -> {
                String query = invocation.getArgument(0);
                String domain = query.replaceAll(".*site:(\\S+) site:\\.gov$", "$1");
                if (failing.contains(domain)) {
                    throw new ProviderException("timeout talking to provider");
                }
                return List.of(hit("https://www." + domain + "/ok"));
            });

            JurisdictionSources sources = orchestrator.federalSources("safety training");

            assertThat(sources.records()).hasSize(7);
            assertThat(sources.urls()).noneMatch(url -> failing.stream().anyMatch(url::contains));
            assertThat(sources.attemptedQueries()).isEqualTo(10);
            assertThat(sources.failedQueries()).isEqualTo(3);
            assertThat(sources.isDegraded()).isTrue();
            assertThat(sources.errors()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("state and local aggregation")
    class StateAndLocal {

        @Test
        @DisplayName("state search is one query scoped to the state")
        void stateQuery() {
            when(searchProvider.search("liquor license Texas state law site:.gov"))
                    .thenReturn(List.of(hit("https://www.tabc.texas.gov/licenses")));

            List<LegalSourceRecord> records = orchestrator.getStateLaws("liquor license", "Texas");

            assertThat(records).singleElement()
                    .extracting(LegalSourceRecord::jurisdiction).isEqualTo(Jurisdiction.STATE);
        }

        @Test
        @DisplayName("local search adds city and state before scoping")
        void localQuery() {
            when(searchProvider.search("liquor license Austin Texas local law site:.gov"))
                    .thenReturn(List.of(hit("https://www.austintexas.gov/permits")));

            JurisdictionSources sources = orchestrator.localSources("liquor license", "Austin", "Texas");

            assertThat(sources.records()).singleElement()
                    .extracting(LegalSourceRecord::jurisdiction).isEqualTo(Jurisdiction.LOCAL);
            assertThat(sources.attemptedQueries()).isEqualTo(1);
        }

        @Test
        @DisplayName("an empty result is not degraded")
        void emptyIsNotDegraded() {
            when(searchProvider.search(anyString())).thenReturn(List.of());

            JurisdictionSources sources = orchestrator.stateSources("liquor license", "Texas");

            assertThat(sources.records()).isEmpty();
            assertThat(sources.isDegraded()).isFalse();
        }
    }
}
