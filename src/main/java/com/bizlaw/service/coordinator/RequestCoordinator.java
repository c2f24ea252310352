package com.bizlaw.service.coordinator;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import com.bizlaw.config.AdvisorProperties;
import com.bizlaw.config.ExecutorConfig;
import com.bizlaw.exception.BizLawException;
import com.bizlaw.exception.LlmException;
import com.bizlaw.exception.SynthesisTimeoutException;
import com.bizlaw.model.BusinessContext;
import com.bizlaw.model.Jurisdiction;
import com.bizlaw.model.JurisdictionSources;
import com.bizlaw.model.LegalAnalysis;
import com.bizlaw.model.ResearchRequest;
import com.bizlaw.model.ResearchResult;
import com.bizlaw.service.monitoring.PerformanceMonitorService;
import com.bizlaw.service.monitoring.QueryTimer;
import com.bizlaw.service.search.SearchOrchestrator;
import com.bizlaw.service.synthesis.ResponseSynthesizer;

import lombok.extern.slf4j.Slf4j;

/**
 * Drives one research query end to end: three concurrent jurisdiction searches joined at a
 * single barrier, then synthesis under a cancellable deadline.
 *
 * <p>Holds no per-query state; every call reruns the full pipeline.
 */
@Slf4j
@Service
public class RequestCoordinator {

    private final SearchOrchestrator searchOrchestrator;
    private final ResponseSynthesizer responseSynthesizer;
    private final PerformanceMonitorService performanceMonitor;
    private final AdvisorProperties properties;
    private final AsyncTaskExecutor researchExecutor;
    private final AsyncTaskExecutor synthesisExecutor;

    public RequestCoordinator(SearchOrchestrator searchOrchestrator,
                              ResponseSynthesizer responseSynthesizer,
                              PerformanceMonitorService performanceMonitor,
                              AdvisorProperties properties,
                              @Qualifier(ExecutorConfig.RESEARCH_EXECUTOR) AsyncTaskExecutor researchExecutor,
                              @Qualifier(ExecutorConfig.SYNTHESIS_EXECUTOR) AsyncTaskExecutor synthesisExecutor) {
        this.searchOrchestrator = searchOrchestrator;
        this.responseSynthesizer = responseSynthesizer;
        this.performanceMonitor = performanceMonitor;
        this.properties = properties;
        this.researchExecutor = researchExecutor;
        this.synthesisExecutor = synthesisExecutor;
    }

    public ResearchResult research(ResearchRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        if (request.context() == null) {
            throw new IllegalArgumentException("Business context is required");
        }

        String query = request.query().trim();
        BusinessContext context = request.context();

        QueryTimer timer = QueryTimer.started();
        log.info("Research query: '{}' ({} in {}, {})",
                truncate(query, 80), context.businessType(), context.city(), context.state());

        /* =========================
           STEP 1: JURISDICTION SEARCH (fan-out / join)
           ========================= */
        CompletableFuture<JurisdictionSources> federalBranch = branch(Jurisdiction.FEDERAL,
                () -> searchOrchestrator.federalSources(query));
        CompletableFuture<JurisdictionSources> stateBranch = branch(Jurisdiction.STATE,
                () -> searchOrchestrator.stateSources(query, context.state()));
        CompletableFuture<JurisdictionSources> localBranch = branch(Jurisdiction.LOCAL,
                () -> searchOrchestrator.localSources(query, context.city(), context.state()));

        CompletableFuture.allOf(federalBranch, stateBranch, localBranch).join();
        timer.mark("Search");
        double searchSeconds = timer.getTotalTime();

        JurisdictionSources federal = federalBranch.join();
        JurisdictionSources state = stateBranch.join();
        JurisdictionSources local = localBranch.join();

        log.info("Search joined in {}s: federal={}, state={}, local={}",
                String.format("%.2f", searchSeconds),
                federal.records().size(), state.records().size(), local.records().size());

        /* =========================
           STEP 2: SYNTHESIS
           ========================= */
        LegalAnalysis analysis;
        try {
            analysis = synthesizeWithDeadline(context, federal, state, local, effectiveTimeout(request));
        } catch (RuntimeException e) {
            timer.mark("Synthesis");
            timer.end();
            performanceMonitor.addQuery(query, timer, "failed");
            log.error("Research query failed after {}: {}", timer.formatDisplay(), e.getMessage());
            throw e;
        }
        timer.mark("Synthesis");
        timer.end();

        ResearchResult result = new ResearchResult(
                analysis, federal, state, local, searchSeconds, timer.getTotalTime());

        performanceMonitor.addQuery(query, timer, result.isDegraded() ? "degraded" : "complete");
        log.info("Research query complete: {}", timer.formatDisplay());

        return result;
    }

    // ============================================================
    // Helpers
    // ============================================================

    private CompletableFuture<JurisdictionSources> branch(Jurisdiction jurisdiction,
                                                          Supplier<JurisdictionSources> search) {
        CompletableFuture<JurisdictionSources> future;
        try {
            future = CompletableFuture.supplyAsync(search, researchExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Research pool saturated, running {} search on caller thread", jurisdiction.getDisplayName());
            future = CompletableFuture.supplyAsync(search, Runnable::run);
        }

        // A branch failure must not cancel its siblings
        return future.exceptionally(ex -> {
            log.error("{} search branch failed", jurisdiction.getDisplayName(), ex);
            return JurisdictionSources.failed(jurisdiction, String.valueOf(ex.getMessage()));
        });
    }

    private LegalAnalysis synthesizeWithDeadline(BusinessContext context,
                                                 JurisdictionSources federal,
                                                 JurisdictionSources state,
                                                 JurisdictionSources local,
                                                 long timeoutSeconds) {

        CountDownLatch started = new CountDownLatch(1);
        Future<LegalAnalysis> future;
        try {
            future = synthesisExecutor.submit(() -> {
                started.countDown();
                return responseSynthesizer.synthesize(
                        context, federal.records(), state.records(), local.records());
            });
        } catch (RejectedExecutionException e) {
            throw new LlmException("Synthesis capacity exhausted, try again later", e);
        }

        try {
            // the deadline covers the model call, not the wait for a synthesis worker
            awaitStart(started, future);
            return future.get(timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SynthesisTimeoutException(timeoutSeconds);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new BizLawException("Synthesis failed", cause);

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BizLawException("Interrupted while waiting for synthesis", e);
        }
    }

    private static void awaitStart(CountDownLatch started, Future<?> future) throws InterruptedException {
        while (!started.await(1, TimeUnit.SECONDS)) {
            if (future.isDone()) {
                return;
            }
            log.debug("Waiting for a free synthesis worker");
        }
    }

    private long effectiveTimeout(ResearchRequest request) {
        Long requested = request.timeoutSeconds();
        if (requested != null && requested > 0) {
            return requested;
        }
        return properties.getSynthesis().getTimeoutSeconds();
    }

    private static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
