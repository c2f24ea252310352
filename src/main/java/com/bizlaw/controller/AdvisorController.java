package com.bizlaw.controller;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.bizlaw.config.SourceRegistry;
import com.bizlaw.dto.request.ContextExtractionRequest;
import com.bizlaw.dto.request.ContextRequest;
import com.bizlaw.dto.request.QueryRequest;
import com.bizlaw.dto.response.AnalysisResponse;
import com.bizlaw.model.BusinessContext;
import com.bizlaw.service.advisory.AdvisoryService;
import com.bizlaw.service.advisory.AdvisoryService.AdvisoryResult;
import com.bizlaw.service.monitoring.PerformanceMonitorService;
import com.bizlaw.service.session.AdvisorSessionService;
import com.bizlaw.service.synthesis.ContextExtractionService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AdvisorController {

    private final AdvisoryService advisoryService;
    private final ContextExtractionService contextExtractionService;
    private final AdvisorSessionService sessionService;
    private final PerformanceMonitorService performanceMonitor;
    private final SourceRegistry sourceRegistry;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.debug("Health check requested");

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", Instant.now().toString());
        health.put("service", "BizLaw Advisor API");
        health.put("active_sessions", sessionService.getSessionCount());
        health.put("federal_domains", sourceRegistry.federalDomains().size());

        return ResponseEntity.ok(health);
    }

    @GetMapping("/categories")
    public ResponseEntity<Map<String, Object>> categories() {
        List<String> categories = sourceRegistry.lawCategories();
        return ResponseEntity.ok(Map.of("categories", categories, "total", categories.size()));
    }

    /**
     * Sets the business context for a session and returns the applicable-laws summary.
     */
    @PostMapping("/context")
    public ResponseEntity<AnalysisResponse> submitContext(@Valid @RequestBody ContextRequest request) {
        log.info("Context submitted: {}", request.getContext());

        AdvisoryResult result = advisoryService.submitContext(
                request.getSessionId(),
                request.getContext(),
                request.getTimeoutSeconds());

        return ResponseEntity.ok(AnalysisResponse.from(result));
    }

    @PostMapping("/context/extract")
    public ResponseEntity<BusinessContext> extractContext(@Valid @RequestBody ContextExtractionRequest request) {
        return ResponseEntity.ok(contextExtractionService.extract(request.getText()));
    }

    @PostMapping("/query")
    public ResponseEntity<AnalysisResponse> query(@Valid @RequestBody QueryRequest request) {
        log.info("Query received: {}", request.getQuery());

        AdvisoryResult result = advisoryService.query(
                request.getQuery(),
                request.getContext(),
                request.getSessionId(),
                request.getTimeoutSeconds());

        return ResponseEntity.ok(AnalysisResponse.from(result));
    }

    // ===== PERFORMANCE MONITORING =====

    @GetMapping("/performance/stats")
    public ResponseEntity<Map<String, Object>> performanceStats() {
        log.debug("Performance stats requested");
        return ResponseEntity.ok(performanceMonitor.getStatistics());
    }

    @GetMapping("/performance/history")
    public ResponseEntity<?> performanceHistory() {
        var history = performanceMonitor.getQueryHistory();
        return ResponseEntity.ok(Map.of("totalQueries", history.size(), "history", history));
    }
}
