package com.bizlaw.service.advisory;

import java.util.Optional;

import org.springframework.stereotype.Service;

import com.bizlaw.config.SourceRegistry;
import com.bizlaw.exception.BizLawException;
import com.bizlaw.model.BusinessContext;
import com.bizlaw.model.LegalAnalysis;
import com.bizlaw.model.ResearchRequest;
import com.bizlaw.model.ResearchResult;
import com.bizlaw.service.artifact.AnalysisArtifactStore;
import com.bizlaw.service.artifact.ArtifactPaths;
import com.bizlaw.service.artifact.ManifestWriter;
import com.bizlaw.service.coordinator.RequestCoordinator;
import com.bizlaw.service.session.AdvisorSession;
import com.bizlaw.service.session.AdvisorSessionService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Session-facing entry point: resolves the business context for a call, runs the research
 * pipeline and keeps session history and artifacts up to date.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdvisoryService {

    public static final String CONTEXT_DEFINING_QUERY = "Provide Summary of Laws/Rules applicable to the Business";

    private final RequestCoordinator requestCoordinator;
    private final AdvisorSessionService sessionService;
    private final SourceRegistry sourceRegistry;
    private final ManifestWriter manifestWriter;
    private final AnalysisArtifactStore analysisArtifactStore;
    private final ArtifactPaths artifactPaths;

    /**
     * Sets the session's business context (clearing its history) and runs the context-defining search.
     */
    public AdvisoryResult submitContext(String sessionId, BusinessContext context, Long timeoutSeconds) {
        validateContext(context);

        AdvisorSession session = sessionService.defineContext(sessionId, context);

        ResearchResult result = requestCoordinator.research(
                new ResearchRequest(CONTEXT_DEFINING_QUERY, context, timeoutSeconds));

        writeArtifacts(session.getId(), result);

        return new AdvisoryResult(session.getId(), result);
    }

    /**
     * Answers a query against the explicit context when one is given, else the session's context.
     */
    public AdvisoryResult query(String query, BusinessContext explicitContext, String sessionId, Long timeoutSeconds) {
        BusinessContext context;
        if (explicitContext != null) {
            validateContext(explicitContext);
            context = explicitContext;
        } else if (sessionId != null) {
            context = sessionService.require(sessionId).getContext();
            if (context == null) {
                throw new IllegalArgumentException("Session " + sessionId + " has no business context yet");
            }
        } else {
            throw new IllegalArgumentException("Either a business context or a session id is required");
        }

        ResearchResult result = requestCoordinator.research(new ResearchRequest(query, context, timeoutSeconds));

        if (sessionService.sessionExists(sessionId)) {
            sessionService.addTurn(sessionId, query, result.analysis());
        }

        return new AdvisoryResult(sessionId, result);
    }

    public Optional<LegalAnalysis> applicableLaws(String sessionId) {
        sessionService.require(sessionId);
        return analysisArtifactStore.load(sessionId);
    }

    public boolean deleteSession(String sessionId) {
        boolean deleted = sessionService.deleteSession(sessionId);
        if (deleted && artifactPaths.isEnabled()) {
            analysisArtifactStore.delete(sessionId);
            manifestWriter.delete(sessionId);
            artifactPaths.removeSessionDirectory(sessionId);
        }
        return deleted;
    }

    public void validateContext(BusinessContext context) {
        if (context == null || !context.isComplete()) {
            throw new IllegalArgumentException("city, state, business_type and area_of_law are all required");
        }
        if (!sourceRegistry.isKnownLawCategory(context.areaOfLaw())) {
            throw new IllegalArgumentException("Unknown area of law: " + context.areaOfLaw());
        }
    }

    private void writeArtifacts(String sessionId, ResearchResult result) {
        if (!artifactPaths.isEnabled()) {
            return;
        }
        try {
            manifestWriter.write(sessionId, result.federal(), result.state(), result.local());
            analysisArtifactStore.save(sessionId, result.analysis());
        } catch (BizLawException e) {
            // the analysis is still returned to the caller
            log.warn("Artifacts not written for session {}: {}", sessionId, e.getMessage());
        }
    }

    public record AdvisoryResult(String sessionId, ResearchResult result) {
    }
}
