package com.bizlaw.service.synthesis;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.bizlaw.exception.SynthesisParseException;
import com.bizlaw.model.BusinessContext;
import com.bizlaw.model.LegalAnalysis;
import com.bizlaw.model.LegalSourceRecord;
import com.bizlaw.service.llm.LlmService;
import com.bizlaw.service.monitoring.QueryTimer;
import com.bizlaw.util.PromptBuilder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the synthesis prompt from the business context and the three jurisdiction source lists,
 * calls the model once and parses its output into a {@link LegalAnalysis}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResponseSynthesizer {

    private final LlmService llmService;
    private final PromptBuilder promptBuilder;
    private final LlmOutputParser outputParser;

    /**
     * @throws SynthesisParseException when the model output cannot be coerced to the analysis schema
     */
    public LegalAnalysis synthesize(BusinessContext context,
                                    List<LegalSourceRecord> federalSources,
                                    List<LegalSourceRecord> stateSources,
                                    List<LegalSourceRecord> localSources) {

        String systemPrompt = promptBuilder.buildSystemPrompt();
        String userPrompt = promptBuilder.buildSynthesisPrompt(context, federalSources, stateSources, localSources);

        log.info("Synthesizing analysis for '{}' in {}, {} from {}/{}/{} sources",
                context.businessType(), context.city(), context.state(),
                federalSources.size(), stateSources.size(), localSources.size());

        QueryTimer timer = QueryTimer.started();

        String rawOutput = llmService.generate(systemPrompt, userPrompt);
        timer.mark("Model Call");

        LlmOutputParser.AnalysisContent content;
        try {
            content = outputParser.parseAnalysis(rawOutput);
        } catch (SynthesisParseException e) {
            log.error("Could not parse model output: {}\n--- raw ---\n{}\n--- cleaned ---\n{}",
                    e.getMessage(), e.getRawOutput(), e.getCleanedOutput());
            throw e;
        }
        timer.mark("Parse");
        timer.end();

        log.info("Synthesis complete in {}", timer.formatDisplay());

        return new LegalAnalysis(
                content.summary(),
                content.keyPoints(),
                content.jurisdictionAnalysis(),
                content.complianceSteps(),
                content.overlappingRegulations(),
                concatenateUrls(federalSources, stateSources, localSources),
                timer.getTotalTime()
        );
    }

    // Federal, then State, then Local; no dedup
    private static List<String> concatenateUrls(List<LegalSourceRecord> federalSources,
                                                List<LegalSourceRecord> stateSources,
                                                List<LegalSourceRecord> localSources) {
        List<String> urls = new ArrayList<>(federalSources.size() + stateSources.size() + localSources.size());
        federalSources.forEach(s -> urls.add(s.url()));
        stateSources.forEach(s -> urls.add(s.url()));
        localSources.forEach(s -> urls.add(s.url()));
        return urls;
    }
}
