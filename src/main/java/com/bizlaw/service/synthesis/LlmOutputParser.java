package com.bizlaw.service.synthesis;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.bizlaw.exception.SynthesisParseException;
import com.bizlaw.model.Jurisdiction;
import com.bizlaw.util.PromptBuilder;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns free-text model output into a JSON object and coerces it to the analysis schema.
 *
 * <p>A code fence is stripped only when it wraps the whole output. The object is then the whole
 * remaining text if that decodes, else the first '{' that opens a complete JSON object, so prose
 * before and after it is ignored. Anything still not decodable fails with
 * {@link SynthesisParseException}; there is no further recovery.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmOutputParser {

    private static final Pattern SURROUNDING_FENCE = Pattern.compile("^```[\\w-]*\\s*(.*?)\\s*```$", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public String clean(String raw) {
        if (raw == null) {
            return "";
        }

        String trimmed = raw.trim();
        Matcher fence = SURROUNDING_FENCE.matcher(trimmed);
        return fence.matches() ? fence.group(1) : trimmed;
    }

    /**
     * Decodes the model output as a JSON object.
     */
    public JsonNode decodeObject(String raw) {
        String cleaned = clean(raw);

        // the unmodified output wins when it already is an object
        String trimmed = raw == null ? "" : raw.trim();
        if (!trimmed.equals(cleaned)) {
            JsonNode node = readObjectOrNull(trimmed);
            if (node != null) {
                return node;
            }
        }

        IOException firstFailure = null;
        boolean sawNonObject = false;

        // fence-stripped text as a whole, then every later '{' in order
        List<String> candidates = new ArrayList<>();
        candidates.add(cleaned);
        for (int start = cleaned.indexOf('{', 1); start > 0; start = cleaned.indexOf('{', start + 1)) {
            candidates.add(cleaned.substring(start));
        }

        for (String candidate : candidates) {
            try {
                JsonNode node = readFirstValue(candidate);
                if (node != null && node.isObject()) {
                    return node;
                }
                sawNonObject |= node != null;
            } catch (IOException e) {
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }

        if (sawNonObject || firstFailure == null) {
            throw new SynthesisParseException("Model output is not a JSON object", raw, cleaned);
        }
        String reason = firstFailure instanceof JsonProcessingException
                ? ((JsonProcessingException) firstFailure).getOriginalMessage()
                : firstFailure.getMessage();
        throw new SynthesisParseException("Model output is not valid JSON: " + reason, raw, cleaned, firstFailure);
    }

    private JsonNode readObjectOrNull(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("Output is not a bare JSON object, trying cleanup: {}", e.getOriginalMessage());
            return null;
        }
    }

    // one JSON value from the start of the text; whatever follows it is ignored
    private JsonNode readFirstValue(String text) throws IOException {
        try (JsonParser parser = objectMapper.getFactory().createParser(text)) {
            return objectMapper.readTree(parser);
        }
    }

    public AnalysisContent parseAnalysis(String raw) {
        JsonNode root = decodeObject(raw);
        String cleaned = clean(raw);

        List<String> missing = PromptBuilder.ANALYSIS_FIELDS.stream()
                .filter(field -> !root.has(field))
                .toList();
        if (!missing.isEmpty()) {
            throw new SynthesisParseException(
                    "Model output is missing required field(s): " + String.join(", ", missing), raw, cleaned);
        }

        return new AnalysisContent(
                toText(root.get("summary"), "summary", raw, cleaned),
                toTextList(root.get("key_points"), "key_points", raw, cleaned),
                toJurisdictionMap(root.get("jurisdiction_analysis"), raw, cleaned),
                toTextList(root.get("compliance_steps"), "compliance_steps", raw, cleaned),
                toTextList(root.get("overlapping_regulations"), "overlapping_regulations", raw, cleaned)
        );
    }

    // ============================================================
    // Coercion
    // ============================================================

    private String toText(JsonNode node, String field, String raw, String cleaned) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            throw new SynthesisParseException("Field '" + field + "' must be a string", raw, cleaned);
        }
        return node.asText();
    }

    private List<String> toTextList(JsonNode node, String field, String raw, String cleaned) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isValueNode()) {
            String single = node.asText();
            return single.isBlank() ? List.of() : List.of(single);
        }
        if (!node.isArray()) {
            throw new SynthesisParseException("Field '" + field + "' must be a list of strings", raw, cleaned);
        }

        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isNull()) {
                continue;
            }
            values.add(element.isValueNode() ? element.asText() : element.toString());
        }
        return values;
    }

    private Map<String, String> toJurisdictionMap(JsonNode node, String raw, String cleaned) {
        if (node == null || !node.isObject()) {
            throw new SynthesisParseException(
                    "Field 'jurisdiction_analysis' must be an object keyed by jurisdiction", raw, cleaned);
        }

        Map<Jurisdiction, String> byJurisdiction = new EnumMap<>(Jurisdiction.class);
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            Jurisdiction jurisdiction = Jurisdiction.lookup(entry.getKey()).orElse(null);
            if (jurisdiction == null) {
                log.warn("Dropping unknown jurisdiction key in model output: '{}'", entry.getKey());
                continue;
            }
            JsonNode value = entry.getValue();
            if (value == null || value.isNull()) {
                continue;
            }
            byJurisdiction.put(jurisdiction, value.isValueNode() ? value.asText() : value.toString());
        }

        Map<String, String> analysis = new LinkedHashMap<>();
        byJurisdiction.forEach((jurisdiction, text) -> analysis.put(jurisdiction.getDisplayName(), text));
        return analysis;
    }

    /**
     * The five model-produced analysis fields, after coercion.
     */
    public record AnalysisContent(
            String summary,
            List<String> keyPoints,
            Map<String, String> jurisdictionAnalysis,
            List<String> complianceSteps,
            List<String> overlappingRegulations
    ) {
    }
}
