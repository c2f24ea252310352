package com.bizlaw.service.artifact;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.bizlaw.exception.ArtifactFormatException;
import com.bizlaw.exception.BizLawException;
import com.bizlaw.model.Jurisdiction;
import com.bizlaw.model.LegalAnalysis;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Versioned JSON persistence of a {@link LegalAnalysis}.
 *
 * <p>Decoding fails closed: the document must carry the expected format tag and version, and the
 * analysis object must hold exactly the known fields with the expected types.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisArtifactStore {

    public static final String FILE_NAME = "applicable_laws.json";
    public static final String FORMAT = "bizlaw.legal-analysis";
    public static final int VERSION = 1;

    private static final Set<String> ENVELOPE_FIELDS = Set.of("format", "version", "analysis");
    private static final Set<String> ANALYSIS_FIELDS = Set.of(
            "summary",
            "key_points",
            "jurisdiction_analysis",
            "compliance_steps",
            "overlapping_regulations",
            "sources",
            "response_time"
    );

    private final ObjectMapper objectMapper;
    private final ArtifactPaths artifactPaths;

    // ============================================================
    // File storage
    // ============================================================

    public Path save(String sessionId, LegalAnalysis analysis) {
        Path target = artifactPaths.resolve(sessionId, FILE_NAME);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, encode(analysis), StandardCharsets.UTF_8);
            log.debug("Wrote analysis artifact: {}", target);
            return target;
        } catch (IOException e) {
            throw new BizLawException("Failed to write analysis artifact " + target, e);
        }
    }

    public Optional<LegalAnalysis> load(String sessionId) {
        Path source = artifactPaths.resolve(sessionId, FILE_NAME);
        if (!Files.exists(source)) {
            return Optional.empty();
        }
        try {
            return Optional.of(decode(Files.readString(source, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new BizLawException("Failed to read analysis artifact " + source, e);
        }
    }

    public void delete(String sessionId) {
        Path source = artifactPaths.resolve(sessionId, FILE_NAME);
        try {
            Files.deleteIfExists(source);
        } catch (IOException e) {
            log.warn("Could not delete analysis artifact {}: {}", source, e.getMessage());
        }
    }

    // ============================================================
    // Encoding
    // ============================================================

    public String encode(LegalAnalysis analysis) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("format", FORMAT);
        root.put("version", VERSION);

        ObjectNode body = root.putObject("analysis");
        body.put("summary", analysis.summary());
        putTextArray(body, "key_points", analysis.keyPoints());
        ObjectNode byJurisdiction = body.putObject("jurisdiction_analysis");
        analysis.jurisdictionAnalysis().forEach(byJurisdiction::put);
        putTextArray(body, "compliance_steps", analysis.complianceSteps());
        putTextArray(body, "overlapping_regulations", analysis.overlappingRegulations());
        putTextArray(body, "sources", analysis.sources());
        body.put("response_time", analysis.responseTime());

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new BizLawException("Failed to encode analysis artifact", e);
        }
    }

    private static void putTextArray(ObjectNode node, String field, List<String> values) {
        ArrayNode array = node.putArray(field);
        values.forEach(array::add);
    }

    // ============================================================
    // Strict decoding
    // ============================================================

    public LegalAnalysis decode(String document) {
        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new ArtifactFormatException("Analysis artifact is not valid JSON", e);
        }

        requireObject(root, "document");
        requireExactFields(root, ENVELOPE_FIELDS, "document");

        JsonNode format = root.get("format");
        if (!format.isTextual() || !FORMAT.equals(format.asText())) {
            throw new ArtifactFormatException("Unexpected artifact format: " + format);
        }
        JsonNode version = root.get("version");
        if (!version.isIntegralNumber() || version.asInt() != VERSION) {
            throw new ArtifactFormatException("Unsupported artifact version: " + version);
        }

        JsonNode body = root.get("analysis");
        requireObject(body, "analysis");
        requireExactFields(body, ANALYSIS_FIELDS, "analysis");

        JsonNode responseTime = body.get("response_time");
        if (!responseTime.isNumber()) {
            throw new ArtifactFormatException("Field 'response_time' must be a number");
        }

        return new LegalAnalysis(
                requireText(body.get("summary"), "summary"),
                requireTextList(body.get("key_points"), "key_points"),
                requireJurisdictionMap(body.get("jurisdiction_analysis")),
                requireTextList(body.get("compliance_steps"), "compliance_steps"),
                requireTextList(body.get("overlapping_regulations"), "overlapping_regulations"),
                requireTextList(body.get("sources"), "sources"),
                responseTime.asDouble()
        );
    }

    private static void requireObject(JsonNode node, String name) {
        if (node == null || !node.isObject()) {
            throw new ArtifactFormatException("'" + name + "' must be a JSON object");
        }
    }

    private static void requireExactFields(JsonNode node, Set<String> expected, String name) {
        List<String> unknown = new ArrayList<>();
        node.fieldNames().forEachRemaining(field -> {
            if (!expected.contains(field)) {
                unknown.add(field);
            }
        });
        if (!unknown.isEmpty()) {
            throw new ArtifactFormatException("Unknown field(s) in " + name + ": " + unknown);
        }

        List<String> missing = expected.stream().filter(field -> !node.has(field)).sorted().toList();
        if (!missing.isEmpty()) {
            throw new ArtifactFormatException("Missing field(s) in " + name + ": " + missing);
        }
    }

    private static String requireText(JsonNode node, String field) {
        if (node == null || !node.isTextual()) {
            throw new ArtifactFormatException("Field '" + field + "' must be a string");
        }
        return node.asText();
    }

    private static List<String> requireTextList(JsonNode node, String field) {
        if (node == null || !node.isArray()) {
            throw new ArtifactFormatException("Field '" + field + "' must be an array of strings");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            values.add(requireText(element, field + "[]"));
        }
        return values;
    }

    private static Map<String, String> requireJurisdictionMap(JsonNode node) {
        requireObject(node, "jurisdiction_analysis");

        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            Jurisdiction jurisdiction = Jurisdiction.lookup(entry.getKey())
                    .filter(j -> j.getDisplayName().equals(entry.getKey()))
                    .orElseThrow(() -> new ArtifactFormatException(
                            "Unknown jurisdiction in jurisdiction_analysis: " + entry.getKey()));
            values.put(jurisdiction.getDisplayName(), requireText(entry.getValue(), "jurisdiction_analysis." + entry.getKey()));
        }
        return values;
    }
}
