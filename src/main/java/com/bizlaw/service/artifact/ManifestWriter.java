package com.bizlaw.service.artifact;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.bizlaw.exception.BizLawException;
import com.bizlaw.model.JurisdictionSources;
import com.bizlaw.model.LegalSourceRecord;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the identified-sources manifest consumed by the presentation layer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ManifestWriter {

    public static final String FILE_NAME = "identified_sources.json";

    public static final String FEDERAL_KEY = "Federal Laws";
    public static final String STATE_KEY = "State Laws";
    public static final String LOCAL_KEY = "Local Laws";

    private final ObjectMapper objectMapper;
    private final ArtifactPaths artifactPaths;

    public Map<String, List<LegalSourceRecord>> toManifest(JurisdictionSources federal,
                                                            JurisdictionSources state,
                                                            JurisdictionSources local) {
        Map<String, List<LegalSourceRecord>> manifest = new LinkedHashMap<>();
        manifest.put(FEDERAL_KEY, federal.records());
        manifest.put(STATE_KEY, state.records());
        manifest.put(LOCAL_KEY, local.records());
        return manifest;
    }

    public Path write(String sessionId,
                      JurisdictionSources federal,
                      JurisdictionSources state,
                      JurisdictionSources local) {
        Path target = artifactPaths.resolve(sessionId, FILE_NAME);
        try {
            Files.createDirectories(target.getParent());
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(target.toFile(), toManifest(federal, state, local));
            log.debug("Wrote source manifest: {}", target);
            return target;
        } catch (IOException e) {
            throw new BizLawException("Failed to write source manifest " + target, e);
        }
    }

    public void delete(String sessionId) {
        Path target = artifactPaths.resolve(sessionId, FILE_NAME);
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("Could not delete source manifest {}: {}", target, e.getMessage());
        }
    }
}
