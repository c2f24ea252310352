package com.bizlaw.service.artifact;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.bizlaw.config.AdvisorProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves per-session artifact files under the configured artifact directory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArtifactPaths {

    private static final Pattern SAFE_SESSION_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final AdvisorProperties properties;

    public Path resolve(String sessionId, String fileName) {
        return sessionDirectory(sessionId).resolve(fileName);
    }

    public Path sessionDirectory(String sessionId) {
        if (sessionId == null || !SAFE_SESSION_ID.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("Invalid session id for artifact storage: " + sessionId);
        }
        return Paths.get(properties.getArtifacts().getDirectory()).resolve(sessionId);
    }

    /**
     * Removes the session's artifact directory once it is empty. Unknown files keep it in place.
     */
    public void removeSessionDirectory(String sessionId) {
        Path directory = sessionDirectory(sessionId);
        try {
            Files.deleteIfExists(directory);
        } catch (DirectoryNotEmptyException e) {
            log.warn("Artifact directory {} still holds files, leaving it in place", directory);
        } catch (IOException e) {
            log.warn("Could not delete artifact directory {}: {}", directory, e.getMessage());
        }
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(properties.getArtifacts().getEnabled());
    }
}
