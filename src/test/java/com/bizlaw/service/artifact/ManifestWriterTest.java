package com.bizlaw.service.artifact;

import com.bizlaw.config.AdvisorProperties;
import com.bizlaw.model.Jurisdiction;
import com.bizlaw.model.JurisdictionSources;
import com.bizlaw.model.LegalSourceRecord;
import com.bizlaw.model.ScopedSearchOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ManifestWriterTest {

    @TempDir
    Path artifactDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ManifestWriter writer;

    @BeforeEach
    void setUp() {
        AdvisorProperties properties = new AdvisorProperties();
        properties.getArtifacts().setDirectory(artifactDir.toString());
        writer = new ManifestWriter(objectMapper, new ArtifactPaths(properties));
    }

    private static JurisdictionSources sources(Jurisdiction jurisdiction, String... urls) {
        List<LegalSourceRecord> records = new ArrayList<>();
        for (String url : urls) {
            records.add(new LegalSourceRecord(url, jurisdiction, "Title", "Snippet", 1.0, "{\"link\":\"" + url + "\"}"));
        }
        return JurisdictionSources.of(jurisdiction, List.of(ScopedSearchOutcome.success("q", records)));
    }

    @Test
    @DisplayName("manifest has exactly the three jurisdiction keys with ordered record lists")
    void writesManifest() throws Exception {
        Path written = writer.write("abc-123",
                sources(Jurisdiction.FEDERAL, "https://www.irs.gov/a", "https://www.sba.gov/b"),
                sources(Jurisdiction.STATE),
                sources(Jurisdiction.LOCAL, "https://www.boston.gov/c"));

        JsonNode manifest = objectMapper.readTree(written.toFile());

        List<String> keys = new ArrayList<>();
        manifest.fieldNames().forEachRemaining(keys::add);
        assertThat(keys).containsExactly("Federal Laws", "State Laws", "Local Laws");

        JsonNode federal = manifest.get("Federal Laws");
        assertThat(federal).hasSize(2);
        assertThat(federal.get(0).get("url").asText()).isEqualTo("https://www.irs.gov/a");
        assertThat(federal.get(1).get("url").asText()).isEqualTo("https://www.sba.gov/b");
        assertThat(federal.get(0).get("jurisdiction").asText()).isEqualTo("Federal");
        assertThat(federal.get(0).get("relevance_score").asDouble()).isEqualTo(1.0);
        assertThat(manifest.get("State Laws")).isEmpty();
        assertThat(manifest.get("Local Laws").get(0).get("jurisdiction").asText()).isEqualTo("Local");
    }
}
