package com.bizlaw.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import lombok.Data;

/**
 * Application configuration bound from the {@code bizlaw.*} tree.
 * Every group carries defaults so an empty configuration still yields a working registry.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "bizlaw")
public class AdvisorProperties {

    private Sources sources = new Sources();
    private Search search = new Search();
    private Synthesis synthesis = new Synthesis();
    private Session session = new Session();
    private Artifacts artifacts = new Artifacts();
    private Monitoring monitoring = new Monitoring();

    // ============================================================
    // Source registry
    // ============================================================
    @Data
    public static class Sources {
        private List<String> trustedSuffixes = new ArrayList<>(List.of(".gov", ".org"));

        private List<String> federalDomains = new ArrayList<>(List.of(
                "irs.gov",
                "osha.gov",
                "epa.gov",
                "dol.gov",
                "msha.gov",
                "eeoc.gov",
                "hhs.gov",
                "sba.gov",
                "ecfr.gov",
                "govinfo.gov"
        ));

        private List<String> lawCategories = new ArrayList<>(List.of(
                "Business Formation and Governance",
                "Taxation",
                "Employment and Labor",
                "Health and Safety",
                "Environmental Protection",
                "Intellectual Property",
                "Consumer Protection and Marketing",
                "Privacy and Data Protection",
                "Antitrust and Competition",
                "Licensing, Permits and Zoning",
                "Immigration and Workforce Eligibility",
                "Financial and Securities",
                "International Trade and Imports/Exports",
                "Industry-Specific Regulations",
                "OTHER"
        ));
    }

    // ============================================================
    // Search provider
    // ============================================================
    @Data
    public static class Search {
        private String baseUrl = "https://google.serper.dev";
        private String apiKey;
        private Integer timeoutSeconds = 15;
        private Integer federalConcurrency = 4;
        private String domainRestriction = "site:.gov";
    }

    // ============================================================
    // Synthesis
    // ============================================================
    @Data
    public static class Synthesis {
        private Double temperature = 0.7;
        private Long timeoutSeconds = 60L;
        private Integer maxConcurrent = 8;
    }

    // ============================================================
    // Sessions
    // ============================================================
    @Data
    public static class Session {
        private Integer maxHistory = 20;
    }

    // ============================================================
    // Artifacts
    // ============================================================
    @Data
    public static class Artifacts {
        private Boolean enabled = true;
        private String directory = "data/artifacts";
    }

    // ============================================================
    // Monitoring
    // ============================================================
    @Data
    public static class Monitoring {
        private Integer maxQueryHistory = 100;
    }
}
