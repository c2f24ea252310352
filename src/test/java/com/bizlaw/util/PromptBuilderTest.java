package com.bizlaw.util;

import com.bizlaw.model.BusinessContext;
import com.bizlaw.model.Jurisdiction;
import com.bizlaw.model.LegalSourceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private PromptBuilder promptBuilder;

    @BeforeEach
    void setUp() {
        promptBuilder = new PromptBuilder();
    }

    @Test
    @DisplayName("synthesis prompt: context, then Federal, State and Local blocks, then the JSON format")
    void synthesisPromptLayout() {
        BusinessContext context = new BusinessContext("Denver", "Colorado", "Landlord", "Taxation", "TABOR");
        LegalSourceRecord federal = new LegalSourceRecord(
                "https://www.irs.gov/rental", Jurisdiction.FEDERAL, "Rental income", "Schedule E", 1.0, "{\"link\":\"x\"}");

        String prompt = promptBuilder.buildSynthesisPrompt(context, List.of(federal), List.of(), List.of());

        assertThat(prompt).contains("- Type: Landlord", "- Location: Denver, Colorado", "- Specific Statute: TABOR");
        assertThat(prompt.indexOf("Federal Laws:"))
                .isLessThan(prompt.indexOf("State Laws:"));
        assertThat(prompt.indexOf("State Laws:"))
                .isLessThan(prompt.indexOf("Local Laws:"));
        assertThat(prompt).contains("Source: https://www.irs.gov/rental", "Title: Rental income");
        PromptBuilder.ANALYSIS_FIELDS.forEach(field -> assertThat(prompt).contains("\"" + field + "\""));
    }

    @Test
    @DisplayName("statute line is omitted when no statute is given")
    void noStatute() {
        String prompt = promptBuilder.buildSynthesisPrompt(
                new BusinessContext("Denver", "Colorado", "Landlord", "Taxation"), List.of(), List.of(), List.of());

        assertThat(prompt).doesNotContain("Specific Statute");
    }

    @Test
    @DisplayName("source summary falls back to the description when content is empty")
    void formatSources() {
        LegalSourceRecord bare = new LegalSourceRecord(
                "https://www.sba.gov/guide", Jurisdiction.FEDERAL, "Guide", "Plain description", 1.0, "");

        assertThat(promptBuilder.formatSources(List.of(bare)))
                .isEqualTo("\nSource: https://www.sba.gov/guide\nTitle: Guide\nContent Summary: Plain description\n");
        assertThat(promptBuilder.formatSources(List.of())).isEqualTo("No sources found.\n");
    }

    @Test
    @DisplayName("extraction prompt embeds the user input")
    void extractionPrompt() {
        assertThat(promptBuilder.buildContextExtractionPrompt("bakery in Boise"))
                .contains("User Input: \"bakery in Boise\"")
                .contains("\"statute_of_law\"");
    }
}
