package com.bizlaw.util;

import java.util.List;

import org.springframework.stereotype.Component;

import com.bizlaw.model.BusinessContext;
import com.bizlaw.model.LegalSourceRecord;

@Component
public class PromptBuilder {

    public static final List<String> ANALYSIS_FIELDS = List.of(
            "summary",
            "key_points",
            "jurisdiction_analysis",
            "compliance_steps",
            "overlapping_regulations"
    );

    /* =========================================================
     * SYSTEM PROMPT
     * ========================================================= */
    public String buildSystemPrompt() {
        return """
                You are a legal advisor helping businesses understand applicable laws and regulations.

                Principles:
                1. GROUNDED: Base the analysis on the legal information provided
                2. STRUCTURED: Separate Federal, State and Local requirements
                3. PRACTICAL: Turn requirements into concrete compliance steps
                4. CAREFUL: Say so when the provided information is insufficient

                Always answer with a single JSON object and no additional text.
                """;
    }

    /* =========================================================
     * SYNTHESIS PROMPT
     * ========================================================= */
    public String buildSynthesisPrompt(
            BusinessContext context,
            List<LegalSourceRecord> federalSources,
            List<LegalSourceRecord> stateSources,
            List<LegalSourceRecord> localSources) {

        StringBuilder prompt = new StringBuilder();

        prompt.append("### BUSINESS CONTEXT\n");
        prompt.append("- Type: ").append(context.businessType()).append("\n");
        prompt.append("- Location: ").append(context.city()).append(", ").append(context.state()).append("\n");
        prompt.append("- Area of Law: ").append(context.areaOfLaw()).append("\n");
        if (context.statuteOfLaw() != null && !context.statuteOfLaw().isBlank()) {
            prompt.append("- Specific Statute: ").append(context.statuteOfLaw()).append("\n");
        }
        prompt.append("\n");

        prompt.append("### AVAILABLE LEGAL INFORMATION\n\n");
        prompt.append("Federal Laws:\n").append(formatSources(federalSources)).append("\n");
        prompt.append("State Laws:\n").append(formatSources(stateSources)).append("\n");
        prompt.append("Local Laws:\n").append(formatSources(localSources)).append("\n");

        prompt.append("### TASK\n");
        prompt.append("Based on the provided information, analyze the legal requirements and provide:\n");
        prompt.append("1. A comprehensive summary\n");
        prompt.append("2. Key points to remember\n");
        prompt.append("3. Analysis for each jurisdiction level\n");
        prompt.append("4. Specific steps for compliance\n");
        prompt.append("5. Identification of any overlapping regulations\n\n");

        prompt.append("### RESPONSE FORMAT\n");
        prompt.append("Respond in JSON without any additional text, with exactly these fields:\n");
        prompt.append("{\n");
        prompt.append("  \"summary\": \"A comprehensive summary of the applicable laws\",\n");
        prompt.append("  \"key_points\": [\"Key point to remember about the laws\"],\n");
        prompt.append("  \"jurisdiction_analysis\": {\"Federal\": \"...\", \"State\": \"...\", \"Local\": \"...\"},\n");
        prompt.append("  \"compliance_steps\": [\"Step for compliance\"],\n");
        prompt.append("  \"overlapping_regulations\": [\"Identified overlapping regulation\"]\n");
        prompt.append("}");

        return prompt.toString();
    }

    /* =========================================================
     * CONTEXT EXTRACTION
     * ========================================================= */
    public String buildContextExtractionPrompt(String userInput) {
        return """
                Analyze the following user input and extract the business context.

                User Input: "%s"

                Extract:
                - US City
                - US State
                - Business Type (e.g., Restaurant Owner, Landlord, Property Manager)
                - Area of Law (e.g., Employment, Taxation, Environmental)
                - Specific Statute of Law (if mentioned, e.g., OSHA, EPA, IRS)

                Return valid JSON only, in this format:
                {
                    "city": "US City Name or None",
                    "state": "US State Name or None",
                    "business_type": "Type of Business or None",
                    "area_of_law": "Area of Law or None",
                    "statute_of_law": "Specific Statute or None"
                }
                """.formatted(userInput);
    }

    /* =========================================================
     * SOURCE FORMAT
     * ========================================================= */
    public String formatSources(List<LegalSourceRecord> sources) {
        if (sources == null || sources.isEmpty()) {
            return "No sources found.\n";
        }

        StringBuilder text = new StringBuilder();
        for (LegalSourceRecord source : sources) {
            text.append("\nSource: ").append(source.url()).append("\n");
            text.append("Title: ").append(source.title()).append("\n");
            text.append("Content Summary: ").append(summaryOf(source)).append("\n");
        }
        return text.toString();
    }

    private String summaryOf(LegalSourceRecord source) {
        if (source.content() != null && !source.content().isBlank()) {
            return source.content();
        }
        return source.description() != null ? source.description() : "";
    }
}
