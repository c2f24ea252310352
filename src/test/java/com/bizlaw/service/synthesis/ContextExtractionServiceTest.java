package com.bizlaw.service.synthesis;

import com.bizlaw.exception.SynthesisParseException;
import com.bizlaw.model.BusinessContext;
import com.bizlaw.service.llm.LlmService;
import com.bizlaw.util.PromptBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContextExtractionServiceTest {

    @Mock
    private LlmService llmService;

    private ContextExtractionService service;

    @BeforeEach
    void setUp() {
        service = new ContextExtractionService(llmService, new PromptBuilder(), new LlmOutputParser(new ObjectMapper()));
    }

    @Test
    @DisplayName("extracts all fields from fenced model output")
    void extractsFields() {
        when(llmService.generate(anyString(), contains("I run a food truck in Portland"))).thenReturn("""
                ```json
                {"city": "Portland", "state": "Oregon", "business_type": "Food Truck Operator",
                 "area_of_law": "Licensing, Permits and Zoning", "statute_of_law": "ORS 624"}
                ```""");

        BusinessContext context = service.extract("I run a food truck in Portland, Oregon");

        assertThat(context).isEqualTo(new BusinessContext(
                "Portland", "Oregon", "Food Truck Operator", "Licensing, Permits and Zoning", "ORS 624"));
        assertThat(context.isComplete()).isTrue();
    }

    @Test
    @DisplayName("'None' and blank values come back absent")
    void noneBecomesNull() {
        when(llmService.generate(anyString(), anyString())).thenReturn("""
                {"city": "None", "state": "Ohio", "business_type": " ", "area_of_law": "Taxation", "statute_of_law": "none"}
                """);

        BusinessContext context = service.extract("tax questions for my Ohio business");

        assertThat(context.city()).isNull();
        assertThat(context.state()).isEqualTo("Ohio");
        assertThat(context.businessType()).isNull();
        assertThat(context.statuteOfLaw()).isNull();
        assertThat(context.isComplete()).isFalse();
    }

    @Test
    @DisplayName("non-JSON output is a parse error")
    void invalidOutput() {
        when(llmService.generate(anyString(), anyString())).thenReturn("Sorry, no idea.");

        assertThatThrownBy(() -> service.extract("hello")).isInstanceOf(SynthesisParseException.class);
    }
}
