package com.deepansh.wordplay.writing;

import com.deepansh.wordplay.exception.ModelCallException;
import com.deepansh.wordplay.llm.LlmClient;
import com.deepansh.wordplay.llm.ModelReplyParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WritingAssistantTest {

    private static final String TEXT = "The tide rolled in slowly, carrying driftwood and the smell of salt.";

    @Mock LlmClient llmClient;

    private WritingAssistant assistant;

    @BeforeEach
    void setUp() {
        assistant = new WritingAssistant(llmClient, new ModelReplyParser(new ObjectMapper()));
    }

    @Test
    void analyzeStyle_shortText_skipsModel() {
        StyleAnalysis analysis = assistant.analyzeStyle("Too short", null);

        assertThat(analysis.getReadabilityGrade()).isEqualTo("Not determined");
        assertThat(analysis.getFormality()).isEqualTo(50);
        verifyNoInteractions(llmClient);
    }

    @Test
    void analyzeStyle_fractionalScores_scaledToHundred() {
        when(llmClient.complete(anyString(), anyString(), any())).thenReturn("""
                {"metrics": {"formality": 0.8, "complexity": 65, "coherence": "90",
                             "engagement": 140, "conciseness": "n/a"},
                 "readability": {"score": 72, "grade": "High School"},
                 "toneAnalysis": "Calm"}""");

        StyleAnalysis analysis = assistant.analyzeStyle(TEXT, null);

        assertThat(analysis.isFallback()).isFalse();
        assertThat(analysis.getFormality()).isEqualTo(80);
        assertThat(analysis.getComplexity()).isEqualTo(65);
        assertThat(analysis.getCoherence()).isEqualTo(90);
        assertThat(analysis.getEngagement()).isEqualTo(100);
        assertThat(analysis.getConciseness()).isEqualTo(50);
        assertThat(analysis.getReadabilityGrade()).isEqualTo("High School");
        assertThat(analysis.getToneAnalysis()).isEqualTo("Calm");
    }

    @Test
    void analyzeStyle_modelDown_returnsNeutralFallback() {
        when(llmClient.complete(anyString(), anyString(), any())).thenThrow(new ModelCallException("down"));

        StyleAnalysis analysis = assistant.analyzeStyle(TEXT, null);

        assertThat(analysis.isFallback()).isTrue();
        assertThat(analysis.getReadabilityGrade()).isEqualTo("Analysis unavailable");
        assertThat(analysis.toMetrics()).containsEntry("formality", 50);
    }

    @Test
    void normalize_nonNumeric_isFifty() {
        assertThat(WritingAssistant.normalize(JsonNodeFactory.instance.missingNode())).isEqualTo(50);
        assertThat(WritingAssistant.normalize(JsonNodeFactory.instance.numberNode(-5))).isZero();
    }

    @Test
    void suggestions_modelDown_returnsEmpty() {
        when(llmClient.complete(anyString(), anyString(), any())).thenThrow(new ModelCallException("down"));

        assertThat(assistant.suggestions(TEXT, Map.of(), "clarity", null)).isEmpty();
    }

    @Test
    void suggestions_parsesList() {
        when(llmClient.complete(anyString(), anyString(), any()))
                .thenReturn("{\"suggestions\": [\"Shorten the opening\", \"Add a sensory detail\"]}");

        assertThat(assistant.suggestions(TEXT, Map.of(), "improvement", null))
                .containsExactly("Shorten the opening", "Add a sensory detail");
    }

    @Test
    void generateText_modelDown_propagates() {
        when(llmClient.complete(anyString(), anyString(), any())).thenThrow(new ModelCallException("down"));

        assertThatThrownBy(() -> assistant.generateText(TEXT, Map.of(), "Continue", null))
                .isInstanceOf(ModelCallException.class);
    }

    @Test
    void processCommand_missingFields_defaultToSourceAndGenericMessage() {
        when(llmClient.complete(anyString(), anyString(), any())).thenReturn("{}");

        TextCommandResult result = assistant.processCommand(TEXT, "format paragraph", null);

        assertThat(result.result()).isEqualTo(TEXT);
        assertThat(result.message()).isEqualTo("Command processed successfully.");
    }

    @Test
    void processCommand_prose_throws() {
        when(llmClient.complete(anyString(), anyString(), any())).thenReturn("I replaced everything.");

        assertThatThrownBy(() -> assistant.processCommand(TEXT, "replace 'a' 'b'", null))
                .isInstanceOf(ModelCallException.class);
    }
}
