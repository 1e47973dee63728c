package com.deepansh.research.analysis;

import com.deepansh.research.model.DispatchFlags;
import com.deepansh.research.model.QueryIntent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntentClassifierTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock LlmGateway llmGateway;

    @InjectMocks
    IntentClassifier classifier;

    @Test
    void classify_readsIntentAndLooseFlags() {
        ObjectNode reply = MAPPER.createObjectNode()
                .put("intent", "Sentiment_Analysis")
                .put("fetch_market_data", true)
                .put("analyze_sentiment", "yes")
                .put("retrieve_context", 0);
        when(llmGateway.completeJson(anyString(), anyString(), anyInt(), anyDouble())).thenReturn(reply);

        IntentClassification result = classifier.classify("How do people feel about TSLA?", List.of("TSLA"));

        assertThat(result.intent()).isEqualTo(QueryIntent.SENTIMENT_ANALYSIS);
        assertThat(result.flags()).isEqualTo(new DispatchFlags(true, true, false));
    }

    @Test
    void classify_unknownIntent_defaultsToGeneralResearch() {
        when(llmGateway.completeJson(anyString(), anyString(), anyInt(), anyDouble()))
                .thenReturn(MAPPER.createObjectNode().put("intent", "astrology"));

        IntentClassification result = classifier.classify("Tell me about markets", List.of());

        assertThat(result.intent()).isEqualTo(QueryIntent.GENERAL_RESEARCH);
        assertThat(result.flags()).isEqualTo(DispatchFlags.none());
    }

    @Test
    void fallback_dependsOnTickers() {
        assertThat(IntentClassification.fallback(true).flags()).isEqualTo(DispatchFlags.all());
        assertThat(IntentClassification.fallback(false).flags()).isEqualTo(DispatchFlags.contextOnly());
    }
}
