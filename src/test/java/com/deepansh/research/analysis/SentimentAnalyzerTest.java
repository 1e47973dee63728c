package com.deepansh.research.analysis;

import com.deepansh.research.model.SentimentAnalysis;
import com.deepansh.research.provider.NewsArticle;
import com.deepansh.research.provider.NewsProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SentimentAnalyzerTest {

    @Mock NewsProvider newsProvider;
    @Mock LlmGateway llmGateway;

    @InjectMocks
    SentimentAnalyzer analyzer;

    private static final List<NewsArticle> NEWS = List.of(
            new NewsArticle("Apple beats estimates", "https://example.com/a", "Record quarter", "1 day ago"),
            new NewsArticle("iPhone demand slows", "https://example.com/b", "", ""));

    @Test
    void analyze_scoresNewsWithLlm() throws Exception {
        when(newsProvider.search("AAPL stock news")).thenReturn(NEWS);
        when(llmGateway.completeJson(anyString(), anyString(), anyInt(), anyDouble())).thenReturn(new ObjectMapper().readTree(
                "{\"sentiment\": \"POSITIVE\", \"confidence\": 1.7, \"themes\": [\"earnings\"], \"summary\": \"Upbeat.\"}"));

        SentimentAnalysis result = analyzer.analyze("AAPL");

        assertThat(result.overallSentiment()).isEqualTo("positive");
        assertThat(result.confidence()).isEqualTo(1.0);
        assertThat(result.keyThemes()).containsExactly("earnings");
        assertThat(result.newsCount()).isEqualTo(2);
    }

    @Test
    void analyze_noNews_isNeutralWithoutLlm() {
        when(newsProvider.search("MSFT stock news")).thenReturn(List.of());

        SentimentAnalysis result = analyzer.analyze("MSFT");

        assertThat(result.overallSentiment()).isEqualTo("neutral");
        assertThat(result.newsCount()).isZero();
        verifyNoInteractions(llmGateway);
    }

    @Test
    void analyze_llmFails_degradesToNeutral() {
        when(newsProvider.search("AAPL stock news")).thenReturn(NEWS);
        when(llmGateway.completeJson(anyString(), anyString(), anyInt(), anyDouble()))
                .thenThrow(new IllegalStateException("LLM down"));

        SentimentAnalysis result = analyzer.analyze("AAPL");

        assertThat(result.overallSentiment()).isEqualTo("neutral");
        assertThat(result.confidence()).isZero();
        assertThat(result.summary()).contains("2 news items");
    }

    @Test
    void analyze_newsFails_propagates() {
        when(newsProvider.search("AAPL stock news")).thenThrow(new ResourceAccessException("timeout"));

        assertThatThrownBy(() -> analyzer.analyze("AAPL")).isInstanceOf(ResourceAccessException.class);
    }
}
