package com.deepansh.research.node;

import com.deepansh.research.analysis.SentimentAnalyzer;
import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.state.StateMerger;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.exception.ResearchException;
import com.deepansh.research.model.SentimentAnalysis;
import com.deepansh.research.resilience.ErrorClassifier;
import com.deepansh.research.resilience.RetryExecutor;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SentimentNodeTest {

    private final SentimentAnalyzer analyzer = mock(SentimentAnalyzer.class);
    private final SentimentNode node = new SentimentNode(analyzer,
            new PerTickerFetcher(new RetryExecutor(new ErrorClassifier(), 2, Duration.ofMillis(1))));

    @Test
    void execute_oneTickerFails_othersKept() throws Exception {
        WorkflowState state = StateMerger.merge(
                WorkflowState.initial("run-1", "session-1", "Sentiment on AAPL and TSLA", Instant.now()),
                StateUpdate.builder().tickers(List.of("AAPL", "TSLA")).build());
        when(analyzer.analyze("AAPL")).thenReturn(SentimentAnalysis.neutral("AAPL", 3, "Mixed."));
        when(analyzer.analyze("TSLA")).thenThrow(new ResearchException("Brave Search API key not configured"));

        ExecutionTrace trace = new ExecutionTrace("sentiment");
        WorkflowState result = StateMerger.merge(state, node.execute(state, trace));

        assertThat(result.sentiment()).extracting(SentimentAnalysis::ticker).containsExactly("AAPL");
        assertThat(result.nodeErrors()).containsKey("sentiment:TSLA");
        assertThat(result.errors()).singleElement().asString().startsWith("sentiment error for TSLA");
        assertThat(trace.steps()).containsExactly("AAPL: ok", "TSLA: failed - Brave Search API key not configured");
    }
}
