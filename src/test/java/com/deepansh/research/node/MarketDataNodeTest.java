package com.deepansh.research.node;

import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.state.StateMerger;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.model.MarketSnapshot;
import com.deepansh.research.model.PeerValuation;
import com.deepansh.research.provider.MarketDataProvider;
import com.deepansh.research.provider.QuoteData;
import com.deepansh.research.resilience.ErrorClassifier;
import com.deepansh.research.resilience.RetryExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarketDataNodeTest {

    @Mock MarketDataProvider marketDataProvider;

    private MarketDataNode node;
    private WorkflowState state;

    @BeforeEach
    void setUp() {
        PerTickerFetcher fetcher = new PerTickerFetcher(
                new RetryExecutor(new ErrorClassifier(), 3, Duration.ofMillis(1)));
        node = new MarketDataNode(marketDataProvider, fetcher);
        state = StateMerger.merge(
                WorkflowState.initial("run-1", "session-1", "Compare AAPL and MSFT", Instant.now()),
                StateUpdate.builder().tickers(List.of("AAPL", "MSFT")).build());
    }

    private static QuoteData quote(String ticker, double price) {
        return QuoteData.builder().ticker(ticker).price(price).yearHigh(200.0).yearLow(100.0).build();
    }

    @Test
    void execute_oneTickerTimesOut_siblingStillSucceeds() throws Exception {
        when(marketDataProvider.quote("AAPL")).thenReturn(quote("AAPL", 190.0));
        when(marketDataProvider.quote("MSFT")).thenThrow(new ResourceAccessException("Read timed out"));
        when(marketDataProvider.peerValuation("AAPL")).thenReturn(PeerValuation.builder().ticker("AAPL").build());
        when(marketDataProvider.peerValuation("MSFT")).thenReturn(PeerValuation.builder().ticker("MSFT").build());

        WorkflowState merged = StateMerger.merge(state, node.execute(state, new ExecutionTrace("market_data")));

        verify(marketDataProvider, times(3)).quote("MSFT");
        verify(marketDataProvider, times(1)).quote("AAPL");
        assertThat(merged.marketData()).extracting(MarketSnapshot::ticker).containsExactly("AAPL");
        assertThat(merged.marketData().get(0).trendSignal()).isEqualTo("near_high");
        assertThat(merged.peerValuations()).hasSize(2);
        assertThat(merged.nodeErrors()).containsOnlyKeys("market_data:MSFT");
        assertThat(merged.errors()).containsExactly("market_data error for MSFT: Read timed out");
    }

    @Test
    void execute_permanentFailure_notRetried() throws Exception {
        when(marketDataProvider.quote("AAPL")).thenReturn(quote("AAPL", 150.0));
        when(marketDataProvider.quote("MSFT")).thenThrow(new IllegalArgumentException("unknown symbol"));
        when(marketDataProvider.peerValuation("AAPL")).thenThrow(new IllegalArgumentException("no sector"));
        when(marketDataProvider.peerValuation("MSFT")).thenThrow(new IllegalArgumentException("no sector"));

        ExecutionTrace trace = new ExecutionTrace("market_data");
        WorkflowState merged = StateMerger.merge(state, node.execute(state, trace));

        verify(marketDataProvider, times(1)).quote("MSFT");
        assertThat(merged.marketData()).hasSize(1);
        assertThat(merged.peerValuations()).isEmpty();
        assertThat(merged.nodeErrors()).containsOnlyKeys(
                "market_data:MSFT", "peer_valuation:AAPL", "peer_valuation:MSFT");
        assertThat(trace.steps()).contains("MSFT: failed - unknown symbol");
    }
}
