package com.deepansh.research.node;

import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.graph.NodeId;
import com.deepansh.research.core.graph.WorkflowNode;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.model.MarketSnapshot;
import com.deepansh.research.model.PeerValuation;
import com.deepansh.research.provider.MarketDataProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Quotes (with 52-week trend) and sector peer valuation for every ticker.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MarketDataNode implements WorkflowNode {

    private final MarketDataProvider marketDataProvider;
    private final PerTickerFetcher fetcher;

    @Override
    public NodeId id() {
        return NodeId.MARKET_DATA;
    }

    @Override
    public StateUpdate execute(WorkflowState state, ExecutionTrace trace) throws Exception {
        StateUpdate.Builder update = StateUpdate.builder();

        List<MarketSnapshot> snapshots = fetcher.fetch(name(), state.tickers(),
                ticker -> MarketSnapshot.from(marketDataProvider.quote(ticker)), update, trace);
        List<PeerValuation> peers = fetcher.fetch("peer_valuation", state.tickers(),
                marketDataProvider::peerValuation, update, trace);

        log.info("Market data: {}/{} quotes, {} peer valuations [runId={}]",
                snapshots.size(), state.tickers().size(), peers.size(), state.runId());

        return update.marketData(snapshots)
                .peerValuations(peers)
                .build();
    }
}
