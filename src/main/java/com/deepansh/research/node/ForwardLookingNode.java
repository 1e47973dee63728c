package com.deepansh.research.node;

import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.graph.NodeId;
import com.deepansh.research.core.graph.WorkflowNode;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.model.AnalystConsensus;
import com.deepansh.research.provider.MarketDataProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/** Analyst price targets and recommendations per ticker. */
@Component
@Slf4j
@RequiredArgsConstructor
public class ForwardLookingNode implements WorkflowNode {

    private final MarketDataProvider marketDataProvider;
    private final PerTickerFetcher fetcher;

    @Override
    public NodeId id() {
        return NodeId.FORWARD_LOOKING;
    }

    @Override
    public StateUpdate execute(WorkflowState state, ExecutionTrace trace) throws Exception {
        StateUpdate.Builder update = StateUpdate.builder();
        List<AnalystConsensus> consensus = fetcher.fetch(name(), state.tickers(),
                marketDataProvider::analystConsensus, update, trace);

        log.info("Analyst consensus for {}/{} tickers [runId={}]",
                consensus.size(), state.tickers().size(), state.runId());
        return update.analystConsensus(consensus).build();
    }
}
