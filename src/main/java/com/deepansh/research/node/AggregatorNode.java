package com.deepansh.research.node;

import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.graph.NodeId;
import com.deepansh.research.core.graph.WorkflowNode;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Join point after the specialists. The scheduler has already merged every
 * branch by the time this runs; the node only reports what arrived.
 */
@Component
@Slf4j
public class AggregatorNode implements WorkflowNode {

    @Override
    public NodeId id() {
        return NodeId.AGGREGATOR;
    }

    @Override
    public StateUpdate execute(WorkflowState state, ExecutionTrace trace) {
        String summary = String.format("market_data=%d, peer_valuations=%d, analyst_consensus=%d, sentiment=%d, context=%d",
                state.marketData().size(), state.peerValuations().size(), state.analystConsensus().size(),
                state.sentiment().size(), state.retrievedContext().size());
        trace.step("Collected " + summary);
        log.info("Aggregated specialist results [runId={}, {}, errors={}]",
                state.runId(), summary, state.errors().size());
        return StateUpdate.empty();
    }
}
