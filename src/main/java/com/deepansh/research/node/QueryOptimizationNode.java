package com.deepansh.research.node;

import com.deepansh.research.analysis.QueryRefiner;
import com.deepansh.research.analysis.TickerExtractor;
import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.graph.NodeId;
import com.deepansh.research.core.graph.WorkflowNode;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.resilience.RetryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rewrites the query into a sharper research question. Skipped for invalid
 * queries; any failure keeps the user's original wording.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QueryOptimizationNode implements WorkflowNode {

    private final QueryRefiner queryRefiner;
    private final TickerExtractor tickerExtractor;
    private final RetryExecutor retryExecutor;

    @Override
    public NodeId id() {
        return NodeId.QUERY_OPTIMIZATION;
    }

    @Override
    public StateUpdate execute(WorkflowState state, ExecutionTrace trace) throws Exception {
        if (!state.queryValid()) {
            trace.step("Skipped: query is invalid");
            return StateUpdate.empty();
        }

        String original = state.userQuery();
        String refined;
        try {
            refined = retryExecutor.call("query_optimization:llm",
                    () -> queryRefiner.refine(original, tickerExtractor.extract(original)));
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Query refinement failed, keeping original [runId={}]: {}", state.runId(), e.getMessage());
            trace.step("Refinement unavailable, original query kept");
            return StateUpdate.builder().refinedQuery(original).build();
        }

        if (refined == null || refined.isBlank()) {
            trace.step("Refiner returned nothing, original query kept");
            refined = original;
        } else {
            trace.step("Refined: " + refined);
        }
        return StateUpdate.builder().refinedQuery(refined).build();
    }
}
