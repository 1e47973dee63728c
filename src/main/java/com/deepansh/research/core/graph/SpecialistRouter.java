package com.deepansh.research.core.graph;

import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.model.DispatchFlags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Picks the specialist nodes to fan out to after intent classification.
 *
 * Rules, applied in order:
 * 1. Invalid query: nothing.
 * 2. Context flag set, or no tickers: rag_retrieval.
 * 3. Market flag with tickers: market_data and forward_looking.
 * 4. Sentiment flag with tickers: sentiment.
 * 5. Tickers but neither market nor sentiment flag: market_data, sentiment, forward_looking.
 *
 * The result is a set, so each node is dispatched at most once.
 * Visualization never runs here; it depends on the merged results.
 */
@Component
@Slf4j
public class SpecialistRouter implements DispatchRouter {

    public static final Set<NodeId> SPECIALISTS = Collections.unmodifiableSet(EnumSet.of(
            NodeId.MARKET_DATA, NodeId.SENTIMENT, NodeId.FORWARD_LOOKING, NodeId.RAG_RETRIEVAL));

    @Override
    public Set<NodeId> route(WorkflowState state) {
        if (!state.queryValid()) {
            log.info("Query marked invalid, no specialists dispatched [runId={}]", state.runId());
            return Set.of();
        }

        DispatchFlags flags = state.dispatchFlags();
        boolean hasTickers = state.hasTickers();
        EnumSet<NodeId> targets = EnumSet.noneOf(NodeId.class);

        if (flags.context() || !hasTickers) {
            targets.add(NodeId.RAG_RETRIEVAL);
        }
        if (flags.marketData() && hasTickers) {
            targets.add(NodeId.MARKET_DATA);
            targets.add(NodeId.FORWARD_LOOKING);
        }
        if (flags.sentiment() && hasTickers) {
            targets.add(NodeId.SENTIMENT);
        }
        if (hasTickers && !flags.marketData() && !flags.sentiment()) {
            targets.add(NodeId.MARKET_DATA);
            targets.add(NodeId.SENTIMENT);
            targets.add(NodeId.FORWARD_LOOKING);
        }

        log.info("Dispatching {} [runId={}, tickers={}, flags={}]",
                targets, state.runId(), state.tickers(), flags);
        return Collections.unmodifiableSet(targets);
    }
}
