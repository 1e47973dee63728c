package com.deepansh.research.node;

import com.deepansh.research.analysis.IntentClassification;
import com.deepansh.research.analysis.IntentClassifier;
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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts tickers and sets intent plus dispatch flags for the router.
 *
 * If the classifier cannot be reached the node falls back to general
 * research: every specialist when tickers are known, document retrieval only
 * when they are not.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IntentClassificationNode implements WorkflowNode {

    private final IntentClassifier intentClassifier;
    private final TickerExtractor tickerExtractor;
    private final RetryExecutor retryExecutor;

    @Override
    public NodeId id() {
        return NodeId.INTENT_CLASSIFICATION;
    }

    @Override
    public StateUpdate execute(WorkflowState state, ExecutionTrace trace) throws Exception {
        Set<String> found = new LinkedHashSet<>(tickerExtractor.extract(state.userQuery()));
        found.addAll(tickerExtractor.extract(state.effectiveQuery()));
        List<String> tickers = new ArrayList<>(found);
        trace.step("Tickers: " + (tickers.isEmpty() ? "none" : String.join(", ", tickers)));

        if (!state.queryValid()) {
            trace.step("Query invalid, classification skipped");
            return StateUpdate.builder().tickers(tickers).build();
        }

        IntentClassification classification;
        try {
            classification = retryExecutor.call("intent_classification:llm",
                    () -> intentClassifier.classify(state.effectiveQuery(), tickers));
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.error("Intent analysis failed, using fallback [runId={}]: {}", state.runId(), e.getMessage());
            classification = IntentClassification.fallback(!tickers.isEmpty());
            trace.step("Classifier unavailable, fallback applied");
        }

        trace.step("Intent " + classification.intent().wireName() + ", flags " + classification.flags());
        return StateUpdate.builder()
                .tickers(tickers)
                .intent(classification.intent())
                .dispatchFlags(classification.flags())
                .build();
    }
}
