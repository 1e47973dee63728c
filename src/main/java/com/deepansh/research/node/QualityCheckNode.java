package com.deepansh.research.node;

import com.deepansh.research.analysis.QualityReviewer;
import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.graph.NodeId;
import com.deepansh.research.core.graph.WorkflowNode;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class QualityCheckNode implements WorkflowNode {

    private final QualityReviewer qualityReviewer;

    @Override
    public NodeId id() {
        return NodeId.QUALITY_CHECK;
    }

    @Override
    public StateUpdate execute(WorkflowState state, ExecutionTrace trace) {
        if (!state.queryValid() || state.report() == null || state.report().isBlank()) {
            trace.step("Nothing to review");
            return StateUpdate.empty();
        }

        boolean passed = qualityReviewer.review(state.effectiveQuery(), state.report());
        trace.step(passed ? "PASS" : "FAIL");
        return StateUpdate.builder().qualityPassed(passed).build();
    }
}
