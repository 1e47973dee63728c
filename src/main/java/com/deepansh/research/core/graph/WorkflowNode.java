package com.deepansh.research.core.graph;

import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;

/**
 * A unit of work in the research graph.
 *
 * Implementations read the snapshot they are given and return only the
 * fields they produce. They never mutate shared state and never handle
 * retries themselves: throw, and the {@link ExecutionEnvelope} decides
 * whether to try again.
 */
public interface WorkflowNode {

    NodeId id();

    StateUpdate execute(WorkflowState state, ExecutionTrace trace) throws Exception;

    default String name() {
        return id().nodeName();
    }
}
