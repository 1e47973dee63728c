package com.deepansh.research.core.graph;

import com.deepansh.research.core.state.WorkflowState;

import java.util.Set;

/**
 * Chooses the branches of a conditional edge from the merged state.
 * Must be pure: no I/O, no side effects.
 */
@FunctionalInterface
public interface DispatchRouter {

    Set<NodeId> route(WorkflowState state);
}
