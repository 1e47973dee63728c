package com.deepansh.research.core.graph;

import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.resilience.ErrorClass;

import java.time.Duration;

/**
 * Outcome of running one node through the envelope. The update already
 * includes bookkeeping (executed nodes, metrics, traces, errors).
 */
public record NodeResult(
        NodeId nodeId,
        StateUpdate update,
        boolean success,
        Duration elapsed,
        int attempts,
        ErrorClass errorClass,
        String errorMessage
) {
}
