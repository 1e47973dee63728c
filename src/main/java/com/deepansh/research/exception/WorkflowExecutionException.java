package com.deepansh.research.exception;

import com.deepansh.research.core.state.WorkflowState;

import java.util.Optional;

/**
 * A run could not produce a result: a critical node failed, report
 * synthesis returned nothing, or the scheduler itself broke.
 *
 * The scheduler attaches the last merged state so a failed run can still
 * be traced with the nodes, metrics and errors recorded before the failure.
 */
public class WorkflowExecutionException extends RuntimeException {

    private final String nodeName;
    private transient WorkflowState lastState;

    public WorkflowExecutionException(String message) {
        this(message, null, null);
    }

    public WorkflowExecutionException(String message, String nodeName) {
        this(message, nodeName, null);
    }

    public WorkflowExecutionException(String message, String nodeName, Throwable cause) {
        super(message, cause);
        this.nodeName = nodeName;
    }

    /** The node that caused the failure, or null when no single node is to blame. */
    public String getNodeName() {
        return nodeName;
    }

    /** Keeps the first state attached; later (outer) calls do not overwrite it. */
    public WorkflowExecutionException withLastState(WorkflowState state) {
        if (lastState == null) {
            lastState = state;
        }
        return this;
    }

    public Optional<WorkflowState> getLastState() {
        return Optional.ofNullable(lastState);
    }
}
