package com.deepansh.research.exception;

import java.time.Duration;

public class WorkflowTimeoutException extends WorkflowExecutionException {

    public WorkflowTimeoutException(String runId, Duration budget) {
        super("Research run " + runId + " exceeded its deadline of " + budget.toSeconds() + "s");
    }
}
