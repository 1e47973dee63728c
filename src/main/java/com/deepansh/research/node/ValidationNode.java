package com.deepansh.research.node;

import com.deepansh.research.analysis.QueryValidator;
import com.deepansh.research.analysis.ValidationResult;
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
 * Screens the query. Only an empty query is rejected outright; when the
 * validator itself is unavailable the query is let through.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ValidationNode implements WorkflowNode {

    private final QueryValidator queryValidator;
    private final RetryExecutor retryExecutor;

    @Override
    public NodeId id() {
        return NodeId.VALIDATION;
    }

    @Override
    public StateUpdate execute(WorkflowState state, ExecutionTrace trace) throws Exception {
        String query = state.userQuery();
        if (query == null || query.isBlank()) {
            trace.step("Empty query rejected");
            return StateUpdate.builder().queryValid(false).validationReason("Query is empty").build();
        }

        ValidationResult result;
        try {
            result = retryExecutor.call("validation:llm", () -> queryValidator.validate(query));
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Query validation unavailable, accepting query [runId={}]: {}", state.runId(), e.getMessage());
            trace.step("Validator unavailable, query accepted");
            result = ValidationResult.accepted("validation unavailable");
        }

        trace.step("valid=" + result.valid() + ": " + result.reason());
        return StateUpdate.builder()
                .queryValid(result.valid())
                .validationReason(result.reason())
                .build();
    }
}
