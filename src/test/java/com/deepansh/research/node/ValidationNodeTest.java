package com.deepansh.research.node;

import com.deepansh.research.analysis.QueryValidator;
import com.deepansh.research.analysis.ValidationResult;
import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.state.StateMerger;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.resilience.ErrorClassifier;
import com.deepansh.research.resilience.RetryExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValidationNodeTest {

    @Mock QueryValidator queryValidator;

    private ValidationNode node;

    @BeforeEach
    void setUp() {
        node = new ValidationNode(queryValidator, new RetryExecutor(new ErrorClassifier(), 3, Duration.ofMillis(1)));
    }

    private WorkflowState run(String query) throws Exception {
        WorkflowState state = WorkflowState.initial("run-1", "session-1", query, Instant.now());
        return StateMerger.merge(state, node.execute(state, new ExecutionTrace("validation")));
    }

    @Test
    void execute_blankQuery_invalidWithoutCallingValidator() throws Exception {
        WorkflowState result = run("   ");

        assertThat(result.queryValid()).isFalse();
        assertThat(result.validationReason()).isEqualTo("Query is empty");
        verifyNoInteractions(queryValidator);
    }

    @Test
    void execute_validatorRejects_marksInvalid() throws Exception {
        when(queryValidator.validate("tell me a joke"))
                .thenReturn(ValidationResult.rejected("Not an investment query"));

        WorkflowState result = run("tell me a joke");

        assertThat(result.queryValid()).isFalse();
        assertThat(result.validationReason()).isEqualTo("Not an investment query");
    }

    @Test
    void execute_validatorUnavailable_failsOpen() throws Exception {
        when(queryValidator.validate("Should I buy NVDA?"))
                .thenThrow(new IllegalStateException("LLM down"));

        WorkflowState result = run("Should I buy NVDA?");

        assertThat(result.queryValid()).isTrue();
        assertThat(result.validationReason()).isEqualTo("validation unavailable");
    }
}
