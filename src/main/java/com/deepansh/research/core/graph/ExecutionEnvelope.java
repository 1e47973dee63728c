package com.deepansh.research.core.graph;

import com.deepansh.research.core.state.NodeMetrics;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.resilience.ErrorClass;
import com.deepansh.research.resilience.ErrorClassifier;
import com.deepansh.research.resilience.RetryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Uniform wrapper around every node invocation.
 *
 * Per call:
 * - fresh {@link ExecutionTrace} per attempt
 * - transient failures retried with exponential backoff via {@link RetryExecutor}
 * - on success: node update + executed_nodes, node_metrics and reasoning trace
 * - on final failure: the node's partial work is dropped and replaced by
 *   error bookkeeping (errors, node_errors, metrics, trace ending in "ERROR: ...")
 *
 * Never throws. The scheduler decides what a failure means for the run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ExecutionEnvelope {

    private final RetryExecutor retryExecutor;
    private final ErrorClassifier errorClassifier;

    public NodeResult execute(WorkflowNode node, WorkflowState snapshot) {
        String name = node.name();
        long startNanos = System.nanoTime();
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<ExecutionTrace> lastTrace = new AtomicReference<>(new ExecutionTrace(name));

        log.info("Node [{}] starting [runId={}]", name, snapshot.runId());

        try {
            StateUpdate update = retryExecutor.call(name, () -> {
                attempts.incrementAndGet();
                ExecutionTrace trace = new ExecutionTrace(name);
                lastTrace.set(trace);
                StateUpdate produced = node.execute(snapshot, trace);
                return produced == null ? StateUpdate.empty() : produced;
            });

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            ExecutionTrace trace = lastTrace.get();

            StateUpdate.Builder bookkeeping = StateUpdate.builder()
                    .executedNode(name)
                    .nodeMetrics(name, NodeMetrics.succeeded(elapsed.toMillis(), attempts.get()));
            if (!trace.isEmpty()) {
                bookkeeping.reasoningTrace(name, trace.steps());
            }

            log.info("Node [{}] completed [runId={}, elapsed={}ms, attempt={}/{}]",
                    name, snapshot.runId(), elapsed.toMillis(), attempts.get(), retryExecutor.maxAttempts());

            return new NodeResult(node.id(), update.plus(bookkeeping.build()), true,
                    elapsed, attempts.get(), null, null);

        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return failure(node, snapshot, e, startNanos, Math.max(1, attempts.get()), lastTrace.get());
        }
    }

    private NodeResult failure(WorkflowNode node, WorkflowState snapshot, Exception error,
                               long startNanos, int attempts, ExecutionTrace trace) {
        String name = node.name();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        ErrorClass errorClass = errorClassifier.classify(error);
        boolean transientError = errorClass == ErrorClass.TRANSIENT;
        String message = messageOf(error);

        log.error("Node [{}] failed [runId={}, attempts={}, class={}]: {}",
                name, snapshot.runId(), attempts, errorClass, message);

        List<String> steps = new ArrayList<>(trace.steps());
        steps.add("ERROR: " + message);

        StateUpdate update = StateUpdate.builder()
                .error(name + " node error: " + message)
                .executedNode(name)
                .nodeError(name, message)
                .nodeMetrics(name, NodeMetrics.failed(elapsed.toMillis(), attempts,
                        error.getClass().getSimpleName(), transientError))
                .reasoningTrace(name, steps)
                .build();

        return new NodeResult(node.id(), update, false, elapsed, attempts, errorClass, message);
    }

    static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
