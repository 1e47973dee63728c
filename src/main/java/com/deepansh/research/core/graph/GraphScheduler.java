package com.deepansh.research.core.graph;

import com.deepansh.research.core.state.StateMerger;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.exception.WorkflowExecutionException;
import com.deepansh.research.exception.WorkflowTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Walks a {@link WorkflowGraph} from entry to exit.
 *
 * Every node runs on the workflow executor so the run deadline bounds it.
 * At a conditional edge the router picks branches from the merged state;
 * they all receive the same snapshot, run concurrently, and the scheduler
 * waits for every one of them (the barrier) before merging their updates in
 * {@link NodeId} order and moving on to the join node.
 *
 * All merging happens on the calling thread. The scheduler keeps no
 * per-run state, so one instance serves concurrent runs.
 */
@Component
@Slf4j
public class GraphScheduler {

    private final ExecutionEnvelope envelope;
    private final AsyncTaskExecutor executor;

    public GraphScheduler(ExecutionEnvelope envelope,
                          @Qualifier("workflowTaskExecutor") AsyncTaskExecutor executor) {
        this.envelope = envelope;
        this.executor = executor;
    }

    public WorkflowState run(WorkflowGraph graph, WorkflowState initial, RunDeadline deadline) {
        WorkflowState state = initial;
        NodeId current = graph.entry();

        try {
            while (current != null) {
                NodeResult result = runNodes(graph, List.of(current), state, deadline).get(0);
                state = apply(graph, state, result);

                Optional<WorkflowGraph.ConditionalEdge> fanOut = graph.conditionalEdge(current);
                if (fanOut.isPresent()) {
                    state = fanOut(graph, fanOut.get(), state, deadline);
                    current = fanOut.get().join();
                } else {
                    current = graph.next(current).orElse(null);
                }
            }
        } catch (WorkflowExecutionException e) {
            throw e.withLastState(state);
        }

        log.info("Graph finished [runId={}, executed={}, errors={}]",
                state.runId(), state.executedNodes(), state.errors().size());
        return state;
    }

    private WorkflowState fanOut(WorkflowGraph graph, WorkflowGraph.ConditionalEdge edge,
                                 WorkflowState state, RunDeadline deadline) {
        Set<NodeId> targets = edge.router().route(state);
        if (!edge.branches().containsAll(targets)) {
            throw new WorkflowExecutionException(
                    "Router selected undeclared branches " + targets + ", allowed " + edge.branches());
        }
        if (targets.isEmpty()) {
            log.info("No branches dispatched, continuing to {} [runId={}]", edge.join().nodeName(), state.runId());
            return state;
        }

        List<NodeId> ordered = new ArrayList<>(EnumSet.copyOf(targets));
        List<NodeResult> results = runNodes(graph, ordered, state, deadline);

        WorkflowState merged = state;
        for (NodeResult result : results) {
            merged = apply(graph, merged, result);
        }
        log.info("Barrier reached, merged {} branch results [runId={}]", results.size(), state.runId());
        return merged;
    }

    private WorkflowState apply(WorkflowGraph graph, WorkflowState state, NodeResult result) {
        WorkflowState merged = StateMerger.merge(state, result.update());
        if (!result.success() && graph.isCritical(result.nodeId())) {
            String name = result.nodeId().nodeName();
            throw new WorkflowExecutionException(
                    "Critical node '" + name + "' failed: " + result.errorMessage(), name).withLastState(merged);
        }
        return merged;
    }

    private List<NodeResult> runNodes(WorkflowGraph graph, List<NodeId> ids,
                                      WorkflowState snapshot, RunDeadline deadline) {
        if (deadline.isExpired()) {
            throw new WorkflowTimeoutException(snapshot.runId(), deadline.budget());
        }

        List<Future<NodeResult>> futures = new ArrayList<>(ids.size());
        try {
            for (NodeId id : ids) {
                WorkflowNode node = graph.node(id);
                futures.add(executor.submit(() -> envelope.execute(node, snapshot)));
            }
        } catch (TaskRejectedException e) {
            cancelAll(futures);
            throw new WorkflowExecutionException("Workflow executor rejected node tasks " + ids, null, e);
        }

        List<NodeResult> results = new ArrayList<>(futures.size());
        int waiting = 0;
        try {
            for (; waiting < futures.size(); waiting++) {
                results.add(futures.get(waiting).get(deadline.remainingNanos(), TimeUnit.NANOSECONDS));
            }
        } catch (TimeoutException e) {
            cancelAll(futures);
            log.error("Run deadline of {}s expired while waiting for {} [runId={}]",
                    deadline.budget().toSeconds(), ids, snapshot.runId());
            throw new WorkflowTimeoutException(snapshot.runId(), deadline.budget());
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new WorkflowExecutionException("Run interrupted while waiting for " + ids, null, e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String name = ids.get(waiting).nodeName();
            log.error("Node [{}] failed outside its envelope [runId={}]", name, snapshot.runId(), cause);
            throw new WorkflowExecutionException(
                    "Node '" + name + "' failed outside its envelope: " + cause, name, cause);
        }
        return results;
    }

    private void cancelAll(List<Future<NodeResult>> futures) {
        futures.forEach(f -> f.cancel(true));
    }
}
