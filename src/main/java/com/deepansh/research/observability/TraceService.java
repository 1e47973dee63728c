package com.deepansh.research.observability;

import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.exception.WorkflowTimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Persists run traces and exposes read access for the trace endpoints.
 *
 * Persistence is @Async on the trace executor and never fails the run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private final WorkflowRunTraceRepository traceRepository;

    /**
     * @param finalState merged state at the end of the run, or the initial
     *                   state when the run aborted before producing one
     * @param error      null for a successful run
     */
    @Async("traceTaskExecutor")
    public void persistTrace(WorkflowState finalState, long latencyMs, Throwable error) {
        try {
            WorkflowRunTrace.Status status;
            if (error == null) {
                status = WorkflowRunTrace.Status.SUCCESS;
            } else if (error instanceof WorkflowTimeoutException) {
                status = WorkflowRunTrace.Status.TIMEOUT;
            } else {
                status = WorkflowRunTrace.Status.FAILED;
            }

            WorkflowRunTrace trace = WorkflowRunTrace.builder()
                    .runId(finalState.runId())
                    .sessionId(finalState.sessionId())
                    .query(truncate(finalState.userQuery(), 2000))
                    .intent(finalState.intent().wireName())
                    .tickers(finalState.tickers())
                    .executedNodes(finalState.executedNodes())
                    .nodeMetrics(finalState.nodeMetrics())
                    .nodeErrors(finalState.nodeErrors())
                    .errorCount(finalState.errors().size())
                    .status(status)
                    .totalLatencyMs(latencyMs)
                    .errorMessage(error != null ? truncate(error.getMessage(), 2000) : null)
                    .build();

            traceRepository.save(trace);

            log.info("Trace persisted [runId={}, status={}, latency={}ms, nodes={}]",
                    finalState.runId(), status, latencyMs, finalState.executedNodes().size());

        } catch (Exception e) {
            log.error("Failed to persist run trace for runId={}", finalState.runId(), e);
        }
    }

    public Optional<WorkflowRunTrace> getTrace(String runId) {
        return traceRepository.findByRunId(runId);
    }

    public List<WorkflowRunTrace> getTracesForSession(String sessionId) {
        return traceRepository.findBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    public Map<String, Object> getAnalytics() {
        Double avgLatency = traceRepository.avgLatency();
        Map<String, Long> statusBreakdown = traceRepository.statusBreakdown().stream()
                .collect(Collectors.toMap(
                        WorkflowRunTraceRepository.StatusCount::id,
                        WorkflowRunTraceRepository.StatusCount::count));

        return Map.of(
                "avgLatencyMs", avgLatency != null ? Math.round(avgLatency) : 0,
                "statusBreakdown", statusBreakdown
        );
    }

    private String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
