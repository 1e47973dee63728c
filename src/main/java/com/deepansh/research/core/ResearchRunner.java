package com.deepansh.research.core;

import com.deepansh.research.config.WorkflowProperties;
import com.deepansh.research.core.graph.GraphScheduler;
import com.deepansh.research.core.graph.RunDeadline;
import com.deepansh.research.core.graph.WorkflowGraph;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.exception.WorkflowExecutionException;
import com.deepansh.research.model.ResearchRequest;
import com.deepansh.research.model.ResearchResponse;
import com.deepansh.research.observability.TraceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Entry point for one research request.
 *
 * Flow:
 * 1. Resolve the session id (new UUID when the client sent none)
 * 2. Build the initial state and a deadline from research.workflow.run-timeout
 * 3. Run the research graph once
 * 4. Fail if no report text came out, otherwise assemble the response
 * 5. Persist a run trace (async) whatever the outcome; a failed run is traced
 *    with the last state the scheduler merged
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResearchRunner {

    private final GraphScheduler scheduler;
    private final WorkflowGraph researchGraph;
    private final WorkflowProperties properties;
    private final TraceService traceService;

    public ResearchResponse run(ResearchRequest request) {
        String runId = UUID.randomUUID().toString();
        String sessionId = request.getSessionId() != null && !request.getSessionId().isBlank()
                ? request.getSessionId()
                : UUID.randomUUID().toString();
        long startMs = System.currentTimeMillis();

        log.info("Research run starting [runId={}, sessionId={}]", runId, sessionId);

        WorkflowState initial = WorkflowState.initial(runId, sessionId, request.getQuery(), Instant.now());
        WorkflowState terminal = initial;
        try {
            terminal = scheduler.run(researchGraph, initial, RunDeadline.after(properties.getRunTimeout()));

            if (terminal.report() == null || terminal.report().isBlank()) {
                throw new WorkflowExecutionException("Report synthesis produced no text", "report");
            }

            ResearchResponse response = toResponse(terminal);
            long latencyMs = System.currentTimeMillis() - startMs;
            log.info("Research run complete [runId={}, sessionId={}, nodes={}, errors={}, latency={}ms]",
                    runId, sessionId, terminal.executedNodes().size(), terminal.errors().size(), latencyMs);
            traceService.persistTrace(terminal, latencyMs, null);
            return response;

        } catch (RuntimeException e) {
            long latencyMs = System.currentTimeMillis() - startMs;
            log.error("Research run failed [runId={}, sessionId={}, latency={}ms]: {}",
                    runId, sessionId, latencyMs, e.getMessage());
            WorkflowState traced = e instanceof WorkflowExecutionException
                    ? ((WorkflowExecutionException) e).getLastState().orElse(terminal)
                    : terminal;
            traceService.persistTrace(traced, latencyMs, e);
            throw e;
        }
    }

    ResearchResponse toResponse(WorkflowState state) {
        return ResearchResponse.builder()
                .runId(state.runId())
                .sessionId(state.sessionId())
                .query(state.userQuery())
                .report(state.report())
                .tickers(state.tickers())
                .executedNodes(state.executedNodes())
                .nodeErrors(state.nodeErrors())
                .intent(state.intent())
                .routingFlags(state.dispatchFlags())
                .marketDataAvailable(!state.marketData().isEmpty())
                .sentimentAvailable(!state.sentiment().isEmpty())
                .analystConsensusAvailable(!state.analystConsensus().isEmpty())
                .contextRetrieved(state.retrievedContext().size())
                .visualizationData(state.visualizationData())
                .snapshot(state.snapshot())
                .reportMetadata(state.reportMetadata())
                .qualityPassed(state.qualityPassed())
                .timestamp(Instant.now())
                .build();
    }
}
