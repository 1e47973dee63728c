package com.deepansh.research.api;

import com.deepansh.research.observability.TraceService;
import com.deepansh.research.observability.WorkflowRunTrace;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Workflow run traces.
 *
 * GET /api/v1/traces/session/{sessionId}   runs of a session, newest first
 * GET /api/v1/traces/run/{runId}           one run
 * GET /api/v1/traces/analytics             average latency and status breakdown
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class ObservabilityController {

    private final TraceService traceService;

    @GetMapping("/session/{sessionId}")
    public ResponseEntity<List<WorkflowRunTrace>> sessionTraces(@PathVariable String sessionId) {
        return ResponseEntity.ok(traceService.getTracesForSession(sessionId));
    }

    @GetMapping("/run/{runId}")
    public ResponseEntity<WorkflowRunTrace> runTrace(@PathVariable String runId) {
        return traceService.getTrace(runId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/analytics")
    public ResponseEntity<Map<String, Object>> analytics() {
        return ResponseEntity.ok(traceService.getAnalytics());
    }
}
