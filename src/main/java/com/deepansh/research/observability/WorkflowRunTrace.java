package com.deepansh.research.observability;

import com.deepansh.research.core.state.NodeMetrics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One document per workflow run.
 *
 * Collection: workflow_run_traces
 * Indexes: runId (unique), sessionId + createdAt, status
 */
@Document(collection = "workflow_run_traces")
@CompoundIndex(name = "idx_session_date", def = "{'sessionId': 1, 'createdAt': -1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRunTrace {

    @Id
    private String id;

    @Indexed(unique = true)
    private String runId;

    private String sessionId;

    private String query;

    private String intent;

    private List<String> tickers;

    private List<String> executedNodes;

    private Map<String, NodeMetrics> nodeMetrics;

    private Map<String, String> nodeErrors;

    private int errorCount;

    @Indexed
    private Status status;

    private long totalLatencyMs;

    private String errorMessage;

    @CreatedDate
    private Instant createdAt;

    public enum Status {
        SUCCESS, FAILED, TIMEOUT
    }
}
