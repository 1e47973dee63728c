package com.deepansh.research.observability;

import org.springframework.data.mongodb.repository.Aggregation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WorkflowRunTraceRepository extends MongoRepository<WorkflowRunTrace, String> {

    Optional<WorkflowRunTrace> findByRunId(String runId);

    List<WorkflowRunTrace> findBySessionIdOrderByCreatedAtDesc(String sessionId);

    @Aggregation(pipeline = {
        "{ $group: { _id: null, avg: { $avg: '$totalLatencyMs' } } }"
    })
    Double avgLatency();

    @Aggregation(pipeline = {
        "{ $group: { _id: '$status', count: { $sum: 1 } } }"
    })
    List<StatusCount> statusBreakdown();

    record StatusCount(String id, long count) {}
}
