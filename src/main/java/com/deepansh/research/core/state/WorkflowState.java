package com.deepansh.research.core.state;

import com.deepansh.research.model.AnalystConsensus;
import com.deepansh.research.model.ConversationMessage;
import com.deepansh.research.model.DispatchFlags;
import com.deepansh.research.model.InvestorSnapshot;
import com.deepansh.research.model.MarketSnapshot;
import com.deepansh.research.model.PeerValuation;
import com.deepansh.research.model.QueryIntent;
import com.deepansh.research.model.ReportMetadata;
import com.deepansh.research.model.RetrievedDocument;
import com.deepansh.research.model.SentimentAnalysis;
import com.deepansh.research.model.VisualizationData;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of one research run, carried from node to node.
 *
 * Nodes only ever see a snapshot and return a {@link StateUpdate}; new
 * states are produced exclusively by {@link StateMerger}. Accumulator
 * fields always hold a non-null (possibly empty) list or map.
 */
public final class WorkflowState {

    private final EnumMap<StateField, Object> values;

    WorkflowState(EnumMap<StateField, Object> values) {
        this.values = values;
    }

    public static WorkflowState initial(String runId, String sessionId, String userQuery, Instant startedAt) {
        EnumMap<StateField, Object> values = new EnumMap<>(StateField.class);
        for (StateField field : StateField.values()) {
            values.put(field, field.policy().identity());
        }
        values.put(StateField.RUN_ID, Objects.requireNonNull(runId, "runId"));
        values.put(StateField.SESSION_ID, Objects.requireNonNull(sessionId, "sessionId"));
        values.put(StateField.USER_QUERY, userQuery == null ? "" : userQuery);
        values.put(StateField.STARTED_AT, Objects.requireNonNull(startedAt, "startedAt"));
        values.put(StateField.QUERY_VALID, Boolean.TRUE);
        values.put(StateField.INTENT, QueryIntent.GENERAL_RESEARCH);
        values.put(StateField.TICKERS, List.of());
        values.put(StateField.DISPATCH_FLAGS, DispatchFlags.none());
        values.put(StateField.CONVERSATION_HISTORY, List.of());
        return new WorkflowState(values);
    }

    public Object get(StateField field) {
        return values.get(field);
    }

    Map<StateField, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    EnumMap<StateField, Object> copyValues() {
        return new EnumMap<>(values);
    }

    // ─── identity ─────────────────────────────────────────────────────────────

    public String runId() {
        return (String) values.get(StateField.RUN_ID);
    }

    public String sessionId() {
        return (String) values.get(StateField.SESSION_ID);
    }

    public String userQuery() {
        return (String) values.get(StateField.USER_QUERY);
    }

    public Instant startedAt() {
        return (Instant) values.get(StateField.STARTED_AT);
    }

    // ─── routing ──────────────────────────────────────────────────────────────

    public List<ConversationMessage> conversationHistory() {
        return list(StateField.CONVERSATION_HISTORY);
    }

    public boolean queryValid() {
        return !Boolean.FALSE.equals(values.get(StateField.QUERY_VALID));
    }

    public String validationReason() {
        return (String) values.get(StateField.VALIDATION_REASON);
    }

    public String refinedQuery() {
        return (String) values.get(StateField.REFINED_QUERY);
    }

    /** The refined query when one exists, otherwise the user's original text. */
    public String effectiveQuery() {
        String refined = refinedQuery();
        return refined == null || refined.isBlank() ? userQuery() : refined;
    }

    public QueryIntent intent() {
        return (QueryIntent) values.get(StateField.INTENT);
    }

    public List<String> tickers() {
        return list(StateField.TICKERS);
    }

    public boolean hasTickers() {
        return !tickers().isEmpty();
    }

    public DispatchFlags dispatchFlags() {
        return (DispatchFlags) values.get(StateField.DISPATCH_FLAGS);
    }

    // ─── bookkeeping ──────────────────────────────────────────────────────────

    public List<String> executedNodes() {
        return list(StateField.EXECUTED_NODES);
    }

    public List<String> errors() {
        return list(StateField.ERRORS);
    }

    public Map<String, String> nodeErrors() {
        return map(StateField.NODE_ERRORS);
    }

    public Map<String, NodeMetrics> nodeMetrics() {
        return map(StateField.NODE_METRICS);
    }

    public Map<String, List<String>> reasoningTraces() {
        return map(StateField.REASONING_TRACES);
    }

    // ─── specialist results ───────────────────────────────────────────────────

    public List<MarketSnapshot> marketData() {
        return list(StateField.MARKET_DATA);
    }

    public List<PeerValuation> peerValuations() {
        return list(StateField.PEER_VALUATIONS);
    }

    public List<AnalystConsensus> analystConsensus() {
        return list(StateField.ANALYST_CONSENSUS);
    }

    public List<SentimentAnalysis> sentiment() {
        return list(StateField.SENTIMENT);
    }

    public List<RetrievedDocument> retrievedContext() {
        return list(StateField.RETRIEVED_CONTEXT);
    }

    public List<VisualizationData> visualizationData() {
        return list(StateField.VISUALIZATION_DATA);
    }

    // ─── output ───────────────────────────────────────────────────────────────

    public String report() {
        return (String) values.get(StateField.REPORT);
    }

    public InvestorSnapshot snapshot() {
        return (InvestorSnapshot) values.get(StateField.SNAPSHOT);
    }

    public ReportMetadata reportMetadata() {
        return (ReportMetadata) values.get(StateField.REPORT_METADATA);
    }

    public Boolean qualityPassed() {
        return (Boolean) values.get(StateField.QUALITY_PASSED);
    }

    @SuppressWarnings("unchecked")
    private <T> List<T> list(StateField field) {
        Object value = values.get(field);
        return value == null ? List.of() : (List<T>) value;
    }

    @SuppressWarnings("unchecked")
    private <K, V> Map<K, V> map(StateField field) {
        Object value = values.get(field);
        return value == null ? Map.of() : (Map<K, V>) value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowState that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "WorkflowState[runId=" + runId() + ", sessionId=" + sessionId()
                + ", executedNodes=" + executedNodes() + ", errors=" + errors().size() + "]";
    }
}
