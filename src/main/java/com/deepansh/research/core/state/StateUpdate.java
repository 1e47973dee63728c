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

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A partial update produced by one node: only the fields it explicitly set.
 *
 * Repeated writes to the same field inside one builder follow the field's
 * merge policy, so {@code error("a").error("b")} yields both entries.
 */
public final class StateUpdate {

    private static final StateUpdate EMPTY = new StateUpdate(new EnumMap<>(StateField.class));

    private final EnumMap<StateField, Object> values;

    private StateUpdate(EnumMap<StateField, Object> values) {
        this.values = values;
    }

    public static StateUpdate empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean contains(StateField field) {
        return values.containsKey(field);
    }

    public Object get(StateField field) {
        return values.get(field);
    }

    public Set<StateField> fields() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /**
     * Combines two updates into one, applying each field's policy where both set it.
     * Used to attach envelope bookkeeping to a node's own update.
     */
    public StateUpdate plus(StateUpdate other) {
        if (other.isEmpty()) return this;
        if (this.isEmpty()) return other;
        Builder builder = toBuilder();
        other.values.forEach(builder::set);
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(values);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateUpdate that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "StateUpdate" + values.keySet();
    }

    public static final class Builder {

        private final EnumMap<StateField, Object> values = new EnumMap<>(StateField.class);

        private Builder() {
        }

        public Builder set(StateField field, Object value) {
            if (field.isAccumulator()) {
                Objects.requireNonNull(value, () -> "Accumulator field " + field + " cannot be set to null");
            }
            if (values.containsKey(field)) {
                values.put(field, field.policy().combine(field, values.get(field), value));
            } else {
                values.put(field, copyOf(value));
            }
            return this;
        }

        public Builder conversationHistory(List<ConversationMessage> history) {
            return set(StateField.CONVERSATION_HISTORY, List.copyOf(history));
        }

        public Builder queryValid(boolean valid) {
            return set(StateField.QUERY_VALID, valid);
        }

        public Builder validationReason(String reason) {
            return set(StateField.VALIDATION_REASON, reason);
        }

        public Builder refinedQuery(String query) {
            return set(StateField.REFINED_QUERY, query);
        }

        public Builder intent(QueryIntent intent) {
            return set(StateField.INTENT, intent);
        }

        /** Tickers are stored upper-cased, in first-seen order, without duplicates. */
        public Builder tickers(List<String> tickers) {
            LinkedHashSet<String> unique = new LinkedHashSet<>();
            tickers.stream()
                    .filter(Objects::nonNull)
                    .map(t -> t.trim().toUpperCase())
                    .filter(t -> !t.isEmpty())
                    .forEach(unique::add);
            return set(StateField.TICKERS, List.copyOf(unique));
        }

        public Builder dispatchFlags(DispatchFlags flags) {
            return set(StateField.DISPATCH_FLAGS, flags);
        }

        public Builder executedNode(String nodeName) {
            return set(StateField.EXECUTED_NODES, List.of(nodeName));
        }

        public Builder error(String message) {
            return set(StateField.ERRORS, List.of(message));
        }

        public Builder nodeError(String key, String message) {
            return set(StateField.NODE_ERRORS, Map.of(key, String.valueOf(message)));
        }

        public Builder nodeMetrics(String nodeName, NodeMetrics metrics) {
            return set(StateField.NODE_METRICS, Map.of(nodeName, metrics));
        }

        public Builder reasoningTrace(String nodeName, List<String> steps) {
            return set(StateField.REASONING_TRACES, Map.of(nodeName, List.copyOf(steps)));
        }

        public Builder marketData(List<MarketSnapshot> snapshots) {
            return set(StateField.MARKET_DATA, snapshots);
        }

        public Builder peerValuations(List<PeerValuation> valuations) {
            return set(StateField.PEER_VALUATIONS, valuations);
        }

        public Builder analystConsensus(List<AnalystConsensus> consensus) {
            return set(StateField.ANALYST_CONSENSUS, consensus);
        }

        public Builder sentiment(List<SentimentAnalysis> sentiment) {
            return set(StateField.SENTIMENT, sentiment);
        }

        public Builder retrievedContext(List<RetrievedDocument> documents) {
            return set(StateField.RETRIEVED_CONTEXT, documents);
        }

        public Builder visualizationData(List<VisualizationData> data) {
            return set(StateField.VISUALIZATION_DATA, data);
        }

        public Builder report(String report) {
            return set(StateField.REPORT, report);
        }

        public Builder snapshot(InvestorSnapshot snapshot) {
            return set(StateField.SNAPSHOT, snapshot);
        }

        public Builder reportMetadata(ReportMetadata metadata) {
            return set(StateField.REPORT_METADATA, metadata);
        }

        public Builder qualityPassed(boolean passed) {
            return set(StateField.QUALITY_PASSED, passed);
        }

        public StateUpdate build() {
            if (values.isEmpty()) return EMPTY;
            return new StateUpdate(new EnumMap<>(values));
        }

        private static Object copyOf(Object value) {
            if (value instanceof List<?> list) return List.copyOf(list);
            if (value instanceof Map<?, ?> map) return Collections.unmodifiableMap(new LinkedHashMap<>(map));
            return value;
        }
    }
}
