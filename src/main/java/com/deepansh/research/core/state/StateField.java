package com.deepansh.research.core.state;

import static com.deepansh.research.core.state.MergePolicy.APPEND;
import static com.deepansh.research.core.state.MergePolicy.IMMUTABLE;
import static com.deepansh.research.core.state.MergePolicy.OVERWRITE;
import static com.deepansh.research.core.state.MergePolicy.UNION;

/**
 * Every field of {@link WorkflowState}, each tagged with the policy used to
 * merge partial updates into it.
 */
public enum StateField {

    // identity
    RUN_ID(IMMUTABLE),
    SESSION_ID(IMMUTABLE),
    USER_QUERY(IMMUTABLE),
    STARTED_AT(IMMUTABLE),

    // pre-processing and routing
    CONVERSATION_HISTORY(OVERWRITE),
    QUERY_VALID(OVERWRITE),
    VALIDATION_REASON(OVERWRITE),
    REFINED_QUERY(OVERWRITE),
    INTENT(OVERWRITE),
    TICKERS(OVERWRITE),
    DISPATCH_FLAGS(OVERWRITE),

    // execution bookkeeping
    EXECUTED_NODES(APPEND),
    ERRORS(APPEND),
    NODE_ERRORS(UNION),
    NODE_METRICS(UNION),
    REASONING_TRACES(UNION),

    // specialist results
    MARKET_DATA(APPEND),
    PEER_VALUATIONS(APPEND),
    ANALYST_CONSENSUS(APPEND),
    SENTIMENT(APPEND),
    RETRIEVED_CONTEXT(APPEND),
    VISUALIZATION_DATA(APPEND),

    // output
    REPORT(OVERWRITE),
    SNAPSHOT(OVERWRITE),
    REPORT_METADATA(OVERWRITE),
    QUALITY_PASSED(OVERWRITE);

    private final MergePolicy policy;

    StateField(MergePolicy policy) {
        this.policy = policy;
    }

    public MergePolicy policy() {
        return policy;
    }

    public boolean isAccumulator() {
        return policy == APPEND || policy == UNION;
    }
}
