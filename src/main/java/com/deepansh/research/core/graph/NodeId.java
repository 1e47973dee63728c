package com.deepansh.research.core.graph;

/**
 * Every node the research graph can run. Declaration order is the order in
 * which fan-out branch results are merged at the aggregator.
 */
public enum NodeId {

    VALIDATION("validation"),
    QUERY_OPTIMIZATION("query_optimization"),
    MEMORY_LOADER("memory_loader"),
    INTENT_CLASSIFICATION("intent_classification"),
    MARKET_DATA("market_data"),
    SENTIMENT("sentiment"),
    FORWARD_LOOKING("forward_looking"),
    RAG_RETRIEVAL("rag_retrieval"),
    AGGREGATOR("aggregator"),
    VISUALIZATION("visualization"),
    REPORT("report"),
    QUALITY_CHECK("quality_check"),
    MEMORY_SAVER("memory_saver");

    private final String nodeName;

    NodeId(String nodeName) {
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
