package com.deepansh.research.node;

import com.deepansh.research.config.ProviderProperties;
import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.graph.NodeId;
import com.deepansh.research.core.graph.WorkflowNode;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.model.RetrievedDocument;
import com.deepansh.research.retrieval.DocumentRetriever;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Semantic search over stored research documents, filtered to the first
 * ticker when there is one.
 */
@Component
@Slf4j
public class DocumentRetrievalNode implements WorkflowNode {

    private final DocumentRetriever documentRetriever;
    private final int topK;

    public DocumentRetrievalNode(DocumentRetriever documentRetriever, ProviderProperties providerProperties) {
        this.documentRetriever = documentRetriever;
        this.topK = providerProperties.getRetrieval().getTopK();
    }

    @Override
    public NodeId id() {
        return NodeId.RAG_RETRIEVAL;
    }

    @Override
    public StateUpdate execute(WorkflowState state, ExecutionTrace trace) {
        String ticker = state.hasTickers() ? state.tickers().get(0) : null;
        trace.step("Searching top " + topK + (ticker != null ? " for " + ticker : " across all documents"));

        List<RetrievedDocument> documents = documentRetriever.search(state.effectiveQuery(), ticker, topK);

        trace.step("Retrieved " + documents.size() + " documents");
        log.info("Retrieved {} documents [runId={}, ticker={}]", documents.size(), state.runId(), ticker);
        return StateUpdate.builder().retrievedContext(documents).build();
    }
}
