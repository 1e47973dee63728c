package com.deepansh.research.node;

import com.deepansh.research.analysis.SentimentAnalyzer;
import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.graph.NodeId;
import com.deepansh.research.core.graph.WorkflowNode;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.model.SentimentAnalysis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
public class SentimentNode implements WorkflowNode {

    private final SentimentAnalyzer sentimentAnalyzer;
    private final PerTickerFetcher fetcher;

    @Override
    public NodeId id() {
        return NodeId.SENTIMENT;
    }

    @Override
    public StateUpdate execute(WorkflowState state, ExecutionTrace trace) throws Exception {
        StateUpdate.Builder update = StateUpdate.builder();
        List<SentimentAnalysis> sentiment = fetcher.fetch(name(), state.tickers(),
                sentimentAnalyzer::analyze, update, trace);

        log.info("Sentiment for {}/{} tickers [runId={}]", sentiment.size(), state.tickers().size(), state.runId());
        return update.sentiment(sentiment).build();
    }
}
