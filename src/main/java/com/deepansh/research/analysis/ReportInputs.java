package com.deepansh.research.analysis;

import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.model.AnalystConsensus;
import com.deepansh.research.model.MarketSnapshot;
import com.deepansh.research.model.PeerValuation;
import com.deepansh.research.model.QueryIntent;
import com.deepansh.research.model.RetrievedDocument;
import com.deepansh.research.model.SentimentAnalysis;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the report writer reads, lifted out of the merged workflow state.
 */
public record ReportInputs(
        String query,
        List<String> tickers,
        QueryIntent intent,
        List<MarketSnapshot> marketData,
        List<PeerValuation> peerValuations,
        List<AnalystConsensus> analystConsensus,
        List<SentimentAnalysis> sentiment,
        List<RetrievedDocument> context
) {

    public static ReportInputs from(WorkflowState state) {
        return new ReportInputs(
                state.effectiveQuery(),
                state.tickers(),
                state.intent(),
                state.marketData(),
                state.peerValuations(),
                state.analystConsensus(),
                state.sentiment(),
                state.retrievedContext());
    }

    /** Source name to "at least one result exists". Iteration order is stable. */
    public Map<String, Boolean> dataSources() {
        Map<String, Boolean> sources = new LinkedHashMap<>();
        sources.put("market_data", !marketData.isEmpty());
        sources.put("peer_valuation", !peerValuations.isEmpty());
        sources.put("sentiment", !sentiment.isEmpty());
        sources.put("analyst_consensus", !analystConsensus.isEmpty());
        sources.put("context", !context.isEmpty());
        return sources;
    }
}
