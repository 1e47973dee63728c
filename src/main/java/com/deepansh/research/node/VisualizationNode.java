package com.deepansh.research.node;

import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.graph.NodeId;
import com.deepansh.research.core.graph.WorkflowNode;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.model.MarketSnapshot;
import com.deepansh.research.model.PeerComparisonEntry;
import com.deepansh.research.model.PeerValuation;
import com.deepansh.research.model.PricePoint;
import com.deepansh.research.model.VisualizationData;
import com.deepansh.research.provider.MarketDataProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Chart data for every ticker that has a quote: daily price history, the
 * 52-week band and a two-bar peer comparison (ticker vs "Sector Avg").
 * Runs after the aggregator because it reads merged market data.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VisualizationNode implements WorkflowNode {

    static final String SECTOR_AVG_LABEL = "Sector Avg";

    private final MarketDataProvider marketDataProvider;
    private final PerTickerFetcher fetcher;

    @Override
    public NodeId id() {
        return NodeId.VISUALIZATION;
    }

    @Override
    public StateUpdate execute(WorkflowState state, ExecutionTrace trace) throws Exception {
        List<String> tickers = state.marketData().stream()
                .map(MarketSnapshot::ticker)
                .distinct()
                .toList();
        if (tickers.isEmpty()) {
            trace.step("No market data, nothing to chart");
            return StateUpdate.empty();
        }

        StateUpdate.Builder update = StateUpdate.builder();
        List<VisualizationData> charts = fetcher.fetch(name(), tickers,
                ticker -> build(ticker, marketDataProvider.priceHistory(ticker), state), update, trace);

        log.info("Visualization data for {}/{} tickers [runId={}]", charts.size(), tickers.size(), state.runId());
        return update.visualizationData(charts).build();
    }

    static VisualizationData build(String ticker, List<PricePoint> history, WorkflowState state) {
        Optional<MarketSnapshot> market = state.marketData().stream()
                .filter(m -> ticker.equals(m.ticker()))
                .findFirst();

        VisualizationData.VisualizationDataBuilder builder = VisualizationData.builder()
                .ticker(ticker)
                .priceHistory(history)
                .peerComparison(peerComparison(ticker, state.peerValuations()));

        market.ifPresent(m -> builder
                .week52High(m.yearHigh())
                .week52Low(m.yearLow())
                .currentPrice(m.currentPrice())
                .currentPositionPct(m.week52Position()));

        if (!history.isEmpty()) {
            builder.periodHigh(history.stream().mapToDouble(PricePoint::high).max().getAsDouble())
                    .periodLow(history.stream().mapToDouble(PricePoint::low).min().getAsDouble())
                    .averageVolume(Math.round(history.stream().mapToLong(PricePoint::volume).average().orElse(0)));
        }
        return builder.build();
    }

    private static List<PeerComparisonEntry> peerComparison(String ticker, List<PeerValuation> valuations) {
        return valuations.stream()
                .filter(v -> ticker.equals(v.ticker()))
                .findFirst()
                .map(v -> List.of(
                        new PeerComparisonEntry(ticker, v.peRatio(), v.priceToBook(), v.priceToSales()),
                        new PeerComparisonEntry(SECTOR_AVG_LABEL, v.sectorAvgPe(), v.sectorAvgPb(), v.sectorAvgPs())))
                .orElse(List.of());
    }
}
