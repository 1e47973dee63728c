package com.deepansh.research.model;

import lombok.Builder;

import java.util.List;

/**
 * Chart-ready data for one ticker: one year of daily prices, the 52-week
 * range and a peer comparison (the ticker itself followed by "Sector Avg").
 */
@Builder
public record VisualizationData(
        String ticker,
        List<PricePoint> priceHistory,
        Double week52High,
        Double week52Low,
        Double currentPrice,
        Double currentPositionPct,
        List<PeerComparisonEntry> peerComparison,
        Double periodHigh,
        Double periodLow,
        Long averageVolume
) {
}
