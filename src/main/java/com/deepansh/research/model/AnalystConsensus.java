package com.deepansh.research.model;

import lombok.Builder;

@Builder
public record AnalystConsensus(
        String ticker,
        Double targetPriceMean,
        Double targetPriceHigh,
        Double targetPriceLow,
        Double currentPrice,
        Double upsidePotential,
        String recommendation,
        Integer numAnalysts
) {

    /** Percentage distance from the current price to the mean target, or null if either is missing. */
    public static Double upside(Double targetMean, Double currentPrice) {
        if (targetMean == null || currentPrice == null || currentPrice <= 0) return null;
        return MarketSnapshot.round((targetMean - currentPrice) / currentPrice * 100, 2);
    }
}
