package com.deepansh.research.provider;

import lombok.Builder;

/**
 * Raw quote fields as reported by the market-data provider.
 */
@Builder
public record QuoteData(
        String ticker,
        Double price,
        Double changePercent,
        Long volume,
        Long marketCap,
        Double peRatio,
        Double dayHigh,
        Double dayLow,
        Double yearHigh,
        Double yearLow
) {
}
