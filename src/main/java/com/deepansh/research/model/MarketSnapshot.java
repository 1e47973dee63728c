package com.deepansh.research.model;

import com.deepansh.research.provider.QuoteData;
import lombok.Builder;

/**
 * Quote for one ticker plus its position inside the 52-week range.
 *
 * trendSignal is near_high at or above 80% of the range, near_low at or
 * below 20%, mid_range otherwise. Trend fields stay null when the range
 * is unknown or degenerate.
 */
@Builder
public record MarketSnapshot(
        String ticker,
        Double currentPrice,
        Double changePercent,
        Long volume,
        Long marketCap,
        Double peRatio,
        Double dayHigh,
        Double dayLow,
        Double yearHigh,
        Double yearLow,
        Double week52Position,
        Double distanceFromHigh,
        Double distanceFromLow,
        String trendSignal
) {

    public static MarketSnapshot from(QuoteData quote) {
        MarketSnapshotBuilder builder = MarketSnapshot.builder()
                .ticker(quote.ticker())
                .currentPrice(quote.price())
                .changePercent(quote.changePercent())
                .volume(quote.volume())
                .marketCap(quote.marketCap())
                .peRatio(quote.peRatio())
                .dayHigh(quote.dayHigh())
                .dayLow(quote.dayLow())
                .yearHigh(quote.yearHigh())
                .yearLow(quote.yearLow());

        Double price = quote.price();
        Double high = quote.yearHigh();
        Double low = quote.yearLow();
        if (price != null && high != null && low != null && high > low && low > 0) {
            double position = (price - low) / (high - low) * 100;
            builder.week52Position(round(position, 1))
                    .distanceFromHigh(round((price - high) / high * 100, 2))
                    .distanceFromLow(round((price - low) / low * 100, 2))
                    .trendSignal(position >= 80 ? "near_high" : position <= 20 ? "near_low" : "mid_range");
        }
        return builder.build();
    }

    static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
