package com.deepansh.research.model;

import lombok.Builder;

import java.util.List;

/**
 * Beginner-friendly summary of the primary ticker.
 * investmentRating is one of strong_buy, buy, hold, sell, strong_sell.
 */
@Builder
public record InvestorSnapshot(
        String ticker,
        Double currentPrice,
        Double priceChangePct,
        Long marketCap,
        Double peRatio,
        String investmentRating,
        String ratingExplanation,
        List<String> keyHighlights,
        List<String> riskWarnings
) {
}
