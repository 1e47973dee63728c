package com.deepansh.research.provider;

public record ValuationProfile(
        String ticker,
        String sector,
        String industry,
        Double peRatio,
        Double priceToBook,
        Double priceToSales
) {
}
