package com.deepansh.research.model;

import com.deepansh.research.provider.ValuationProfile;
import lombok.Builder;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Valuation ratios for one ticker against the average of its sector peers.
 * Premium/discount values are percentages; positive means a premium.
 */
@Builder
public record PeerValuation(
        String ticker,
        String sector,
        String industry,
        Double peRatio,
        Double priceToBook,
        Double priceToSales,
        Double sectorAvgPe,
        Double sectorAvgPb,
        Double sectorAvgPs,
        Double pePremiumDiscount,
        Double pbPremiumDiscount,
        Double psPremiumDiscount,
        int peerCount
) {

    public static PeerValuation compare(ValuationProfile company, List<ValuationProfile> peers) {
        Double avgPe = average(peers, ValuationProfile::peRatio);
        Double avgPb = average(peers, ValuationProfile::priceToBook);
        Double avgPs = average(peers, ValuationProfile::priceToSales);

        return PeerValuation.builder()
                .ticker(company.ticker())
                .sector(company.sector())
                .industry(company.industry())
                .peRatio(company.peRatio())
                .priceToBook(company.priceToBook())
                .priceToSales(company.priceToSales())
                .sectorAvgPe(avgPe)
                .sectorAvgPb(avgPb)
                .sectorAvgPs(avgPs)
                .pePremiumDiscount(premium(company.peRatio(), avgPe))
                .pbPremiumDiscount(premium(company.priceToBook(), avgPb))
                .psPremiumDiscount(premium(company.priceToSales(), avgPs))
                .peerCount(peers.size())
                .build();
    }

    private static Double average(List<ValuationProfile> peers, Function<ValuationProfile, Double> metric) {
        List<Double> values = peers.stream()
                .map(metric)
                .filter(Objects::nonNull)
                .filter(v -> v > 0)
                .toList();
        if (values.isEmpty()) return null;
        double avg = values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        return MarketSnapshot.round(avg, 2);
    }

    private static Double premium(Double value, Double average) {
        if (value == null || average == null || average <= 0) return null;
        return MarketSnapshot.round((value - average) / average * 100, 2);
    }
}
