package com.deepansh.research.provider;

import com.deepansh.research.model.AnalystConsensus;
import com.deepansh.research.model.PeerValuation;
import com.deepansh.research.model.PricePoint;

import java.util.List;
import java.util.Optional;

/**
 * Source of quotes, valuation ratios, analyst targets and price history.
 * Implementations throw on failure; callers decide whether to retry.
 */
public interface MarketDataProvider {

    QuoteData quote(String ticker);

    PeerValuation peerValuation(String ticker);

    AnalystConsensus analystConsensus(String ticker);

    List<PricePoint> priceHistory(String ticker);

    /**
     * Best listed equity symbol for a company name, or empty when the
     * provider knows no equity whose name matches.
     */
    Optional<String> lookupSymbol(String companyName);
}
