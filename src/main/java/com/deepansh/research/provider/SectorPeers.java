package com.deepansh.research.provider;

import java.util.List;
import java.util.Map;

/**
 * Fixed peer groups per sector used for relative valuation.
 */
final class SectorPeers {

    static final int MAX_PEERS = 5;

    private static final List<String> MARKET_FALLBACK = List.of("SPY");

    private static final Map<String, List<String>> PEERS = Map.ofEntries(
            Map.entry("Technology", List.of("AAPL", "MSFT", "GOOGL", "META", "NVDA", "AMD", "INTC", "ORCL", "CRM", "ADBE")),
            Map.entry("Consumer Cyclical", List.of("AMZN", "TSLA", "NKE", "HD", "MCD", "SBUX", "TGT", "LOW", "F", "GM")),
            Map.entry("Healthcare", List.of("JNJ", "UNH", "PFE", "ABBV", "TMO", "MRK", "LLY", "DHR", "CVS", "AMGN")),
            Map.entry("Financial Services", List.of("JPM", "BAC", "WFC", "GS", "MS", "C", "BLK", "SCHW", "AXP", "USB")),
            Map.entry("Communication Services", List.of("GOOGL", "META", "DIS", "NFLX", "CMCSA", "T", "VZ", "TMUS", "CHTR")),
            Map.entry("Consumer Defensive", List.of("PG", "KO", "PEP", "WMT", "COST", "PM", "MO", "CL", "MDLZ", "KHC")),
            Map.entry("Industrials", List.of("BA", "HON", "UNP", "UPS", "CAT", "RTX", "LMT", "DE", "GE", "MMM")),
            Map.entry("Energy", List.of("XOM", "CVX", "COP", "SLB", "EOG", "PSX", "MPC", "VLO", "OXY", "HAL")),
            Map.entry("Basic Materials", List.of("LIN", "APD", "ECL", "SHW", "DD", "NEM", "FCX", "NUE", "DOW", "ALB")),
            Map.entry("Real Estate", List.of("AMT", "PLD", "CCI", "EQIX", "PSA", "SPG", "O", "WELL", "DLR", "AVB")),
            Map.entry("Utilities", List.of("NEE", "DUK", "SO", "D", "AEP", "EXC", "SRE", "XEL", "ED", "PEG"))
    );

    private SectorPeers() {
    }

    /** Up to {@link #MAX_PEERS} peers for the sector, excluding the ticker itself. */
    static List<String> forSector(String sector, String ticker) {
        List<String> peers = PEERS.getOrDefault(sector, List.of()).stream()
                .filter(p -> !p.equalsIgnoreCase(ticker))
                .limit(MAX_PEERS)
                .toList();
        return peers.isEmpty() ? MARKET_FALLBACK : peers;
    }
}
