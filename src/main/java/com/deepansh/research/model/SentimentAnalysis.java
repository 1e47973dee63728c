package com.deepansh.research.model;

import java.util.List;

public record SentimentAnalysis(
        String ticker,
        String overallSentiment,
        double confidence,
        List<String> keyThemes,
        int newsCount,
        String summary
) {

    public static SentimentAnalysis neutral(String ticker, int newsCount, String summary) {
        return new SentimentAnalysis(ticker, "neutral", 0.0, List.of(), newsCount, summary);
    }
}
