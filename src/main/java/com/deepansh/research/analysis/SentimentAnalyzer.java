package com.deepansh.research.analysis;

import com.deepansh.research.model.SentimentAnalysis;
import com.deepansh.research.provider.NewsArticle;
import com.deepansh.research.provider.NewsProvider;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * News sentiment for one ticker: recent articles from the {@link NewsProvider},
 * scored by the LLM.
 *
 * A news lookup failure propagates so the caller can retry it. Once the news
 * is in hand, an LLM failure degrades to a neutral reading with zero
 * confidence rather than losing the ticker.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SentimentAnalyzer {

    private static final Set<String> SENTIMENTS = Set.of("positive", "neutral", "negative");

    private static final String SYSTEM_PROMPT = """
            You are an expert financial analyst. Analyze news sentiment objectively.
            Respond with JSON only:
            {"sentiment": "positive|neutral|negative", "confidence": <0.0-1.0>,
             "themes": ["theme", ...], "summary": "<2-3 sentences>"}""";

    private final NewsProvider newsProvider;
    private final LlmGateway llmGateway;

    public SentimentAnalysis analyze(String ticker) {
        List<NewsArticle> articles = newsProvider.search(ticker + " stock news");
        if (articles.isEmpty()) {
            log.info("No recent news for {}", ticker);
            return SentimentAnalysis.neutral(ticker, 0, "No recent news found for " + ticker + ".");
        }

        try {
            JsonNode result = llmGateway.completeJson(SYSTEM_PROMPT, prompt(ticker, articles), 400, 0.3);

            String sentiment = result.path("sentiment").asText("neutral").toLowerCase();
            if (!SENTIMENTS.contains(sentiment)) sentiment = "neutral";
            double confidence = Math.max(0.0, Math.min(1.0, result.path("confidence").asDouble(0.5)));

            List<String> themes = new ArrayList<>();
            result.path("themes").forEach(t -> themes.add(t.asText()));

            SentimentAnalysis analysis = new SentimentAnalysis(ticker, sentiment, confidence,
                    List.copyOf(themes), articles.size(), result.path("summary").asText("No summary available"));
            log.info("{} sentiment: {} (confidence: {})", ticker, sentiment, confidence);
            return analysis;

        } catch (RuntimeException e) {
            log.error("LLM sentiment analysis failed for {}: {}", ticker, e.getMessage());
            return SentimentAnalysis.neutral(ticker, articles.size(),
                    "Sentiment analysis unavailable. Based on " + articles.size() + " news items.");
        }
    }

    private String prompt(String ticker, List<NewsArticle> articles) {
        StringBuilder sb = new StringBuilder("Analyze the sentiment of these recent news articles about ")
                .append(ticker).append(":\n\n");
        for (int i = 0; i < articles.size(); i++) {
            NewsArticle article = articles.get(i);
            sb.append(i + 1).append(". ").append(article.title());
            if (!article.age().isBlank()) sb.append(" (").append(article.age()).append(')');
            sb.append('\n');
            if (!article.description().isBlank()) sb.append("   ").append(article.description()).append('\n');
        }
        return sb.toString();
    }
}
