package com.deepansh.research.analysis;

import com.deepansh.research.model.DispatchFlags;
import com.deepansh.research.model.QueryIntent;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Assigns a {@link QueryIntent} and decides which specialist families the
 * query needs. The flags feed the specialist router directly.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IntentClassifier {

    private static final String SYSTEM_PROMPT = """
            You are an expert investment query analyzer.
            Identify the single most specific intent and set a data flag to true only when the query needs it.

            Intents and their usual flags:
            - price_query: current price or quote only. market_data=true, sentiment=false, context=false
            - fundamental_analysis: ratios, valuation, financials. market_data=true, sentiment=false, context=true
            - sentiment_analysis: news and market mood. market_data=true, sentiment=true, context=false
            - general_research: broad "should I invest" questions. all flags true
            - comparison: two or more companies or a sector. market_data=true, sentiment=false, context=true

            If no tickers were found, set retrieve_context to true.
            Respond with JSON only:
            {"intent": "<intent>", "fetch_market_data": <bool>, "analyze_sentiment": <bool>,
             "retrieve_context": <bool>, "reasoning": "<one sentence>"}""";

    private final LlmGateway llmGateway;

    public IntentClassification classify(String query, List<String> tickers) {
        String prompt = "User query: \"" + query + "\"\nTickers found: "
                + (tickers.isEmpty() ? "None" : String.join(", ", tickers));

        JsonNode result = llmGateway.completeJson(SYSTEM_PROMPT, prompt, 250, 0.2);

        QueryIntent intent = QueryIntent.fromWire(result.path("intent").asText(null));
        DispatchFlags flags = new DispatchFlags(
                parseBool(result.path("fetch_market_data")),
                parseBool(result.path("analyze_sentiment")),
                parseBool(result.path("retrieve_context")));

        log.info("Intent: {} | flags: market_data={}, sentiment={}, context={} | reasoning: {}",
                intent.wireName(), flags.marketData(), flags.sentiment(), flags.context(),
                result.path("reasoning").asText("n/a"));

        if (!flags.marketData() && !flags.sentiment() && !flags.context()) {
            log.warn("No specialist flags set for query '{}' [tickers={}]", query, tickers);
        }
        return new IntentClassification(intent, flags);
    }

    /** Accepts real booleans as well as "true"/"yes"/"1" strings; anything else is false. */
    static boolean parseBool(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return false;
        if (node.isBoolean()) return node.asBoolean();
        if (node.isNumber()) return node.asInt() != 0;
        String text = node.asText().trim().toLowerCase();
        return text.equals("true") || text.equals("yes") || text.equals("1");
    }
}
