package com.deepansh.research.analysis;

import com.deepansh.research.config.WorkflowProperties;
import com.deepansh.research.exception.ResearchException;
import com.deepansh.research.model.AnalystConsensus;
import com.deepansh.research.model.InvestorSnapshot;
import com.deepansh.research.model.MarketSnapshot;
import com.deepansh.research.model.PeerValuation;
import com.deepansh.research.model.QueryIntent;
import com.deepansh.research.model.RetrievedDocument;
import com.deepansh.research.model.SentimentAnalysis;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Writes the research report.
 *
 * The template follows the intent (price_query: brief_market,
 * sentiment_analysis: sentiment_focused, comparison: peer_comparison,
 * anything else: comprehensive) and only sections with data are included.
 *
 * {@link #generate} runs generate, evaluate and refine until the normalized
 * score reaches the quality threshold or the iteration cap is hit. An
 * evaluation that fails accepts the current text; a refinement that fails
 * keeps it.
 */
@Service
@Slf4j
public class ReportSynthesizer {

    private static final Map<String, List<String>> TEMPLATE_SECTIONS = Map.of(
            "brief_market", List.of("market", "52_week_trend"),
            "sentiment_focused", List.of("sentiment", "market"),
            "peer_comparison", List.of("market", "peer_valuation", "key_insights"),
            "comprehensive", List.of("market", "52_week_trend", "peer_valuation", "sentiment",
                    "analyst", "context", "key_insights"));

    private static final Map<String, String> TEMPLATE_INSTRUCTIONS = Map.of(
            "brief_market", """
                    Provide a BRIEF market summary (3-4 sentences) covering the current price and change,
                    the 52-week position and what it indicates, and a quick valuation assessment.""",
            "sentiment_focused", """
                    Provide a sentiment-focused analysis with: 1. Executive Summary, 2. Sentiment Analysis
                    (news themes and sentiment breakdown), 3. Market Context, 4. Conclusion.""",
            "peer_comparison", """
                    Provide a peer comparison with: 1. Executive Summary, 2. Market Overview,
                    3. Peer Valuation Comparison, 4. Key Insights (3-5 bullets), 5. Conclusion.""",
            "comprehensive", """
                    Provide a comprehensive research report with: 1. Executive Summary (2-3 sentences),
                    2. each available section in detail, 3. Key Insights (3-5 bullets), 4. a balanced Conclusion.""");

    private static final String WRITER_PROMPT = """
            You are an expert investment research analyst. Use only the data provided,
            never invent figures, format in markdown and answer in the language of the question.""";

    private static final String EVALUATOR_PROMPT = """
            You are a quality assurance analyst for investment research reports.
            Score completeness, consistency, actionability and clarity from 0 to 10.
            Respond with JSON only:
            {"completeness": n, "consistency": n, "actionability": n, "clarity": n,
             "overall_score": <0-10>, "strengths": ["..."], "gaps": ["..."], "summary": "..."}""";

    private static final String SNAPSHOT_PROMPT = """
            You are a financial advisor helping beginner investors. Avoid jargon.
            Respond with JSON only:
            {"investment_rating": "strong_buy|buy|hold|sell|strong_sell",
             "rating_explanation": "<1-2 sentences>", "key_highlights": ["..."], "risk_warnings": ["..."]}""";

    private final LlmGateway llmGateway;
    private final int maxIterations;
    private final double qualityThreshold;

    public ReportSynthesizer(LlmGateway llmGateway, WorkflowProperties properties) {
        this.llmGateway = llmGateway;
        this.maxIterations = Math.max(1, properties.getReport().getMaxIterations());
        this.qualityThreshold = properties.getReport().getQualityThreshold();
    }

    public static String templateFor(QueryIntent intent) {
        return switch (intent) {
            case PRICE_QUERY -> "brief_market";
            case SENTIMENT_ANALYSIS -> "sentiment_focused";
            case COMPARISON -> "peer_comparison";
            default -> "comprehensive";
        };
    }

    public ReportDraft generate(ReportInputs inputs) {
        String template = templateFor(inputs.intent());
        String report = synthesize(inputs, template);
        int iterations = 1;
        double score = 0.0;

        while (true) {
            Optional<QualityEvaluation> evaluation = tryEvaluate(report, inputs);
            if (evaluation.isEmpty()) {
                score = qualityThreshold;
                break;
            }
            score = evaluation.get().score();
            log.info("Report quality after pass {}: {} (threshold {})", iterations, score, qualityThreshold);
            if (score >= qualityThreshold || iterations >= maxIterations) {
                break;
            }
            report = refineOrKeep(report, evaluation.get(), inputs);
            iterations++;
        }

        return new ReportDraft(report, template, iterations, score);
    }

    public String synthesize(ReportInputs inputs, String template) {
        Map<String, String> sections = buildSections(inputs, template);

        StringBuilder prompt = new StringBuilder()
                .append("Generate an investment research report to answer this query:\n\n")
                .append("**User Query:** ").append(inputs.query()).append('\n')
                .append("**Tickers:** ").append(tickerList(inputs.tickers())).append('\n')
                .append("**Intent:** ").append(inputs.intent().wireName()).append('\n');
        sections.forEach((name, content) ->
                prompt.append("\n---\n\n**").append(name).append(":**\n").append(content).append('\n'));
        prompt.append("\n---\n\n").append(TEMPLATE_INSTRUCTIONS.get(template))
                .append("\nAvailable sections: ")
                .append(sections.isEmpty() ? "none, say that data was unavailable" : String.join(", ", sections.keySet()))
                .append("\nStocks near 52-week highs (80%+) show momentum or resistance; near lows (20%-) weakness or value.")
                .append("\nA positive peer premium means the market pays more than for sector peers.");

        return llmGateway.complete(WRITER_PROMPT, prompt.toString(), 1500, 0.7);
    }

    public QualityEvaluation evaluate(String report, ReportInputs inputs) {
        String sources = inputs.dataSources().entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .collect(Collectors.joining(", "));
        String prompt = "**User Query:** " + inputs.query()
                + "\n**Intent:** " + inputs.intent().wireName()
                + "\n**Available Data Sources:** " + (sources.isEmpty() ? "none" : sources)
                + "\n\n**Report to Evaluate:**\n" + report;

        JsonNode feedback = llmGateway.completeJson(EVALUATOR_PROMPT, prompt, 500, 0.3);
        JsonNode overall = feedback.path("overall_score");
        if (!overall.isNumber()) {
            throw new ResearchException("Evaluation did not include a numeric overall_score");
        }
        return new QualityEvaluation(
                overall.asDouble() / 10.0,
                texts(feedback.path("strengths")),
                texts(feedback.path("gaps")),
                feedback.path("summary").asText(""));
    }

    public String refine(String report, QualityEvaluation evaluation, ReportInputs inputs) {
        String prompt = "**User Query:** " + inputs.query()
                + "\n**Tickers:** " + tickerList(inputs.tickers())
                + "\n\n**Original Report:**\n" + report
                + "\n\n---\n**Strengths:** " + String.join(", ", evaluation.strengths())
                + "\n**Gaps to Address:** " + String.join(", ", evaluation.gaps())
                + "\n\nKeep the strengths, address each gap, keep the report's language and add nothing"
                + " the data does not support. Reply with the refined report only.";
        return llmGateway.complete(WRITER_PROMPT, prompt, 1500, 0.7);
    }

    /**
     * Beginner-friendly snapshot of the first ticker. Empty when there is no
     * market data for it; LLM failures propagate.
     */
    public Optional<InvestorSnapshot> snapshot(ReportInputs inputs) {
        if (inputs.tickers().isEmpty()) return Optional.empty();
        String ticker = inputs.tickers().get(0);
        Optional<MarketSnapshot> market = inputs.marketData().stream()
                .filter(m -> ticker.equals(m.ticker()))
                .findFirst();
        if (market.isEmpty()) return Optional.empty();
        MarketSnapshot m = market.get();

        StringBuilder prompt = new StringBuilder("Investment data for ").append(ticker).append(":\n")
                .append("Current price: ").append(number(m.currentPrice())).append('\n')
                .append("Price change: ").append(number(m.changePercent())).append("%\n")
                .append("Market cap: ").append(m.marketCap() != null ? m.marketCap() : "N/A").append('\n')
                .append("P/E ratio: ").append(number(m.peRatio())).append('\n');
        inputs.sentiment().stream().filter(s -> ticker.equals(s.ticker())).findFirst().ifPresent(s ->
                prompt.append("Sentiment: ").append(s.overallSentiment().toUpperCase(Locale.ROOT))
                        .append(" (confidence ").append(s.confidence()).append(")\n"));
        inputs.analystConsensus().stream().filter(a -> ticker.equals(a.ticker())).findFirst().ifPresent(a ->
                prompt.append("Analyst target: ").append(number(a.targetPriceMean()))
                        .append(" (upside ").append(number(a.upsidePotential())).append("%), recommendation ")
                        .append(a.recommendation()).append('\n'));

        JsonNode result = llmGateway.completeJson(SNAPSHOT_PROMPT, prompt.toString(), 600, 0.5);

        return Optional.of(InvestorSnapshot.builder()
                .ticker(ticker)
                .currentPrice(m.currentPrice())
                .priceChangePct(m.changePercent())
                .marketCap(m.marketCap())
                .peRatio(m.peRatio())
                .investmentRating(result.path("investment_rating").asText("hold"))
                .ratingExplanation(result.path("rating_explanation").asText(""))
                .keyHighlights(texts(result.path("key_highlights")))
                .riskWarnings(texts(result.path("risk_warnings")))
                .build());
    }

    private Optional<QualityEvaluation> tryEvaluate(String report, ReportInputs inputs) {
        try {
            return Optional.of(evaluate(report, inputs));
        } catch (RuntimeException e) {
            log.warn("Report evaluation failed, accepting current report: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String refineOrKeep(String report, QualityEvaluation evaluation, ReportInputs inputs) {
        try {
            return refine(report, evaluation, inputs);
        } catch (RuntimeException e) {
            log.warn("Report refinement failed, keeping previous text: {}", e.getMessage());
            return report;
        }
    }

    Map<String, String> buildSections(ReportInputs inputs, String template) {
        List<String> layout = TEMPLATE_SECTIONS.getOrDefault(template, TEMPLATE_SECTIONS.get("comprehensive"));
        Map<String, Boolean> sources = inputs.dataSources();
        Map<String, String> sections = new LinkedHashMap<>();

        if (layout.contains("market") && sources.get("market_data")) {
            sections.put("Market Analysis", formatMarket(inputs.marketData()));
        }
        if (layout.contains("52_week_trend") && sources.get("market_data")) {
            sections.put("52-Week Trend Analysis", formatTrend(inputs.marketData()));
        }
        if (layout.contains("peer_valuation") && sources.get("peer_valuation")) {
            sections.put("Peer Valuation Comparison", formatPeers(inputs.peerValuations()));
        }
        if (layout.contains("sentiment") && sources.get("sentiment")) {
            sections.put("Sentiment & News", formatSentiment(inputs.sentiment()));
        }
        if (layout.contains("analyst") && sources.get("analyst_consensus")) {
            sections.put("Analyst Consensus & Forward-Looking", formatConsensus(inputs.analystConsensus()));
        }
        if (layout.contains("context") && sources.get("context")) {
            sections.put("Supporting Context", formatContext(inputs.context()));
        }
        return sections;
    }

    private static String formatMarket(List<MarketSnapshot> data) {
        return data.stream()
                .map(m -> String.format("- %s: price %s, change %s%%, volume %s, market cap %s, P/E %s",
                        m.ticker(), number(m.currentPrice()), number(m.changePercent()),
                        m.volume() != null ? m.volume() : "N/A",
                        m.marketCap() != null ? m.marketCap() : "N/A", number(m.peRatio())))
                .collect(Collectors.joining("\n"));
    }

    private static String formatTrend(List<MarketSnapshot> data) {
        List<String> lines = new ArrayList<>();
        for (MarketSnapshot m : data) {
            if (m.week52Position() == null) {
                lines.add("- " + m.ticker() + ": 52-week range unavailable");
                continue;
            }
            lines.add(String.format("- %s: 52-week range %s to %s, position %s%% (%s), %s%% from high, %s%% from low",
                    m.ticker(), number(m.yearLow()), number(m.yearHigh()), number(m.week52Position()),
                    m.trendSignal(), number(m.distanceFromHigh()), number(m.distanceFromLow())));
        }
        return String.join("\n", lines);
    }

    private static String formatPeers(List<PeerValuation> data) {
        return data.stream()
                .map(p -> String.format("- %s (%s, %d peers): P/E %s vs %s (%s%%), P/B %s vs %s (%s%%), P/S %s vs %s (%s%%)",
                        p.ticker(), p.sector(), p.peerCount(),
                        number(p.peRatio()), number(p.sectorAvgPe()), number(p.pePremiumDiscount()),
                        number(p.priceToBook()), number(p.sectorAvgPb()), number(p.pbPremiumDiscount()),
                        number(p.priceToSales()), number(p.sectorAvgPs()), number(p.psPremiumDiscount())))
                .collect(Collectors.joining("\n"));
    }

    private static String formatSentiment(List<SentimentAnalysis> data) {
        return data.stream()
                .map(s -> String.format("- %s: %s (confidence %.2f, %d articles). Themes: %s. %s",
                        s.ticker(), s.overallSentiment(), s.confidence(), s.newsCount(),
                        s.keyThemes().isEmpty() ? "none" : String.join(", ", s.keyThemes()), s.summary()))
                .collect(Collectors.joining("\n"));
    }

    private static String formatConsensus(List<AnalystConsensus> data) {
        return data.stream()
                .map(a -> String.format("- %s: mean target %s (low %s, high %s), upside %s%%, recommendation %s, %s analysts",
                        a.ticker(), number(a.targetPriceMean()), number(a.targetPriceLow()),
                        number(a.targetPriceHigh()), number(a.upsidePotential()),
                        a.recommendation() != null ? a.recommendation() : "N/A",
                        a.numAnalysts() != null ? a.numAnalysts() : "N/A"))
                .collect(Collectors.joining("\n"));
    }

    private static String formatContext(List<RetrievedDocument> data) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < data.size(); i++) {
            RetrievedDocument doc = data.get(i);
            String text = doc.text() == null ? "" : doc.text();
            sb.append(i + 1).append(". [").append(doc.source()).append("] ")
                    .append(text.length() > 500 ? text.substring(0, 500) + "..." : text)
                    .append('\n');
        }
        return sb.toString().trim();
    }

    private static String tickerList(List<String> tickers) {
        return tickers.isEmpty() ? "Not specified" : String.join(", ", tickers);
    }

    private static String number(Double value) {
        return value == null ? "N/A" : String.format(Locale.ROOT, "%.2f", value);
    }

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(n -> values.add(n.asText()));
        return List.copyOf(values);
    }
}
