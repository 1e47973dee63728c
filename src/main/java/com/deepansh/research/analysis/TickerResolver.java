package com.deepansh.research.analysis;

import com.deepansh.research.provider.MarketDataProvider;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves a company name ("Netflix", "IBM", "Home Depot Inc.") to a ticker.
 *
 * Three layers, cheapest first:
 * 1. Redis cache, key research:ticker:{normalized name}
 * 2. Market data provider symbol search
 * 3. LLM, accepted only at confidence 0.7 or above and when the provider
 *    can quote the symbol
 *
 * Hits are cached for 90 days, misses for one day. Every layer treats its
 * own failure as a miss, so resolution never fails a run.
 */
@Component
@Slf4j
public class TickerResolver {

    private static final String KEY_PREFIX = "research:ticker:";
    private static final String MISS = "-";
    private static final Duration HIT_TTL = Duration.ofDays(90);
    private static final Duration MISS_TTL = Duration.ofDays(1);
    private static final double LLM_CONFIDENCE_THRESHOLD = 0.7;

    private static final Pattern SYMBOL = Pattern.compile("^[A-Z]{1,5}(\\.[A-Z])?$");
    private static final Pattern LEGAL_SUFFIX = Pattern.compile(
            "\\s+(inc\\.?|corp\\.?|corporation|ltd\\.?|llc|company|co\\.?)$", Pattern.CASE_INSENSITIVE);

    private static final String SYSTEM_PROMPT = """
            You are a financial ticker resolver. Identify the primary US stock ticker for the company.
            Handle aliases ("Facebook" is META) and abbreviations ("J&J" is JNJ).
            Only publicly traded US companies; if ambiguous or not a company, return null.
            Respond with JSON only:
            {"ticker": "AAPL", "confidence": 0.95, "official_name": "Apple Inc."}
            or {"ticker": null, "confidence": 0.0, "official_name": null}""";

    private final StringRedisTemplate redisTemplate;
    private final MarketDataProvider marketDataProvider;
    private final LlmGateway llmGateway;

    public TickerResolver(StringRedisTemplate redisTemplate,
                          MarketDataProvider marketDataProvider,
                          LlmGateway llmGateway) {
        this.redisTemplate = redisTemplate;
        this.marketDataProvider = marketDataProvider;
        this.llmGateway = llmGateway;
    }

    public Optional<String> resolve(String companyName) {
        String normalized = normalize(companyName);
        if (normalized.isEmpty()) return Optional.empty();

        Optional<String> cached = readCache(normalized);
        if (cached.isPresent()) {
            String value = cached.get();
            log.debug("Ticker cache hit: '{}' -> {}", companyName, value);
            return MISS.equals(value) ? Optional.empty() : Optional.of(value);
        }

        Optional<String> ticker = searchProvider(companyName);
        if (ticker.isEmpty()) {
            ticker = askLlm(companyName);
        }

        if (ticker.isPresent()) {
            log.info("Resolved '{}' -> {}", companyName, ticker.get());
        } else {
            log.debug("Could not resolve '{}'", companyName);
        }
        writeCache(normalized, ticker.orElse(MISS), ticker.isPresent() ? HIT_TTL : MISS_TTL);
        return ticker;
    }

    static String normalize(String name) {
        if (name == null) return "";
        String stripped = LEGAL_SUFFIX.matcher(name.trim()).replaceAll("");
        return stripped.replaceAll("[^\\w\\s&]", " ")
                .trim()
                .replaceAll("\\s+", " ")
                .toLowerCase(Locale.ROOT);
    }

    private Optional<String> searchProvider(String companyName) {
        try {
            return marketDataProvider.lookupSymbol(companyName);
        } catch (RuntimeException e) {
            log.warn("Symbol search failed for '{}': {}", companyName, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> askLlm(String companyName) {
        String ticker;
        try {
            JsonNode result = llmGateway.completeJson(SYSTEM_PROMPT,
                    "Company input: \"" + companyName + "\"", 150, 0.1);
            JsonNode tickerNode = result.path("ticker");
            if (!tickerNode.isTextual()
                    || result.path("confidence").asDouble(0.0) < LLM_CONFIDENCE_THRESHOLD) {
                return Optional.empty();
            }
            ticker = tickerNode.asText().trim().toUpperCase(Locale.ROOT);
        } catch (RuntimeException e) {
            log.warn("LLM ticker resolution failed for '{}': {}", companyName, e.getMessage());
            return Optional.empty();
        }

        if (!SYMBOL.matcher(ticker).matches() || !isQuotable(ticker)) {
            log.debug("Discarding LLM ticker {} for '{}'", ticker, companyName);
            return Optional.empty();
        }
        return Optional.of(ticker);
    }

    private boolean isQuotable(String ticker) {
        try {
            return marketDataProvider.quote(ticker) != null;
        } catch (RuntimeException e) {
            return false;
        }
    }

    private Optional<String> readCache(String normalized) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(KEY_PREFIX + normalized));
        } catch (RuntimeException e) {
            log.warn("Ticker cache read failed for '{}', treating as miss: {}", normalized, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String normalized, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + normalized, value, ttl);
        } catch (RuntimeException e) {
            log.warn("Ticker cache write failed for '{}': {}", normalized, e.getMessage());
        }
    }
}
