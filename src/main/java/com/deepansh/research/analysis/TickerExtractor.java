package com.deepansh.research.analysis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds stock tickers in free text, in three passes:
 * 1. explicit symbols from a known list
 * 2. well-known company names and aliases
 * 3. remaining capitalized words or phrases ("Netflix", "IBM", "Home Depot"),
 *    split on and/vs/versus, handed to the {@link TickerResolver}
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TickerExtractor {

    private static final Pattern SYMBOL = Pattern.compile("\\b([A-Z]{1,5})\\b");

    private static final Pattern CAPITALIZED = Pattern.compile("\\b([A-Z][a-zA-Z&]+(?:\\s+[A-Z][a-zA-Z&]+)*)\\b");

    private static final Pattern CONNECTOR = Pattern.compile("\\s+(?:and|vs|versus)\\s+", Pattern.CASE_INSENSITIVE);

    /** Upper bound on resolver lookups per text. */
    static final int MAX_RESOLVED_CANDIDATES = 5;

    private static final Set<String> STOPWORDS = Set.of(
            "what", "how", "when", "where", "why", "who", "which", "the", "is", "are", "can", "could",
            "should", "would", "will", "do", "does", "did", "give", "tell", "show", "analyze", "analyse",
            "compare", "research", "explain", "please", "i", "me", "my", "we", "it", "a", "an", "buy",
            "sell", "hold", "stock", "stocks", "price", "news", "market", "outlook", "invest", "ceo", "ai",
            "us", "usa", "etf", "ipo", "eps", "pe", "q1", "q2", "q3", "q4");

    static final Set<String> KNOWN_TICKERS = Set.of(
            "AAPL", "MSFT", "GOOGL", "AMZN", "TSLA", "META", "NVDA", "JPM",
            "V", "WMT", "JNJ", "PG", "MA", "UNH", "HD", "DIS");

    private static final Map<String, String> COMPANY_NAMES = Map.ofEntries(
            Map.entry("apple", "AAPL"),
            Map.entry("microsoft", "MSFT"),
            Map.entry("google", "GOOGL"),
            Map.entry("alphabet", "GOOGL"),
            Map.entry("amazon", "AMZN"),
            Map.entry("tesla", "TSLA"),
            Map.entry("meta", "META"),
            Map.entry("facebook", "META"),
            Map.entry("nvidia", "NVDA"),
            Map.entry("jpmorgan", "JPM"),
            Map.entry("jp morgan", "JPM"),
            Map.entry("visa", "V"),
            Map.entry("walmart", "WMT"),
            Map.entry("johnson & johnson", "JNJ"),
            Map.entry("j&j", "JNJ"),
            Map.entry("procter & gamble", "PG"),
            Map.entry("mastercard", "MA"),
            Map.entry("unitedhealth", "UNH"),
            Map.entry("home depot", "HD"),
            Map.entry("disney", "DIS"));

    private final TickerResolver tickerResolver;

    /** Tickers in first-seen order: explicit symbols, then company names, then resolved candidates. */
    public List<String> extract(String text) {
        if (text == null || text.isBlank()) return List.of();

        Set<String> tickers = new LinkedHashSet<>();
        Matcher matcher = SYMBOL.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group(1);
            if (KNOWN_TICKERS.contains(candidate)) {
                tickers.add(candidate);
            }
        }

        String lower = text.toLowerCase(Locale.ROOT);
        COMPANY_NAMES.entrySet().stream()
                .filter(e -> containsWord(lower, e.getKey()))
                .sorted(Map.Entry.comparingByKey((a, b) -> Integer.compare(lower.indexOf(a), lower.indexOf(b))))
                .forEach(e -> tickers.add(e.getValue()));

        for (String candidate : unresolvedCandidates(text)) {
            tickerResolver.resolve(candidate).ifPresent(tickers::add);
        }

        return List.copyOf(tickers);
    }

    /**
     * Capitalized words and phrases not already covered by the symbol list,
     * the alias table or the stopwords.
     */
    List<String> unresolvedCandidates(String text) {
        Set<String> candidates = new LinkedHashSet<>();
        Matcher matcher = CAPITALIZED.matcher(text);
        while (matcher.find()) {
            for (String part : CONNECTOR.split(matcher.group(1))) {
                String phrase = trimStopwords(part);
                if (phrase.length() < 2) continue;
                String lower = phrase.toLowerCase(Locale.ROOT);
                if (KNOWN_TICKERS.contains(phrase) || COMPANY_NAMES.containsKey(lower)
                        || COMPANY_NAMES.keySet().stream().anyMatch(name -> containsWord(lower, name))) {
                    continue;
                }
                candidates.add(phrase);
            }
        }

        List<String> limited = new ArrayList<>(candidates);
        if (limited.size() > MAX_RESOLVED_CANDIDATES) {
            log.debug("Resolving only the first {} of {} candidates", MAX_RESOLVED_CANDIDATES, limited.size());
            return List.copyOf(limited.subList(0, MAX_RESOLVED_CANDIDATES));
        }
        return List.copyOf(limited);
    }

    /** Drops stopwords from both ends: "Analyze Netflix" becomes "Netflix". */
    private static String trimStopwords(String phrase) {
        List<String> words = new ArrayList<>(List.of(phrase.trim().split("\\s+")));
        while (!words.isEmpty() && STOPWORDS.contains(words.get(0).toLowerCase(Locale.ROOT))) {
            words.remove(0);
        }
        while (!words.isEmpty() && STOPWORDS.contains(words.get(words.size() - 1).toLowerCase(Locale.ROOT))) {
            words.remove(words.size() - 1);
        }
        return String.join(" ", words);
    }

    private static boolean containsWord(String text, String name) {
        return Pattern.compile("(?<![a-z])" + Pattern.quote(name) + "(?![a-z])").matcher(text).find();
    }
}
