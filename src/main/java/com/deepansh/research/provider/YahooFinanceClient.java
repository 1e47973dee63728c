package com.deepansh.research.provider;

import com.deepansh.research.config.ProviderProperties;
import com.deepansh.research.exception.ResearchException;
import com.deepansh.research.model.AnalystConsensus;
import com.deepansh.research.model.PeerValuation;
import com.deepansh.research.model.PricePoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Market data from Yahoo Finance's public JSON endpoints.
 *
 * - quoteSummary (v10): price, ratios, sector, analyst targets
 * - chart (v8): daily OHLCV history
 * - search (v1): company name to symbol
 *
 * Numbers arrive as {"raw": 123.4, "fmt": "123.40"}; only raw is read.
 * HTTP failures surface as RestClient exceptions (a 429 or 5xx is retried
 * by the caller); an empty result is a {@link ResearchException}.
 */
@Component
@Slf4j
public class YahooFinanceClient implements MarketDataProvider {

    private static final String SUMMARY_MODULES =
            "price,summaryDetail,defaultKeyStatistics,financialData,assetProfile";

    private final RestClient quoteClient;
    private final RestClient chartClient;
    private final ObjectMapper objectMapper;
    private final QuoteCache quoteCache;
    private final String historyRange;

    public YahooFinanceClient(RestClient.Builder restClientBuilder,
                              ProviderProperties providerProperties,
                              ObjectMapper objectMapper,
                              QuoteCache quoteCache) {
        ProviderProperties.Yahoo yahoo = providerProperties.getYahoo();
        this.quoteClient = restClientBuilder.clone()
                .baseUrl(yahoo.getQuoteBaseUrl())
                .defaultHeader("Accept", "application/json")
                .defaultHeader("User-Agent", "Mozilla/5.0")
                .build();
        this.chartClient = restClientBuilder.clone()
                .baseUrl(yahoo.getChartBaseUrl())
                .defaultHeader("Accept", "application/json")
                .defaultHeader("User-Agent", "Mozilla/5.0")
                .build();
        this.objectMapper = objectMapper;
        this.quoteCache = quoteCache;
        this.historyRange = yahoo.getHistoryRange();
    }

    @Override
    public QuoteData quote(String ticker) {
        return quoteCache.get(ticker).orElseGet(() -> {
            QuoteData quote = fetchQuote(ticker);
            quoteCache.put(quote);
            return quote;
        });
    }

    @Override
    public PeerValuation peerValuation(String ticker) {
        ValuationProfile company = valuationProfile(ticker);
        if (company.sector() == null) {
            throw new ResearchException("No sector information for " + ticker);
        }

        List<ValuationProfile> peers = new ArrayList<>();
        for (String peer : SectorPeers.forSector(company.sector(), ticker)) {
            try {
                peers.add(valuationProfile(peer));
            } catch (RuntimeException e) {
                log.warn("Skipping peer {} for {}: {}", peer, ticker, e.getMessage());
            }
        }

        log.info("Peer valuation for {} [sector={}, peers={}]", ticker, company.sector(), peers.size());
        return PeerValuation.compare(company, peers);
    }

    @Override
    public AnalystConsensus analystConsensus(String ticker) {
        JsonNode summary = fetchSummary(ticker);
        JsonNode financial = summary.path("financialData");

        Double targetMean = raw(financial, "targetMeanPrice");
        Double currentPrice = raw(financial, "currentPrice");
        if (currentPrice == null) {
            currentPrice = raw(summary.path("price"), "regularMarketPrice");
        }
        Double analysts = raw(financial, "numberOfAnalystOpinions");

        return AnalystConsensus.builder()
                .ticker(ticker.toUpperCase())
                .targetPriceMean(targetMean)
                .targetPriceHigh(raw(financial, "targetHighPrice"))
                .targetPriceLow(raw(financial, "targetLowPrice"))
                .currentPrice(currentPrice)
                .upsidePotential(AnalystConsensus.upside(targetMean, currentPrice))
                .recommendation(text(financial, "recommendationKey"))
                .numAnalysts(analysts != null ? analysts.intValue() : null)
                .build();
    }

    @Override
    public List<PricePoint> priceHistory(String ticker) {
        String uri = UriComponentsBuilder.fromPath("/v8/finance/chart/{ticker}")
                .queryParam("range", historyRange)
                .queryParam("interval", "1d")
                .buildAndExpand(ticker)
                .toUriString();

        JsonNode result = readFirstResult(chartClient.get().uri(uri).retrieve().body(String.class),
                "chart", ticker);

        JsonNode timestamps = result.path("timestamp");
        JsonNode quote = result.path("indicators").path("quote").path(0);
        List<PricePoint> points = new ArrayList<>();
        for (int i = 0; i < timestamps.size(); i++) {
            JsonNode close = quote.path("close").path(i);
            if (close.isMissingNode() || close.isNull()) continue;
            LocalDate date = Instant.ofEpochSecond(timestamps.path(i).asLong())
                    .atZone(ZoneOffset.UTC).toLocalDate();
            points.add(new PricePoint(date,
                    quote.path("open").path(i).asDouble(close.asDouble()),
                    quote.path("high").path(i).asDouble(close.asDouble()),
                    quote.path("low").path(i).asDouble(close.asDouble()),
                    close.asDouble(),
                    quote.path("volume").path(i).asLong(0)));
        }

        log.debug("Fetched {} price points for {}", points.size(), ticker);
        return points;
    }

    ValuationProfile valuationProfile(String ticker) {
        JsonNode summary = fetchSummary(ticker);
        JsonNode profile = summary.path("assetProfile");
        JsonNode detail = summary.path("summaryDetail");
        JsonNode stats = summary.path("defaultKeyStatistics");

        return new ValuationProfile(
                ticker.toUpperCase(),
                text(profile, "sector"),
                text(profile, "industry"),
                raw(detail, "trailingPE"),
                raw(stats, "priceToBook"),
                raw(detail, "priceToSalesTrailing12Months"));
    }

    private QuoteData fetchQuote(String ticker) {
        JsonNode summary = fetchSummary(ticker);
        JsonNode price = summary.path("price");
        JsonNode detail = summary.path("summaryDetail");

        Double regularPrice = raw(price, "regularMarketPrice");
        if (regularPrice == null) {
            throw new ResearchException("No price available for " + ticker);
        }
        Double changeFraction = raw(price, "regularMarketChangePercent");
        Double volume = raw(price, "regularMarketVolume");
        Double marketCap = raw(price, "marketCap");

        return QuoteData.builder()
                .ticker(ticker.toUpperCase())
                .price(regularPrice)
                .changePercent(changeFraction != null ? changeFraction * 100 : null)
                .volume(volume != null ? volume.longValue() : null)
                .marketCap(marketCap != null ? marketCap.longValue() : null)
                .peRatio(raw(detail, "trailingPE"))
                .dayHigh(raw(price, "regularMarketDayHigh"))
                .dayLow(raw(price, "regularMarketDayLow"))
                .yearHigh(raw(detail, "fiftyTwoWeekHigh"))
                .yearLow(raw(detail, "fiftyTwoWeekLow"))
                .build();
    }

    /**
     * Accepts the first EQUITY quote whose symbol equals the input or whose
     * short/long name contains it, so common words do not resolve to
     * arbitrary listings.
     */
    @Override
    public Optional<String> lookupSymbol(String companyName) {
        String uri = UriComponentsBuilder.fromPath("/v1/finance/search")
                .queryParam("q", companyName)
                .queryParam("quotesCount", 5)
                .queryParam("newsCount", 0)
                .build()
                .toUriString();

        String body = quoteClient.get().uri(uri).retrieve().body(String.class);
        if (body == null || body.isBlank()) return Optional.empty();

        JsonNode quotes;
        try {
            quotes = objectMapper.readTree(body).path("quotes");
        } catch (JsonProcessingException e) {
            throw new ResearchException("Malformed search response for '" + companyName + "'", e);
        }

        String needle = companyName.trim().toLowerCase(Locale.ROOT);
        for (JsonNode quote : quotes) {
            if (!"EQUITY".equals(quote.path("quoteType").asText())) continue;
            String symbol = quote.path("symbol").asText("");
            String names = (quote.path("shortname").asText("") + " " + quote.path("longname").asText(""))
                    .toLowerCase(Locale.ROOT);
            if (!symbol.isBlank() && (symbol.equalsIgnoreCase(needle) || names.contains(needle))) {
                log.debug("Symbol search '{}' -> {}", companyName, symbol);
                return Optional.of(symbol.toUpperCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }

    private JsonNode fetchSummary(String ticker) {
        String uri = UriComponentsBuilder.fromPath("/v10/finance/quoteSummary/{ticker}")
                .queryParam("modules", SUMMARY_MODULES)
                .buildAndExpand(ticker)
                .toUriString();

        String body = quoteClient.get().uri(uri).retrieve().body(String.class);
        return readFirstResult(body, "quoteSummary", ticker);
    }

    private JsonNode readFirstResult(String body, String envelope, String ticker) {
        if (body == null || body.isBlank()) {
            throw new ResearchException("Empty " + envelope + " response for " + ticker);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ResearchException("Malformed " + envelope + " response for " + ticker, e);
        }
        JsonNode container = root.path(envelope);
        JsonNode error = container.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new ResearchException(envelope + " error for " + ticker + ": "
                    + error.path("description").asText(error.toString()));
        }
        JsonNode first = container.path("result").path(0);
        if (first.isMissingNode() || first.isNull()) {
            throw new ResearchException("No " + envelope + " data for " + ticker);
        }
        return first;
    }

    private static Double raw(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        JsonNode value = node.isObject() ? node.path("raw") : node;
        return value.isNumber() ? value.asDouble() : null;
    }

    private static String text(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        return node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }
}
