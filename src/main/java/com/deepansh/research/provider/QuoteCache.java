package com.deepansh.research.provider;

import com.deepansh.research.config.ProviderProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived Redis cache for quotes so concurrent runs on the same ticker
 * share one provider call.
 *
 * Key pattern: research:quote:{TICKER}. Cache errors are logged and treated
 * as a miss; they never fail a run.
 */
@Component
@Slf4j
public class QuoteCache {

    private static final String KEY_PREFIX = "research:quote:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public QuoteCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                      ProviderProperties providerProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofMinutes(providerProperties.getYahoo().getQuoteCacheTtlMinutes());
    }

    public Optional<QuoteData> get(String ticker) {
        try {
            String json = redisTemplate.opsForValue().get(buildKey(ticker));
            if (json == null) return Optional.empty();
            log.debug("Quote cache hit for {}", ticker);
            return Optional.of(objectMapper.readValue(json, QuoteData.class));
        } catch (Exception e) {
            log.warn("Quote cache read failed for {}, treating as miss: {}", ticker, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(QuoteData quote) {
        try {
            redisTemplate.opsForValue().set(buildKey(quote.ticker()), objectMapper.writeValueAsString(quote), ttl);
        } catch (Exception e) {
            log.warn("Quote cache write failed for {}: {}", quote.ticker(), e.getMessage());
        }
    }

    private String buildKey(String ticker) {
        return KEY_PREFIX + ticker.toUpperCase();
    }
}
