package com.deepansh.research.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed idempotency for research requests.
 *
 * A research run is expensive (several LLM calls plus market data), so a
 * client that retries after a network timeout should get the stored answer
 * instead of triggering a second run. Clients opt in with an
 * Idempotency-Key header.
 *
 * Key pattern: research:idempotency:{key}, TTL 24h.
 * While a run is in flight the key holds a sentinel; a failed run releases it.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "research:idempotency:";
    private static final Duration TTL = Duration.ofHours(24);
    private static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;

    public IdempotencyService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Returns the stored response for a completed request, or empty when the
     * key is new or still in flight.
     */
    public Optional<String> getCachedResponse(String idempotencyKey) {
        String existing = redisTemplate.opsForValue().get(buildKey(idempotencyKey));

        if (existing == null) {
            return Optional.empty();
        }
        if (IN_FLIGHT_SENTINEL.equals(existing)) {
            log.warn("Idempotency key {} is in flight, running again", idempotencyKey);
            return Optional.empty();
        }

        log.info("Idempotency hit for key={}", idempotencyKey);
        return Optional.of(existing);
    }

    /** SET NX with the in-flight sentinel. False when another request holds the key. */
    public boolean claimKey(String idempotencyKey) {
        Boolean claimed = redisTemplate.opsForValue()
                .setIfAbsent(buildKey(idempotencyKey), IN_FLIGHT_SENTINEL, TTL);
        return Boolean.TRUE.equals(claimed);
    }

    public void storeResponse(String idempotencyKey, String responseJson) {
        redisTemplate.opsForValue().set(buildKey(idempotencyKey), responseJson, TTL);
        log.debug("Stored idempotent response for key={}", idempotencyKey);
    }

    public void releaseKey(String idempotencyKey) {
        redisTemplate.delete(buildKey(idempotencyKey));
        log.debug("Released idempotency key={}", idempotencyKey);
    }

    private String buildKey(String idempotencyKey) {
        return KEY_PREFIX + idempotencyKey;
    }
}
