package com.deepansh.research.retrieval;

import com.deepansh.research.exception.ResearchException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Text embeddings via OpenAI's embeddings API (text-embedding-3-small, 1536 dims).
 *
 * Embeddings are deterministic per text, so they are cached in Redis:
 * key research:embed:{sha256(text)}, TTL 7 days. Cache failures fall
 * through to the API.
 */
@Service
@Slf4j
public class EmbeddingService {

    private static final String EMBEDDING_MODEL = "text-embedding-3-small";
    private static final String CACHE_PREFIX = "research:embed:";
    private static final Duration CACHE_TTL = Duration.ofDays(7);

    private final RestClient restClient;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public EmbeddingService(
            @Value("${openai.base-url}") String baseUrl,
            @Value("${openai.api-key:}") String apiKey,
            RestClient.Builder restClientBuilder,
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder.clone()
                .baseUrl(baseUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    public float[] embed(String text) {
        String cacheKey = CACHE_PREFIX + sha256(text);

        String cached = readCache(cacheKey);
        if (cached != null) {
            try {
                return objectMapper.readValue(cached, float[].class);
            } catch (Exception e) {
                log.warn("Failed to deserialize cached embedding, re-fetching");
            }
        }

        float[] embedding = fetchEmbedding(text);

        try {
            redisTemplate.opsForValue().set(cacheKey, objectMapper.writeValueAsString(embedding), CACHE_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache embedding: {}", e.getMessage());
        }
        return embedding;
    }

    private String readCache(String key) {
        try {
            return redisTemplate.opsForValue().get(key);
        } catch (Exception e) {
            log.warn("Embedding cache unavailable: {}", e.getMessage());
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    private float[] fetchEmbedding(String text) {
        log.debug("Fetching embedding for text length={}", text.length());

        Map<String, Object> response = restClient.post()
                .uri("/embeddings")
                .body(Map.of("model", EMBEDDING_MODEL, "input", text))
                .retrieve()
                .body(new ParameterizedTypeReference<>() {});

        if (response == null || !(response.get("data") instanceof List<?> data) || data.isEmpty()) {
            throw new ResearchException("Embedding response contained no data");
        }
        List<Number> rawEmbedding = (List<Number>) ((Map<String, Object>) data.get(0)).get("embedding");

        float[] result = new float[rawEmbedding.size()];
        for (int i = 0; i < rawEmbedding.size(); i++) {
            result[i] = rawEmbedding.get(i).floatValue();
        }
        return result;
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
