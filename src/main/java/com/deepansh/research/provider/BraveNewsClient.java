package com.deepansh.research.provider;

import com.deepansh.research.config.ProviderProperties;
import com.deepansh.research.exception.ResearchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * News search powered by the Brave Search news endpoint.
 *
 * - Free tier: 2,000 queries/month, https://api.search.brave.com/register
 * - Results limited to the past week (freshness=pw)
 *
 * A missing API key is a configuration error and throws ResearchException,
 * which the envelope does not retry.
 */
@Component
@Slf4j
public class BraveNewsClient implements NewsProvider {

    private final ProviderProperties.News.Brave brave;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public BraveNewsClient(RestClient.Builder restClientBuilder,
                           ProviderProperties providerProperties,
                           ObjectMapper objectMapper) {
        this.brave = providerProperties.getNews().getBrave();
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder.clone()
                .baseUrl(brave.getBaseUrl())
                .defaultHeader("Accept", "application/json")
                .build();
    }

    @Override
    public List<NewsArticle> search(String query) {
        String apiKey = brave.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new ResearchException("Brave Search API key not configured. Set BRAVE_API_KEY.");
        }
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("News query must not be blank");
        }

        String uri = UriComponentsBuilder.fromPath("/news/search")
                .queryParam("q", query)
                .queryParam("count", brave.getMaxResults())
                .queryParam("freshness", "pw")
                .queryParam("search_lang", "en")
                .build()
                .toUriString();

        log.info("News search: query='{}' count={}", query, brave.getMaxResults());

        String responseBody = restClient.get()
                .uri(uri)
                .header("X-Subscription-Token", apiKey)
                .retrieve()
                .body(String.class);

        return parseResults(responseBody);
    }

    List<NewsArticle> parseResults(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) return List.of();
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new ResearchException("Malformed Brave news response", e);
        }

        JsonNode results = root.path("results");
        if (!results.isArray() || results.isEmpty()) {
            return List.of();
        }

        List<NewsArticle> articles = new ArrayList<>();
        for (JsonNode result : results) {
            articles.add(new NewsArticle(
                    result.path("title").asText("No title"),
                    result.path("url").asText(""),
                    result.path("description").asText(""),
                    result.path("age").asText("")));
        }
        return articles;
    }
}
