package com.deepansh.research.provider;

import com.deepansh.research.config.ProviderProperties;
import com.deepansh.research.exception.ResearchException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BraveNewsClientTest {

    private BraveNewsClient client;

    @BeforeEach
    void setUp() {
        client = new BraveNewsClient(RestClient.builder(), new ProviderProperties(), new ObjectMapper());
    }

    @Test
    void search_withoutApiKey_throwsConfigurationError() {
        assertThatThrownBy(() -> client.search("AAPL stock news"))
                .isInstanceOf(ResearchException.class)
                .hasMessageContaining("API key");
    }

    @Test
    void parseResults_mapsFieldsWithDefaults() {
        List<NewsArticle> articles = client.parseResults("""
                {"results": [
                  {"title": "Apple beats estimates", "url": "https://example.com/a",
                   "description": "Record services revenue", "age": "2 hours ago"},
                  {"url": "https://example.com/b"}
                ]}""");

        assertThat(articles).hasSize(2);
        assertThat(articles.get(0).title()).isEqualTo("Apple beats estimates");
        assertThat(articles.get(0).age()).isEqualTo("2 hours ago");
        assertThat(articles.get(1).title()).isEqualTo("No title");
        assertThat(articles.get(1).description()).isEmpty();
    }

    @Test
    void parseResults_noResults_isEmpty() {
        assertThat(client.parseResults("{\"type\": \"news\"}")).isEmpty();
        assertThat(client.parseResults("")).isEmpty();
    }

    @Test
    void parseResults_malformed_throws() {
        assertThatThrownBy(() -> client.parseResults("{not json"))
                .isInstanceOf(ResearchException.class);
    }
}
