package com.deepansh.research.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Strongly-typed configuration for the specialist data providers.
 * Bound from application.yml under the "providers" prefix.
 */
@Component
@ConfigurationProperties(prefix = "providers")
@Data
public class ProviderProperties {

    private Http http = new Http();
    private Yahoo yahoo = new Yahoo();
    private News news = new News();
    private Retrieval retrieval = new Retrieval();

    @Data
    public static class Http {
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 15000;
    }

    @Data
    public static class Yahoo {
        private String quoteBaseUrl = "https://query2.finance.yahoo.com";
        private String chartBaseUrl = "https://query1.finance.yahoo.com";
        private long quoteCacheTtlMinutes = 5;
        private String historyRange = "1y";
    }

    @Data
    public static class News {
        private Brave brave = new Brave();

        @Data
        public static class Brave {
            private String apiKey = "";
            private String baseUrl = "https://api.search.brave.com/res/v1";
            private int maxResults = 8;
        }
    }

    @Data
    public static class Retrieval {
        private int topK = 5;
        private double similarityThreshold = 0.75;
    }
}
