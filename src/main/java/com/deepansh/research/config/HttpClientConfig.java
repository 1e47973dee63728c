package com.deepansh.research.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Shared pooled HttpClient behind every outbound RestClient
 * (LLM provider, Yahoo Finance, Brave, embeddings).
 *
 * Connect, socket and response timeouts are always set: a provider that
 * hangs surfaces as a timeout exception, which the envelope treats as
 * transient and retries.
 *
 * Consumers must call {@code clone()} on the injected builder before
 * setting a base URL or default headers.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient.Builder restClientBuilder(ProviderProperties providerProperties) {
        ProviderProperties.Http http = providerProperties.getHttp();

        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(http.getConnectTimeoutMs()))
                .setSocketTimeout(Timeout.ofMilliseconds(http.getReadTimeoutMs()))
                .build();

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(connectionConfig)
                .setMaxConnTotal(64)
                .setMaxConnPerRoute(16)
                .build();

        RequestConfig requestConfig = RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(http.getReadTimeoutMs()))
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .evictIdleConnections(TimeValue.ofSeconds(30))
                .build();

        log.info("HttpClient configured [connectTimeout={}ms, readTimeout={}ms]",
                http.getConnectTimeoutMs(), http.getReadTimeoutMs());
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
