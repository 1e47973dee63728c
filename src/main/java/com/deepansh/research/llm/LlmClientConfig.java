package com.deepansh.research.llm;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the active LLM client based on the LLM_PROVIDER env var.
 * The raw client is wrapped by {@link com.deepansh.research.resilience.ResilientLlmClient}.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:groq}")
    private String provider;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url}") private String openAiBaseUrl;
    @Value("${openai.model}")    private String openAiModel;
    @Value("${openai.max-tokens}") private int openAiMaxTokens;
    @Value("${openai.temperature}") private double openAiTemp;

    // Groq
    @Value("${groq.api-key:}") private String groqKey;
    @Value("${groq.base-url}") private String groqBaseUrl;
    @Value("${groq.model}")    private String groqModel;
    @Value("${groq.max-tokens}") private int groqMaxTokens;
    @Value("${groq.temperature}") private double groqTemp;

    // Gemini
    @Value("${gemini.api-key:}") private String geminiKey;
    @Value("${gemini.base-url}") private String geminiBaseUrl;
    @Value("${gemini.model}")    private String geminiModel;
    @Value("${gemini.max-tokens}") private int geminiMaxTokens;
    @Value("${gemini.temperature}") private double geminiTemp;

    @PostConstruct
    public void logActiveProvider() {
        LlmProviderSettings active = activeSettings();
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", active.name().toUpperCase());
        log.info("  Model               : {}", active.model());
        if (!active.hasApiKey()) {
            log.error("  {} API key not set! Set env var: {}_API_KEY", active.name().toUpperCase(),
                    active.name().toUpperCase());
        }
        log.info("================================================================");
    }

    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(RestClient.Builder restClientBuilder) {
        return new GenericLlmClient(activeSettings(), restClientBuilder.clone());
    }

    LlmProviderSettings activeSettings() {
        return switch (provider.toLowerCase()) {
            case "openai" -> new LlmProviderSettings("openai", openAiKey, openAiBaseUrl,
                    openAiModel, openAiMaxTokens, openAiTemp);
            case "gemini" -> new LlmProviderSettings("gemini", geminiKey, geminiBaseUrl,
                    geminiModel, geminiMaxTokens, geminiTemp);
            default -> new LlmProviderSettings("groq", groqKey, groqBaseUrl,
                    groqModel, groqMaxTokens, groqTemp);
        };
    }
}
