package com.deepansh.research.llm;

/**
 * Connection settings for one OpenAI-compatible provider (openai, groq, gemini).
 */
public record LlmProviderSettings(
        String name,
        String apiKey,
        String baseUrl,
        String model,
        int maxTokens,
        double temperature
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
