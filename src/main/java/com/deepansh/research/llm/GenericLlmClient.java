package com.deepansh.research.llm;

import com.deepansh.research.exception.ResearchException;
import com.deepansh.research.model.LlmResponse;
import com.deepansh.research.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat-completions client: works with Groq, OpenAI and Gemini.
 *
 * Error mapping, chosen so the envelope's classifier does the right thing:
 *
 * | Error                    | Thrown as                                   |
 * |--------------------------|---------------------------------------------|
 * | 401 invalid key          | ResearchException (permanent)               |
 * | 400 model_decommissioned | ResearchException with guidance (permanent) |
 * | 429 rate limit           | RuntimeException "rate limit" (transient)   |
 * | other 4xx                | ResearchException (permanent)               |
 * | 5xx                      | RuntimeException with status (transient)    |
 * | network error / timeout  | ResourceAccessException (transient)         |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderSettings settings;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderSettings settings, RestClient.Builder restClientBuilder) {
        this.settings = settings;
        this.restClient = restClientBuilder
                .baseUrl(settings.baseUrl())
                .defaultHeader("Authorization", "Bearer " + settings.apiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse chat(List<Message> messages, int maxTokens, double temperature) {
        if (!settings.hasApiKey()) {
            throw new ResearchException(settings.name() + " API key is not configured. Set "
                    + settings.name().toUpperCase() + "_API_KEY.");
        }

        Map<String, Object> requestBody = buildRequestBody(messages, maxTokens, temperature);

        log.debug("Sending {} messages to {} [model={}]", messages.size(), settings.name(), settings.model());

        Map<String, Object> response = restClient.post()
                .uri("/chat/completions")
                .body(requestBody)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 4xx [{}]: {}", settings.name(), res.getStatusCode(), body);
                    handle4xxError(body, res.getStatusCode().value());
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 5xx [{}]: {}", settings.name(), res.getStatusCode(), body);
                    throw new RuntimeException(
                            settings.name() + " server error [" + res.getStatusCode().value() + "]: " + body);
                })
                .body(new ParameterizedTypeReference<>() {});

        return parseResponse(response);
    }

    private void handle4xxError(String body, int statusCode) {
        if (body.contains("model_decommissioned")) {
            log.error("================================================================");
            log.error("  MODEL DECOMMISSIONED: {} is no longer served by {}.", settings.model(), settings.name());
            log.error("  Update the model in application.yml or via {}_MODEL.", settings.name().toUpperCase());
            log.error("================================================================");
            throw new ResearchException("Model '" + settings.model() + "' is decommissioned on " + settings.name());
        }

        if (statusCode == 401) {
            throw new ResearchException(settings.name() + " API key is invalid. Check your "
                    + settings.name().toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new RuntimeException(settings.name() + " rate limit exceeded (429)");
        }

        throw new ResearchException(settings.name() + " client error [" + statusCode + "]: " + body);
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, int maxTokens, double temperature) {
        List<Map<String, Object>> formattedMessages = messages.stream()
                .map(msg -> Map.<String, Object>of(
                        "role", msg.getRole().name(),
                        "content", msg.getContent() != null ? msg.getContent() : ""))
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", settings.model());
        body.put("max_tokens", maxTokens > 0 ? maxTokens : settings.maxTokens());
        body.put("temperature", temperature >= 0 ? temperature : settings.temperature());
        body.put("messages", formattedMessages);
        return body;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        if (response == null) {
            throw new ResearchException(settings.name() + " returned an empty body");
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new ResearchException(settings.name() + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        String content = message != null ? (String) message.get("content") : null;

        return LlmResponse.builder()
                .content(content)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }
}
