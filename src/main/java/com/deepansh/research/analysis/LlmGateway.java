package com.deepansh.research.analysis;

import com.deepansh.research.exception.ResearchException;
import com.deepansh.research.llm.LlmClient;
import com.deepansh.research.model.LlmResponse;
import com.deepansh.research.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Thin prompt helper over the (circuit-broken) {@link LlmClient}: one system
 * prompt, one user prompt, text or JSON back.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LlmGateway {

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;

    public String complete(String systemPrompt, String userPrompt, int maxTokens, double temperature) {
        LlmResponse response = llmClient.chat(
                List.of(Message.system(systemPrompt), Message.user(userPrompt)), maxTokens, temperature);

        String content = response.getContent();
        if (content == null || content.isBlank()) {
            throw new ResearchException("LLM returned an empty completion");
        }
        log.debug("LLM completion [tokens={}]", response.totalTokens());
        return content.trim();
    }

    /**
     * Same as {@link #complete} but parses the reply as a JSON object.
     * Markdown code fences around the object are tolerated.
     */
    public JsonNode completeJson(String systemPrompt, String userPrompt, int maxTokens, double temperature) {
        String content = stripFences(complete(systemPrompt, userPrompt, maxTokens, temperature));
        try {
            JsonNode node = objectMapper.readTree(content);
            if (node == null || !node.isObject()) {
                throw new ResearchException("LLM reply is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ResearchException("LLM reply is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static String stripFences(String content) {
        String text = content.trim();
        if (!text.startsWith("```")) return text;
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text.replace("```", "").trim();
        }
        return text.substring(firstNewline + 1, closing).trim();
    }
}
