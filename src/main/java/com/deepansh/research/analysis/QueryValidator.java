package com.deepansh.research.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides whether a query is an investment-research question at all.
 * A blank query is rejected without calling the LLM.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QueryValidator {

    private static final String SYSTEM_PROMPT = """
            You screen questions for an investment research assistant.
            Accept anything about stocks, companies, markets, valuation, earnings, sectors or investing.
            Reject greetings, gibberish and unrelated topics.
            Respond with JSON only: {"valid": true|false, "reason": "<one short sentence>"}""";

    private final LlmGateway llmGateway;

    public ValidationResult validate(String query) {
        if (query == null || query.isBlank()) {
            return ValidationResult.rejected("Query is empty");
        }

        JsonNode result = llmGateway.completeJson(SYSTEM_PROMPT, "Query: \"" + query + "\"", 120, 0.0);
        boolean valid = result.path("valid").asBoolean(true);
        String reason = result.path("reason").asText(valid ? "Investment query" : "Not an investment query");

        log.info("Query validation: valid={} reason='{}'", valid, reason);
        return valid ? ValidationResult.accepted(reason) : ValidationResult.rejected(reason);
    }
}
