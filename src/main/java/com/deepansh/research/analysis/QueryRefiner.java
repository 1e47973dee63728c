package com.deepansh.research.analysis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Rewrites a vague query into a self-contained research question, keeping
 * the user's language. Tickers found up front are passed as hints.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QueryRefiner {

    private static final String SYSTEM_PROMPT = """
            You rewrite investment research questions so they are specific and self-contained.
            Keep the user's language and every company or ticker they mention.
            Do not answer the question. Reply with the rewritten question only, on one line.""";

    private final LlmGateway llmGateway;

    public String refine(String query, List<String> tickers) {
        String prompt = "Question: " + query + "\nTickers mentioned: "
                + (tickers.isEmpty() ? "None" : String.join(", ", tickers));

        String refined = llmGateway.complete(SYSTEM_PROMPT, prompt, 150, 0.2)
                .lines()
                .findFirst()
                .orElse("")
                .replaceAll("^\"|\"$", "")
                .trim();

        log.debug("Refined query: '{}' -> '{}'", query, refined);
        return refined;
    }
}
