package com.deepansh.research.analysis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Final pass/fail check of a finished report against the user's question.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QualityReviewer {

    private static final String SYSTEM_PROMPT = """
            You review investment research reports before they are shown to a user.
            A report passes when it answers the question, stays consistent with itself
            and makes no claims without supporting data.
            Reply with exactly one word: PASS or FAIL.""";

    private final LlmGateway llmGateway;

    public boolean review(String query, String report) {
        String verdict = llmGateway.complete(SYSTEM_PROMPT,
                "Question: " + query + "\n\nReport:\n" + report, 5, 0.0);
        boolean passed = verdict.trim().toUpperCase().startsWith("PASS");
        log.info("Quality review verdict: {}", passed ? "PASS" : "FAIL");
        return passed;
    }
}
