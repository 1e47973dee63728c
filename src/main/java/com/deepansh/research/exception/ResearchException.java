package com.deepansh.research.exception;

/**
 * Non-retryable collaborator failure: bad credentials, malformed provider
 * response, configuration errors. Ignored by the LLM circuit breaker.
 */
public class ResearchException extends RuntimeException {

    public ResearchException(String message) {
        super(message);
    }

    public ResearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
