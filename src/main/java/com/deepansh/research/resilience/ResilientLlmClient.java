package com.deepansh.research.resilience;

import com.deepansh.research.llm.LlmClient;
import com.deepansh.research.model.LlmResponse;
import com.deepansh.research.model.Message;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the active provider client that adds a circuit breaker.
 *
 * Retries are not done here: the node envelope already retries transient
 * failures, and stacking a second retry layer would multiply attempts.
 * There is no fallback either. When the circuit is open the call fails with
 * CallNotPermittedException, which the classifier treats as permanent, so
 * nodes stop hammering a provider that is down.
 *
 * Circuit breaker config (application.yml, instance "llmClient"):
 * - opens at 50% failures over a sliding window of 10 calls
 * - waits 30s before half-open probes
 * - ResearchException (bad key, bad request) does not count as a failure
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @CircuitBreaker(name = "llmClient")
    public LlmResponse chat(List<Message> messages, int maxTokens, double temperature) {
        return delegate.chat(messages, maxTokens, temperature);
    }

    // Overridden so the advice also applies here; the interface default would self-invoke past the proxy.
    @Override
    @CircuitBreaker(name = "llmClient")
    public LlmResponse chat(List<Message> messages) {
        return delegate.chat(messages);
    }
}
