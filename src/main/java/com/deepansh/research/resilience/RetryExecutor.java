package com.deepansh.research.resilience;

import com.deepansh.research.config.WorkflowProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Shared retry policy for node invocations and per-ticker provider calls.
 *
 * Built on a resilience4j {@link RetryRegistry}: one named Retry per caller
 * (node name, or "market_data:AAPL" style keys), exponential backoff with
 * multiplier 2, and retries only for failures the {@link ErrorClassifier}
 * marks TRANSIENT. The n-th retry waits {@code baseDelay * 2^(n-1)}.
 *
 * Retry instances are stateless between calls, so one instance per name is
 * safe to share across concurrent runs.
 */
@Component
@Slf4j
public class RetryExecutor {

    private final RetryRegistry registry;
    private final int maxAttempts;

    @Autowired
    public RetryExecutor(ErrorClassifier classifier, WorkflowProperties properties) {
        this(classifier, properties.getMaxAttempts(), properties.getBaseDelay());
    }

    public RetryExecutor(ErrorClassifier classifier, int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(baseDelay, 2.0))
                .retryOnException(classifier::isTransient)
                .build();

        this.registry = RetryRegistry.of(config);
        this.registry.getEventPublisher().onEntryAdded(event ->
                event.getAddedEntry().getEventPublisher().onRetry(retry ->
                        log.warn("Transient failure in [{}], retry {} of {} in {}ms: {}",
                                retry.getName(),
                                retry.getNumberOfRetryAttempts(),
                                maxAttempts - 1,
                                retry.getWaitInterval().toMillis(),
                                retry.getLastThrowable() != null ? retry.getLastThrowable().getMessage() : "")));
    }

    /**
     * Runs the call under the named retry policy.
     * Rethrows the last failure once attempts are exhausted or the failure is permanent.
     */
    public <T> T call(String name, Callable<T> callable) throws Exception {
        Retry retry = retry(name);
        try {
            return retry.executeCheckedSupplier(callable::call);
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException("Unexpected throwable from " + name, t);
        }
    }

    public Retry retry(String name) {
        return registry.retry(name);
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
