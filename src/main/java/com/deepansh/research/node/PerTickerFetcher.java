package com.deepansh.research.node;

import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.resilience.RetryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one provider call per ticker, each under its own retry policy
 * ("market_data:MSFT"). A ticker that still fails is recorded in the
 * update (node_errors, errors, trace) and skipped; the others carry on.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PerTickerFetcher {

    private final RetryExecutor retryExecutor;

    @FunctionalInterface
    public interface TickerCall<T> {
        T fetch(String ticker) throws Exception;
    }

    /**
     * @param label   prefix of the per-ticker error key, usually the node name
     * @param failures receives the bookkeeping for failed tickers
     * @return successful results in ticker order
     * @throws InterruptedException when the run is cancelled mid-fetch
     */
    public <T> List<T> fetch(String label, List<String> tickers, TickerCall<T> call,
                             StateUpdate.Builder failures, ExecutionTrace trace) throws InterruptedException {
        List<T> results = new ArrayList<>();
        for (String ticker : tickers) {
            String key = label + ":" + ticker;
            try {
                T result = retryExecutor.call(key, () -> call.fetch(ticker));
                if (result != null) {
                    results.add(result);
                }
                trace.step(ticker + ": ok");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                String message = e.getMessage() == null || e.getMessage().isBlank()
                        ? e.getClass().getSimpleName() : e.getMessage();
                log.warn("[{}] failed for {}: {}", label, ticker, message);
                failures.nodeError(key, message)
                        .error(label + " error for " + ticker + ": " + message);
                trace.step(ticker + ": failed - " + message);
            }
        }
        return results;
    }
}
