package com.deepansh.research.core.state;

/**
 * Per-node execution telemetry recorded by the execution envelope.
 * errorType and transientError are only meaningful when success is false.
 */
public record NodeMetrics(long elapsedMs, int attempts, boolean success, String errorType, boolean transientError) {

    public static NodeMetrics succeeded(long elapsedMs, int attempts) {
        return new NodeMetrics(elapsedMs, attempts, true, null, false);
    }

    public static NodeMetrics failed(long elapsedMs, int attempts, String errorType, boolean transientError) {
        return new NodeMetrics(elapsedMs, attempts, false, errorType, transientError);
    }
}
