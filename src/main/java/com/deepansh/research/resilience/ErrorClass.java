package com.deepansh.research.resilience;

public enum ErrorClass {
    /** Worth retrying: timeouts, rate limits, upstream 5xx, dropped connections. */
    TRANSIENT,
    /** Retrying cannot help: bad input, auth failures, programming errors. */
    PERMANENT
}
