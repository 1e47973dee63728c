package com.deepansh.research.resilience;

import com.deepansh.research.exception.ResearchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;

import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * Decides whether a failure is worth retrying.
 *
 * Rules, in order:
 * 1. Known permanent exception types are PERMANENT regardless of message.
 * 2. TRANSIENT if the type name or message of the error, or of any cause,
 *    contains a transient marker (timeout, rate limit, 429, 5xx gateway codes,
 *    connection, temporary, unavailable).
 * 3. Anything else is PERMANENT, so unknown failures are not retried.
 *
 * Pure function of the throwable.
 */
@Component
public class ErrorClassifier {

    private static final List<Class<? extends Throwable>> PERMANENT_TYPES = List.of(
            IllegalArgumentException.class,
            ClassCastException.class,
            NullPointerException.class,
            NoSuchElementException.class,
            UnsupportedOperationException.class,
            SecurityException.class,
            JsonProcessingException.class,
            HttpClientErrorException.Unauthorized.class,
            HttpClientErrorException.Forbidden.class,
            ResearchException.class
    );

    private static final List<String> TRANSIENT_MARKERS = List.of(
            "timeout", "timed out", "rate limit", "429", "502", "503", "504",
            "connection", "temporar", "unavailable"
    );

    private static final int MAX_CAUSE_DEPTH = 10;

    public ErrorClass classify(Throwable error) {
        if (error == null) return ErrorClass.PERMANENT;

        for (Class<? extends Throwable> type : PERMANENT_TYPES) {
            if (type.isInstance(error)) return ErrorClass.PERMANENT;
        }

        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (hasTransientMarker(describe(current))) return ErrorClass.TRANSIENT;
            if (current.getCause() == current) break;
            current = current.getCause();
        }
        return ErrorClass.PERMANENT;
    }

    public boolean isTransient(Throwable error) {
        return classify(error) == ErrorClass.TRANSIENT;
    }

    private String describe(Throwable t) {
        String message = t.getMessage() == null ? "" : t.getMessage();
        return (t.getClass().getSimpleName() + ": " + message).toLowerCase(Locale.ROOT);
    }

    private boolean hasTransientMarker(String text) {
        return TRANSIENT_MARKERS.stream().anyMatch(text::contains);
    }
}
