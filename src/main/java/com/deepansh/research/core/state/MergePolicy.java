package com.deepansh.research.core.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * How an incoming value for a field combines with the value already present.
 *
 * APPEND and UNION fields start at their identity (empty list, empty map),
 * so merging an update into a fresh state never sees null on the left.
 */
public enum MergePolicy {

    /** Set once at run creation; a different value later is a programming error. */
    IMMUTABLE {
        @Override
        Object combine(StateField field, Object current, Object incoming) {
            if (current != null && !Objects.equals(current, incoming)) {
                throw new IllegalStateException(
                        "Field " + field + " is immutable [current=" + current + ", incoming=" + incoming + "]");
            }
            return incoming;
        }
    },

    /** Last writer wins for the whole field. */
    OVERWRITE {
        @Override
        Object combine(StateField field, Object current, Object incoming) {
            return incoming;
        }
    },

    /** List concatenation, existing elements first. */
    APPEND {
        @Override
        Object combine(StateField field, Object current, Object incoming) {
            Collection<?> left = current == null ? List.of() : (Collection<?>) current;
            Collection<?> right = (Collection<?>) incoming;
            if (right.isEmpty()) return List.copyOf(left);
            List<Object> merged = new ArrayList<>(left.size() + right.size());
            merged.addAll(left);
            merged.addAll(right);
            return List.copyOf(merged);
        }

        @Override
        public Object identity() {
            return List.of();
        }
    },

    /** Shallow map merge; on a key collision the incoming value wins for that key. */
    UNION {
        @Override
        Object combine(StateField field, Object current, Object incoming) {
            Map<?, ?> left = current == null ? Map.of() : (Map<?, ?>) current;
            Map<?, ?> right = (Map<?, ?>) incoming;
            Map<Object, Object> merged = new LinkedHashMap<>(left);
            merged.putAll(right);
            return Collections.unmodifiableMap(merged);
        }

        @Override
        public Object identity() {
            return Map.of();
        }
    };

    abstract Object combine(StateField field, Object current, Object incoming);

    /** The value a field holds before any update touches it. */
    public Object identity() {
        return null;
    }
}
