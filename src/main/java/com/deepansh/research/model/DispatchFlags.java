package com.deepansh.research.model;

/**
 * Which specialist families the classifier asked for.
 */
public record DispatchFlags(boolean marketData, boolean sentiment, boolean context) {

    public static DispatchFlags none() {
        return new DispatchFlags(false, false, false);
    }

    public static DispatchFlags all() {
        return new DispatchFlags(true, true, true);
    }

    public static DispatchFlags contextOnly() {
        return new DispatchFlags(false, false, true);
    }
}
