package com.deepansh.research.analysis;

import com.deepansh.research.model.DispatchFlags;
import com.deepansh.research.model.QueryIntent;

public record IntentClassification(QueryIntent intent, DispatchFlags flags) {

    /** Used when the classifier is unavailable: broad research when tickers are known, context search otherwise. */
    public static IntentClassification fallback(boolean hasTickers) {
        return new IntentClassification(QueryIntent.GENERAL_RESEARCH,
                hasTickers ? DispatchFlags.all() : DispatchFlags.contextOnly());
    }
}
