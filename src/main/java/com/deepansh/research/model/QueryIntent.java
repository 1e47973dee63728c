package com.deepansh.research.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Closed set of query intents the classifier may assign.
 * Unknown wire values collapse to GENERAL_RESEARCH.
 */
public enum QueryIntent {

    PRICE_QUERY("price_query"),
    FUNDAMENTAL_ANALYSIS("fundamental_analysis"),
    SENTIMENT_ANALYSIS("sentiment_analysis"),
    GENERAL_RESEARCH("general_research"),
    COMPARISON("comparison");

    private final String wireName;

    QueryIntent(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static QueryIntent fromWire(String value) {
        if (value == null) return GENERAL_RESEARCH;
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(i -> i.wireName.equals(normalized))
                .findFirst()
                .orElse(GENERAL_RESEARCH);
    }
}
