package com.deepansh.research.model;

import java.util.Map;

public record RetrievedDocument(
        String text,
        String source,
        String ticker,
        double similarity,
        Map<String, Object> metadata
) {
}
