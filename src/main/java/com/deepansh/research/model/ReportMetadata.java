package com.deepansh.research.model;

import lombok.Builder;

import java.util.List;
import java.util.Map;

@Builder
public record ReportMetadata(
        List<String> executedNodes,
        Map<String, Boolean> dataSources,
        QueryIntent intent,
        List<String> tickers,
        String reportTemplate,
        int reflectionIterations,
        double finalScore
) {
}
