package com.deepansh.research.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchResponse {

    private String runId;
    private String sessionId;
    private String query;
    private String report;

    @Builder.Default
    private List<String> tickers = new ArrayList<>();

    @Builder.Default
    private List<String> executedNodes = new ArrayList<>();

    @Builder.Default
    private Map<String, String> nodeErrors = new HashMap<>();

    private QueryIntent intent;
    private DispatchFlags routingFlags;

    private boolean marketDataAvailable;
    private boolean sentimentAvailable;
    private boolean analystConsensusAvailable;
    private int contextRetrieved;

    @Builder.Default
    private List<VisualizationData> visualizationData = new ArrayList<>();

    private InvestorSnapshot snapshot;
    private ReportMetadata reportMetadata;
    private Boolean qualityPassed;
    private Instant timestamp;
}
