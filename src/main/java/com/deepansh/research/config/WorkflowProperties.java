package com.deepansh.research.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tuning for the research workflow engine.
 * Bound from application.yml under the "research.workflow" prefix.
 */
@Component
@ConfigurationProperties(prefix = "research.workflow")
@Data
public class WorkflowProperties {

    /** Total attempts per node invocation, first try included. */
    private int maxAttempts = 3;

    /** Wait before the first retry; doubled for each retry after that. */
    private Duration baseDelay = Duration.ofSeconds(1);

    /** Wall-clock budget for one run, branches included. */
    private Duration runTimeout = Duration.ofSeconds(120);

    /** How many past messages the memory loader pulls in. */
    private int historyLimit = 10;

    private Report report = new Report();

    @Data
    public static class Report {
        private int maxIterations = 3;
        private double qualityThreshold = 0.85;
    }
}
