package org.carball.insight.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Slf4j
public class InsightOptions {

    // Capture store
    @Builder.Default
    private int maxStoredQueries = 1000;

    // Plan analysis
    @Builder.Default
    private boolean enableQueryPlanAnalysis = true;

    @Builder.Default
    private int queryPlanAnalysisThresholdMs = 100;

    @Builder.Default
    private int planTimeoutMs = 5000;

    @Builder.Default
    private int planCacheSize = 100;

    // Pattern history
    @Builder.Default
    private boolean enableQueryHistory = false;

    @Builder.Default
    private int historyRetentionDays = 7;

    private String historyStoragePath;

    // Pattern detection defaults, overridable per call
    @Builder.Default
    private int n1Threshold = 3;

    @Builder.Default
    private int splitQueryMaxGapMs = 50;

    public static InsightOptions defaults() {
        return InsightOptions.builder().build();
    }

    /**
     * Logs warnings for values that will not behave as the user probably expects.
     */
    public void validate() {
        if (maxStoredQueries <= 0) {
            log.warn("Max stored queries ({}) should be positive; the store needs room for at least one query",
                    maxStoredQueries);
        }

        if (queryPlanAnalysisThresholdMs <= 0 && enableQueryPlanAnalysis) {
            log.warn("Plan analysis threshold ({}ms) disables automatic plan capture; plans are only captured on request",
                    queryPlanAnalysisThresholdMs);
        }

        if (planTimeoutMs <= 0) {
            log.warn("Plan timeout ({}ms) should be positive", planTimeoutMs);
        }

        if (planCacheSize <= 0) {
            log.warn("Plan cache size ({}) should be positive", planCacheSize);
        }

        if (historyRetentionDays <= 0) {
            log.warn("History retention ({} days) should be positive", historyRetentionDays);
        }

        if (historyStoragePath != null && !enableQueryHistory) {
            log.warn("History storage path '{}' is set but query history is disabled", historyStoragePath);
        }

        if (n1Threshold < 2) {
            log.warn("N+1 threshold ({}) below 2 reports every query as a pattern", n1Threshold);
        }

        if (splitQueryMaxGapMs < 0) {
            log.warn("Split query max gap ({}ms) should not be negative", splitQueryMaxGapMs);
        }

        log.debug("Using options - Max stored: {}, Plans: {}, History: {}, N+1: {}, Split gap: {}ms",
                maxStoredQueries, enableQueryPlanAnalysis, enableQueryHistory, n1Threshold, splitQueryMaxGapMs);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Max stored: %d | Plans: %s (>= %dms) | History: %s (%d days%s) | N+1: %d | Split gap: %dms",
                maxStoredQueries,
                enableQueryPlanAnalysis ? "on" : "off", queryPlanAnalysisThresholdMs,
                enableQueryHistory ? "on" : "off", historyRetentionDays,
                historyStoragePath != null ? ", " + historyStoragePath : ", in memory",
                n1Threshold, splitQueryMaxGapMs);
    }
}
