package org.carball.insight.model.history;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Long-horizon statistics for one statement pattern.
 */
@Value
@Builder
public class QueryPatternHistory {
    String patternHash;
    String normalizedSql;
    long executionCount;
    double avgDurationMs;
    double minDurationMs;
    double maxDurationMs;
    double p95DurationMs;
    double totalDurationMs;
    Instant firstSeen;
    Instant lastSeen;
    Double baselineAvgDurationMs;
    Instant baselineSetAt;
    @Builder.Default
    List<DurationSample> recentSamples = List.of();

    public boolean hasBaseline() {
        return baselineAvgDurationMs != null;
    }
}
