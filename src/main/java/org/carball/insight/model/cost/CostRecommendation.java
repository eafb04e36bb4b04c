package org.carball.insight.model.cost;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * A fix for one statement pattern, ranked by how much query time it would save per minute.
 */
@Value
@Builder
public class CostRecommendation {
    String issueType;
    String patternHash;
    String normalizedSql;
    String description;
    int executionCount;
    double executionsPerMinute;
    double avgDurationMs;
    double totalDurationMs;
    double estimatedSavingsPercent;
    double estimatedTimeSavedPerMinMs;
    String requestPath;
    String suggestedFix;
    RecommendationSeverity severity;
    @Builder.Default
    List<UUID> affectedQueryIds = List.of();
    String table;
    String column;
}
