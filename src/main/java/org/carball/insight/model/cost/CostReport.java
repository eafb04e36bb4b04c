package org.carball.insight.model.cost;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class CostReport {
    Instant generatedAt;
    double timeWindowMinutes;
    int totalQueryCount;
    double totalQueryTimeMs;
    double totalTimeSavedPerMinMs;
    double totalTimeSpentPerMinMs;
    double potentialSavingsPercent;
    @Builder.Default
    List<CostRecommendation> recommendations = List.of();
}
