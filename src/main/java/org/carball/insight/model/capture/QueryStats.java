package org.carball.insight.model.capture;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view over a snapshot of the capture store.
 */
@Value
@Builder
public class QueryStats {
    int totalQueries;
    int errorCount;
    double averageDurationMs;
    double minDurationMs;
    double maxDurationMs;
    double totalDurationMs;
    @Builder.Default
    Map<String, Integer> queriesPerRequest = Map.of();
    @Builder.Default
    List<N1Pattern> n1Patterns = List.of();
    @Builder.Default
    List<SplitQueryGroup> splitQueryGroups = List.of();
    @Builder.Default
    List<ConnectionSummary> connections = List.of();

    public static QueryStats empty() {
        return QueryStats.builder().build();
    }
}
