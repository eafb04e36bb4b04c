package org.carball.insight.capture;

import lombok.Builder;
import lombok.Value;
import org.carball.insight.analyzer.PatternDetector;
import org.carball.insight.model.capture.N1Pattern;
import org.carball.insight.model.capture.QueryEvent;
import org.carball.insight.model.capture.SplitQueryGroup;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Criteria for listing captured queries. Unset criteria match everything.
 */
@Value
@Builder
public class QueryEventFilter {

    public static final QueryEventFilter NONE = QueryEventFilter.builder().build();

    Double minDurationMs;
    String requestId;
    String pathContains;
    boolean errorsOnly;
    boolean n1Only;
    boolean splitOnly;

    /**
     * Filters events, keeping their order. N+1 and split membership is computed over the
     * whole {@code events} list with the given detection settings.
     */
    public List<QueryEvent> apply(List<QueryEvent> events, int n1Threshold, int splitMaxGapMs) {
        Set<UUID> n1Ids = n1Only ? n1Members(events, n1Threshold) : Set.of();
        Set<UUID> splitIds = splitOnly ? splitMembers(events, splitMaxGapMs) : Set.of();
        String path = pathContains != null ? pathContains.toLowerCase(Locale.ROOT) : null;

        return events.stream()
                .filter(e -> minDurationMs == null || e.getDurationMs() >= minDurationMs)
                .filter(e -> requestId == null || requestId.equals(e.getRequestId()))
                .filter(e -> path == null || (e.getRequestPath() != null
                        && e.getRequestPath().toLowerCase(Locale.ROOT).contains(path)))
                .filter(e -> !errorsOnly || e.isError())
                .filter(e -> !n1Only || n1Ids.contains(e.getId()))
                .filter(e -> !splitOnly || splitIds.contains(e.getId()))
                .collect(Collectors.toList());
    }

    private static Set<UUID> n1Members(List<QueryEvent> events, int threshold) {
        Set<UUID> ids = new HashSet<>();
        for (N1Pattern pattern : PatternDetector.detectN1(events, threshold)) {
            ids.addAll(pattern.queryIds());
        }
        return ids;
    }

    private static Set<UUID> splitMembers(List<QueryEvent> events, int maxGapMs) {
        Set<UUID> ids = new HashSet<>();
        for (SplitQueryGroup group : PatternDetector.detectSplitQueries(events, maxGapMs)) {
            ids.addAll(group.queryIds());
        }
        return ids;
    }
}
