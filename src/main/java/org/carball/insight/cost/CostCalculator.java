package org.carball.insight.cost;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.analyzer.PatternDetector;
import org.carball.insight.analyzer.QueryAnalyzer;
import org.carball.insight.capture.QueryStore;
import org.carball.insight.model.capture.N1Pattern;
import org.carball.insight.model.capture.QueryEvent;
import org.carball.insight.model.cost.CostRecommendation;
import org.carball.insight.model.cost.CostReport;
import org.carball.insight.model.cost.RecommendationSeverity;
import org.carball.insight.model.suggestion.QuerySuggestion;
import org.carball.insight.model.suggestion.SuggestionType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ranks fixes by estimated query time saved per minute of observed traffic.
 */
@Slf4j
public class CostCalculator {

    static final double HIGH_SAVINGS_MS_PER_MIN = 1000;
    static final double MEDIUM_SAVINGS_MS_PER_MIN = 100;

    private static final String N_PLUS_ONE_FIX =
            "Load the related rows in one query (join fetch or entity graph) or batch the lookups with an IN list";

    private final SavingsEstimates savings;
    private final QueryAnalyzer analyzer;
    private final Clock clock;

    public CostCalculator() {
        this(SavingsEstimates.defaults(), new QueryAnalyzer(), Clock.systemUTC());
    }

    public CostCalculator(SavingsEstimates savings, QueryAnalyzer analyzer, Clock clock) {
        this.savings = savings;
        this.analyzer = analyzer;
        this.clock = clock;
    }

    public CostReport calculate(QueryStore store) {
        List<QueryEvent> events = store.getAll();
        return calculate(events, PatternDetector.detectN1(events, store.getN1Threshold()));
    }

    public CostReport calculate(List<QueryEvent> events, List<N1Pattern> n1Patterns) {
        double windowMinutes = timeWindowMinutes(events);
        List<CostRecommendation> recommendations = new ArrayList<>();

        for (N1Pattern pattern : n1Patterns) {
            double perMinute = pattern.queryIds().size() / windowMinutes;
            double savingsFraction = savings.get(SavingsEstimates.N_PLUS_ONE);
            double savedPerMinute = perMinute * pattern.averageDurationMs() * savingsFraction;

            recommendations.add(CostRecommendation.builder()
                    .issueType(SavingsEstimates.N_PLUS_ONE)
                    .patternHash(pattern.patternHash())
                    .normalizedSql(pattern.normalizedSql())
                    .description(String.format("N+1 query pattern detected with %d executions", pattern.count()))
                    .executionCount(pattern.count())
                    .executionsPerMinute(perMinute)
                    .avgDurationMs(pattern.averageDurationMs())
                    .totalDurationMs(pattern.totalDurationMs())
                    .estimatedSavingsPercent(savingsFraction * 100)
                    .estimatedTimeSavedPerMinMs(savedPerMinute)
                    .requestPath(pattern.requestPath())
                    .suggestedFix(N_PLUS_ONE_FIX)
                    .severity(severityFor(savedPerMinute))
                    .affectedQueryIds(List.copyOf(pattern.queryIds()))
                    .build());
        }

        Set<String> coveredHashes = n1Patterns.stream()
                .map(N1Pattern::patternHash)
                .collect(Collectors.toSet());
        Map<String, List<QueryEvent>> byPattern = events.stream()
                .collect(Collectors.groupingBy(QueryEvent::getPatternHash, LinkedHashMap::new, Collectors.toList()));

        for (Map.Entry<String, List<QueryEvent>> group : byPattern.entrySet()) {
            if (coveredHashes.contains(group.getKey())) {
                continue;
            }
            recommendations.addAll(recommendationsFor(group.getValue(), windowMinutes));
        }

        recommendations.sort(Comparator.comparingDouble(CostRecommendation::getEstimatedTimeSavedPerMinMs).reversed());

        double totalQueryTime = events.stream().mapToDouble(QueryEvent::getDurationMs).sum();
        double totalSavedPerMinute = recommendations.stream()
                .mapToDouble(CostRecommendation::getEstimatedTimeSavedPerMinMs)
                .sum();
        double totalSpentPerMinute = totalQueryTime / windowMinutes;

        log.debug("Cost report: {} recommendation(s) over {} queries in {} minute window",
                recommendations.size(), events.size(), windowMinutes);

        return CostReport.builder()
                .generatedAt(Instant.now(clock))
                .timeWindowMinutes(windowMinutes)
                .totalQueryCount(events.size())
                .totalQueryTimeMs(totalQueryTime)
                .totalTimeSavedPerMinMs(totalSavedPerMinute)
                .totalTimeSpentPerMinMs(totalSpentPerMinute)
                .potentialSavingsPercent(totalSpentPerMinute > 0 ? totalSavedPerMinute / totalSpentPerMinute * 100 : 0)
                .recommendations(recommendations)
                .build();
    }

    private List<CostRecommendation> recommendationsFor(List<QueryEvent> group, double windowMinutes) {
        QueryEvent representative = group.get(0);
        List<QuerySuggestion> suggestions = analyzer.analyze(representative);
        if (suggestions.isEmpty()) {
            return List.of();
        }

        double perMinute = group.size() / windowMinutes;
        double totalDuration = group.stream().mapToDouble(QueryEvent::getDurationMs).sum();
        double avgDuration = totalDuration / group.size();
        List<CostRecommendation> result = new ArrayList<>();

        for (QuerySuggestion suggestion : suggestions) {
            // Read-only hints carry no measurable saving
            if (suggestion.getType() == SuggestionType.NO_TRACKING) {
                continue;
            }

            String issueType = suggestion.getType().name();
            double savingsFraction = savings.get(issueType);
            double savedPerMinute = perMinute * avgDuration * savingsFraction;

            result.add(CostRecommendation.builder()
                    .issueType(issueType)
                    .patternHash(representative.getPatternHash())
                    .normalizedSql(representative.getNormalizedSql())
                    .description(suggestion.getMessage())
                    .executionCount(group.size())
                    .executionsPerMinute(perMinute)
                    .avgDurationMs(avgDuration)
                    .totalDurationMs(totalDuration)
                    .estimatedSavingsPercent(savingsFraction * 100)
                    .estimatedTimeSavedPerMinMs(savedPerMinute)
                    .requestPath(representative.getRequestPath())
                    .suggestedFix(suggestion.getSuggestedFix() != null ? suggestion.getSuggestedFix() : "")
                    .severity(severityFor(savedPerMinute))
                    .affectedQueryIds(group.stream().map(QueryEvent::getId).collect(Collectors.toList()))
                    .table(suggestion.getTable())
                    .column(suggestion.getColumn())
                    .build());
        }
        return result;
    }

    static RecommendationSeverity severityFor(double savedPerMinute) {
        if (savedPerMinute > HIGH_SAVINGS_MS_PER_MIN) {
            return RecommendationSeverity.HIGH;
        }
        return savedPerMinute > MEDIUM_SAVINGS_MS_PER_MIN ? RecommendationSeverity.MEDIUM : RecommendationSeverity.LOW;
    }

    /**
     * Span between the oldest and newest event in minutes, never less than one.
     */
    static double timeWindowMinutes(List<QueryEvent> events) {
        if (events.size() < 2) {
            return 1;
        }
        Instant oldest = events.stream().map(QueryEvent::getTimestamp).min(Comparator.naturalOrder()).orElseThrow();
        Instant newest = events.stream().map(QueryEvent::getTimestamp).max(Comparator.naturalOrder()).orElseThrow();
        double minutes = Duration.between(oldest, newest).toMillis() / 60_000.0;
        return Math.max(minutes, 1);
    }
}
