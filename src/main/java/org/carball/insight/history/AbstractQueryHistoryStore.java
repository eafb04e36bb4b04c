package org.carball.insight.history;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.model.history.QueryPatternHistory;
import org.carball.insight.model.history.QueryRegression;
import org.carball.insight.model.history.RegressionSeverity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Shared aggregation logic. Updates go through {@link ConcurrentHashMap#compute} so concurrent
 * recordings of the same pattern never lose a sample.
 */
@Slf4j
public abstract class AbstractQueryHistoryStore implements QueryHistoryStore {

    public static final int MAX_SAMPLES_PER_PATTERN = 100;
    public static final int RECENT_SAMPLE_COUNT = 20;

    protected final Clock clock;
    protected final Map<String, PatternRecord> patterns = new ConcurrentHashMap<>();

    protected AbstractQueryHistoryStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Called after every change to the tracked patterns.
     */
    protected void markDirty() {
    }

    @Override
    public void recordExecution(String patternHash, String normalizedSql, double durationMs) {
        if (patternHash == null) {
            return;
        }
        Instant now = clock.instant();
        patterns.compute(patternHash, (hash, existing) -> existing == null
                ? PatternRecord.first(hash, normalizedSql, durationMs, now)
                : existing.withExecution(durationMs, now, MAX_SAMPLES_PER_PATTERN));
        markDirty();
    }

    @Override
    public List<QueryPatternHistory> getPatterns() {
        return patterns.values().stream()
                .map(r -> r.toHistory(RECENT_SAMPLE_COUNT))
                .sorted(Comparator.comparingDouble(QueryPatternHistory::getTotalDurationMs).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public Optional<QueryPatternHistory> getPattern(String patternHash) {
        return Optional.ofNullable(patterns.get(patternHash)).map(r -> r.toHistory(RECENT_SAMPLE_COUNT));
    }

    @Override
    public boolean setBaseline(String patternHash) {
        Instant now = clock.instant();
        PatternRecord updated = patterns.computeIfPresent(patternHash, (hash, existing) -> existing.withBaseline(now));
        if (updated == null) {
            log.debug("No history for pattern {}, baseline not set", patternHash);
            return false;
        }
        log.info("Baseline for pattern {} set to {} ms", patternHash, String.format("%.2f", updated.baselineAvgDurationMs()));
        markDirty();
        return true;
    }

    @Override
    public List<QueryRegression> getRegressions(double thresholdPercent) {
        List<QueryRegression> regressions = new ArrayList<>();

        for (PatternRecord record : patterns.values()) {
            Double baseline = record.baselineAvgDurationMs();
            if (baseline == null || baseline <= 0) {
                continue;
            }

            double currentAvg = record.averageDurationMs();
            double percentChange = (currentAvg - baseline) / baseline * 100;
            if (percentChange >= thresholdPercent) {
                regressions.add(new QueryRegression(record.toHistory(RECENT_SAMPLE_COUNT), percentChange,
                        currentAvg - baseline, RegressionSeverity.fromPercentChange(percentChange)));
            }
        }

        regressions.sort(Comparator.comparingDouble(QueryRegression::percentChange).reversed());
        return regressions;
    }

    @Override
    public int cleanup(int retentionDays) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        int removed = 0;
        for (Map.Entry<String, PatternRecord> entry : patterns.entrySet()) {
            if (entry.getValue().lastSeen().isBefore(cutoff) && patterns.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} pattern(s) not seen in the last {} day(s)", removed, retentionDays);
            markDirty();
        }
        return removed;
    }

    protected Collection<PatternRecord> snapshot() {
        return List.copyOf(patterns.values());
    }

    protected void restore(Collection<PatternRecord> records) {
        records.stream()
                .filter(r -> r.patternHash() != null)
                .forEach(r -> patterns.put(r.patternHash(), r));
    }
}
