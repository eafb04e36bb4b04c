package org.carball.insight.history;

import org.carball.insight.model.history.DurationSample;
import org.carball.insight.model.history.QueryPatternHistory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored state of one pattern. Immutable; every update produces a new record.
 * This is also the persisted form inside {@code history.json}.
 */
public record PatternRecord(
        String patternHash,
        String normalizedSql,
        long executionCount,
        double totalDurationMs,
        double minDurationMs,
        double maxDurationMs,
        Instant firstSeen,
        Instant lastSeen,
        Double baselineAvgDurationMs,
        Instant baselineSetAt,
        List<DurationSample> samples
) {

    public PatternRecord {
        samples = samples == null ? List.of() : List.copyOf(samples);
    }

    static PatternRecord first(String patternHash, String normalizedSql, double durationMs, Instant now) {
        return new PatternRecord(patternHash, normalizedSql, 1, durationMs, durationMs, durationMs,
                now, now, null, null, List.of(new DurationSample(now, durationMs)));
    }

    PatternRecord withExecution(double durationMs, Instant now, int maxSamples) {
        List<DurationSample> updated = new ArrayList<>(samples);
        updated.add(new DurationSample(now, durationMs));
        if (updated.size() > maxSamples) {
            updated = updated.subList(updated.size() - maxSamples, updated.size());
        }
        return new PatternRecord(patternHash, normalizedSql, executionCount + 1,
                totalDurationMs + durationMs,
                Math.min(minDurationMs, durationMs),
                Math.max(maxDurationMs, durationMs),
                firstSeen, now, baselineAvgDurationMs, baselineSetAt, updated);
    }

    PatternRecord withBaseline(Instant now) {
        return new PatternRecord(patternHash, normalizedSql, executionCount, totalDurationMs,
                minDurationMs, maxDurationMs, firstSeen, lastSeen, averageDurationMs(), now, samples);
    }

    double averageDurationMs() {
        return executionCount > 0 ? totalDurationMs / executionCount : 0;
    }

    /**
     * Duration at the 95th percentile position of the sample window, clamped to the last sample.
     */
    double p95DurationMs() {
        if (samples.isEmpty()) {
            return 0;
        }
        double[] sorted = samples.stream().mapToDouble(DurationSample::durationMs).sorted().toArray();
        int index = (int) (sorted.length * 0.95);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    QueryPatternHistory toHistory(int recentSampleCount) {
        int from = Math.max(0, samples.size() - recentSampleCount);
        return QueryPatternHistory.builder()
                .patternHash(patternHash)
                .normalizedSql(normalizedSql)
                .executionCount(executionCount)
                .avgDurationMs(averageDurationMs())
                .minDurationMs(minDurationMs)
                .maxDurationMs(maxDurationMs)
                .p95DurationMs(p95DurationMs())
                .totalDurationMs(totalDurationMs)
                .firstSeen(firstSeen)
                .lastSeen(lastSeen)
                .baselineAvgDurationMs(baselineAvgDurationMs)
                .baselineSetAt(baselineSetAt)
                .recentSamples(List.copyOf(samples.subList(from, samples.size())))
                .build();
    }
}
