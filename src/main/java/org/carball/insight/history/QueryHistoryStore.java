package org.carball.insight.history;

import org.carball.insight.model.history.QueryPatternHistory;
import org.carball.insight.model.history.QueryRegression;

import java.util.List;
import java.util.Optional;

/**
 * Aggregates executions per pattern hash across a longer horizon than the capture store.
 */
public interface QueryHistoryStore extends AutoCloseable {

    double DEFAULT_REGRESSION_THRESHOLD_PERCENT = 20;

    void recordExecution(String patternHash, String normalizedSql, double durationMs);

    /**
     * All tracked patterns, highest total duration first.
     */
    List<QueryPatternHistory> getPatterns();

    Optional<QueryPatternHistory> getPattern(String patternHash);

    /**
     * Snapshots the pattern's current average duration as its baseline.
     *
     * @return false when the pattern is unknown
     */
    boolean setBaseline(String patternHash);

    /**
     * Patterns whose average grew by at least {@code thresholdPercent} over their baseline,
     * largest change first.
     */
    List<QueryRegression> getRegressions(double thresholdPercent);

    /**
     * Drops patterns not seen within the retention window.
     *
     * @return number of patterns removed
     */
    int cleanup(int retentionDays);

    @Override
    void close();
}
