package org.carball.insight.history;

import org.carball.insight.model.history.DurationSample;
import org.carball.insight.model.history.QueryPatternHistory;
import org.carball.insight.model.history.QueryRegression;
import org.carball.insight.model.history.RegressionSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class InMemoryQueryHistoryStoreTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final String SQL = "SELECT * FROM Orders WHERE Id = ?";

    private MutableClock clock;
    private InMemoryQueryHistoryStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryQueryHistoryStore(clock);
    }

    @Test
    void shouldAggregateExecutions() {
        // Given
        store.recordExecution("h1", SQL, 10);
        clock.advance(Duration.ofSeconds(5));
        store.recordExecution("h1", SQL, 20);
        clock.advance(Duration.ofSeconds(5));
        store.recordExecution("h1", SQL, 30);

        // When
        QueryPatternHistory history = store.getPattern("h1").orElseThrow();

        // Then
        assertThat(history.getNormalizedSql()).isEqualTo(SQL);
        assertThat(history.getExecutionCount()).isEqualTo(3);
        assertThat(history.getAvgDurationMs()).isEqualTo(20.0);
        assertThat(history.getMinDurationMs()).isEqualTo(10.0);
        assertThat(history.getMaxDurationMs()).isEqualTo(30.0);
        assertThat(history.getTotalDurationMs()).isEqualTo(60.0);
        assertThat(history.getFirstSeen()).isEqualTo(START);
        assertThat(history.getLastSeen()).isEqualTo(START.plusSeconds(10));
        assertThat(history.hasBaseline()).isFalse();
        assertThat(history.getRecentSamples()).extracting(DurationSample::durationMs).containsExactly(10.0, 20.0, 30.0);
    }

    @Test
    void shouldIgnoreExecutionsWithoutHash() {
        store.recordExecution(null, SQL, 10);

        assertThat(store.getPatterns()).isEmpty();
    }

    @Test
    void shouldReportRegressionAgainstBaseline() {
        // Given
        store.recordExecution("h1", SQL, 10);
        assertThat(store.setBaseline("h1")).isTrue();
        store.recordExecution("h1", SQL, 40);

        // When
        List<QueryRegression> regressions = store.getRegressions(QueryHistoryStore.DEFAULT_REGRESSION_THRESHOLD_PERCENT);

        // Then
        assertThat(regressions).singleElement().satisfies(regression -> {
            assertThat(regression.pattern().getBaselineAvgDurationMs()).isEqualTo(10.0);
            assertThat(regression.pattern().getAvgDurationMs()).isEqualTo(25.0);
            assertThat(regression.percentChange()).isCloseTo(150.0, within(1e-9));
            assertThat(regression.absoluteChangeMs()).isCloseTo(15.0, within(1e-9));
            assertThat(regression.severity()).isEqualTo(RegressionSeverity.SEVERE);
        });
    }

    @Test
    void shouldNotReportChangeBelowThreshold() {
        store.recordExecution("h1", SQL, 10);
        store.setBaseline("h1");
        store.recordExecution("h1", SQL, 11);

        assertThat(store.getRegressions(20)).isEmpty();
        assertThat(store.getRegressions(5)).hasSize(1);
    }

    @Test
    void shouldIgnorePatternsWithoutBaseline() {
        store.recordExecution("h1", SQL, 10);
        store.recordExecution("h1", SQL, 500);

        assertThat(store.getRegressions(20)).isEmpty();
    }

    @Test
    void shouldSortRegressionsByPercentChange() {
        // Given
        store.recordExecution("minor", "SELECT 1", 100);
        store.recordExecution("moderate", "SELECT 2", 100);
        store.setBaseline("minor");
        store.setBaseline("moderate");
        store.recordExecution("minor", "SELECT 1", 160);     // avg 130, +30%
        store.recordExecution("moderate", "SELECT 2", 240);  // avg 170, +70%

        // When
        List<QueryRegression> regressions = store.getRegressions(20);

        // Then
        assertThat(regressions).extracting(r -> r.pattern().getPatternHash()).containsExactly("moderate", "minor");
        assertThat(regressions).extracting(QueryRegression::severity)
                .containsExactly(RegressionSeverity.MODERATE, RegressionSeverity.MINOR);
    }

    @Test
    void shouldNotSetBaselineForUnknownPattern() {
        assertThat(store.setBaseline("missing")).isFalse();
    }

    @Test
    void shouldComputeP95FromSamples() {
        for (int i = 1; i <= 100; i++) {
            store.recordExecution("h1", SQL, i);
        }

        assertThat(store.getPattern("h1").orElseThrow().getP95DurationMs()).isEqualTo(96.0);
    }

    @Test
    void shouldCapSamplesButKeepTotals() {
        // Given
        for (int i = 1; i <= 120; i++) {
            store.recordExecution("h1", SQL, i);
        }

        // When
        QueryPatternHistory history = store.getPattern("h1").orElseThrow();

        // Then
        assertThat(history.getExecutionCount()).isEqualTo(120);
        assertThat(history.getMinDurationMs()).isEqualTo(1.0);
        assertThat(history.getP95DurationMs()).isEqualTo(116.0);
        assertThat(history.getRecentSamples()).hasSize(AbstractQueryHistoryStore.RECENT_SAMPLE_COUNT);
        assertThat(history.getRecentSamples().get(0).durationMs()).isEqualTo(101.0);
    }

    @Test
    void shouldSortPatternsByTotalDuration() {
        store.recordExecution("small", "SELECT 1", 5);
        store.recordExecution("large", "SELECT 2", 50);
        store.recordExecution("small", "SELECT 1", 5);

        assertThat(store.getPatterns()).extracting(QueryPatternHistory::getPatternHash).containsExactly("large", "small");
    }

    @Test
    void shouldRemovePatternsNotSeenWithinRetention() {
        // Given
        store.recordExecution("old", "SELECT 1", 5);
        clock.advance(Duration.ofDays(8));
        store.recordExecution("fresh", "SELECT 2", 5);

        // When
        int removed = store.cleanup(7);

        // Then
        assertThat(removed).isEqualTo(1);
        assertThat(store.getPattern("old")).isEmpty();
        assertThat(store.getPattern("fresh")).isPresent();
    }

    @Test
    void shouldNotLoseConcurrentRecordings() throws Exception {
        // Given
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int t = 0; t < 8; t++) {
            futures.add(pool.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    store.recordExecution("h1", SQL, 1);
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Then
        QueryPatternHistory history = store.getPattern("h1").orElseThrow();
        assertThat(history.getExecutionCount()).isEqualTo(4000);
        assertThat(history.getTotalDurationMs()).isEqualTo(4000.0);
    }

    @Test
    void shouldDiscardHistoryOnClose() {
        store.recordExecution("h1", SQL, 5);

        store.close();

        assertThat(store.getPatterns()).isEmpty();
    }
}
