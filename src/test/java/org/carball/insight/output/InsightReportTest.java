package org.carball.insight.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.insight.analyzer.QueryAnalyzer;
import org.carball.insight.capture.QueryStore;
import org.carball.insight.cost.CostCalculator;
import org.carball.insight.cost.SavingsEstimates;
import org.carball.insight.model.capture.QueryEvent;
import org.carball.insight.model.capture.QueryStats;
import org.carball.insight.model.cost.CostReport;
import org.carball.insight.model.history.QueryPatternHistory;
import org.carball.insight.model.history.QueryRegression;
import org.carball.insight.model.history.RegressionSeverity;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class InsightReportTest {

    private static final Instant BASE = Instant.parse("2024-05-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(BASE.plusSeconds(3600), ZoneOffset.UTC);

    private final CostCalculator calculator = new CostCalculator(SavingsEstimates.defaults(), new QueryAnalyzer(), CLOCK);

    private static QueryEvent event(String sql, String requestId, double durationMs, long offsetMs) {
        return QueryEvent.builder()
                .sql(sql)
                .requestId(requestId)
                .requestPath("/customers")
                .durationMs(durationMs)
                .timestamp(BASE.plusMillis(offsetMs))
                .build();
    }

    private InsightReport reportFor(List<QueryEvent> events, List<QueryRegression> regressions) {
        QueryStore store = new QueryStore();
        events.forEach(store::add);
        QueryStats stats = store.getStats();
        CostReport costReport = calculator.calculate(store.getAll(), stats.getN1Patterns());
        return new InsightReport(stats, costReport, regressions);
    }

    private static List<QueryEvent> n1Events() {
        List<QueryEvent> events = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            events.add(event("SELECT * FROM Orders WHERE CustomerId = " + i, "req-1", 15, i * 10L));
        }
        return events;
    }

    @Test
    public void shouldRenderJsonSummaryAndSections() throws Exception {
        // Given
        InsightReport report = reportFor(n1Events(), List.of());

        // When
        JsonNode root = new ObjectMapper().readTree(report.toJson());

        // Then
        assertThat(root.get("generatedAt").asText()).isEqualTo("2024-05-01T11:00:00Z");
        JsonNode summary = root.get("summary");
        assertThat(summary.get("totalQueries").asInt()).isEqualTo(4);
        assertThat(summary.get("errorCount").asInt()).isZero();
        assertThat(summary.get("requestCount").asInt()).isEqualTo(1);
        assertThat(summary.get("totalDurationMs").asDouble()).isEqualTo(60.0);

        assertThat(root.get("n1Patterns").size()).isEqualTo(1);
        assertThat(root.get("n1Patterns").get(0).get("count").asInt()).isEqualTo(4);
        assertThat(root.get("recommendations").size()).isGreaterThanOrEqualTo(1);
        assertThat(root.get("regressions").isArray()).isTrue();
        assertThat(root.get("regressions").size()).isZero();
    }

    @Test
    public void shouldRenderMarkdownSections() {
        // Given
        InsightReport report = reportFor(n1Events(), List.of());

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown).startsWith("# Query Insight Report");
        assertThat(markdown).contains("## Summary");
        assertThat(markdown).contains("| Queries Captured | 4 |");
        assertThat(markdown).contains("## Recommendations");
        assertThat(markdown).contains("### 1. ");
        assertThat(markdown).contains("## N+1 Patterns");
        assertThat(markdown).contains("| /customers | 4 | 60.00 ms |");
        assertThat(markdown).doesNotContain("## Regressions");
        assertThat(markdown).endsWith("*Generated by Query Insight*\n");
    }

    @Test
    public void shouldReportHealthyCaptureWithoutRecommendations() {
        // Given
        InsightReport report = reportFor(List.of(event("SELECT Id FROM Users WHERE Id = 1", "req-1", 5, 0)), null);

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown).contains("**No recommendations. Captured queries look healthy.**");
        assertThat(markdown).doesNotContain("## N+1 Patterns");
        assertThat(markdown).doesNotContain("## Split Queries");
    }

    @Test
    public void shouldRenderRegressionsWithSanitizedPreview() {
        // Given - a statement longer than the preview containing a pipe
        String longSql = "SELECT a || b FROM Orders WHERE " + "x = ? AND ".repeat(20) + "y = ?";
        QueryPatternHistory pattern = QueryPatternHistory.builder()
                .patternHash("abc123")
                .normalizedSql(longSql)
                .executionCount(12)
                .avgDurationMs(250)
                .baselineAvgDurationMs(100.0)
                .build();
        QueryRegression regression = new QueryRegression(pattern, 150.0, 150.0, RegressionSeverity.SEVERE);
        InsightReport report = reportFor(List.of(event("SELECT Id FROM Users WHERE Id = 1", "req-1", 5, 0)), List.of(regression));

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown).contains("## Regressions");
        assertThat(markdown).contains("| SEVERE | +150.0% | 100.00 ms | 250.00 ms | `SELECT a // b FROM Orders");
        assertThat(markdown).doesNotContain("a || b");
        String expectedPreview = longSql.replace('|', '/').substring(0, 120) + "...";
        assertThat(markdown).contains("`" + expectedPreview + "`");
    }

    @Test
    public void shouldIncludeRegressionsInJson() throws Exception {
        // Given
        QueryPatternHistory pattern = QueryPatternHistory.builder()
                .patternHash("abc123")
                .normalizedSql("SELECT * FROM Orders WHERE Id = ?")
                .avgDurationMs(160)
                .baselineAvgDurationMs(100.0)
                .build();
        InsightReport report = reportFor(n1Events(),
                List.of(new QueryRegression(pattern, 60.0, 60.0, RegressionSeverity.MODERATE)));

        // When
        JsonNode regressions = new ObjectMapper().readTree(report.toJson()).get("regressions");

        // Then
        assertThat(regressions.size()).isEqualTo(1);
        assertThat(regressions.get(0).get("severity").asText()).isEqualTo("MODERATE");
        assertThat(regressions.get(0).get("percentChange").asDouble()).isEqualTo(60.0);
        assertThat(regressions.get(0).get("pattern").get("patternHash").asText()).isEqualTo("abc123");
    }
}
