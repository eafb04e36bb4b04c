package org.carball.insight.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.insight.model.capture.ConnectionSummary;
import org.carball.insight.model.capture.N1Pattern;
import org.carball.insight.model.capture.QueryStats;
import org.carball.insight.model.capture.SplitQueryGroup;
import org.carball.insight.model.cost.CostRecommendation;
import org.carball.insight.model.cost.CostReport;
import org.carball.insight.model.history.QueryRegression;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Renders capture statistics, the cost report and any regressions as JSON or Markdown.
 */
@Slf4j
public class InsightReport {

    private static final int SQL_PREVIEW_LENGTH = 120;

    private final QueryStats stats;
    private final CostReport costReport;
    private final List<QueryRegression> regressions;
    private final ObjectMapper objectMapper;

    public InsightReport(QueryStats stats, CostReport costReport) {
        this(stats, costReport, List.of());
    }

    public InsightReport(QueryStats stats, CostReport costReport, List<QueryRegression> regressions) {
        this.stats = stats;
        this.costReport = costReport;
        this.regressions = regressions != null ? regressions : List.of();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        // Header
        md.append("# Query Insight Report\n\n");
        md.append("**Generated:** ").append(costReport.getGeneratedAt()).append("  \n");
        md.append("**Time Window:** ").append(format("%.1f", costReport.getTimeWindowMinutes())).append(" min  \n\n");

        // Summary
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Queries Captured | ").append(stats.getTotalQueries()).append(" |\n");
        md.append("| Errors | ").append(stats.getErrorCount()).append(" |\n");
        md.append("| Requests | ").append(stats.getQueriesPerRequest().size()).append(" |\n");
        md.append("| Avg Duration | ").append(format("%.2f ms", stats.getAverageDurationMs())).append(" |\n");
        md.append("| Max Duration | ").append(format("%.2f ms", stats.getMaxDurationMs())).append(" |\n");
        md.append("| Total Query Time | ").append(format("%.2f ms", stats.getTotalDurationMs())).append(" |\n");
        md.append("| N+1 Patterns | ").append(stats.getN1Patterns().size()).append(" |\n");
        md.append("| Split Query Groups | ").append(stats.getSplitQueryGroups().size()).append(" |\n");
        md.append("| Potential Savings | ").append(format("%.1f%%", costReport.getPotentialSavingsPercent())).append(" |\n\n");

        if (!stats.getConnections().isEmpty()) {
            md.append("## Databases\n\n");
            md.append("| Engine | Database | Queries |\n");
            md.append("|--------|----------|---------|\n");
            for (ConnectionSummary connection : stats.getConnections()) {
                md.append("| ").append(connection.engineLabel())
                        .append(" | ").append(connection.databaseId() != null ? connection.databaseId() : "-")
                        .append(" | ").append(connection.queryCount()).append(" |\n");
            }
            md.append("\n");
        }

        // Recommendations
        md.append("## Recommendations\n\n");
        if (costReport.getRecommendations().isEmpty()) {
            md.append("**No recommendations. Captured queries look healthy.**\n\n");
        }
        int recNum = 1;
        for (CostRecommendation rec : costReport.getRecommendations()) {
            md.append("### ").append(recNum++).append(". ").append(rec.getIssueType())
                    .append(" (").append(rec.getSeverity()).append(")\n\n");
            md.append("- **Pattern:** `").append(preview(rec.getNormalizedSql())).append("`\n");
            md.append("- **Issue:** ").append(rec.getDescription()).append("\n");
            md.append("- **Executions:** ").append(rec.getExecutionCount())
                    .append(format(" (%.1f/min, avg %.2f ms)", rec.getExecutionsPerMinute(), rec.getAvgDurationMs())).append("\n");
            md.append("- **Estimated Saving:** ").append(format("%.1f ms/min (%.0f%%)",
                    rec.getEstimatedTimeSavedPerMinMs(), rec.getEstimatedSavingsPercent())).append("\n");
            if (rec.getRequestPath() != null) {
                md.append("- **Request:** ").append(rec.getRequestPath()).append("\n");
            }
            if (rec.getSuggestedFix() != null && !rec.getSuggestedFix().isEmpty()) {
                md.append("- **Suggested Fix:** ").append(rec.getSuggestedFix()).append("\n");
            }
            md.append("\n");
        }

        // N+1 patterns
        if (!stats.getN1Patterns().isEmpty()) {
            md.append("## N+1 Patterns\n\n");
            md.append("| Request | Count | Total | Statement |\n");
            md.append("|---------|-------|-------|-----------|\n");
            for (N1Pattern pattern : stats.getN1Patterns()) {
                md.append("| ").append(pattern.requestPath() != null ? pattern.requestPath() : pattern.requestId())
                        .append(" | ").append(pattern.count())
                        .append(" | ").append(format("%.2f ms", pattern.totalDurationMs()))
                        .append(" | `").append(preview(pattern.normalizedSql())).append("` |\n");
            }
            md.append("\n");
        }

        // Split queries
        if (!stats.getSplitQueryGroups().isEmpty()) {
            md.append("## Split Queries\n\n");
            md.append("| Request | Queries | Total | Tables |\n");
            md.append("|---------|---------|-------|--------|\n");
            for (SplitQueryGroup group : stats.getSplitQueryGroups()) {
                md.append("| ").append(group.requestPath() != null ? group.requestPath() : group.requestId())
                        .append(" | ").append(group.queryCount())
                        .append(" | ").append(format("%.2f ms", group.totalDurationMs()))
                        .append(" | ").append(String.join(", ", group.tables())).append(" |\n");
            }
            md.append("\n");
        }

        // Regressions
        if (!regressions.isEmpty()) {
            md.append("## Regressions\n\n");
            md.append("| Severity | Change | Baseline | Current | Statement |\n");
            md.append("|----------|--------|----------|---------|-----------|\n");
            for (QueryRegression regression : regressions) {
                md.append("| ").append(regression.severity())
                        .append(" | ").append(format("+%.1f%%", regression.percentChange()))
                        .append(" | ").append(format("%.2f ms", regression.pattern().getBaselineAvgDurationMs()))
                        .append(" | ").append(format("%.2f ms", regression.pattern().getAvgDurationMs()))
                        .append(" | `").append(preview(regression.pattern().getNormalizedSql())).append("` |\n");
            }
            md.append("\n");
        }

        // Footer
        md.append("---\n\n");
        md.append("*Generated by Query Insight*\n");

        return md.toString();
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setGeneratedAt(costReport.getGeneratedAt());

        Summary summary = new Summary();
        summary.setTotalQueries(stats.getTotalQueries());
        summary.setErrorCount(stats.getErrorCount());
        summary.setRequestCount(stats.getQueriesPerRequest().size());
        summary.setAverageDurationMs(stats.getAverageDurationMs());
        summary.setMaxDurationMs(stats.getMaxDurationMs());
        summary.setTotalDurationMs(stats.getTotalDurationMs());
        summary.setTimeWindowMinutes(costReport.getTimeWindowMinutes());
        summary.setTotalTimeSpentPerMinMs(costReport.getTotalTimeSpentPerMinMs());
        summary.setTotalTimeSavedPerMinMs(costReport.getTotalTimeSavedPerMinMs());
        summary.setPotentialSavingsPercent(costReport.getPotentialSavingsPercent());
        report.setSummary(summary);

        report.setConnections(stats.getConnections());
        report.setN1Patterns(stats.getN1Patterns());
        report.setSplitQueryGroups(stats.getSplitQueryGroups());
        report.setRecommendations(costReport.getRecommendations());
        report.setRegressions(regressions);
        return report;
    }

    private static String preview(String sql) {
        if (sql == null) {
            return "";
        }
        String oneLine = sql.replace('|', '/');
        return oneLine.length() > SQL_PREVIEW_LENGTH ? oneLine.substring(0, SQL_PREVIEW_LENGTH) + "..." : oneLine;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private Instant generatedAt;
        private Summary summary;
        private List<ConnectionSummary> connections;
        private List<N1Pattern> n1Patterns;
        private List<SplitQueryGroup> splitQueryGroups;
        private List<CostRecommendation> recommendations;
        private List<QueryRegression> regressions;
    }

    @lombok.Data
    private static class Summary {
        private int totalQueries;
        private int errorCount;
        private int requestCount;
        private double averageDurationMs;
        private double maxDurationMs;
        private double totalDurationMs;
        private double timeWindowMinutes;
        private double totalTimeSpentPerMinMs;
        private double totalTimeSavedPerMinMs;
        private double potentialSavingsPercent;
    }
}
