package org.carball.insight.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.insight.model.plan.PlanIssue;
import org.carball.insight.model.plan.PlanIssueSeverity;
import org.carball.insight.model.plan.PlanIssueType;
import org.carball.insight.model.plan.PlanNode;
import org.carball.insight.model.plan.QueryPlanResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses PostgreSQL {@code EXPLAIN (FORMAT JSON)} output and flags sequential scans, index
 * scans, misestimated row counts and large nested loops.
 */
public final class PostgresPlanParser {

    static final long SEQ_SCAN_ROW_THRESHOLD = 1_000;
    static final long SEQ_SCAN_CRITICAL_ROWS = 10_000;
    static final double CARDINALITY_RATIO = 10.0;
    static final long NESTED_LOOP_ROW_THRESHOLD = 10_000;

    private static final Set<String> SEQ_SCAN_TYPES = Set.of("Seq Scan", "Parallel Seq Scan");
    private static final Set<String> INDEX_SCAN_TYPES = Set.of("Index Scan", "Bitmap Index Scan");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PostgresPlanParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses the JSON document into a result carrying the tree and top-level totals.
     *
     * @throws JsonProcessingException when the text is not JSON
     */
    public static QueryPlanResult parse(String sql, String rawPlan) throws JsonProcessingException {
        JsonNode root = MAPPER.readTree(rawPlan == null || rawPlan.isBlank() ? "[]" : rawPlan);
        // Some drivers hand the plan back wrapped in a single-element array, others as the object itself
        JsonNode first = root.isArray() ? (root.size() > 0 ? root.get(0) : null) : root;
        JsonNode plan = first != null ? first.get("Plan") : null;

        QueryPlanResult.QueryPlanResultBuilder builder = QueryPlanResult.builder()
                .sql(sql)
                .engine(PostgresPlanProvider.ENGINE)
                .rawPlan(rawPlan == null ? "" : rawPlan);
        if (plan == null) {
            return builder.build();
        }

        List<PlanNode> nodes = List.of(parseNode(plan, 0));
        Double executionTime = first.hasNonNull("Execution Time") ? first.get("Execution Time").asDouble() : null;
        return builder
                .nodes(nodes)
                .issues(detectIssues(nodes))
                .estimatedCost(doubleOrNull(plan, "Total Cost"))
                .estimatedRows(longOrNull(plan, "Plan Rows"))
                .actualTimeMs(executionTime != null ? executionTime : doubleOrNull(plan, "Actual Total Time"))
                .build();
    }

    static PlanNode parseNode(JsonNode node, int depth) {
        String nodeType = textOrNull(node, "Node Type");
        if (nodeType == null) {
            nodeType = "Unknown";
        }

        PlanNode.PlanNodeBuilder builder = PlanNode.builder()
                .operation(nodeType)
                .objectName(textOrNull(node, "Relation Name"))
                .indexName(textOrNull(node, "Index Name"))
                .details(buildDetails(textOrNull(node, "Filter"), textOrNull(node, "Index Cond"),
                        textOrNull(node, "Join Type")))
                .estimatedCost(doubleOrNull(node, "Total Cost"))
                .estimatedRows(longOrNull(node, "Plan Rows"))
                .actualTimeMs(doubleOrNull(node, "Actual Total Time"))
                .actualRows(longOrNull(node, "Actual Rows"))
                .tableScan(SEQ_SCAN_TYPES.contains(nodeType))
                .usesIndex(nodeType.toLowerCase(Locale.ROOT).contains("index"))
                .depth(depth);

        JsonNode plans = node.get("Plans");
        if (plans != null && plans.isArray()) {
            for (JsonNode child : plans) {
                builder.child(parseNode(child, depth + 1));
            }
        }
        return builder.build();
    }

    public static List<PlanIssue> detectIssues(List<PlanNode> roots) {
        List<PlanIssue> issues = new ArrayList<>();
        roots.forEach(root -> root.walk(node -> inspect(node, issues)));
        return issues;
    }

    private static void inspect(PlanNode node, List<PlanIssue> issues) {
        Long estimated = node.getEstimatedRows();
        Long actual = node.getActualRows();
        String table = node.getObjectName();

        if (node.isTableScan() && table != null && (estimated == null || estimated > SEQ_SCAN_ROW_THRESHOLD)) {
            issues.add(PlanIssue.builder()
                    .type(PlanIssueType.TABLE_SCAN)
                    .severity(estimated != null && estimated > SEQ_SCAN_CRITICAL_ROWS
                            ? PlanIssueSeverity.CRITICAL : PlanIssueSeverity.WARNING)
                    .title("Sequential Scan Detected")
                    .message(String.format("Table '%s' is being sequentially scanned%s. Consider adding an index on "
                            + "the columns used in WHERE or JOIN clauses.", table,
                            estimated != null ? String.format(" (%,d estimated rows)", estimated) : ""))
                    .suggestedFix(String.format("CREATE INDEX CONCURRENTLY ix_%s_<column> ON %s (<column>);",
                            table.toLowerCase(Locale.ROOT), table))
                    .table(table)
                    .sourceNode(node)
                    .build());
        }

        if (INDEX_SCAN_TYPES.contains(node.getOperation())) {
            issues.add(PlanIssue.builder()
                    .type(PlanIssueType.INDEX_SCAN)
                    .severity(PlanIssueSeverity.INFO)
                    .title("Index Scan (not Seek)")
                    .message(String.format("Index '%s' on '%s' is being scanned rather than seeked. "
                            + "This may indicate the index could be more selective.", node.getIndexName(), table))
                    .table(table)
                    .indexName(node.getIndexName())
                    .sourceNode(node)
                    .build());
        }

        if (estimated != null && actual != null) {
            double ratio = actual / (double) Math.max(1, estimated);
            if (ratio > CARDINALITY_RATIO || ratio < 1 / CARDINALITY_RATIO) {
                issues.add(PlanIssue.builder()
                        .type(PlanIssueType.CARDINALITY_MISMATCH)
                        .severity(PlanIssueSeverity.WARNING)
                        .title("Row Count Estimate Mismatch")
                        .message(String.format("Estimated %,d rows but got %,d. This may indicate stale statistics. "
                                + "Consider running ANALYZE.", estimated, actual))
                        .suggestedFix(table != null ? "ANALYZE " + table + ";" : "ANALYZE;")
                        .table(table)
                        .sourceNode(node)
                        .build());
            }
        }

        if ("Nested Loop".equals(node.getOperation()) && actual != null && actual > NESTED_LOOP_ROW_THRESHOLD) {
            issues.add(PlanIssue.builder()
                    .type(PlanIssueType.NESTED_LOOP_WARNING)
                    .severity(PlanIssueSeverity.WARNING)
                    .title("Nested Loop on Large Dataset")
                    .message(String.format("Nested loop join processed %,d rows. "
                            + "Consider if a hash join or merge join would be more efficient.", actual))
                    .sourceNode(node)
                    .build());
        }
    }

    private static String buildDetails(String filter, String indexCond, String joinType) {
        List<String> parts = new ArrayList<>();
        if (filter != null && !filter.isEmpty()) {
            parts.add("Filter: " + filter);
        }
        if (indexCond != null && !indexCond.isEmpty()) {
            parts.add("Index Cond: " + indexCond);
        }
        if (joinType != null && !joinType.isEmpty()) {
            parts.add("Join Type: " + joinType);
        }
        return parts.isEmpty() ? null : String.join("; ", parts);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static Double doubleOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }

    private static Long longOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? Long.valueOf(Math.round(value.asDouble())) : null;
    }
}
