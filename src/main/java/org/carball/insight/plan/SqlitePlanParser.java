package org.carball.insight.plan;

import org.carball.insight.model.plan.PlanIssue;
import org.carball.insight.model.plan.PlanIssueSeverity;
import org.carball.insight.model.plan.PlanIssueType;
import org.carball.insight.model.plan.PlanNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns SQLite {@code EXPLAIN QUERY PLAN} rows into a plan tree and flags scans and temporary sorts.
 */
public final class SqlitePlanParser {

    public static final String TEMP_BTREE_OPERATION = "TEMP B-TREE";

    /**
     * One output row of EXPLAIN QUERY PLAN.
     */
    public record PlanRow(int id, int parent, String detail) {

        public String toRawLine() {
            return id + "|" + parent + "|" + detail;
        }
    }

    // SCAN Users, SCAN TABLE Users, SCAN Users AS u, SCAN u USING COVERING INDEX ix
    private static final Pattern SCAN_PATTERN = Pattern.compile(
            "^SCAN\\s+(?:TABLE\\s+)?(\\w+)(?:\\s+AS\\s+\\w+)?(?:\\s+USING\\s+(?:COVERING\\s+)?INDEX\\s+(\\w+))?",
            Pattern.CASE_INSENSITIVE);

    // SEARCH Users USING INDEX ix (Email=?), SEARCH Users USING AUTOMATIC COVERING INDEX (x=?)
    private static final Pattern SEARCH_INDEX_PATTERN = Pattern.compile(
            "^SEARCH\\s+(?:TABLE\\s+)?(\\w+)(?:\\s+AS\\s+\\w+)?\\s+USING\\s+(AUTOMATIC\\s+)?(?:(?:COVERING|PARTIAL)\\s+)*INDEX(?:\\s+(\\w+))?",
            Pattern.CASE_INSENSITIVE);

    // SEARCH Users USING INTEGER PRIMARY KEY (rowid=?), SEARCH t USING PRIMARY KEY (id=?)
    private static final Pattern SEARCH_PRIMARY_KEY_PATTERN = Pattern.compile(
            "^SEARCH\\s+(?:TABLE\\s+)?(\\w+)(?:\\s+AS\\s+\\w+)?\\s+USING\\s+(?:INTEGER\\s+)?PRIMARY\\s+KEY",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TEMP_BTREE_PATTERN = Pattern.compile("USE TEMP B-TREE", Pattern.CASE_INSENSITIVE);

    private static final Set<String> NON_TABLE_SCANS = Set.of("CONSTANT", "SUBQUERY");

    private SqlitePlanParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Builds the plan forest. Parent links are resolved by id so row order does not matter;
     * rows whose parent is 0, unknown or part of a cycle become roots.
     */
    public static List<PlanNode> buildTree(List<PlanRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }

        // First pass: index rows by id
        Map<Integer, PlanRow> byId = new LinkedHashMap<>();
        for (PlanRow row : rows) {
            byId.putIfAbsent(row.id(), row);
        }

        // Second pass: resolve parent edges by id
        Map<Integer, List<Integer>> childIds = new LinkedHashMap<>();
        List<Integer> rootIds = new ArrayList<>();
        for (PlanRow row : byId.values()) {
            if (row.parent() == 0 || row.parent() == row.id() || !byId.containsKey(row.parent())) {
                rootIds.add(row.id());
            } else {
                childIds.computeIfAbsent(row.parent(), k -> new ArrayList<>()).add(row.id());
            }
        }

        Set<Integer> visited = new HashSet<>();
        List<PlanNode> roots = new ArrayList<>();
        for (Integer id : rootIds) {
            roots.add(build(id, 0, byId, childIds, visited));
        }
        // Rows only reachable through a parent cycle
        for (Integer id : byId.keySet()) {
            if (!visited.contains(id)) {
                roots.add(build(id, 0, byId, childIds, visited));
            }
        }
        return roots;
    }

    private static PlanNode build(int id, int depth, Map<Integer, PlanRow> byId,
                                  Map<Integer, List<Integer>> childIds, Set<Integer> visited) {
        visited.add(id);
        PlanNode.PlanNodeBuilder builder = parseDetail(byId.get(id).detail()).toBuilder().depth(depth);
        for (Integer childId : childIds.getOrDefault(id, List.of())) {
            if (!visited.contains(childId)) {
                builder.child(build(childId, depth + 1, byId, childIds, visited));
            }
        }
        return builder.build();
    }

    /**
     * Classifies one detail string as a scan, an index search or a temporary sort.
     */
    public static PlanNode parseDetail(String detail) {
        String text = detail == null ? "" : detail.trim();

        Matcher search = SEARCH_INDEX_PATTERN.matcher(text);
        if (search.find()) {
            String indexName = search.group(3) != null ? search.group(3)
                    : search.group(2) != null ? "automatic" : null;
            return PlanNode.builder()
                    .operation("SEARCH")
                    .objectName(search.group(1))
                    .details(text)
                    .usesIndex(true)
                    .indexName(indexName)
                    .build();
        }

        Matcher primaryKey = SEARCH_PRIMARY_KEY_PATTERN.matcher(text);
        if (primaryKey.find()) {
            return PlanNode.builder()
                    .operation("SEARCH")
                    .objectName(primaryKey.group(1))
                    .details(text)
                    .usesIndex(true)
                    .indexName("PRIMARY KEY")
                    .build();
        }

        Matcher scan = SCAN_PATTERN.matcher(text);
        if (scan.find() && !NON_TABLE_SCANS.contains(scan.group(1).toUpperCase(Locale.ROOT))) {
            return PlanNode.builder()
                    .operation("SCAN")
                    .objectName(scan.group(1))
                    .details(text)
                    .tableScan(true)
                    .usesIndex(scan.group(2) != null)
                    .indexName(scan.group(2))
                    .build();
        }

        if (TEMP_BTREE_PATTERN.matcher(text).find()) {
            return PlanNode.builder()
                    .operation(TEMP_BTREE_OPERATION)
                    .details(text)
                    .build();
        }

        return PlanNode.builder()
                .operation(text)
                .build();
    }

    public static List<PlanIssue> detectIssues(List<PlanNode> roots) {
        List<PlanIssue> issues = new ArrayList<>();
        roots.forEach(root -> root.walk(node -> {
            if (node.isTableScan() && node.getObjectName() != null) {
                issues.add(PlanIssue.builder()
                        .type(PlanIssueType.TABLE_SCAN)
                        .severity(PlanIssueSeverity.WARNING)
                        .title("Full Table Scan Detected")
                        .message(String.format("Table '%s' is being scanned without using an index. Consider adding "
                                + "an index on the columns used in WHERE, JOIN, or ORDER BY clauses.", node.getObjectName()))
                        .suggestedFix(String.format("CREATE INDEX IX_%1$s_<column> ON %1$s (<column>);", node.getObjectName()))
                        .table(node.getObjectName())
                        .indexName(node.getIndexName())
                        .sourceNode(node)
                        .build());
            }

            if (TEMP_BTREE_OPERATION.equals(node.getOperation())) {
                issues.add(PlanIssue.builder()
                        .type(PlanIssueType.SORT_SPILL)
                        .severity(PlanIssueSeverity.WARNING)
                        .title("Temporary B-Tree for Sorting")
                        .message("A temporary B-tree is being used for sorting or grouping. "
                                + "Consider adding an index on the ORDER BY columns to avoid this.")
                        .sourceNode(node)
                        .build());
            }
        }));
        return issues;
    }
}
