package org.carball.insight.plan;

import org.carball.insight.model.plan.PlanIssue;
import org.carball.insight.model.plan.PlanIssueSeverity;
import org.carball.insight.model.plan.PlanIssueType;
import org.carball.insight.model.plan.PlanNode;
import org.carball.insight.plan.SqlitePlanParser.PlanRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class SqlitePlanParserTest {

    @Test
    void shouldBuildTreeRegardlessOfRowOrder() {
        // Given - child row arrives before its parent
        List<PlanRow> rows = List.of(
                new PlanRow(4, 2, "SEARCH Orders USING INDEX IX_Orders_UserId (UserId=?)"),
                new PlanRow(2, 0, "SCAN Users"),
                new PlanRow(9, 0, "USE TEMP B-TREE FOR ORDER BY"));

        // When
        List<PlanNode> roots = SqlitePlanParser.buildTree(rows);

        // Then
        assertThat(roots).extracting(PlanNode::getOperation).containsExactly("SCAN", SqlitePlanParser.TEMP_BTREE_OPERATION);
        PlanNode users = roots.get(0);
        assertThat(users.getObjectName()).isEqualTo("Users");
        assertThat(users.getDepth()).isZero();
        assertThat(users.getChildren()).singleElement().satisfies(child -> {
            assertThat(child.getObjectName()).isEqualTo("Orders");
            assertThat(child.getIndexName()).isEqualTo("IX_Orders_UserId");
            assertThat(child.isUsesIndex()).isTrue();
            assertThat(child.getDepth()).isEqualTo(1);
        });
    }

    @Test
    void shouldTreatOrphansAsRoots() {
        List<PlanNode> roots = SqlitePlanParser.buildTree(List.of(
                new PlanRow(3, 0, "SCAN Users"),
                new PlanRow(5, 42, "SCAN Orders")));

        assertThat(roots).extracting(PlanNode::getObjectName).containsExactly("Users", "Orders");
    }

    @Test
    void shouldSurviveParentCycles() {
        List<PlanNode> roots = SqlitePlanParser.buildTree(List.of(
                new PlanRow(1, 2, "SCAN A"),
                new PlanRow(2, 1, "SCAN B")));

        assertThat(roots).hasSize(1);
        assertThat(roots.get(0).getObjectName()).isEqualTo("A");
        assertThat(roots.get(0).getChildren()).extracting(PlanNode::getObjectName).containsExactly("B");
    }

    @Test
    void shouldReturnEmptyTreeForNoRows() {
        assertThat(SqlitePlanParser.buildTree(List.of())).isEmpty();
        assertThat(SqlitePlanParser.buildTree(null)).isEmpty();
    }

    @Test
    void shouldParseScanVariants() {
        PlanNode scan = SqlitePlanParser.parseDetail("SCAN TABLE Users AS u");

        assertThat(scan.getOperation()).isEqualTo("SCAN");
        assertThat(scan.getObjectName()).isEqualTo("Users");
        assertThat(scan.isTableScan()).isTrue();
        assertThat(scan.isUsesIndex()).isFalse();
    }

    @Test
    void shouldParseSearchVariants() {
        PlanNode primaryKey = SqlitePlanParser.parseDetail("SEARCH Users USING INTEGER PRIMARY KEY (rowid=?)");
        assertThat(primaryKey.getIndexName()).isEqualTo("PRIMARY KEY");
        assertThat(primaryKey.isUsesIndex()).isTrue();
        assertThat(primaryKey.isTableScan()).isFalse();

        PlanNode automatic = SqlitePlanParser.parseDetail("SEARCH Users USING AUTOMATIC COVERING INDEX (Email=?)");
        assertThat(automatic.getObjectName()).isEqualTo("Users");
        assertThat(automatic.getIndexName()).isEqualTo("automatic");
    }

    @Test
    void shouldNotTreatConstantRowAsTableScan() {
        PlanNode node = SqlitePlanParser.parseDetail("SCAN CONSTANT ROW");

        assertThat(node.isTableScan()).isFalse();
        assertThat(node.getOperation()).isEqualTo("SCAN CONSTANT ROW");
    }

    @Test
    void shouldDetectTableScanAndTempBTree() {
        // Given
        List<PlanNode> roots = SqlitePlanParser.buildTree(List.of(
                new PlanRow(2, 0, "SCAN Users"),
                new PlanRow(9, 0, "USE TEMP B-TREE FOR ORDER BY")));

        // When
        List<PlanIssue> issues = SqlitePlanParser.detectIssues(roots);

        // Then
        assertThat(issues).extracting(PlanIssue::getType)
                .containsExactly(PlanIssueType.TABLE_SCAN, PlanIssueType.SORT_SPILL);
        PlanIssue scan = issues.get(0);
        assertThat(scan.getSeverity()).isEqualTo(PlanIssueSeverity.WARNING);
        assertThat(scan.getTable()).isEqualTo("Users");
        assertThat(scan.getSuggestedFix()).isEqualTo("CREATE INDEX IX_Users_<column> ON Users (<column>);");
    }
}
