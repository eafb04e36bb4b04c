package org.carball.insight.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.carball.insight.model.plan.PlanIssue;
import org.carball.insight.model.plan.PlanIssueSeverity;
import org.carball.insight.model.plan.PlanIssueType;
import org.carball.insight.model.plan.PlanNode;
import org.carball.insight.model.plan.QueryPlanResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

public class PostgresPlanParserTest {

    private static final String SQL = "SELECT * FROM orders o JOIN customers c ON c.id = o.customer_id WHERE o.status = 'open'";

    private String fixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/plans/postgres-nested-loop.json")) {
            assertThat(in).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void shouldParsePlanTreeAndTotals() throws Exception {
        // When
        QueryPlanResult result = PostgresPlanParser.parse(SQL, fixture());

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEngine()).isEqualTo(PostgresPlanProvider.ENGINE);
        assertThat(result.getEstimatedCost()).isEqualTo(2450.75);
        assertThat(result.getEstimatedRows()).isEqualTo(1500L);
        assertThat(result.getActualTimeMs()).isEqualTo(123.4);

        PlanNode root = result.getNodes().get(0);
        assertThat(root.getOperation()).isEqualTo("Nested Loop");
        assertThat(root.getDetails()).isEqualTo("Join Type: Inner");
        assertThat(root.getChildren())
                .extracting(PlanNode::getOperation, PlanNode::getObjectName, PlanNode::isTableScan, PlanNode::isUsesIndex,
                        PlanNode::getDepth)
                .containsExactly(
                        tuple("Seq Scan", "orders", true, false, 1),
                        tuple("Index Scan", "customers", false, true, 1));
        assertThat(root.getChildren().get(1).getIndexName()).isEqualTo("customers_pkey");
    }

    @Test
    void shouldDetectIssuesInPlanOrder() throws Exception {
        QueryPlanResult result = PostgresPlanParser.parse(SQL, fixture());

        assertThat(result.getIssues())
                .extracting(PlanIssue::getType, PlanIssue::getSeverity, PlanIssue::getTable)
                .containsExactly(
                        tuple(PlanIssueType.CARDINALITY_MISMATCH, PlanIssueSeverity.WARNING, null),
                        tuple(PlanIssueType.NESTED_LOOP_WARNING, PlanIssueSeverity.WARNING, null),
                        tuple(PlanIssueType.TABLE_SCAN, PlanIssueSeverity.CRITICAL, "orders"),
                        tuple(PlanIssueType.INDEX_SCAN, PlanIssueSeverity.INFO, "customers"));
    }

    @Test
    void shouldUseWarningForMediumSequentialScan() throws Exception {
        String plan = "[{\"Plan\": {\"Node Type\": \"Seq Scan\", \"Relation Name\": \"users\", \"Plan Rows\": 5000}}]";

        QueryPlanResult result = PostgresPlanParser.parse("SELECT * FROM users", plan);

        assertThat(result.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getType()).isEqualTo(PlanIssueType.TABLE_SCAN);
            assertThat(issue.getSeverity()).isEqualTo(PlanIssueSeverity.WARNING);
            assertThat(issue.getSuggestedFix()).isEqualTo("CREATE INDEX CONCURRENTLY ix_users_<column> ON users (<column>);");
        });
    }

    @Test
    void shouldIgnoreSmallSequentialScan() throws Exception {
        String plan = "{\"Plan\": {\"Node Type\": \"Seq Scan\", \"Relation Name\": \"flags\", \"Plan Rows\": 12}}";

        QueryPlanResult result = PostgresPlanParser.parse("SELECT * FROM flags", plan);

        assertThat(result.getNodes()).hasSize(1);
        assertThat(result.getIssues()).isEmpty();
    }

    @Test
    void shouldReturnEmptyTreeForEmptyDocument() throws Exception {
        QueryPlanResult result = PostgresPlanParser.parse("SELECT 1", "[]");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getNodes()).isEmpty();
    }

    @Test
    void shouldRejectNonJsonPlan() {
        assertThatThrownBy(() -> PostgresPlanParser.parse("SELECT 1", "Seq Scan on users"))
                .isInstanceOf(JsonProcessingException.class);
    }

    @Test
    void shouldExplainReadsWithAnalyzeOnly() {
        assertThat(PostgresPlanProvider.explainCommand("SELECT * FROM users"))
                .isEqualTo("EXPLAIN (ANALYZE, BUFFERS, FORMAT JSON) SELECT * FROM users");
        assertThat(PostgresPlanProvider.explainCommand("DELETE FROM users WHERE id = 1"))
                .isEqualTo("EXPLAIN (FORMAT JSON) DELETE FROM users WHERE id = 1");
    }
}
