package org.carball.insight.model.plan;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a plan capture: the unified plan tree plus detected issues, or an error message.
 */
@Value
@Builder(toBuilder = true)
public class QueryPlanResult {
    String sql;
    @Builder.Default
    String rawPlan = "";
    String engine;
    @Builder.Default
    List<PlanNode> nodes = List.of();
    @Builder.Default
    List<PlanIssue> issues = List.of();
    Double estimatedCost;
    Long estimatedRows;
    Double actualTimeMs;
    @Builder.Default
    boolean success = true;
    String errorMessage;

    public static QueryPlanResult failure(String sql, String engine, String errorMessage) {
        return QueryPlanResult.builder()
                .sql(sql)
                .engine(engine)
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    /**
     * All nodes of the tree, depth first.
     */
    public List<PlanNode> flatten() {
        List<PlanNode> all = new ArrayList<>();
        nodes.forEach(root -> root.walk(all::add));
        return all;
    }

    public boolean hasIssue(PlanIssueType type) {
        return issues.stream().anyMatch(i -> i.getType() == type);
    }
}
