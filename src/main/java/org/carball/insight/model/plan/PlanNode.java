package org.carball.insight.model.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.function.Consumer;

/**
 * One operator of an execution plan. Nodes form an immutable tree owned by a {@link QueryPlanResult}.
 */
@Value
@Builder(toBuilder = true)
public class PlanNode {
    String operation;
    String objectName;
    String details;
    Double estimatedCost;
    Long estimatedRows;
    Double actualTimeMs;
    Long actualRows;
    boolean tableScan;
    boolean usesIndex;
    // Fetches remaining columns by row locator after a narrower index access
    boolean lookup;
    String indexName;
    int depth;
    @Singular
    List<PlanNode> children;

    /**
     * Visits this node and all descendants depth first, parents before children.
     */
    public void walk(Consumer<PlanNode> visitor) {
        visitor.accept(this);
        for (PlanNode child : children) {
            child.walk(visitor);
        }
    }
}
