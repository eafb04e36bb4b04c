package org.carball.insight.model.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PlanIssue {
    PlanIssueType type;
    PlanIssueSeverity severity;
    String title;
    String message;
    String suggestedFix;
    String table;
    String column;
    String indexName;

    // Only the operator itself; its subtree is already part of the plan
    @JsonIgnoreProperties("children")
    PlanNode sourceNode;
}
