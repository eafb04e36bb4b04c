package org.carball.insight.model.plan;

public enum PlanIssueSeverity {
    INFO,
    WARNING,
    CRITICAL
}
