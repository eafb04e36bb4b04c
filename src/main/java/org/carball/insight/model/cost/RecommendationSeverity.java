package org.carball.insight.model.cost;

public enum RecommendationSeverity {
    LOW,
    MEDIUM,
    HIGH
}
