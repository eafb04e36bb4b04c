package org.carball.insight.model.suggestion;

public enum SuggestionSeverity {
    INFO,
    LOW,
    MEDIUM,
    HIGH
}
