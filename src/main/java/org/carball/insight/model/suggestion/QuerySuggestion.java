package org.carball.insight.model.suggestion;

import lombok.Builder;
import lombok.Value;

/**
 * An improvement proposed for a single statement.
 */
@Value
@Builder
public class QuerySuggestion {
    SuggestionType type;
    SuggestionSeverity severity;
    String title;
    String message;
    String suggestedFix;
    String table;
    String column;

    public boolean isActionable() {
        return severity != SuggestionSeverity.INFO;
    }
}
