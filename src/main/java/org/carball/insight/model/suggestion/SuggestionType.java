package org.carball.insight.model.suggestion;

public enum SuggestionType {
    MISSING_INDEX,
    MISSING_PAGINATION,
    SELECT_ALL,
    NO_TRACKING,
    CARTESIAN_EXPLOSION
}
