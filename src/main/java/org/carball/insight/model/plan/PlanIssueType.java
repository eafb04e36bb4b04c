package org.carball.insight.model.plan;

public enum PlanIssueType {
    TABLE_SCAN,
    MISSING_INDEX,
    IMPLICIT_CONVERSION,
    SORT_SPILL,
    HASH_SPILL,
    KEY_LOOKUP,
    NESTED_LOOP_WARNING,
    INDEX_SCAN,
    CARDINALITY_MISMATCH
}
