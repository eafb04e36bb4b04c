package org.carball.insight.cost;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Expected fraction of query time a fix removes, per issue type. Immutable; derive variants
 * with {@link #with(String, double)}.
 */
public final class SavingsEstimates {

    public static final String N_PLUS_ONE = "N+1";
    public static final String MISSING_INDEX = "MISSING_INDEX";
    public static final String CARTESIAN_EXPLOSION = "CARTESIAN_EXPLOSION";
    public static final String SELECT_ALL = "SELECT_ALL";
    public static final String TABLE_SCAN = "TABLE_SCAN";
    public static final String KEY_LOOKUP = "KEY_LOOKUP";
    public static final String SORT_SPILL = "SORT_SPILL";
    public static final String MISSING_PAGINATION = "MISSING_PAGINATION";

    public static final double DEFAULT_FALLBACK = 0.20;

    private static final SavingsEstimates DEFAULTS = new SavingsEstimates(Map.of(
            N_PLUS_ONE, 0.90,
            MISSING_INDEX, 0.80,
            CARTESIAN_EXPLOSION, 0.50,
            SELECT_ALL, 0.20,
            TABLE_SCAN, 0.75,
            KEY_LOOKUP, 0.40,
            SORT_SPILL, 0.30,
            MISSING_PAGINATION, 0.50), DEFAULT_FALLBACK);

    private final Map<String, Double> estimates;
    private final double fallback;

    public SavingsEstimates(Map<String, Double> estimates, double fallback) {
        this.estimates = Map.copyOf(estimates);
        this.fallback = fallback;
    }

    public static SavingsEstimates defaults() {
        return DEFAULTS;
    }

    public double get(String issueType) {
        return estimates.getOrDefault(issueType, fallback);
    }

    public SavingsEstimates with(String issueType, double savings) {
        if (savings < 0 || savings > 1) {
            throw new IllegalArgumentException("Savings must be between 0 and 1: " + savings);
        }
        Map<String, Double> copy = new LinkedHashMap<>(estimates);
        copy.put(issueType, savings);
        return new SavingsEstimates(copy, fallback);
    }

    public double getFallback() {
        return fallback;
    }
}
