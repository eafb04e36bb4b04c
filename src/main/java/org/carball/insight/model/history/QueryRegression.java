package org.carball.insight.model.history;

/**
 * A pattern whose average duration has grown past its baseline.
 *
 * @param percentChange    positive when slower than the baseline
 * @param absoluteChangeMs current average minus baseline average
 */
public record QueryRegression(
        QueryPatternHistory pattern,
        double percentChange,
        double absoluteChangeMs,
        RegressionSeverity severity
) {}
