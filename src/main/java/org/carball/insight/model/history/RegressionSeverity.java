package org.carball.insight.model.history;

public enum RegressionSeverity {
    MINOR,
    MODERATE,
    SEVERE;

    public static RegressionSeverity fromPercentChange(double percentChange) {
        if (percentChange >= 100) {
            return SEVERE;
        }
        return percentChange >= 50 ? MODERATE : MINOR;
    }
}
