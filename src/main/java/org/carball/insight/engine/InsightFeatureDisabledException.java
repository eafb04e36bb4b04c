package org.carball.insight.engine;

/**
 * Thrown when an operation needs a feature that is switched off in the options.
 */
public class InsightFeatureDisabledException extends RuntimeException {

    private final String feature;

    public InsightFeatureDisabledException(String feature, String message) {
        super(message);
        this.feature = feature;
    }

    public String getFeature() {
        return feature;
    }
}
