package org.carball.insight.config;

import java.util.Locale;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH;

    public static OutputFormat fromString(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "json":
                return JSON;
            case "markdown":
            case "md":
                return MARKDOWN;
            case "both":
                return BOTH;
            default:
                throw new IllegalArgumentException("Invalid format: " + value + ". Use json, markdown or both");
        }
    }
}
