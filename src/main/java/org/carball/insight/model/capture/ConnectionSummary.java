package org.carball.insight.model.capture;

/**
 * Queries seen per database. The database id never carries credentials.
 */
public record ConnectionSummary(
        String engine,
        String engineLabel,
        String databaseId,
        long queryCount
) {}
