package org.carball.insight.model.capture;

import java.util.List;
import java.util.UUID;

/**
 * The same statement shape executed repeatedly inside one request.
 */
public record N1Pattern(
        String normalizedSql,
        String patternHash,
        int count,
        String requestId,
        String requestPath,
        List<UUID> queryIds,
        double totalDurationMs,
        double averageDurationMs
) {}
