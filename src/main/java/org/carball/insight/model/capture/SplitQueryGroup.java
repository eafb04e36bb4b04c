package org.carball.insight.model.capture;

import java.util.List;
import java.util.UUID;

/**
 * Differently shaped statements fired back to back within one request.
 */
public record SplitQueryGroup(
        String requestId,
        String requestPath,
        int queryCount,
        List<UUID> queryIds,
        double totalDurationMs,
        List<String> tables
) {}
