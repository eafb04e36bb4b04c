package org.carball.insight.model.capture;

import java.util.List;

/**
 * N+1 patterns and split-query groups found with one set of detection settings.
 */
public record DetectedPatterns(
        int n1Threshold,
        int splitQueryMaxGapMs,
        List<N1Pattern> n1Patterns,
        List<SplitQueryGroup> splitQueries
) {}
