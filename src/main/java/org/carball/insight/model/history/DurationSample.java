package org.carball.insight.model.history;

import java.time.Instant;

/**
 * One timed execution of a pattern.
 */
public record DurationSample(Instant timestamp, double durationMs) {}
