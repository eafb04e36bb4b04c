package org.carball.insight.plan;

import org.carball.insight.model.plan.QueryPlanResult;

import java.time.Duration;

/**
 * Captures and interprets the execution plan of a statement for one database engine.
 * Implementations never throw; failures come back as an unsuccessful {@link QueryPlanResult}.
 */
public interface QueryPlanProvider {

    /**
     * Registry key, e.g. {@code sqlite}.
     */
    String getEngine();

    QueryPlanResult getPlan(String sql, String connectionInfo, Duration timeout);
}
