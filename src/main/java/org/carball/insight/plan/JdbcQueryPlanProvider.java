package org.carball.insight.plan;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.model.plan.QueryPlanResult;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Properties;

/**
 * Opens a JDBC connection for the given URL, runs the engine's EXPLAIN command and maps any
 * failure to an unsuccessful result.
 */
@Slf4j
public abstract class JdbcQueryPlanProvider implements QueryPlanProvider {

    private final String engine;

    /**
     * @throws IllegalStateException when the JDBC driver is not on the classpath
     */
    protected JdbcQueryPlanProvider(String engine, String driverClassName) {
        this.engine = engine;
        try {
            Class.forName(driverClassName);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("JDBC driver not available for " + engine + ": " + driverClassName, e);
        }
    }

    @Override
    public String getEngine() {
        return engine;
    }

    @Override
    public QueryPlanResult getPlan(String sql, String connectionInfo, Duration timeout) {
        if (sql == null || sql.isBlank()) {
            return QueryPlanResult.failure(sql, engine, "No SQL statement to explain");
        }
        if (connectionInfo == null || connectionInfo.isBlank()) {
            return QueryPlanResult.failure(sql, engine, "No connection information available for plan capture");
        }

        int timeoutSeconds = toQueryTimeoutSeconds(timeout);
        try (Connection connection = DriverManager.getConnection(connectionInfo, connectionProperties(timeoutSeconds))) {
            QueryPlanResult result = capturePlan(connection, sql, timeoutSeconds);
            log.debug("Captured {} plan with {} issue(s)", engine, result.getIssues().size());
            return result;
        } catch (SQLException | RuntimeException e) {
            log.warn("Plan capture failed for {}: {}", engine, e.getMessage());
            return QueryPlanResult.failure(sql, engine, e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    /**
     * Driver properties for the plan connection. Engines that connect over the network bound
     * login and socket connect time here; settings in the URL take precedence.
     */
    protected Properties connectionProperties(int timeoutSeconds) {
        return new Properties();
    }

    /**
     * Runs the EXPLAIN command on an open connection and parses its output.
     */
    protected abstract QueryPlanResult capturePlan(Connection connection, String sql, int timeoutSeconds)
            throws SQLException;

    static int toQueryTimeoutSeconds(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return 0;
        }
        // JDBC only accepts whole seconds; round up so short timeouts are not disabled
        return (int) Math.max(1, (timeout.toMillis() + 999) / 1000);
    }
}
