package org.carball.insight.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.carball.insight.analyzer.SqlStatementClassifier;
import org.carball.insight.model.plan.QueryPlanResult;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * Plans for PostgreSQL. Reads are explained with {@code ANALYZE} so actual row counts are
 * available; everything else only gets an estimated plan. The work runs in a transaction
 * that is always rolled back.
 */
public class PostgresPlanProvider extends JdbcQueryPlanProvider {

    public static final String ENGINE = "postgresql";

    public PostgresPlanProvider() {
        super(ENGINE, "org.postgresql.Driver");
    }

    static String explainCommand(String sql) {
        return SqlStatementClassifier.isRead(sql)
                ? "EXPLAIN (ANALYZE, BUFFERS, FORMAT JSON) " + sql
                : "EXPLAIN (FORMAT JSON) " + sql;
    }

    @Override
    protected Properties connectionProperties(int timeoutSeconds) {
        Properties properties = new Properties();
        if (timeoutSeconds > 0) {
            properties.setProperty("loginTimeout", Integer.toString(timeoutSeconds));
            properties.setProperty("connectTimeout", Integer.toString(timeoutSeconds));
        }
        return properties;
    }

    @Override
    protected QueryPlanResult capturePlan(Connection connection, String sql, int timeoutSeconds) throws SQLException {
        String rawPlan = null;
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try (Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(timeoutSeconds);
            try (ResultSet rs = statement.executeQuery(explainCommand(sql))) {
                if (rs.next()) {
                    rawPlan = rs.getString(1);
                }
            }
        } finally {
            connection.rollback();
            connection.setAutoCommit(autoCommit);
        }

        try {
            return PostgresPlanParser.parse(sql, rawPlan);
        } catch (JsonProcessingException e) {
            return QueryPlanResult.failure(sql, ENGINE, "Could not parse plan JSON: " + e.getOriginalMessage())
                    .toBuilder()
                    .rawPlan(rawPlan != null ? rawPlan : "")
                    .build();
        }
    }
}
