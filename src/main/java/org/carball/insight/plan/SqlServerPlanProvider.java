package org.carball.insight.plan;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.model.plan.QueryPlanResult;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * Plans for SQL Server through {@code SET SHOWPLAN_XML}. The statement is compiled, not executed.
 */
@Slf4j
public class SqlServerPlanProvider extends JdbcQueryPlanProvider {

    public static final String ENGINE = "sqlserver";

    public SqlServerPlanProvider() {
        super(ENGINE, "com.microsoft.sqlserver.jdbc.SQLServerDriver");
    }

    @Override
    protected Properties connectionProperties(int timeoutSeconds) {
        Properties properties = new Properties();
        if (timeoutSeconds > 0) {
            properties.setProperty("loginTimeout", Integer.toString(timeoutSeconds));
        }
        return properties;
    }

    @Override
    protected QueryPlanResult capturePlan(Connection connection, String sql, int timeoutSeconds) throws SQLException {
        String rawPlan = null;

        try (Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(timeoutSeconds);
            statement.execute("SET SHOWPLAN_XML ON");
            try {
                if (statement.execute(sql)) {
                    try (ResultSet rs = statement.getResultSet()) {
                        if (rs.next()) {
                            rawPlan = rs.getString(1);
                        }
                    }
                }
            } finally {
                try {
                    statement.execute("SET SHOWPLAN_XML OFF");
                } catch (SQLException e) {
                    log.debug("Could not reset SHOWPLAN_XML: {}", e.getMessage());
                }
            }
        }

        try {
            return SqlServerPlanParser.parse(sql, rawPlan);
        } catch (IllegalArgumentException e) {
            return QueryPlanResult.failure(sql, ENGINE, e.getMessage())
                    .toBuilder()
                    .rawPlan(rawPlan != null ? rawPlan : "")
                    .build();
        }
    }
}
