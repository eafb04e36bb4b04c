package org.carball.insight.plan;

import org.carball.insight.model.plan.PlanNode;
import org.carball.insight.model.plan.QueryPlanResult;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Plans for SQLite through {@code EXPLAIN QUERY PLAN}.
 */
public class SqlitePlanProvider extends JdbcQueryPlanProvider {

    public static final String ENGINE = "sqlite";

    public SqlitePlanProvider() {
        super(ENGINE, "org.sqlite.JDBC");
    }

    @Override
    protected QueryPlanResult capturePlan(Connection connection, String sql, int timeoutSeconds) throws SQLException {
        List<SqlitePlanParser.PlanRow> rows = new ArrayList<>();

        try (Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(timeoutSeconds);
            try (ResultSet rs = statement.executeQuery("EXPLAIN QUERY PLAN " + sql)) {
                while (rs.next()) {
                    rows.add(new SqlitePlanParser.PlanRow(rs.getInt(1), rs.getInt(2), rs.getString(4)));
                }
            }
        }

        List<PlanNode> nodes = SqlitePlanParser.buildTree(rows);
        return QueryPlanResult.builder()
                .sql(sql)
                .engine(ENGINE)
                .rawPlan(rows.stream().map(SqlitePlanParser.PlanRow::toRawLine).collect(Collectors.joining("\n")))
                .nodes(nodes)
                .issues(SqlitePlanParser.detectIssues(nodes))
                .build();
    }
}
