package org.carball.insight.plan;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

public class JdbcQueryPlanProviderTest {

    @Test
    void shouldBoundPostgresLoginAndConnectTime() {
        Properties properties = new PostgresPlanProvider().connectionProperties(3);

        assertThat(properties.getProperty("loginTimeout")).isEqualTo("3");
        assertThat(properties.getProperty("connectTimeout")).isEqualTo("3");
    }

    @Test
    void shouldBoundSqlServerLoginTime() {
        Properties properties = new SqlServerPlanProvider().connectionProperties(5);

        assertThat(properties.getProperty("loginTimeout")).isEqualTo("5");
    }

    @Test
    void shouldLeaveDriverDefaultsWithoutTimeout() {
        assertThat(new PostgresPlanProvider().connectionProperties(0)).isEmpty();
        assertThat(new SqlServerPlanProvider().connectionProperties(0)).isEmpty();
        assertThat(new SqlitePlanProvider().connectionProperties(5)).isEmpty();
    }
}
