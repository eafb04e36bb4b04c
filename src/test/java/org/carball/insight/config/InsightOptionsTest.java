package org.carball.insight.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class InsightOptionsTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(InsightOptions.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setAdditive(true);
    }

    @Test
    void shouldCreateDefaultOptions() {
        // When
        InsightOptions options = InsightOptions.defaults();

        // Then
        assertThat(options.getMaxStoredQueries()).isEqualTo(1000);
        assertThat(options.isEnableQueryPlanAnalysis()).isTrue();
        assertThat(options.getQueryPlanAnalysisThresholdMs()).isEqualTo(100);
        assertThat(options.getPlanTimeoutMs()).isEqualTo(5000);
        assertThat(options.getPlanCacheSize()).isEqualTo(100);
        assertThat(options.isEnableQueryHistory()).isFalse();
        assertThat(options.getHistoryRetentionDays()).isEqualTo(7);
        assertThat(options.getHistoryStoragePath()).isNull();
        assertThat(options.getN1Threshold()).isEqualTo(3);
        assertThat(options.getSplitQueryMaxGapMs()).isEqualTo(50);
    }

    @Test
    void shouldOnlyLogDebugForValidOptions() {
        // When
        InsightOptions.defaults().validate();

        // Then
        assertThat(logAppender.list).hasSize(1);
        assertThat(logAppender.list.get(0).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void shouldWarnForNonPositiveStoreSize() {
        InsightOptions.builder().maxStoredQueries(0).build().validate();

        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .singleElement()
                .satisfies(message -> assertThat(message).contains("Max stored queries (0)"));
    }

    @Test
    void shouldWarnWhenStoragePathSetButHistoryDisabled() {
        InsightOptions.builder().historyStoragePath("/tmp/insight").build().validate();

        assertThat(logAppender.list)
                .anyMatch(e -> e.getLevel() == Level.WARN && e.getFormattedMessage().contains("query history is disabled"));
    }

    @Test
    void shouldWarnForLowN1Threshold() {
        InsightOptions.builder().n1Threshold(1).build().validate();

        assertThat(logAppender.list)
                .anyMatch(e -> e.getLevel() == Level.WARN && e.getFormattedMessage().contains("N+1 threshold (1)"));
    }

    @Test
    void shouldDescribeConfiguration() {
        InsightOptions options = InsightOptions.builder()
                .enableQueryHistory(true)
                .historyStoragePath(".query-insight")
                .build();

        assertThat(options.getConfigurationSummary()).isEqualTo(
                "Max stored: 1000 | Plans: on (>= 100ms) | History: on (7 days, .query-insight) | N+1: 3 | Split gap: 50ms");
    }

    @Test
    void shouldParseOutputFormats() {
        assertThat(OutputFormat.fromString("JSON")).isEqualTo(OutputFormat.JSON);
        assertThat(OutputFormat.fromString("md")).isEqualTo(OutputFormat.MARKDOWN);
        assertThat(OutputFormat.fromString("both")).isEqualTo(OutputFormat.BOTH);
        assertThatThrownBy(() -> OutputFormat.fromString("xml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid format: xml");
    }
}
