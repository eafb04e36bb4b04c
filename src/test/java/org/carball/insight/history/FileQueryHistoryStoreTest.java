package org.carball.insight.history;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.insight.model.history.QueryPatternHistory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

public class FileQueryHistoryStoreTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final Duration NEVER = Duration.ofHours(1);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        logger = (Logger) LoggerFactory.getLogger(FileQueryHistoryStore.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldPersistHistoryAcrossInstances() {
        // Given
        try (FileQueryHistoryStore store = new FileQueryHistoryStore(tempDir, clock, NEVER)) {
            store.recordExecution("h1", "SELECT * FROM Orders WHERE Id = ?", 10);
            store.setBaseline("h1");
            clock.advance(Duration.ofMinutes(1));
            store.recordExecution("h1", "SELECT * FROM Orders WHERE Id = ?", 30);
        }

        // When
        try (FileQueryHistoryStore reloaded = new FileQueryHistoryStore(tempDir, clock, NEVER)) {
            QueryPatternHistory history = reloaded.getPattern("h1").orElseThrow();

            // Then
            assertThat(history.getExecutionCount()).isEqualTo(2);
            assertThat(history.getAvgDurationMs()).isEqualTo(20.0);
            assertThat(history.getBaselineAvgDurationMs()).isEqualTo(10.0);
            assertThat(history.getBaselineSetAt()).isEqualTo(START);
            assertThat(history.getLastSeen()).isEqualTo(START.plusSeconds(60));
            assertThat(history.getRecentSamples()).hasSize(2);
            assertThat(reloaded.getRegressions(20)).hasSize(1);
        }
    }

    @Test
    void shouldWriteVersionedDocument() throws Exception {
        // Given
        FileQueryHistoryStore store = new FileQueryHistoryStore(tempDir, clock, NEVER);
        store.recordExecution("h1", "SELECT 1", 5);

        // When
        store.close();

        // Then
        Path file = tempDir.resolve(FileQueryHistoryStore.HISTORY_FILE_NAME);
        assertThat(store.getHistoryFile()).isEqualTo(file);
        JsonNode document = new ObjectMapper().readTree(file.toFile());
        assertThat(document.get("version").asInt()).isEqualTo(FileQueryHistoryStore.FORMAT_VERSION);
        assertThat(document.get("lastUpdated").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(document.get("patterns")).hasSize(1);
        assertThat(document.get("patterns").get(0).get("patternHash").asText()).isEqualTo("h1");
        assertThat(tempDir.resolve(FileQueryHistoryStore.HISTORY_FILE_NAME + ".tmp")).doesNotExist();
    }

    @Test
    void shouldStartEmptyWhenFileIsCorrupt() throws Exception {
        // Given
        Files.writeString(tempDir.resolve(FileQueryHistoryStore.HISTORY_FILE_NAME), "{ not json");

        // When
        try (FileQueryHistoryStore store = new FileQueryHistoryStore(tempDir, clock, NEVER)) {
            // Then
            assertThat(store.getPatterns()).isEmpty();
        }
        assertThat(logAppender.list)
                .anyMatch(e -> e.getLevel() == Level.WARN && e.getFormattedMessage().contains("is corrupt"));
    }

    @Test
    void shouldFlushOnlyWhenDirty() {
        try (FileQueryHistoryStore store = new FileQueryHistoryStore(tempDir, clock, NEVER)) {
            assertThat(store.isDirty()).isFalse();
            assertThat(store.flush()).isFalse();

            store.recordExecution("h1", "SELECT 1", 5);
            assertThat(store.isDirty()).isTrue();
            assertThat(store.flush()).isTrue();
            assertThat(store.isDirty()).isFalse();
            assertThat(store.flush()).isFalse();
        }
    }

    @Test
    void shouldFlushPeriodicallyInBackground() throws Exception {
        try (FileQueryHistoryStore store = new FileQueryHistoryStore(tempDir, clock, Duration.ofMillis(50))) {
            store.recordExecution("h1", "SELECT 1", 5);

            long deadline = System.currentTimeMillis() + 5_000;
            while (Files.notExists(store.getHistoryFile()) && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }

            assertThat(store.getHistoryFile()).exists();
        }
    }

    @Test
    void shouldCreateMissingStorageDirectory() {
        Path nested = tempDir.resolve("a").resolve("b");

        try (FileQueryHistoryStore store = new FileQueryHistoryStore(nested, clock, NEVER)) {
            assertThat(nested).isDirectory();
            assertThat(store.getPatterns()).isEmpty();
        }
    }
}
