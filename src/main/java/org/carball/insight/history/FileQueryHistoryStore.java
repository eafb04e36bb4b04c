package org.carball.insight.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * History persisted to {@code history.json} in a storage directory.
 * <p>
 * The file is read once on construction. A background task rewrites it whenever the state
 * changed since the last flush, and {@link #close()} performs a final flush. Load and save
 * failures are logged and never surface to callers.
 */
@Slf4j
public class FileQueryHistoryStore extends AbstractQueryHistoryStore {

    public static final String HISTORY_FILE_NAME = "history.json";
    public static final String DEFAULT_STORAGE_DIRECTORY = ".query-insight";
    public static final int FORMAT_VERSION = 1;
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(30);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path historyFile;
    private final AtomicBoolean dirty = new AtomicBoolean();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final ScheduledExecutorService flusher;

    /**
     * Persisted document layout.
     */
    record HistoryDocument(int version, Instant lastUpdated, List<PatternRecord> patterns) {}

    public FileQueryHistoryStore(String storagePath) {
        this(storagePath != null ? Paths.get(storagePath) : Paths.get(DEFAULT_STORAGE_DIRECTORY),
                Clock.systemUTC(), DEFAULT_FLUSH_INTERVAL);
    }

    public FileQueryHistoryStore(Path storageDirectory, Clock clock, Duration flushInterval) {
        super(clock);
        this.historyFile = storageDirectory.resolve(HISTORY_FILE_NAME);

        try {
            Files.createDirectories(storageDirectory);
        } catch (IOException e) {
            log.warn("Could not create history directory {}: {}", storageDirectory, e.getMessage());
        }
        load();

        this.flusher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "insight-history-flush");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = flushInterval.toMillis();
        flusher.scheduleWithFixedDelay(this::flushQuietly, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public Path getHistoryFile() {
        return historyFile;
    }

    public boolean isDirty() {
        return dirty.get();
    }

    @Override
    protected void markDirty() {
        dirty.set(true);
    }

    /**
     * Writes the history file if anything changed since the last successful flush.
     *
     * @return true when the file was written
     */
    public boolean flush() {
        writeLock.lock();
        try {
            if (!dirty.getAndSet(false)) {
                return false;
            }
            try {
                write();
                return true;
            } catch (IOException e) {
                dirty.set(true);
                log.warn("Failed to save query history to {}: {}", historyFile, e.getMessage());
                return false;
            }
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() {
        flusher.shutdownNow();
        flush();
    }

    private void flushQuietly() {
        try {
            flush();
        } catch (RuntimeException e) {
            log.error("Unexpected failure flushing query history", e);
        }
    }

    private void write() throws IOException {
        HistoryDocument document = new HistoryDocument(FORMAT_VERSION, clock.instant(), List.copyOf(snapshot()));
        Path temp = historyFile.resolveSibling(HISTORY_FILE_NAME + ".tmp");
        Files.write(temp, MAPPER.writeValueAsBytes(document));
        try {
            Files.move(temp, historyFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, historyFile, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Saved {} pattern(s) to {}", document.patterns().size(), historyFile);
    }

    private void load() {
        if (!Files.exists(historyFile)) {
            log.debug("No history file at {}, starting empty", historyFile);
            return;
        }

        try {
            HistoryDocument document = MAPPER.readValue(historyFile.toFile(), HistoryDocument.class);
            if (document == null || document.patterns() == null) {
                return;
            }
            if (document.version() != FORMAT_VERSION) {
                log.warn("History file {} has version {}, expected {}", historyFile, document.version(), FORMAT_VERSION);
            }
            restore(document.patterns());
            log.info("Loaded {} query pattern(s) from {}", document.patterns().size(), historyFile);
        } catch (JsonProcessingException e) {
            log.warn("History file {} is corrupt, starting with empty history: {}", historyFile, e.getOriginalMessage());
        } catch (IOException e) {
            log.warn("Could not read history file {}, starting with empty history: {}", historyFile, e.getMessage());
        }
    }
}
