package org.carball.insight.capture;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.analyzer.PatternDetector;
import org.carball.insight.model.capture.ConnectionSummary;
import org.carball.insight.model.capture.N1Pattern;
import org.carball.insight.model.capture.QueryEvent;
import org.carball.insight.model.capture.QueryStats;
import org.carball.insight.model.capture.SplitQueryGroup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Bounded, lock-free buffer of captured queries. Oldest events are evicted first once the
 * configured size is exceeded; every read works on a copied snapshot.
 */
@Slf4j
public class QueryStore {

    public static final int DEFAULT_MAX_SIZE = 1000;
    public static final int DEFAULT_N1_THRESHOLD = 3;
    public static final int DEFAULT_SPLIT_MAX_GAP_MS = 50;

    private final ConcurrentLinkedDeque<QueryEvent> events = new ConcurrentLinkedDeque<>();
    private final AtomicInteger count = new AtomicInteger();
    private final int maxSize;
    private final int n1Threshold;
    private final int splitMaxGapMs;

    public QueryStore() {
        this(DEFAULT_MAX_SIZE);
    }

    public QueryStore(int maxSize) {
        this(maxSize, DEFAULT_N1_THRESHOLD, DEFAULT_SPLIT_MAX_GAP_MS);
    }

    public QueryStore(int maxSize, int n1Threshold, int splitMaxGapMs) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.n1Threshold = n1Threshold;
        this.splitMaxGapMs = splitMaxGapMs;
    }

    /**
     * Appends an event, evicting the oldest entries beyond the bound. Never throws.
     */
    public void add(QueryEvent event) {
        if (event == null) {
            log.debug("Ignoring null query event");
            return;
        }

        events.addLast(event);
        int size = count.incrementAndGet();
        while (size > maxSize) {
            if (events.pollFirst() == null) {
                break;
            }
            size = count.decrementAndGet();
        }
    }

    /**
     * All retained events, newest first.
     */
    public List<QueryEvent> getAll() {
        List<QueryEvent> snapshot = snapshot();
        Collections.reverse(snapshot);
        return snapshot;
    }

    public Optional<QueryEvent> getById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return snapshot().stream()
                .filter(e -> id.equals(e.getId()))
                .findFirst();
    }

    /**
     * Events that belong to one request, newest first. Unknown ids give an empty list.
     */
    public List<QueryEvent> getByRequestId(String requestId) {
        if (requestId == null) {
            return List.of();
        }
        return getAll().stream()
                .filter(e -> requestId.equals(e.getRequestId()))
                .collect(Collectors.toList());
    }

    public void clear() {
        QueryEvent removed;
        while ((removed = events.pollFirst()) != null) {
            count.decrementAndGet();
            log.trace("Cleared query {}", removed.getId());
        }
        log.debug("Query store cleared");
    }

    /**
     * Number of retained events, never above the configured maximum.
     */
    public int getCount() {
        return Math.max(0, Math.min(count.get(), maxSize));
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int getN1Threshold() {
        return n1Threshold;
    }

    public int getSplitMaxGapMs() {
        return splitMaxGapMs;
    }

    public QueryStats getStats() {
        return getStats(n1Threshold, splitMaxGapMs);
    }

    public QueryStats getStats(int n1Threshold, int splitMaxGapMs) {
        List<QueryEvent> snapshot = snapshot();
        if (snapshot.isEmpty()) {
            return QueryStats.empty();
        }

        double total = 0;
        double min = Double.MAX_VALUE;
        double max = 0;
        int errors = 0;
        Map<String, Integer> perRequest = new LinkedHashMap<>();

        for (QueryEvent event : snapshot) {
            double duration = event.getDurationMs();
            total += duration;
            min = Math.min(min, duration);
            max = Math.max(max, duration);
            if (event.isError()) {
                errors++;
            }
            if (event.hasRequestId()) {
                perRequest.merge(event.getRequestId(), 1, Integer::sum);
            }
        }

        return QueryStats.builder()
                .totalQueries(snapshot.size())
                .errorCount(errors)
                .averageDurationMs(total / snapshot.size())
                .minDurationMs(min)
                .maxDurationMs(max)
                .totalDurationMs(total)
                .queriesPerRequest(Collections.unmodifiableMap(perRequest))
                .n1Patterns(PatternDetector.detectN1(snapshot, n1Threshold))
                .splitQueryGroups(PatternDetector.detectSplitQueries(snapshot, splitMaxGapMs))
                .connections(summarizeConnections(snapshot))
                .build();
    }

    public List<N1Pattern> detectN1(int threshold) {
        return PatternDetector.detectN1(snapshot(), threshold);
    }

    public List<SplitQueryGroup> detectSplitQueries(int maxGapMs) {
        return PatternDetector.detectSplitQueries(snapshot(), maxGapMs);
    }

    // Oldest first, trimmed to the newest maxSize entries
    private List<QueryEvent> snapshot() {
        List<QueryEvent> copy = new ArrayList<>(events);
        if (copy.size() > maxSize) {
            copy = new ArrayList<>(copy.subList(copy.size() - maxSize, copy.size()));
        }
        return copy;
    }

    private List<ConnectionSummary> summarizeConnections(List<QueryEvent> snapshot) {
        Map<String, ConnectionAccumulator> byKey = new LinkedHashMap<>();

        for (QueryEvent event : snapshot) {
            String engine = event.getEngine();
            if (engine == null && event.getConnectionInfo() != null) {
                engine = ConnectionStringHelper.detectEngine(event.getConnectionInfo());
            }
            if (engine == null) {
                continue;
            }

            String databaseId = ConnectionStringHelper.sanitizeDatabaseId(event.getConnectionInfo(), engine);
            String key = engine + "|" + databaseId;
            String finalEngine = engine;
            byKey.computeIfAbsent(key, k -> new ConnectionAccumulator(finalEngine, databaseId)).count++;
        }

        return byKey.values().stream()
                .map(a -> new ConnectionSummary(a.engine,
                        ConnectionStringHelper.getFriendlyEngineName(a.engine), a.databaseId, a.count))
                .sorted(Comparator.comparingLong(ConnectionSummary::queryCount).reversed())
                .collect(Collectors.toList());
    }

    private static final class ConnectionAccumulator {
        private final String engine;
        private final String databaseId;
        private long count;

        private ConnectionAccumulator(String engine, String databaseId) {
            this.engine = engine;
            this.databaseId = databaseId;
        }
    }
}
