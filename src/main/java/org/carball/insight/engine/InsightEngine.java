package org.carball.insight.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.capture.QueryEventFilter;
import org.carball.insight.capture.QueryStore;
import org.carball.insight.config.InsightOptions;
import org.carball.insight.cost.CostCalculator;
import org.carball.insight.history.FileQueryHistoryStore;
import org.carball.insight.history.InMemoryQueryHistoryStore;
import org.carball.insight.history.QueryHistoryStore;
import org.carball.insight.model.capture.DetectedPatterns;
import org.carball.insight.model.capture.QueryEvent;
import org.carball.insight.model.capture.QueryStats;
import org.carball.insight.model.cost.CostReport;
import org.carball.insight.model.history.QueryPatternHistory;
import org.carball.insight.model.history.QueryRegression;
import org.carball.insight.model.plan.QueryPlanResult;
import org.carball.insight.plan.QueryPlanService;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Entry point for capture adapters and reporting layers.
 * <p>
 * {@link #submit(QueryEvent)} is safe to call from any thread and never throws. History
 * updates and reads run on one background thread, so a read observes every event submitted
 * before it. When the history queue is full, further updates are dropped.
 * <p>
 * Plans are captured and cached per statement pattern: while one capture for a pattern is
 * running or its plan is cached, slow executions of the same pattern start no new capture.
 */
@Slf4j
public class InsightEngine implements AutoCloseable {

    static final Duration CLEANUP_INTERVAL = Duration.ofHours(6);
    static final int HISTORY_QUEUE_CAPACITY = 10_000;

    private static final String HISTORY_FEATURE = "query-history";

    private final InsightOptions options;
    private final QueryStore store;
    private final QueryPlanService planService;
    private final QueryHistoryStore historyStore;
    private final CostCalculator costCalculator;
    private final ExecutorService historyExecutor;
    private final ScheduledExecutorService scheduler;
    // Keyed by pattern hash
    private final Map<String, QueryPlanResult> planCache;
    private final Map<String, CompletableFuture<QueryPlanResult>> pendingPlans = new ConcurrentHashMap<>();

    public InsightEngine(InsightOptions options) {
        this(options, new QueryPlanService(options), createHistoryStore(options), new CostCalculator());
    }

    public InsightEngine(InsightOptions options, QueryPlanService planService,
                         QueryHistoryStore historyStore, CostCalculator costCalculator) {
        this(options, planService, historyStore, costCalculator, HISTORY_QUEUE_CAPACITY);
    }

    InsightEngine(InsightOptions options, QueryPlanService planService, QueryHistoryStore historyStore,
                  CostCalculator costCalculator, int historyQueueCapacity) {
        options.validate();
        this.options = options;
        this.store = new QueryStore(Math.max(1, options.getMaxStoredQueries()),
                options.getN1Threshold(), options.getSplitQueryMaxGapMs());
        this.planService = planService;
        this.historyStore = options.isEnableQueryHistory() ? historyStore : null;
        this.costCalculator = costCalculator;
        this.planCache = Collections.synchronizedMap(boundedCache(Math.max(1, options.getPlanCacheSize())));
        this.historyExecutor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(historyQueueCapacity), r -> daemon(r, "insight-history"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "insight-scheduler"));

        if (this.historyStore != null) {
            long intervalMs = CLEANUP_INTERVAL.toMillis();
            scheduler.scheduleAtFixedRate(this::scheduleCleanup, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }

        log.info("Query insight started: {}", options.getConfigurationSummary());
    }

    private static Thread daemon(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }

    private static QueryHistoryStore createHistoryStore(InsightOptions options) {
        if (!options.isEnableQueryHistory()) {
            return null;
        }
        return options.getHistoryStoragePath() != null
                ? new FileQueryHistoryStore(options.getHistoryStoragePath())
                : new InMemoryQueryHistoryStore();
    }

    private static <K, V> Map<K, V> boundedCache(int maxEntries) {
        return new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > maxEntries;
            }
        };
    }

    // ---------------------------------------------------------------- capture

    /**
     * Records an executed statement. Failures are logged, never thrown.
     */
    public void submit(QueryEvent event) {
        if (event == null) {
            return;
        }
        try {
            store.add(event);
            log.debug("Captured query {} ({} ms)", event.getId(), event.getDurationMs());

            if (historyStore != null && !event.isError()) {
                recordHistoryAsync(event);
            }
            if (shouldCapturePlan(event)) {
                capturePlanAsync(event);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to process captured query {}: {}", event.getId(), e.getMessage());
        }
    }

    private void recordHistoryAsync(QueryEvent event) {
        try {
            historyExecutor.execute(() -> recordHistory(event));
        } catch (RejectedExecutionException e) {
            log.debug("History queue full or engine closed, dropped history update for query {}", event.getId());
        }
    }

    private void recordHistory(QueryEvent event) {
        try {
            historyStore.recordExecution(event.getPatternHash(), event.getNormalizedSql(), event.getDurationMs());
        } catch (RuntimeException e) {
            log.error("Failed to record history for query {}", event.getId(), e);
        }
    }

    boolean shouldCapturePlan(QueryEvent event) {
        int threshold = options.getQueryPlanAnalysisThresholdMs();
        return planService.isEnabled()
                && threshold > 0
                && event.getDurationMs() >= threshold
                && !event.isError()
                && event.getEngine() != null
                && event.getConnectionInfo() != null
                && planService.isEngineSupported(event.getEngine());
    }

    private void capturePlanAsync(QueryEvent event) {
        String patternHash = event.getPatternHash();
        if (planCache.containsKey(patternHash)) {
            return;
        }
        CompletableFuture<QueryPlanResult> pending = new CompletableFuture<>();
        if (pendingPlans.putIfAbsent(patternHash, pending) != null) {
            log.debug("Plan capture for pattern {} already running, query {} skipped", patternHash, event.getId());
            return;
        }

        planService.getPlanAsync(event.getSql(), event.getEngine(), event.getConnectionInfo())
                .whenComplete((result, error) -> {
                    if (result != null && result.isSuccess()) {
                        planCache.put(patternHash, result);
                        log.debug("Cached plan for pattern {} ({} issue(s))", patternHash, result.getIssues().size());
                    } else {
                        log.debug("Automatic plan capture for query {} failed: {}", event.getId(),
                                result != null ? result.getErrorMessage() : error);
                    }
                    // No pending entry means the cache is settled
                    pendingPlans.remove(patternHash, pending);
                    if (error != null) {
                        pending.completeExceptionally(error);
                    } else {
                        pending.complete(result);
                    }
                });
    }

    // ---------------------------------------------------------------- queries

    public List<QueryEvent> listQueries(QueryEventFilter filter) {
        List<QueryEvent> all = store.getAll();
        return (filter != null ? filter : QueryEventFilter.NONE)
                .apply(all, options.getN1Threshold(), options.getSplitQueryMaxGapMs());
    }

    public Optional<QueryEvent> getQuery(UUID id) {
        return store.getById(id);
    }

    public List<QueryEvent> getQueriesByRequest(String requestId) {
        return store.getByRequestId(requestId);
    }

    public void clearQueries() {
        store.clear();
        planCache.clear();
        log.info("Cleared captured queries");
    }

    public QueryStats getStats() {
        return store.getStats();
    }

    public DetectedPatterns getPatterns() {
        return getPatterns(options.getN1Threshold(), options.getSplitQueryMaxGapMs());
    }

    public DetectedPatterns getPatterns(int n1Threshold, int splitQueryMaxGapMs) {
        return new DetectedPatterns(n1Threshold, splitQueryMaxGapMs,
                store.detectN1(n1Threshold), store.detectSplitQueries(splitQueryMaxGapMs));
    }

    // ---------------------------------------------------------------- plans

    /**
     * Plan for a captured query's pattern: the cached one when available, the running
     * automatic capture when there is one, otherwise a fresh capture. Empty when no query has
     * the id.
     */
    public Optional<QueryPlanResult> analyzePlan(UUID id) {
        Optional<QueryEvent> found = store.getById(id);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        QueryEvent event = found.get();
        String patternHash = event.getPatternHash();

        QueryPlanResult cached = planCache.get(patternHash);
        if (cached != null) {
            return Optional.of(cached);
        }

        if (event.getEngine() == null || event.getConnectionInfo() == null) {
            return Optional.of(QueryPlanResult.failure(event.getSql(), event.getEngine(),
                    "Query has no database engine or connection information; plan analysis needs both"));
        }

        CompletableFuture<QueryPlanResult> pending = pendingPlans.get(patternHash);
        if (pending != null) {
            try {
                return Optional.of(pending.join());
            } catch (CompletionException | CancellationException e) {
                log.debug("Pending plan capture for pattern {} failed, capturing again: {}", patternHash, e.getMessage());
            }
        }

        QueryPlanResult result = planService.getPlan(event.getSql(), event.getEngine(), event.getConnectionInfo());
        if (result.isSuccess()) {
            planCache.put(patternHash, result);
        }
        return Optional.of(result);
    }

    /**
     * The in-flight automatic plan capture for a query's pattern, if one is running.
     */
    Optional<CompletableFuture<QueryPlanResult>> pendingPlan(UUID id) {
        return store.getById(id)
                .map(QueryEvent::getPatternHash)
                .map(pendingPlans::get);
    }

    // ---------------------------------------------------------------- reports

    public CostReport getCostReport() {
        return costCalculator.calculate(store);
    }

    public boolean isHistoryEnabled() {
        return historyStore != null;
    }

    public List<QueryPatternHistory> getHistoryPatterns() {
        return onHistoryThread(historyStore()::getPatterns);
    }

    public Optional<QueryPatternHistory> getHistoryPattern(String patternHash) {
        QueryHistoryStore history = historyStore();
        return onHistoryThread(() -> history.getPattern(patternHash));
    }

    public List<QueryRegression> getRegressions() {
        return getRegressions(QueryHistoryStore.DEFAULT_REGRESSION_THRESHOLD_PERCENT);
    }

    public List<QueryRegression> getRegressions(double thresholdPercent) {
        QueryHistoryStore history = historyStore();
        return onHistoryThread(() -> history.getRegressions(thresholdPercent));
    }

    /**
     * @return false when the pattern has no history yet
     */
    public boolean setBaseline(String patternHash) {
        QueryHistoryStore history = historyStore();
        return onHistoryThread(() -> history.setBaseline(patternHash));
    }

    private QueryHistoryStore historyStore() {
        if (historyStore == null) {
            throw new InsightFeatureDisabledException(HISTORY_FEATURE,
                    "Query history is disabled. Enable it with enableQueryHistory=true");
        }
        return historyStore;
    }

    // Queued behind pending history updates
    private <T> T onHistoryThread(Supplier<T> action) {
        try {
            Callable<T> task = action::get;
            return historyExecutor.submit(task).get();
        } catch (RejectedExecutionException e) {
            return action.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return action.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

    private void scheduleCleanup() {
        try {
            historyExecutor.execute(this::runCleanup);
        } catch (RejectedExecutionException e) {
            log.debug("History queue full or engine closed, cleanup skipped");
        }
    }

    private void runCleanup() {
        try {
            historyStore.cleanup(options.getHistoryRetentionDays());
        } catch (RuntimeException e) {
            log.error("History cleanup failed", e);
        }
    }

    public InsightOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        historyExecutor.shutdown();
        try {
            if (!historyExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                historyExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            historyExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        planService.close();
        if (historyStore != null) {
            historyStore.close();
        }
        log.info("Query insight stopped");
    }
}
