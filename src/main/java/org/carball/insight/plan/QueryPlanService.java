package org.carball.insight.plan;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.config.InsightOptions;
import org.carball.insight.model.plan.QueryPlanResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Dispatches plan requests to the provider registered for an engine. Each instance owns its
 * own registry; built-in providers whose JDBC driver is missing are skipped.
 */
@Slf4j
public class QueryPlanService implements AutoCloseable {

    static final int MAX_CONCURRENT_CAPTURES = 4;
    static final int MAX_QUEUED_CAPTURES = 32;

    private final Map<String, QueryPlanProvider> providers = new ConcurrentSkipListMap<>(String.CASE_INSENSITIVE_ORDER);
    private final boolean enabled;
    private final Duration defaultTimeout;
    private final ThreadPoolExecutor executor;

    public QueryPlanService(InsightOptions options) {
        this(options.isEnableQueryPlanAnalysis(), Duration.ofMillis(options.getPlanTimeoutMs()), builtInProviders());
    }

    public QueryPlanService(boolean enabled, Duration defaultTimeout, List<Supplier<QueryPlanProvider>> providerFactories) {
        this.enabled = enabled;
        this.defaultTimeout = defaultTimeout;
        this.executor = new ThreadPoolExecutor(MAX_CONCURRENT_CAPTURES, MAX_CONCURRENT_CAPTURES,
                60L, TimeUnit.SECONDS, new ArrayBlockingQueue<>(MAX_QUEUED_CAPTURES), daemonThreads("insight-plan"));
        this.executor.allowCoreThreadTimeOut(true);

        for (Supplier<QueryPlanProvider> factory : providerFactories) {
            try {
                registerProvider(factory.get());
            } catch (RuntimeException | LinkageError e) {
                log.debug("Plan provider unavailable: {}", e.getMessage());
            }
        }
        log.debug("Plan providers available: {}", getSupportedEngines());
    }

    public static List<Supplier<QueryPlanProvider>> builtInProviders() {
        return List.of(SqlitePlanProvider::new, PostgresPlanProvider::new, SqlServerPlanProvider::new);
    }

    /**
     * Adds a provider, replacing any existing one for the same engine.
     */
    public void registerProvider(QueryPlanProvider provider) {
        providers.put(provider.getEngine(), provider);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isEngineSupported(String engine) {
        return engine != null && providers.containsKey(engine);
    }

    public List<String> getSupportedEngines() {
        return new ArrayList<>(providers.keySet());
    }

    public QueryPlanResult getPlan(String sql, String engine, String connectionInfo) {
        return getPlan(sql, engine, connectionInfo, defaultTimeout);
    }

    /**
     * Captures a plan synchronously. Never throws; every failure is an unsuccessful result.
     */
    public QueryPlanResult getPlan(String sql, String engine, String connectionInfo, Duration timeout) {
        if (!enabled) {
            return QueryPlanResult.failure(sql, engine,
                    "Query plan analysis is disabled. Enable it with enableQueryPlanAnalysis=true");
        }

        QueryPlanProvider provider = engine != null ? providers.get(engine) : null;
        if (provider == null) {
            return QueryPlanResult.failure(sql, engine, String.format(
                    "No query plan provider found for '%s'. Supported engines: %s",
                    engine, String.join(", ", getSupportedEngines())));
        }

        try {
            return provider.getPlan(sql, connectionInfo, timeout);
        } catch (RuntimeException e) {
            log.warn("Plan provider {} failed: {}", engine, e.getMessage());
            return QueryPlanResult.failure(sql, engine, e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    public CompletableFuture<QueryPlanResult> getPlanAsync(String sql, String engine, String connectionInfo) {
        return getPlanAsync(sql, engine, connectionInfo, defaultTimeout);
    }

    /**
     * Captures a plan on the bounded service executor. Once {@code timeout} elapses the future
     * completes with a failed result and the capture is cancelled, interrupting its thread.
     * When every capture slot and queue entry is taken the future completes at once with a
     * failed result.
     */
    public CompletableFuture<QueryPlanResult> getPlanAsync(String sql, String engine, String connectionInfo,
                                                           Duration timeout) {
        CompletableFuture<QueryPlanResult> result = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> {
                result.complete(getPlan(sql, engine, connectionInfo, timeout));
            });
        } catch (RejectedExecutionException e) {
            log.debug("Plan capture for {} rejected: {} running, {} queued", engine,
                    executor.getActiveCount(), executor.getQueue().size());
            result.complete(QueryPlanResult.failure(sql, engine,
                    "Plan capture skipped: too many plan captures in progress"));
            return result;
        }

        QueryPlanResult timedOut = QueryPlanResult.failure(sql, engine,
                "Plan capture timed out after " + timeout.toMillis() + "ms");
        result.completeOnTimeout(timedOut, timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((plan, error) -> {
                    if (plan == timedOut) {
                        task.cancel(true);
                    }
                });
        return result;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
