package org.carball.insight.model.capture;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.carball.insight.capture.SqlNormalizer;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A single executed SQL statement as reported by a capture adapter.
 * Immutable once built; the normalized form and pattern hash are computed on first use.
 */
@Getter
@ToString(exclude = {"connectionInfo", "parameters", "stackTrace"})
public final class QueryEvent {

    private final UUID id;
    private final Instant timestamp;
    private final String sql;
    private final Map<String, Object> parameters;
    private final double durationMs;
    private final Integer rowsAffected;
    private final String requestId;
    private final String requestPath;
    private final String httpMethod;
    private final String commandType;
    private final boolean error;
    private final String errorMessage;
    private final String callSite;
    private final String callingMethod;
    private final List<String> stackTrace;
    private final String engine;

    // JDBC URL used for plan capture; may carry credentials
    @JsonIgnore
    private final String connectionInfo;

    @Getter(AccessLevel.NONE)
    private volatile String normalizedSql;

    @Getter(AccessLevel.NONE)
    private volatile String patternHash;

    @Builder(toBuilder = true)
    private QueryEvent(UUID id, Instant timestamp, String sql, Map<String, Object> parameters,
                       double durationMs, Integer rowsAffected, String requestId, String requestPath,
                       String httpMethod, String commandType, boolean error, String errorMessage,
                       String callSite, String callingMethod, List<String> stackTrace,
                       String engine, String connectionInfo) {
        this.id = id != null ? id : UUID.randomUUID();
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.sql = sql != null ? sql : "";
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
        this.durationMs = durationMs;
        this.rowsAffected = rowsAffected;
        this.requestId = requestId;
        this.requestPath = requestPath;
        this.httpMethod = httpMethod;
        this.commandType = commandType;
        this.error = error;
        this.errorMessage = errorMessage;
        this.callSite = callSite;
        this.callingMethod = callingMethod;
        this.stackTrace = stackTrace != null ? List.copyOf(stackTrace) : List.of();
        this.engine = engine;
        this.connectionInfo = connectionInfo;
    }

    /**
     * The statement with parameters and literals replaced by placeholders.
     */
    public String getNormalizedSql() {
        String value = normalizedSql;
        if (value == null) {
            value = SqlNormalizer.normalize(sql);
            normalizedSql = value;
        }
        return value;
    }

    /**
     * Stable grouping key derived from {@link #getNormalizedSql()}.
     */
    public String getPatternHash() {
        String value = patternHash;
        if (value == null) {
            value = SqlNormalizer.hash(getNormalizedSql());
            patternHash = value;
        }
        return value;
    }

    /**
     * End of execution, used to measure gaps between consecutive statements.
     */
    @JsonIgnore
    public Instant getEndTime() {
        return timestamp.plusNanos((long) (durationMs * 1_000_000));
    }

    public boolean hasRequestId() {
        return requestId != null && !requestId.isEmpty();
    }
}
