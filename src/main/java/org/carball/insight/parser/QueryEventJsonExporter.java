package org.carball.insight.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.carball.insight.model.capture.QueryEvent;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes captured queries to a JSON capture file that {@link QueryEventFileLoader} can replay.
 * Connection information is never written.
 */
public class QueryEventJsonExporter {

    public static final String EXPORT_TYPE = "QUERY_INSIGHT_CAPTURE";

    private final ObjectMapper objectMapper;

    public QueryEventJsonExporter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Exports queries, oldest first, to a JSON file.
     */
    public void exportToJson(List<QueryEvent> queries, Path outputPath) throws IOException {
        Map<String, Object> exportData = new LinkedHashMap<>();

        // Metadata
        exportData.put("exportTimestamp", Instant.now().toString());
        exportData.put("exportType", EXPORT_TYPE);
        exportData.put("totalQueries", queries.size());

        // Query data
        exportData.put("queries", queries);

        // Summary statistics
        exportData.put("summary", createSummary(queries));

        objectMapper.writeValue(outputPath.toFile(), exportData);
    }

    private Map<String, Object> createSummary(List<QueryEvent> queries) {
        Map<String, Object> summary = new LinkedHashMap<>();

        summary.put("totalDurationMs", queries.stream().mapToDouble(QueryEvent::getDurationMs).sum());
        summary.put("avgDurationMs", queries.stream().mapToDouble(QueryEvent::getDurationMs).average().orElse(0.0));
        summary.put("errorCount", queries.stream().filter(QueryEvent::isError).count());
        summary.put("requestCount", queries.stream()
                .filter(QueryEvent::hasRequestId)
                .map(QueryEvent::getRequestId)
                .distinct()
                .count());

        return summary;
    }
}
