package org.carball.insight.parser;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.insight.model.capture.QueryEvent;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reads captured queries from a JSON capture file, either the exporter's document or a bare
 * array of query objects. Entries without SQL text are skipped.
 */
@Slf4j
public class QueryEventFileLoader {

    private static final TypeReference<LinkedHashMap<String, Object>> PARAMETER_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonNode queries;

    public QueryEventFileLoader(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Capture file not found: " + path);
        }

        JsonNode root = objectMapper.readTree(Files.readString(path));
        this.queries = root != null && root.isArray() ? root : root != null ? root.get("queries") : null;

        validateFormat();
    }

    public int getQueryCount() {
        return queries.size();
    }

    /**
     * Parses all queries in file order.
     */
    public List<QueryEvent> getAllQueries() {
        List<QueryEvent> results = new ArrayList<>();
        int index = 0;
        for (JsonNode queryNode : queries) {
            try {
                QueryEvent event = parseQueryFromJson(queryNode);
                if (event != null) {
                    results.add(event);
                } else {
                    log.warn("Skipping query #{}: no sql text", index);
                }
            } catch (IllegalArgumentException | DateTimeParseException e) {
                log.warn("Skipping query #{}: {}", index, e.getMessage());
            }
            index++;
        }
        log.debug("Loaded {} of {} queries", results.size(), queries.size());
        return results;
    }

    private void validateFormat() {
        if (queries == null || !queries.isArray()) {
            throw new IllegalStateException("Missing or invalid queries section in capture file");
        }
    }

    private QueryEvent parseQueryFromJson(JsonNode node) {
        String sql = text(node, "sql");
        if (sql == null) {
            return null;
        }

        QueryEvent.QueryEventBuilder builder = QueryEvent.builder()
                .sql(sql)
                .durationMs(node.path("durationMs").asDouble(0))
                .requestId(text(node, "requestId"))
                .requestPath(text(node, "requestPath"))
                .httpMethod(text(node, "httpMethod"))
                .commandType(text(node, "commandType"))
                .error(node.path("error").asBoolean(false))
                .errorMessage(text(node, "errorMessage"))
                .callSite(text(node, "callSite"))
                .callingMethod(text(node, "callingMethod"))
                .engine(text(node, "engine"))
                .connectionInfo(text(node, "connectionInfo"));

        String id = text(node, "id");
        if (id != null) {
            builder.id(UUID.fromString(id));
        }
        String timestamp = text(node, "timestamp");
        if (timestamp != null) {
            builder.timestamp(Instant.parse(timestamp));
        }
        if (node.hasNonNull("rowsAffected")) {
            builder.rowsAffected(node.get("rowsAffected").asInt());
        }
        if (node.path("parameters").isObject()) {
            Map<String, Object> parameters = objectMapper.convertValue(node.get("parameters"), PARAMETER_MAP);
            builder.parameters(parameters);
        }
        if (node.path("stackTrace").isArray()) {
            List<String> frames = new ArrayList<>();
            node.get("stackTrace").forEach(frame -> frames.add(frame.asText()));
            builder.stackTrace(frames);
        }

        return builder.build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
