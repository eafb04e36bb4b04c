package org.carball.insight.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.model.capture.N1Pattern;
import org.carball.insight.model.capture.QueryEvent;
import org.carball.insight.model.capture.SplitQueryGroup;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Detects repeated-statement storms (N+1) and tightly clustered differently shaped statements
 * (split queries) inside individual requests. Pure functions over event snapshots.
 */
@Slf4j
public final class PatternDetector {

    // FROM Orders, JOIN "OrderItems", JOIN [dbo].[Products]
    private static final Pattern TABLE_PATTERN = Pattern.compile(
            "\\b(?:FROM|JOIN)\\s+(?:[\"'`\\[]?\\w+[\"'`\\]]?\\.)?[\"'`\\[]?(\\w+)[\"'`\\]]?",
            Pattern.CASE_INSENSITIVE);

    private static final Set<String> SQL_KEYWORDS = Set.of(
            "SELECT", "LATERAL", "WHERE", "AS", "ON", "ONLY", "JOIN", "INNER", "LEFT", "RIGHT",
            "OUTER", "CROSS", "FULL", "UNNEST", "VALUES", "WITH", "AND", "OR", "NOT", "NULL");

    private PatternDetector() {
        // Utility class - prevent instantiation
    }

    /**
     * Groups events by request and normalized statement and reports groups of at least
     * {@code threshold} members. Events without a request id are ignored.
     */
    public static List<N1Pattern> detectN1(List<QueryEvent> events, int threshold) {
        Map<String, Map<String, List<QueryEvent>>> byRequest = groupByRequest(events).entrySet().stream()
                .collect(Collectors.toMap(
                        Map.Entry::getKey,
                        e -> e.getValue().stream().collect(Collectors.groupingBy(
                                QueryEvent::getNormalizedSql, LinkedHashMap::new, Collectors.toList())),
                        (a, b) -> a,
                        LinkedHashMap::new));

        List<N1Pattern> patterns = new ArrayList<>();
        for (Map.Entry<String, Map<String, List<QueryEvent>>> request : byRequest.entrySet()) {
            for (Map.Entry<String, List<QueryEvent>> group : request.getValue().entrySet()) {
                List<QueryEvent> members = group.getValue();
                if (members.size() < threshold) {
                    continue;
                }

                double total = members.stream().mapToDouble(QueryEvent::getDurationMs).sum();
                QueryEvent first = members.get(0);
                patterns.add(new N1Pattern(
                        group.getKey(),
                        first.getPatternHash(),
                        members.size(),
                        request.getKey(),
                        firstRequestPath(members),
                        members.stream().map(QueryEvent::getId).collect(Collectors.toList()),
                        total,
                        total / members.size()));
            }
        }

        patterns.sort(Comparator.comparingInt(N1Pattern::count).reversed()
                .thenComparing(Comparator.comparingDouble(N1Pattern::totalDurationMs).reversed()));

        if (!patterns.isEmpty()) {
            log.debug("Detected {} N+1 pattern(s) with threshold {}", patterns.size(), threshold);
        }
        return patterns;
    }

    /**
     * Walks each request's events in time order and cuts a new cluster whenever the previous
     * event ended more than {@code maxGapMs} before the current one started. Clusters with at
     * least two members and two distinct statements are reported.
     */
    public static List<SplitQueryGroup> detectSplitQueries(List<QueryEvent> events, int maxGapMs) {
        List<SplitQueryGroup> groups = new ArrayList<>();
        Duration maxGap = Duration.ofMillis(maxGapMs);

        for (Map.Entry<String, List<QueryEvent>> request : groupByRequest(events).entrySet()) {
            List<QueryEvent> ordered = new ArrayList<>(request.getValue());
            ordered.sort(Comparator.comparing(QueryEvent::getTimestamp));

            List<QueryEvent> cluster = new ArrayList<>();
            QueryEvent previous = null;
            for (QueryEvent current : ordered) {
                if (previous != null
                        && Duration.between(previous.getEndTime(), current.getTimestamp()).compareTo(maxGap) > 0) {
                    addIfSplit(groups, request.getKey(), cluster);
                    cluster = new ArrayList<>();
                }
                cluster.add(current);
                previous = current;
            }
            addIfSplit(groups, request.getKey(), cluster);
        }

        if (!groups.isEmpty()) {
            log.debug("Detected {} split query group(s) with max gap {}ms", groups.size(), maxGapMs);
        }
        return groups;
    }

    /**
     * Table names referenced in FROM and JOIN clauses, sorted and unique ignoring case.
     */
    public static List<String> extractTables(String sql) {
        Set<String> tables = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        if (sql == null) {
            return List.of();
        }

        Matcher matcher = TABLE_PATTERN.matcher(sql);
        while (matcher.find()) {
            String table = matcher.group(1);
            if (!SQL_KEYWORDS.contains(table.toUpperCase(Locale.ROOT)) && !Character.isDigit(table.charAt(0))) {
                tables.add(table);
            }
        }
        return new ArrayList<>(tables);
    }

    private static void addIfSplit(List<SplitQueryGroup> groups, String requestId, List<QueryEvent> cluster) {
        if (cluster.size() < 2) {
            return;
        }

        Set<String> shapes = new HashSet<>();
        cluster.forEach(e -> shapes.add(e.getNormalizedSql()));
        if (shapes.size() < 2) {
            return;
        }

        Set<String> tables = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        cluster.forEach(e -> tables.addAll(extractTables(e.getSql())));

        groups.add(new SplitQueryGroup(
                requestId,
                firstRequestPath(cluster),
                cluster.size(),
                cluster.stream().map(QueryEvent::getId).collect(Collectors.toList()),
                cluster.stream().mapToDouble(QueryEvent::getDurationMs).sum(),
                new ArrayList<>(tables)));
    }

    private static Map<String, List<QueryEvent>> groupByRequest(List<QueryEvent> events) {
        return events.stream()
                .filter(e -> e != null && e.hasRequestId())
                .collect(Collectors.groupingBy(QueryEvent::getRequestId, LinkedHashMap::new, Collectors.toList()));
    }

    private static String firstRequestPath(List<QueryEvent> events) {
        return events.stream()
                .map(QueryEvent::getRequestPath)
                .filter(p -> p != null && !p.isEmpty())
                .findFirst()
                .orElse(null);
    }
}
