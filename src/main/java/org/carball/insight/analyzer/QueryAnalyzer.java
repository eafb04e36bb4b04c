package org.carball.insight.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.model.capture.QueryEvent;
import org.carball.insight.model.suggestion.QuerySuggestion;
import org.carball.insight.model.suggestion.SuggestionSeverity;
import org.carball.insight.model.suggestion.SuggestionType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Text heuristics over a single read statement and its observed duration and row count.
 */
@Slf4j
public class QueryAnalyzer {

    static final double INDEX_MIN_DURATION_MS = 50;
    static final double INDEX_HIGH_DURATION_MS = 500;
    static final double JOIN_INDEX_DURATION_MS = 100;
    static final double ORDER_BY_INDEX_DURATION_MS = 200;
    static final int MAX_INDEX_SUGGESTIONS = 3;
    static final int PAGINATION_ROW_LIMIT = 100;
    static final int PAGINATION_HIGH_ROW_LIMIT = 1000;

    private static final String OPEN_QUOTE = "[\"'`\\[]?";
    private static final String CLOSE_QUOTE = "[\"'`\\]]?";
    private static final String IDENTIFIER = OPEN_QUOTE + "(\\w+)" + CLOSE_QUOTE;

    private static final Pattern FROM_TABLE_PATTERN = Pattern.compile(
            "\\bFROM\\s+(?:" + OPEN_QUOTE + "\\w+" + CLOSE_QUOTE + "\\.)?" + IDENTIFIER, Pattern.CASE_INSENSITIVE);

    private static final Pattern JOIN_TABLE_PATTERN = Pattern.compile(
            "\\bJOIN\\s+(?:" + OPEN_QUOTE + "\\w+" + CLOSE_QUOTE + "\\.)?" + IDENTIFIER, Pattern.CASE_INSENSITIVE);

    // FROM Users u, JOIN Orders AS o
    private static final Pattern TABLE_ALIAS_PATTERN = Pattern.compile(
            "\\b(?:FROM|JOIN)\\s+(?:" + OPEN_QUOTE + "\\w+" + CLOSE_QUOTE + "\\.)?" + IDENTIFIER
                    + "(?:\\s+(?:AS\\s+)?" + IDENTIFIER + ")?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LEFT_JOIN_PATTERN = Pattern.compile("\\bLEFT\\s+(?:OUTER\\s+)?JOIN\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern JOIN_PATTERN = Pattern.compile("\\bJOIN\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern WHERE_PATTERN = Pattern.compile("\\bWHERE\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern WHERE_COLUMN_PATTERN = Pattern.compile(
            "\\b(?:WHERE|AND|OR)\\s+\\(?\\s*(?:" + IDENTIFIER + "\\.)?" + IDENTIFIER
                    + "\\s*(?:=|<>|!=|<=|>=|<|>|\\bLIKE\\b|\\bIN\\b|\\bIS\\b|\\bBETWEEN\\b)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern JOIN_COLUMN_PATTERN = Pattern.compile(
            "\\bON\\s+\\(?\\s*" + IDENTIFIER + "\\." + IDENTIFIER + "\\s*=\\s*" + IDENTIFIER + "\\." + IDENTIFIER,
            Pattern.CASE_INSENSITIVE);

    private static final Pattern ORDER_BY_PATTERN = Pattern.compile(
            "\\bORDER\\s+BY\\s+(.+?)(?:\\bLIMIT\\b|\\bOFFSET\\b|\\bFETCH\\b|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern ORDER_BY_COLUMN_PATTERN = Pattern.compile(
            "(?:^|,)\\s*(?:" + IDENTIFIER + "\\.)?" + IDENTIFIER, Pattern.CASE_INSENSITIVE);

    private static final Pattern LIMIT_PATTERN = Pattern.compile("\\bLIMIT\\s+(?:\\d+|\\?|@\\w+|\\$\\d+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern OFFSET_PATTERN = Pattern.compile("\\bOFFSET\\s+(?:\\d+|\\?|@\\w+|\\$\\d+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TOP_PATTERN = Pattern.compile("\\bTOP\\s*\\(?\\s*(?:\\d+|\\?|@\\w+)\\s*\\)?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FETCH_PATTERN = Pattern.compile("\\bFETCH\\s+(?:FIRST|NEXT)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SELECT_ALL_PATTERN = Pattern.compile("\\bSELECT\\s+(?:DISTINCT\\s+)?(?:\\w+\\.)?\\*\\s+FROM\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern WRITE_KEYWORD_PATTERN = Pattern.compile("\\b(?:INSERT|UPDATE|DELETE)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Set<String> RESERVED_WORDS = Set.of(
            "WHERE", "ON", "INNER", "LEFT", "RIGHT", "OUTER", "FULL", "CROSS", "JOIN", "ORDER", "GROUP",
            "LIMIT", "OFFSET", "HAVING", "UNION", "FETCH", "WITH", "AND", "OR", "NOT", "NULL", "AS", "SELECT",
            "EXISTS", "CASE", "WHEN", "THEN", "ELSE", "END", "ASC", "DESC", "TOP", "USING", "NATURAL");

    private final List<CartesianRule> cartesianRules;

    public QueryAnalyzer() {
        this(CartesianRule.defaults());
    }

    public QueryAnalyzer(List<CartesianRule> cartesianRules) {
        this.cartesianRules = List.copyOf(cartesianRules);
    }

    /**
     * Suggestions for one captured statement. Write statements get none.
     */
    public List<QuerySuggestion> analyze(QueryEvent event) {
        if (event == null || !SqlStatementClassifier.isRead(event.getSql())) {
            return List.of();
        }

        String sql = event.getSql();
        double durationMs = event.getDurationMs();
        Integer rows = event.getRowsAffected();
        TableReferences tables = TableReferences.of(sql);

        List<QuerySuggestion> suggestions = new ArrayList<>(analyzeMissingIndexes(sql, durationMs, tables));
        analyzeMissingPagination(sql, rows).ifPresent(suggestions::add);
        analyzeSelectAll(sql).ifPresent(suggestions::add);
        analyzeNoTracking(sql).ifPresent(suggestions::add);
        analyzeCartesianExplosion(sql, rows, durationMs, tables).ifPresent(suggestions::add);

        log.debug("Statement {} produced {} suggestion(s)", event.getId(), suggestions.size());
        return suggestions;
    }

    List<QuerySuggestion> analyzeMissingIndexes(String sql, double durationMs, TableReferences tables) {
        if (durationMs < INDEX_MIN_DURATION_MS) {
            return List.of();
        }

        Map<String, QuerySuggestion> byColumn = new LinkedHashMap<>();
        SuggestionSeverity whereSeverity = durationMs > INDEX_HIGH_DURATION_MS
                ? SuggestionSeverity.HIGH : SuggestionSeverity.MEDIUM;

        for (ColumnRef ref : extractWhereColumns(sql)) {
            String table = tables.resolve(ref.qualifier());
            byColumn.putIfAbsent(key(table, ref.column()), indexSuggestion(
                    "Consider adding an index",
                    String.format("Column \"%s\" is used in WHERE clause. An index could improve query performance.",
                            ref.column()),
                    whereSeverity, table, List.of(ref.column())));
        }

        if (durationMs > JOIN_INDEX_DURATION_MS) {
            for (ColumnRef ref : extractJoinColumns(sql)) {
                String table = tables.resolve(ref.qualifier());
                byColumn.putIfAbsent(key(table, ref.column()), indexSuggestion(
                        "Consider adding an index for JOIN",
                        String.format("Column \"%s\" is used in a JOIN condition. An index could improve join performance.",
                                ref.column()),
                        SuggestionSeverity.MEDIUM, table, List.of(ref.column())));
            }
        }

        List<ColumnRef> orderBy = extractOrderByColumns(sql);
        if (durationMs > ORDER_BY_INDEX_DURATION_MS && !orderBy.isEmpty()) {
            String table = tables.resolve(orderBy.get(0).qualifier());
            List<String> columns = orderBy.stream().map(ColumnRef::column).collect(Collectors.toList());
            boolean covered = columns.stream().anyMatch(c -> byColumn.containsKey(key(table, c)));
            if (!covered) {
                byColumn.put(key(table, columns.get(0)), indexSuggestion(
                        "Consider adding an index for ORDER BY",
                        String.format("Sorting by \"%s\" without an index may cause a full table scan.",
                                String.join(", ", columns)),
                        SuggestionSeverity.LOW, table, columns));
            }
        }

        return byColumn.values().stream()
                .limit(MAX_INDEX_SUGGESTIONS)
                .collect(Collectors.toList());
    }

    Optional<QuerySuggestion> analyzeMissingPagination(String sql, Integer rows) {
        boolean paginated = LIMIT_PATTERN.matcher(sql).find()
                || OFFSET_PATTERN.matcher(sql).find()
                || TOP_PATTERN.matcher(sql).find()
                || FETCH_PATTERN.matcher(sql).find();
        if (paginated) {
            return Optional.empty();
        }

        boolean hasWhere = WHERE_PATTERN.matcher(sql).find();
        boolean manyRows = rows != null && rows > PAGINATION_ROW_LIMIT;
        if (!manyRows && (hasWhere || rows != null)) {
            return Optional.empty();
        }

        return Optional.of(QuerySuggestion.builder()
                .type(SuggestionType.MISSING_PAGINATION)
                .severity(rows != null && rows > PAGINATION_HIGH_ROW_LIMIT ? SuggestionSeverity.HIGH : SuggestionSeverity.LOW)
                .title("Consider adding pagination")
                .message(rows != null
                        ? String.format("Query returned %d rows without pagination. Consider limiting the page size.", rows)
                        : "Query may return many rows without pagination. Consider limiting the page size.")
                .suggestedFix("Add LIMIT/OFFSET (or setFirstResult/setMaxResults on the query)")
                .build());
    }

    Optional<QuerySuggestion> analyzeSelectAll(String sql) {
        if (!SELECT_ALL_PATTERN.matcher(sql).find()) {
            return Optional.empty();
        }
        return Optional.of(QuerySuggestion.builder()
                .type(SuggestionType.SELECT_ALL)
                .severity(SuggestionSeverity.LOW)
                .title("Avoid SELECT *")
                .message("Query selects all columns. Consider selecting only the columns you need.")
                .suggestedFix("List the required columns or use a projection/DTO query")
                .build());
    }

    Optional<QuerySuggestion> analyzeNoTracking(String sql) {
        if (WRITE_KEYWORD_PATTERN.matcher(sql).find()) {
            return Optional.empty();
        }
        return Optional.of(QuerySuggestion.builder()
                .type(SuggestionType.NO_TRACKING)
                .severity(SuggestionSeverity.INFO)
                .title("Consider a read-only query")
                .message("If the loaded entities are not modified, a read-only query skips change tracking and dirty checking.")
                .suggestedFix("Mark the query or transaction read-only")
                .build());
    }

    Optional<QuerySuggestion> analyzeCartesianExplosion(String sql, Integer rows, double durationMs,
                                                        TableReferences tables) {
        int joins = count(JOIN_PATTERN, sql);
        int leftJoins = count(LEFT_JOIN_PATTERN, sql);
        CartesianRule.JoinProfile profile = new CartesianRule.JoinProfile(joins, leftJoins, rows, durationMs);

        return CartesianRule.evaluate(cartesianRules, profile).map(severity -> {
            String joined = tables.ordered().stream()
                    .skip(1)
                    .limit(3)
                    .collect(Collectors.joining(", "));
            String message = rows != null
                    ? String.format("Query has %d JOINs (%s) and returned %d rows. Multiple collection joins can "
                    + "cause row multiplication. Consider loading collections in separate queries.", joins, joined, rows)
                    : String.format("Query has %d JOINs (%s). Multiple collection joins can cause row multiplication "
                    + "(cartesian product). Consider loading collections in separate queries.", joins, joined);

            return QuerySuggestion.builder()
                    .type(SuggestionType.CARTESIAN_EXPLOSION)
                    .severity(severity)
                    .title("Potential Cartesian Explosion")
                    .message(message)
                    .suggestedFix("Split into one query per collection (batch or subselect fetching)")
                    .build();
        });
    }

    static List<ColumnRef> extractWhereColumns(String sql) {
        List<ColumnRef> columns = new ArrayList<>();
        Matcher matcher = WHERE_COLUMN_PATTERN.matcher(sql);
        while (matcher.find()) {
            addColumn(columns, matcher.group(1), matcher.group(2));
        }
        return columns;
    }

    static List<ColumnRef> extractJoinColumns(String sql) {
        List<ColumnRef> columns = new ArrayList<>();
        Matcher matcher = JOIN_COLUMN_PATTERN.matcher(sql);
        while (matcher.find()) {
            addColumn(columns, matcher.group(1), matcher.group(2));
            addColumn(columns, matcher.group(3), matcher.group(4));
        }
        return columns;
    }

    static List<ColumnRef> extractOrderByColumns(String sql) {
        List<ColumnRef> columns = new ArrayList<>();
        Matcher orderBy = ORDER_BY_PATTERN.matcher(sql);
        if (!orderBy.find()) {
            return columns;
        }

        Matcher matcher = ORDER_BY_COLUMN_PATTERN.matcher(orderBy.group(1).trim());
        while (matcher.find()) {
            addColumn(columns, matcher.group(1), matcher.group(2));
        }
        return columns;
    }

    private static void addColumn(List<ColumnRef> columns, String qualifier, String column) {
        if (column == null || Character.isDigit(column.charAt(0)) || isReserved(column)) {
            return;
        }
        columns.add(new ColumnRef(qualifier, column));
    }

    private static QuerySuggestion indexSuggestion(String title, String message, SuggestionSeverity severity,
                                                   String table, List<String> columns) {
        String tableName = table != null ? table : "table";
        return QuerySuggestion.builder()
                .type(SuggestionType.MISSING_INDEX)
                .severity(severity)
                .title(title)
                .message(message)
                .suggestedFix(String.format("CREATE INDEX IX_%s_%s ON %s (%s);",
                        tableName, columns.get(0), tableName, String.join(", ", columns)))
                .table(table)
                .column(columns.get(0))
                .build();
    }

    private static String key(String table, String column) {
        return (table == null ? "" : table.toLowerCase(Locale.ROOT)) + "." + column.toLowerCase(Locale.ROOT);
    }

    private static int count(Pattern pattern, String sql) {
        Matcher matcher = pattern.matcher(sql);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static boolean isReserved(String word) {
        return RESERVED_WORDS.contains(word.toUpperCase(Locale.ROOT));
    }

    record ColumnRef(String qualifier, String column) {}

    /**
     * Tables named in FROM and JOIN clauses, in order of appearance, with their aliases.
     */
    static final class TableReferences {
        private final List<String> ordered;
        private final Map<String, String> byAliasOrName;

        private TableReferences(List<String> ordered, Map<String, String> byAliasOrName) {
            this.ordered = ordered;
            this.byAliasOrName = byAliasOrName;
        }

        static TableReferences of(String sql) {
            List<String> ordered = new ArrayList<>();
            Matcher from = FROM_TABLE_PATTERN.matcher(sql);
            if (from.find()) {
                ordered.add(from.group(1));
            }
            Matcher join = JOIN_TABLE_PATTERN.matcher(sql);
            while (join.find()) {
                if (!isReserved(join.group(1))) {
                    ordered.add(join.group(1));
                }
            }

            Map<String, String> byAliasOrName = new HashMap<>();
            Matcher alias = TABLE_ALIAS_PATTERN.matcher(sql);
            while (alias.find()) {
                String table = alias.group(1);
                if (isReserved(table)) {
                    continue;
                }
                byAliasOrName.putIfAbsent(table.toLowerCase(Locale.ROOT), table);
                String aliasName = alias.group(2);
                if (aliasName != null && !isReserved(aliasName)) {
                    byAliasOrName.putIfAbsent(aliasName.toLowerCase(Locale.ROOT), table);
                }
            }
            return new TableReferences(ordered, byAliasOrName);
        }

        List<String> ordered() {
            return ordered;
        }

        /**
         * Maps a column qualifier (table name or alias) to its table; unqualified or unknown
         * qualifiers fall back to the first table in the statement.
         */
        String resolve(String qualifier) {
            if (qualifier != null) {
                String table = byAliasOrName.get(qualifier.toLowerCase(Locale.ROOT));
                if (table != null) {
                    return table;
                }
            }
            if (!ordered.isEmpty()) {
                return ordered.get(0);
            }
            return qualifier;
        }
    }
}
