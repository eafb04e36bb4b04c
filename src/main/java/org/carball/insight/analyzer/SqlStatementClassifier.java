package org.carball.insight.analyzer;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.merge.Merge;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.statement.upsert.Upsert;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a statement reads or writes. JSqlParser is tried first; dialect-specific
 * text it cannot parse falls back to the leading keyword.
 */
@Slf4j
public final class SqlStatementClassifier {

    public enum StatementKind {
        READ,
        WRITE,
        OTHER
    }

    private static final Pattern LEADING_KEYWORD = Pattern.compile("^\\s*(?:--[^\\n]*\\n\\s*|/\\*.*?\\*/\\s*)*(\\w+)",
            Pattern.DOTALL);

    private static final Pattern WRITE_KEYWORD = Pattern.compile("\\b(?:INSERT|UPDATE|DELETE|MERGE)\\b",
            Pattern.CASE_INSENSITIVE);

    private SqlStatementClassifier() {
        // Utility class - prevent instantiation
    }

    public static StatementKind classify(String sql) {
        if (sql == null || sql.isBlank()) {
            return StatementKind.OTHER;
        }

        try {
            Statement statement = CCJSqlParserUtil.parse(sql);
            if (statement instanceof Select) {
                return StatementKind.READ;
            }
            if (statement instanceof Insert || statement instanceof Update || statement instanceof Delete
                    || statement instanceof Merge || statement instanceof Upsert) {
                return StatementKind.WRITE;
            }
            return StatementKind.OTHER;
        } catch (JSQLParserException | RuntimeException e) {
            log.trace("JSqlParser could not parse statement, using keyword fallback: {}", e.getMessage());
            return classifyByKeyword(sql);
        }
    }

    public static boolean isRead(String sql) {
        return classify(sql) == StatementKind.READ;
    }

    static StatementKind classifyByKeyword(String sql) {
        Matcher matcher = LEADING_KEYWORD.matcher(sql);
        if (!matcher.find()) {
            return StatementKind.OTHER;
        }

        switch (matcher.group(1).toUpperCase(Locale.ROOT)) {
            case "SELECT":
                return StatementKind.READ;
            case "WITH":
                // CTE feeding a data-modifying statement
                return WRITE_KEYWORD.matcher(sql).find() ? StatementKind.WRITE : StatementKind.READ;
            case "INSERT":
            case "UPDATE":
            case "DELETE":
            case "MERGE":
            case "UPSERT":
            case "REPLACE":
                return StatementKind.WRITE;
            default:
                return StatementKind.OTHER;
        }
    }
}
