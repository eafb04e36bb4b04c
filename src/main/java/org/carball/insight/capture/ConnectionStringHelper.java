package org.carball.insight.capture;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns engine ids and JDBC URLs into labels that are safe to show: no user names, passwords or query options.
 */
@Slf4j
public final class ConnectionStringHelper {

    private static final Pattern JDBC_ENGINE_PATTERN = Pattern.compile("^jdbc:([a-zA-Z0-9]+):", Pattern.CASE_INSENSITIVE);

    // jdbc:postgresql://host:5432/database?user=...
    private static final Pattern URL_STYLE_PATTERN =
            Pattern.compile("^jdbc:[a-zA-Z0-9]+://([^/:;?,]*)(?:[:,]\\d+)?(?:/([^?;]*))?", Pattern.CASE_INSENSITIVE);

    // jdbc:sqlserver://host:1433;databaseName=Shop;user=...
    private static final Pattern SQLSERVER_DATABASE_PATTERN =
            Pattern.compile(";\\s*(?:databaseName|database)\\s*=\\s*([^;]+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern USER_INFO_PATTERN = Pattern.compile("//[^/@;?]*@");

    private ConnectionStringHelper() {
        // Utility class - prevent instantiation
    }

    /**
     * Maps an engine id (or a driver/dialect name) to a display label.
     */
    public static String getFriendlyEngineName(String engine) {
        if (engine == null || engine.isBlank()) {
            return "Unknown";
        }

        String lower = engine.toLowerCase(Locale.ROOT);
        if (lower.contains("sqlite")) {
            return "SQLite";
        } else if (lower.contains("sqlserver") || lower.contains("mssql")) {
            return "SQL Server";
        } else if (lower.contains("postgres") || lower.contains("npgsql")) {
            return "PostgreSQL";
        } else if (lower.contains("mysql") || lower.contains("mariadb")) {
            return "MySQL";
        } else if (lower.contains("oracle")) {
            return "Oracle";
        } else if (lower.contains("h2")) {
            return "H2";
        }

        int lastDot = engine.lastIndexOf('.');
        return lastDot >= 0 ? engine.substring(lastDot + 1) : engine;
    }

    /**
     * Derives the engine id from a JDBC URL, e.g. {@code jdbc:sqlite:app.db} gives {@code sqlite}.
     */
    public static String detectEngine(String jdbcUrl) {
        if (jdbcUrl == null) {
            return null;
        }
        Matcher matcher = JDBC_ENGINE_PATTERN.matcher(jdbcUrl.trim());
        return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : null;
    }

    /**
     * Returns {@code host/database} for server engines, the file name for SQLite, or null when
     * nothing identifying can be extracted.
     */
    public static String sanitizeDatabaseId(String jdbcUrl, String engine) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            return null;
        }

        String effectiveEngine = engine != null ? engine : detectEngine(jdbcUrl);
        String url = USER_INFO_PATTERN.matcher(jdbcUrl.trim()).replaceFirst("//");
        try {
            return switch (getFriendlyEngineName(effectiveEngine)) {
                case "SQLite" -> sanitizeSqlite(url);
                case "SQL Server" -> sanitizeSqlServer(url);
                case "PostgreSQL", "MySQL" -> sanitizeServerDatabase(url);
                default -> null;
            };
        } catch (RuntimeException e) {
            log.debug("Could not sanitize connection info for engine {}: {}", effectiveEngine, e.getMessage());
            return null;
        }
    }

    private static String sanitizeSqlite(String jdbcUrl) {
        String path = jdbcUrl.replaceFirst("(?i)^jdbc:sqlite:", "");
        int queryStart = path.indexOf('?');
        if (queryStart >= 0) {
            path = path.substring(0, queryStart);
        }
        if (path.isEmpty() || path.equalsIgnoreCase(":memory:") || path.contains("mode=memory")) {
            return ":memory:";
        }
        if (path.startsWith("file:")) {
            path = path.substring("file:".length());
        }

        int separator = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        String fileName = separator >= 0 ? path.substring(separator + 1) : path;
        return fileName.isEmpty() ? null : fileName;
    }

    private static String sanitizeServerDatabase(String jdbcUrl) {
        Matcher matcher = URL_STYLE_PATTERN.matcher(jdbcUrl);
        if (!matcher.find()) {
            return null;
        }
        return combine(matcher.group(1), matcher.group(2));
    }

    private static String sanitizeSqlServer(String jdbcUrl) {
        String server = null;
        Matcher urlMatcher = URL_STYLE_PATTERN.matcher(jdbcUrl);
        if (urlMatcher.find()) {
            server = urlMatcher.group(1);
            // Named instances: host\INSTANCE
            int instance = server.indexOf('\\');
            if (instance > 0) {
                server = server.substring(0, instance);
            }
        }

        String database = null;
        Matcher databaseMatcher = SQLSERVER_DATABASE_PATTERN.matcher(jdbcUrl);
        if (databaseMatcher.find()) {
            database = databaseMatcher.group(1).trim();
        }
        return combine(server, database);
    }

    private static String combine(String server, String database) {
        String host = server == null || server.isBlank() ? null : server;
        String db = database == null || database.isBlank() ? null : database;

        if (host == null && db == null) {
            return null;
        }
        if (db != null) {
            return host != null ? host + "/" + db : db;
        }
        return host;
    }
}
