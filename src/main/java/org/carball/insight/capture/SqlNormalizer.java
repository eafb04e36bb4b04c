package org.carball.insight.capture;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Reduces SQL text to a parameter-free shape so that executions of the same statement
 * with different values group together.
 */
public final class SqlNormalizer {

    public static final String PLACEHOLDER = "?";

    // Named (@p0, @userId) and positional ($1) parameter markers
    private static final Pattern PARAMETER_PATTERN = Pattern.compile("@\\w+|\\$\\d+");

    // Doubled quotes stay inside the literal: 'O''Brien'
    private static final Pattern STRING_LITERAL_PATTERN = Pattern.compile("'(?:[^']|'')*'");

    // Integers, decimals and exponents that are not part of an identifier such as t0 or Column1
    private static final Pattern NUMERIC_LITERAL_PATTERN = Pattern.compile(
            "(?<![\\w.])(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?(?!\\w)");

    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    private static final int HASH_BYTES = 8;

    private SqlNormalizer() {
        // Utility class - prevent instantiation
    }

    /**
     * Replaces parameters and literals with {@value #PLACEHOLDER} and collapses whitespace.
     */
    public static String normalize(String sql) {
        if (sql == null || sql.isEmpty()) {
            return "";
        }

        String normalized = PARAMETER_PATTERN.matcher(sql).replaceAll(PLACEHOLDER);
        normalized = STRING_LITERAL_PATTERN.matcher(normalized).replaceAll(PLACEHOLDER);
        normalized = NUMERIC_LITERAL_PATTERN.matcher(normalized).replaceAll(PLACEHOLDER);
        return WHITESPACE_PATTERN.matcher(normalized).replaceAll(" ").trim();
    }

    /**
     * Returns a 16 character lowercase hex digest of an already normalized statement.
     */
    public static String hash(String normalizedSql) {
        byte[] digest = sha256().digest(normalizedSql.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest, 0, HASH_BYTES);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
