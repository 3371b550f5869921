package org.carball.querylens.parser;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns raw SQL into structural patterns for grouping, and renders SQL with its
 * bindings inlined for display.
 */
public class SqlNormalizer {

    private static final Pattern NUMERIC_LITERAL = Pattern.compile("\\b\\d+\\b");
    private static final Pattern STRING_LITERAL = Pattern.compile("'[^']*'");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final int SIMILARITY_PREFIX_LENGTH = 255;

    /**
     * Replaces numeric and quoted string literals with {@code ?} and collapses whitespace.
     */
    public String normalize(String sql) {
        if (sql == null) {
            return "";
        }
        String normalized = NUMERIC_LITERAL.matcher(sql).replaceAll("?");
        normalized = STRING_LITERAL.matcher(normalized).replaceAll("?");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
        return normalized.trim();
    }

    /**
     * SHA-256 hex digest of the normalized statement.
     */
    public String hash(String sql) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(normalize(sql).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Levenshtein-based similarity of the normalized statements, from 0 to 100.
     * Only the first {@value #SIMILARITY_PREFIX_LENGTH} characters are compared.
     */
    public double similarity(String sqlA, String sqlB) {
        String a = normalize(sqlA);
        String b = normalize(sqlB);

        if (a.equals(b)) {
            return 100.0;
        }

        a = a.substring(0, Math.min(a.length(), SIMILARITY_PREFIX_LENGTH));
        b = b.substring(0, Math.min(b.length(), SIMILARITY_PREFIX_LENGTH));

        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 100.0;
        }

        int distance = levenshtein(a, b);
        return (1 - ((double) distance / maxLength)) * 100;
    }

    /**
     * Inlines bindings into the {@code ?} placeholders for display only. Placeholders
     * inside quoted literals are left alone; surplus placeholders stay as {@code ?}.
     */
    public String format(String sql, List<?> bindings) {
        if (sql == null) {
            return "";
        }
        if (bindings == null || bindings.isEmpty()) {
            return sql;
        }

        StringBuilder formatted = new StringBuilder(sql.length() + bindings.size() * 8);
        int bindingIndex = 0;
        boolean inString = false;

        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '\'') {
                inString = !inString;
                formatted.append(c);
            } else if (c == '?' && !inString && bindingIndex < bindings.size()) {
                formatted.append(renderBinding(bindings.get(bindingIndex++)));
            } else {
                formatted.append(c);
            }
        }

        return formatted.toString();
    }

    static String renderBinding(Object binding) {
        if (binding == null) {
            return "NULL";
        }
        if (binding instanceof Boolean bool) {
            return bool ? "1" : "0";
        }
        if (binding instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (binding instanceof Number number) {
            return number.toString();
        }
        if (binding instanceof byte[] bytes) {
            return "X'" + HexFormat.of().formatHex(bytes) + "'";
        }
        return quote(binding.toString());
    }

    private static String quote(String value) {
        String escaped = value
                .replace("\\", "\\\\")
                .replace("'", "''")
                .replace("\0", "\\0");
        return "'" + escaped + "'";
    }

    private static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];

        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                        Math.min(current[j - 1] + 1, previous[j] + 1),
                        previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        return previous[b.length()];
    }
}
