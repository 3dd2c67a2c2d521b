package com.serviceradar.srql.service.core.sql;

/**
 * Placeholder utilities for generated SQL. Compiled queries use {@code ?}; the translated form uses
 * PostgreSQL's {@code $n}. Question marks inside string literals, quoted identifiers and
 * {@code $$} bodies are not placeholders.
 */
public final class SqlPlaceholders {

    private SqlPlaceholders() {}

    public static int count(String sql) {
        int[] count = {0};
        scan(sql, null, () -> count[0]++);
        return count[0];
    }

    /** Rewrites each {@code ?} placeholder to {@code $1, $2, ...} in order of appearance. */
    public static String toPositional(String sql) {
        StringBuilder out = new StringBuilder(sql.length() + 16);
        scan(sql, out, null);
        return out.toString();
    }

    private static void scan(String sql, StringBuilder out, Runnable onPlaceholder) {
        int n = 0;
        int i = 0;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int end = sql.indexOf(c, i + 1);
                end = end < 0 ? sql.length() : end + 1;
                append(out, sql, i, end);
                i = end;
            } else if (c == '$' && i + 1 < sql.length() && sql.charAt(i + 1) == '$') {
                int close = sql.indexOf("$$", i + 2);
                int end = close < 0 ? sql.length() : close + 2;
                append(out, sql, i, end);
                i = end;
            } else if (c == '?') {
                n++;
                if (onPlaceholder != null) onPlaceholder.run();
                if (out != null) out.append('$').append(n);
                i++;
            } else {
                if (out != null) out.append(c);
                i++;
            }
        }
    }

    private static void append(StringBuilder out, String sql, int from, int to) {
        if (out != null) {
            out.append(sql, from, to);
        }
    }
}
