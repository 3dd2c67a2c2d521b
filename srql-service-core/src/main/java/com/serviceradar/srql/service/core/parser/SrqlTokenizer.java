package com.serviceradar.srql.service.core.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for SRQL. Splits on whitespace outside quotes ({@code "}, {@code '}, {@code `}) and outside
 * parentheses. A backslash inside quotes escapes the next character. Unterminated quotes or
 * parentheses extend the current token to the end of input.
 */
public final class SrqlTokenizer {

    private SrqlTokenizer() {}

    public static List<String> tokenize(String input) {
        List<String> tokens = new ArrayList<>();
        if (input == null) {
            return tokens;
        }

        StringBuilder current = new StringBuilder();
        char quote = 0;
        int depth = 0;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (quote != 0) {
                if (c == '\\' && i + 1 < input.length()) {
                    current.append(input.charAt(++i));
                    continue;
                }
                if (c == quote) {
                    quote = 0;
                }
                current.append(c);
                continue;
            }
            if (isQuote(c)) {
                quote = c;
                current.append(c);
            } else if (c == '(') {
                depth++;
                current.append(c);
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
                current.append(c);
            } else if (Character.isWhitespace(c) && depth == 0) {
                flush(current, tokens);
            } else {
                current.append(c);
            }
        }
        flush(current, tokens);
        return tokens;
    }

    /** Turns the right-hand side of a token into a list for {@code (a,b)} or a scalar otherwise. */
    public static FilterValue parseValue(String raw) {
        String value = raw.trim();
        if (value.length() >= 2 && value.startsWith("(") && value.endsWith(")")) {
            List<String> items = new ArrayList<>();
            for (String item : splitTopLevel(value.substring(1, value.length() - 1), ',')) {
                String stripped = stripQuotes(item).trim();
                if (!stripped.isEmpty()) {
                    items.add(stripped);
                }
            }
            return new FilterValue.ListValue(items);
        }
        return new FilterValue.Scalar(stripQuotes(value));
    }

    /** Splits on {@code separator} where it is neither quoted nor nested in parentheses. */
    public static List<String> splitTopLevel(String input, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        int depth = 0;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                current.append(c);
            } else if (isQuote(c)) {
                quote = c;
                current.append(c);
            } else if (c == '(') {
                depth++;
                current.append(c);
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
                current.append(c);
            } else if (c == separator && depth == 0) {
                flush(current, parts);
            } else {
                current.append(c);
            }
        }
        flush(current, parts);
        return parts;
    }

    public static String stripQuotes(String raw) {
        String value = raw.trim();
        if (value.length() >= 2 && isQuote(value.charAt(0)) && value.charAt(value.length() - 1) == value.charAt(0)) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '`';
    }

    private static void flush(StringBuilder current, List<String> out) {
        String token = current.toString().trim();
        if (!token.isEmpty()) {
            out.add(token);
        }
        current.setLength(0);
    }
}
