package com.vedant.dataquery.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Looks at the leading keyword of every statement in a SQL text to tell read-only input from
 * anything that would change the catalog (DML, DDL, ATTACH, ...).
 */
public final class StatementInspector {

    private static final Set<String> READ_ONLY = Set.of(
            "select", "with", "values", "from", "table", "show", "describe", "explain", "summarize", "("
    );

    private StatementInspector() {}

    /** True when the text holds at least one statement and every statement is read-only. */
    public static boolean isReadOnly(String sql) {
        List<String> statements = statements(sql);
        if (statements.isEmpty()) return false;
        for (String statement : statements) {
            String keyword = leadingKeyword(statement);
            if (keyword == null || !READ_ONLY.contains(keyword)) return false;
        }
        return true;
    }

    /**
     * Splits on top-level semicolons. Semicolons inside quoted literals, quoted identifiers and
     * comments do not split. Pieces holding only whitespace and comments are dropped.
     */
    public static List<String> statements(String sql) {
        List<String> out = new ArrayList<>();
        if (sql == null) return out;
        int start = 0;
        int i = 0;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                i = closingQuote(sql, i, c);
            } else if (sql.startsWith("--", i)) {
                int nl = sql.indexOf('\n', i);
                i = nl < 0 ? sql.length() : nl + 1;
            } else if (sql.startsWith("/*", i)) {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? sql.length() : end + 2;
            } else if (c == ';') {
                addIfPresent(out, sql.substring(start, i));
                start = ++i;
            } else {
                i++;
            }
        }
        addIfPresent(out, sql.substring(start));
        return out;
    }

    /**
     * First keyword after leading whitespace and comments, lower case; "(" for a parenthesised
     * query; null for blank input.
     */
    public static String leadingKeyword(String sql) {
        if (sql == null) return null;
        int i = skipWhitespaceAndComments(sql, 0);
        if (i >= sql.length()) return null;
        if (sql.charAt(i) == '(') return "(";
        int start = i;
        while (i < sql.length() && Character.isLetter(sql.charAt(i))) i++;
        if (i == start) return sql.substring(start, start + 1);
        return sql.substring(start, i).toLowerCase(Locale.ROOT);
    }

    private static void addIfPresent(List<String> out, String piece) {
        if (skipWhitespaceAndComments(piece, 0) < piece.length()) out.add(piece);
    }

    // index just past the closing quote; a doubled quote is an escaped one
    private static int closingQuote(String sql, int open, char quote) {
        int i = open + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    private static int skipWhitespaceAndComments(String sql, int from) {
        int i = from;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (sql.startsWith("--", i)) {
                int nl = sql.indexOf('\n', i);
                i = nl < 0 ? sql.length() : nl + 1;
            } else if (sql.startsWith("/*", i)) {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? sql.length() : end + 2;
            } else {
                break;
            }
        }
        return i;
    }
}
