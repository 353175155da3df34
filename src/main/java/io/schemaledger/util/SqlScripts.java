package io.schemaledger.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a SQL script into individual statements on {@code ;}, ignoring separators inside string
 * literals, quoted identifiers, line comments and block comments.
 * Blank and comment-only statements are dropped.
 */
public final class SqlScripts {
    private SqlScripts() {
    }

    public static List<String> split(String script) {
        List<String> out = new ArrayList<>();
        if (script == null || script.isBlank()) {
            return out;
        }
        StringBuilder current = new StringBuilder();
        boolean meaningful = false;
        int i = 0;
        int n = script.length();
        while (i < n) {
            char ch = script.charAt(i);
            char next = i + 1 < n ? script.charAt(i + 1) : '\0';
            if (ch == '-' && next == '-') {
                int end = script.indexOf('\n', i);
                end = end < 0 ? n : end;
                current.append(script, i, end);
                i = end;
                continue;
            }
            if (ch == '/' && next == '*') {
                int end = script.indexOf("*/", i + 2);
                end = end < 0 ? n : end + 2;
                current.append(script, i, end);
                i = end;
                continue;
            }
            if (ch == '\'' || ch == '"') {
                int end = closingQuote(script, i, ch);
                current.append(script, i, end);
                meaningful = true;
                i = end;
                continue;
            }
            if (ch == ';') {
                flush(out, current, meaningful);
                current.setLength(0);
                meaningful = false;
                i++;
                continue;
            }
            if (!Character.isWhitespace(ch)) {
                meaningful = true;
            }
            current.append(ch);
            i++;
        }
        flush(out, current, meaningful);
        return out;
    }

    private static int closingQuote(String script, int start, char quote) {
        int i = start + 1;
        while (i < script.length()) {
            if (script.charAt(i) == quote) {
                // doubled quote is an escaped quote
                if (i + 1 < script.length() && script.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return script.length();
    }

    private static void flush(List<String> out, StringBuilder current, boolean meaningful) {
        if (!meaningful) {
            return;
        }
        String statement = current.toString().strip();
        if (!statement.isEmpty()) {
            out.add(statement);
        }
    }
}
