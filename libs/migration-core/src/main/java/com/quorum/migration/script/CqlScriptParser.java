package com.quorum.migration.script;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits CQL script text into individual statements.
 *
 * <p>Statements end at {@code ;}. Semicolons inside single-quoted literals, double-quoted
 * identifiers and {@code $$} blocks do not split. Comments ({@code --}, {@code //} and
 * {@code /* *}{@code /}) are removed. Blank statements are dropped.
 */
public final class CqlScriptParser {

    private CqlScriptParser() {}

    /**
     * Parses the given script.
     *
     * @throws IllegalArgumentException on an unterminated literal, block or comment
     */
    public static List<String> parse(String source) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int length = source.length();
        int i = 0;
        while (i < length) {
            char c = source.charAt(i);
            char next = i + 1 < length ? source.charAt(i + 1) : '\0';
            if (c == '\'' || c == '"') {
                int end = endOfQuoted(source, i, c);
                current.append(source, i, end);
                i = end;
            } else if (c == '$' && next == '$') {
                int close = source.indexOf("$$", i + 2);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated $$ block at offset " + i);
                }
                current.append(source, i, close + 2);
                i = close + 2;
            } else if ((c == '-' && next == '-') || (c == '/' && next == '/')) {
                int eol = source.indexOf('\n', i);
                i = eol < 0 ? length : eol;
            } else if (c == '/' && next == '*') {
                int close = source.indexOf("*/", i + 2);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated comment at offset " + i);
                }
                current.append(' ');
                i = close + 2;
            } else if (c == ';') {
                flush(current, statements);
                i++;
            } else {
                current.append(c);
                i++;
            }
        }
        flush(current, statements);
        return List.copyOf(statements);
    }

    private static int endOfQuoted(String source, int start, char quote) {
        int i = start + 1;
        while (i < source.length()) {
            if (source.charAt(i) == quote) {
                // doubled quote is an escaped quote
                if (i + 1 < source.length() && source.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        throw new IllegalArgumentException("Unterminated quoted text at offset " + start);
    }

    private static void flush(StringBuilder current, List<String> statements) {
        String statement = current.toString().strip();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
        current.setLength(0);
    }
}
