package io.checkin4j.request;

import io.checkin4j.core.SpecParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a command line into words the way a POSIX shell would, without any expansion.
 * <p>
 * Supported:
 * <ul>
 *   <li>single quotes: everything up to the next single quote is literal</li>
 *   <li>double quotes: backslash escapes only {@code " \ $ `} and newline</li>
 *   <li>backslash outside quotes escapes the next character; backslash-newline is a line continuation</li>
 * </ul>
 */
public final class ShellTokenizer {
    private ShellTokenizer() {
    }

    public static List<String> tokenize(String input) {
        Objects.requireNonNull(input, "input must not be null");

        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inToken = false;

        int n = input.length();
        int i = 0;
        while (i < n) {
            char c = input.charAt(i);

            if (c == '\\') {
                if (i + 1 >= n) {
                    throw malformed("dangling backslash at end of input");
                }
                int skip = lineContinuationLength(input, i + 1);
                if (skip > 0) {
                    i += 1 + skip;
                    continue;
                }
                current.append(input.charAt(i + 1));
                inToken = true;
                i += 2;
            } else if (c == '\'') {
                int end = input.indexOf('\'', i + 1);
                if (end < 0) {
                    throw malformed("unterminated single quote at position " + i);
                }
                current.append(input, i + 1, end);
                inToken = true;
                i = end + 1;
            } else if (c == '"') {
                i = readDoubleQuoted(input, i, current);
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
                i++;
            } else {
                current.append(c);
                inToken = true;
                i++;
            }
        }

        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /**
     * Reads a double-quoted section starting at {@code open} and returns the index after the closing quote.
     */
    private static int readDoubleQuoted(String input, int open, StringBuilder out) {
        int n = input.length();
        int i = open + 1;
        while (i < n) {
            char d = input.charAt(i);
            if (d == '"') {
                return i + 1;
            }
            if (d == '\\' && i + 1 < n) {
                int skip = lineContinuationLength(input, i + 1);
                if (skip > 0) {
                    i += 1 + skip;
                    continue;
                }
                char e = input.charAt(i + 1);
                if (e == '"' || e == '\\' || e == '$' || e == '`') {
                    out.append(e);
                    i += 2;
                    continue;
                }
            }
            out.append(d);
            i++;
        }
        throw malformed("unterminated double quote at position " + open);
    }

    private static int lineContinuationLength(String input, int at) {
        char c = input.charAt(at);
        if (c == '\n') {
            return 1;
        }
        if (c == '\r' && at + 1 < input.length() && input.charAt(at + 1) == '\n') {
            return 2;
        }
        return 0;
    }

    private static SpecParseException malformed(String detail) {
        return new SpecParseException(SpecParseException.Reason.MALFORMED_QUOTING, "Malformed quoting: " + detail);
    }
}
