package com.hdlformatter.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Small string helpers shared by the line passes.
 */
public final class Texts {
    private static final Pattern LEADING_WS = Pattern.compile("^\\s*");
    private static final Pattern TRAILING_COMMENT = Pattern.compile("//.*$");
    private static final Pattern STATEMENT_END = Pattern.compile(";\\s*$");

    private Texts() {
    }

    public static String spaces(int count) {
        return count <= 0 ? "" : " ".repeat(count);
    }

    public static String padEnd(String s, int width) {
        return s.length() >= width ? s : s + spaces(width - s.length());
    }

    public static String padStart(String s, int width) {
        return s.length() >= width ? s : spaces(width - s.length()) + s;
    }

    /**
     * Returns the leading whitespace of a line.
     */
    public static String indentOf(String line) {
        Matcher m = LEADING_WS.matcher(line);
        return m.find() ? m.group() : "";
    }

    public static String trimEnd(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }

    public static String trimStart(String s) {
        int start = 0;
        while (start < s.length() && Character.isWhitespace(s.charAt(start))) {
            start++;
        }
        return s.substring(start);
    }

    public static boolean isBlank(String line) {
        return line.trim().isEmpty();
    }

    /**
     * Removes a trailing line comment.
     */
    public static String stripComment(String line) {
        return TRAILING_COMMENT.matcher(line).replaceFirst("");
    }

    /**
     * True when the line ends a statement: a semicolon optionally followed by a line comment.
     * A semicolon inside the comment does not count.
     */
    public static boolean endsStatement(String line) {
        return STATEMENT_END.matcher(stripComment(line)).find();
    }

    public static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    public static int countMatches(Pattern pattern, String s) {
        Matcher m = pattern.matcher(s);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }
}
