package com.hdlformatter.plugins.verilog.structure;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a declaration such as {@code module m #(...) (...);} or {@code mod #(...) u (...);} into the text
 * outside its top-level parenthesized lists and, per list, one segment for each physical line the list covers.
 * Line comments are kept apart from the code so that parentheses inside them are never counted.
 */
final class BracketScanner {

    /**
     * The part of one physical line that falls inside a list.
     */
    record Segment(String text, String comment, boolean wholeLine) {
    }

    static final class BracketList {
        private final boolean hashed;
        private final List<Segment> segments = new ArrayList<>();

        BracketList(boolean hashed) {
            this.hashed = hashed;
        }

        /** True when the list was opened by {@code #(}. */
        boolean isHashed() {
            return hashed;
        }

        List<Segment> getSegments() {
            return segments;
        }
    }

    /**
     * {@code outside.get(k)} is the text in front of list {@code k}; the last element is the text after the last list.
     */
    record Scan(List<String> outside, List<BracketList> lists, String trailingComment) {

        String prefix() {
            return outside.get(0);
        }

        String suffix() {
            return outside.get(outside.size() - 1);
        }
    }

    private BracketScanner() {
    }

    /**
     * Scans the lines; returns null when a list is left open or a comment sits outside the lists
     * anywhere but on the last line.
     */
    static Scan scan(List<String> lines) {
        List<String> outside = new ArrayList<>();
        List<BracketList> lists = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        BracketList current = null;
        int depth = 0;
        String trailingComment = "";

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int commentAt = commentStart(line);
            String code = commentAt >= 0 ? line.substring(0, commentAt) : line;
            String comment = commentAt >= 0 ? line.substring(commentAt).trim() : "";

            StringBuilder segment = new StringBuilder();
            boolean touchedBoundary = false;
            for (int k = 0; k < code.length(); k++) {
                char c = code.charAt(k);
                if (current == null) {
                    if (c == '(') {
                        String before = pending.toString();
                        boolean hashed = before.trim().endsWith("#");
                        if (hashed) {
                            before = before.substring(0, before.lastIndexOf('#'));
                        }
                        outside.add(before);
                        pending.setLength(0);
                        current = new BracketList(hashed);
                        lists.add(current);
                        depth = 1;
                        segment.setLength(0);
                        touchedBoundary = true;
                    } else {
                        pending.append(c);
                    }
                    continue;
                }
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                    if (depth == 0) {
                        current.getSegments().add(new Segment(segment.toString(), "", false));
                        segment.setLength(0);
                        current = null;
                        touchedBoundary = true;
                        continue;
                    }
                }
                segment.append(c);
            }

            if (current != null) {
                current.getSegments().add(new Segment(segment.toString(), comment, !touchedBoundary));
            } else {
                if (!comment.isEmpty()) {
                    if (i != lines.size() - 1) {
                        return null;
                    }
                    trailingComment = comment;
                }
                pending.append(' ');
            }
        }

        if (current != null) {
            return null;
        }
        outside.add(pending.toString());
        return new Scan(outside, lists, trailingComment);
    }

    /**
     * Index of a {@code //} line comment outside string literals, or -1.
     */
    static int commentStart(String line) {
        boolean inString = false;
        for (int i = 0; i < line.length() - 1; i++) {
            char c = line.charAt(i);
            if (c == '"' && (i == 0 || line.charAt(i - 1) != '\\')) {
                inString = !inString;
            } else if (!inString && c == '/' && line.charAt(i + 1) == '/') {
                return i;
            }
        }
        return -1;
    }
}
