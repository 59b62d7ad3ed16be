package com.hdlformatter.plugins.verilog.structure;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of a parameter, port or connection list: an item (possibly spanning several lines),
 * a directive, a comment-only line, a blank line or a standalone comma.
 */
final class ListEntry {

    enum Kind {
        ITEM, DIRECTIVE, COMMENT, BLANK, SEPARATOR
    }

    private static final String OPERATOR_TAIL = "+-*/%&|^?:<>=";

    private final Kind kind;
    private final List<String> lines = new ArrayList<>();
    private final List<String> comments = new ArrayList<>();
    private boolean hasComma;

    private ListEntry(Kind kind) {
        this.kind = kind;
    }

    /**
     * Cuts list segments into entries. Items end at a comma outside brackets, or at the end of a line
     * when no bracket is open and the line does not end in an operator.
     */
    static List<ListEntry> parse(List<BracketScanner.Segment> segments) {
        List<ListEntry> entries = new ArrayList<>();
        ListEntry open = null;
        int depth = 0;

        for (BracketScanner.Segment segment : segments) {
            String text = segment.text().trim();
            String comment = segment.comment();

            if (text.isEmpty()) {
                if (open != null) {
                    if (!comment.isEmpty()) {
                        open._addLine(comment, "");
                    }
                } else if (!comment.isEmpty()) {
                    entries.add(_single(Kind.COMMENT, "", comment));
                } else if (segment.wholeLine()) {
                    entries.add(_single(Kind.BLANK, "", ""));
                }
                continue;
            }
            if (open == null && text.startsWith("`")) {
                entries.add(_single(Kind.DIRECTIVE, text, comment));
                continue;
            }

            ListEntry touched = null;
            StringBuilder piece = new StringBuilder();
            for (int k = 0; k < text.length(); k++) {
                char c = text.charAt(k);
                if (open == null) {
                    if (Character.isWhitespace(c)) {
                        continue;
                    }
                    if (c == ',') {
                        ListEntry previous = entries.isEmpty() ? null : entries.get(entries.size() - 1);
                        if (previous != null && previous.kind == Kind.ITEM && !previous.hasComma) {
                            previous.hasComma = true;
                            touched = previous;
                        } else {
                            entries.add(_single(Kind.SEPARATOR, ",", ""));
                        }
                        continue;
                    }
                    open = new ListEntry(Kind.ITEM);
                    entries.add(open);
                    depth = 0;
                }
                if (c == '(' || c == '{' || c == '[') {
                    depth++;
                } else if (c == ')' || c == '}' || c == ']') {
                    depth--;
                }
                if (c == ',' && depth <= 0) {
                    if (!piece.toString().isBlank() || open.lines.isEmpty()) {
                        open._addLine(piece.toString().trim(), "");
                    }
                    open.hasComma = true;
                    touched = open;
                    open = null;
                    piece.setLength(0);
                    continue;
                }
                piece.append(c);
            }
            if (open != null) {
                if (!piece.toString().isBlank()) {
                    open._addLine(piece.toString().trim(), "");
                }
                touched = open;
            }

            if (!comment.isEmpty()) {
                if (touched != null && !touched.lines.isEmpty()) {
                    touched._setLastComment(comment);
                } else {
                    entries.add(_single(Kind.COMMENT, "", comment));
                }
            }
            if (open != null && depth <= 0 && !open._endsWithOperator()) {
                open = null;
            }
        }
        entries.removeIf(e -> e.kind == Kind.ITEM && e.lines.isEmpty());
        return entries;
    }

    /**
     * Whether the item at {@code index} is rendered with a trailing comma. A directive before the next item
     * keeps the source comma; otherwise every item but the last gets one.
     */
    static boolean commaAfter(List<ListEntry> entries, int index) {
        boolean directiveFollows = false;
        for (int j = index + 1; j < entries.size(); j++) {
            Kind next = entries.get(j).kind;
            if (next == Kind.DIRECTIVE) {
                directiveFollows = true;
            } else if (next == Kind.ITEM) {
                return directiveFollows ? entries.get(index).hasComma : true;
            }
        }
        return directiveFollows && entries.get(index).hasComma;
    }

    private static ListEntry _single(Kind kind, String text, String comment) {
        ListEntry entry = new ListEntry(kind);
        entry._addLine(text, comment);
        return entry;
    }

    private void _addLine(String text, String comment) {
        lines.add(text);
        comments.add(comment);
    }

    private void _setLastComment(String comment) {
        comments.set(comments.size() - 1, comment);
    }

    private boolean _endsWithOperator() {
        if (lines.isEmpty()) {
            return false;
        }
        String last = lines.get(lines.size() - 1);
        return !last.isEmpty() && !last.startsWith("//") && OPERATOR_TAIL.indexOf(last.charAt(last.length() - 1)) >= 0;
    }

    // Getters
    Kind getKind() { return kind; }
    List<String> getLines() { return lines; }
    List<String> getComments() { return comments; }
    boolean hasComma() { return hasComma; }

    /** First code line. */
    String first() {
        return lines.get(0);
    }

    /** Text of a directive entry with its comment, or the comment of a comment entry. */
    String display() {
        String comment = comments.get(0);
        if (kind == Kind.COMMENT) {
            return comment;
        }
        return comment.isEmpty() ? lines.get(0) : lines.get(0) + " " + comment;
    }

    boolean isMultiLine() {
        return lines.size() > 1;
    }
}
