package com.hdlformatter.plugins.verilog.align;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.plugins.verilog.line.LineClassifier;
import com.hdlformatter.util.Texts;

/**
 * Aligns a group of {@code assign} and blocking/non-blocking statements on their operator and semicolon.
 * {@code assign} rows and plain rows share one operator column.
 */
public class AssignmentAligner {
    static final String ASSIGN_PREFIX = "assign ";

    private static final Pattern TRAILING_COMMENT = Pattern.compile("^(.*?)(//.*)$");
    private static final Pattern OPERATOR = Pattern.compile("^(.*?)\\s*(<=|(?<![=!<>])=(?!=))\\s*(.*)$");
    private static final Pattern ASSIGN_KEYWORD = Pattern.compile("^assign\\s+");
    private static final Pattern SEMICOLON_TAIL = Pattern.compile(";\\s*$");

    private static class Row {
        final List<String> rawLines;
        boolean hasOp;
        boolean isAssign;
        String lhs = "";
        String op = "";
        String assignRemainder = "";
        List<String> rhsLines = new ArrayList<>();
        String comment = "";
        String firstComment = "";
        boolean terminated;

        Row(List<String> rawLines) {
            this.rawLines = rawLines;
        }
    }

    /**
     * Aligns one group. Comments, blanks and directives are kept in place and re-indented to the base indent.
     */
    public List<String> align(List<String> lines) {
        if (lines.isEmpty()) {
            return lines;
        }
        String baseIndent = Texts.indentOf(_firstCodeLine(lines));
        List<Row> rows = _parseRows(lines);

        List<Row> opRows = rows.stream().filter(r -> r.hasOp).toList();
        List<String> out = new ArrayList<>();
        if (opRows.isEmpty()) {
            for (Row r : rows) {
                r.rawLines.forEach(rl -> out.add(_reindent(baseIndent, rl)));
            }
            return out;
        }

        int maxAssignLhs = 0;
        int maxPlainLhs = 0;
        for (Row r : opRows) {
            if (r.isAssign) {
                maxAssignLhs = Math.max(maxAssignLhs, ASSIGN_PREFIX.length() + r.assignRemainder.length());
            } else {
                maxPlainLhs = Math.max(maxPlainLhs, r.lhs.length());
            }
        }
        int targetLhsWidth = Math.max(maxAssignLhs, maxPlainLhs);

        int maxBodyLen = 0;
        for (Row r : opRows) {
            maxBodyLen = Math.max(maxBodyLen, (_prefix(r, baseIndent, targetLhsWidth) + r.rhsLines.get(0).trim()).length());
        }

        for (Row r : rows) {
            if (!r.hasOp) {
                r.rawLines.forEach(rl -> out.add(_reindent(baseIndent, rl)));
                continue;
            }
            String prefix = _prefix(r, baseIndent, targetLhsWidth);
            String comment = r.comment.isEmpty() ? "" : " " + r.comment;

            if (r.rhsLines.size() == 1) {
                String body = prefix + r.rhsLines.get(0).trim();
                out.add(r.terminated ? Texts.padEnd(body, maxBodyLen) + ";" + comment : Texts.trimEnd(body) + comment);
                continue;
            }

            out.add(Texts.trimEnd(prefix + r.rhsLines.get(0).trim())
                    + (r.firstComment.isEmpty() ? "" : " " + r.firstComment));
            String firstRhs = r.rhsLines.get(0).trim();
            String continuation = Texts.spaces(firstRhs.startsWith("(") ? prefix.length() + 1 : prefix.length());
            for (int k = 1; k < r.rhsLines.size(); k++) {
                String core = continuation + r.rhsLines.get(k).trim();
                if (k == r.rhsLines.size() - 1 && r.terminated) {
                    core = core + ";" + comment;
                }
                out.add(core);
            }
        }
        return out;
    }

    private static String _reindent(String baseIndent, String line) {
        return line.isBlank() ? "" : baseIndent + line.trim();
    }

    private static String _prefix(Row r, String baseIndent, int targetLhsWidth) {
        String lhsDisplay = r.isAssign
                ? ASSIGN_PREFIX + Texts.padEnd(r.assignRemainder, targetLhsWidth - ASSIGN_PREFIX.length())
                : Texts.padEnd(r.lhs, targetLhsWidth);
        return baseIndent + lhsDisplay + " " + r.op + " ";
    }

    private static String _firstCodeLine(List<String> lines) {
        for (String l : lines) {
            if (!Texts.isBlank(l) && !LineClassifier.isCommentOrDirective(l)) {
                return l;
            }
        }
        return lines.get(0);
    }

    /**
     * Splits the group into statements (joined until a semicolon) and standalone comment/blank/directive rows.
     */
    private List<Row> _parseRows(List<String> lines) {
        List<List<String>> merged = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String l : lines) {
            if (Texts.isBlank(l) || LineClassifier.isCommentOrDirective(l)) {
                if (!current.isEmpty()) {
                    merged.add(current);
                    current = new ArrayList<>();
                }
                merged.add(List.of(l));
                continue;
            }
            current.add(l);
            if (Texts.endsStatement(l)) {
                merged.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            merged.add(current);
        }

        List<Row> rows = new ArrayList<>();
        for (List<String> statement : merged) {
            rows.add(_parseRow(statement));
        }
        return rows;
    }

    private Row _parseRow(List<String> statement) {
        Row row = new Row(statement);
        String first = statement.get(0);
        if (Texts.isBlank(first) || LineClassifier.isCommentOrDirective(first)) {
            return row;
        }

        Matcher cm = TRAILING_COMMENT.matcher(first);
        boolean firstHasComment = cm.find();
        String firstComment = firstHasComment ? _normalizeComment(cm.group(2)) : "";
        String body = (firstHasComment ? cm.group(1) : first).trim();

        Matcher m = OPERATOR.matcher(body);
        if (!m.find() || m.group(1).isEmpty()) {
            return row;
        }

        row.hasOp = true;
        row.lhs = m.group(1).trim();
        row.op = m.group(2);
        row.isAssign = row.lhs.startsWith("assign ") || row.lhs.equals("assign");
        row.assignRemainder = row.isAssign ? ASSIGN_KEYWORD.matcher(row.lhs).replaceFirst("").trim() : "";
        row.rhsLines.add(SEMICOLON_TAIL.matcher(m.group(3)).replaceFirst(""));
        for (int k = 1; k < statement.size(); k++) {
            String cont = statement.get(k);
            row.rhsLines.add(k == statement.size() - 1
                    ? SEMICOLON_TAIL.matcher(Texts.stripComment(cont).trim()).replaceFirst("").trim()
                    : cont.trim());
        }

        String last = statement.get(statement.size() - 1);
        row.terminated = Texts.endsStatement(last);
        if (statement.size() == 1) {
            row.comment = firstComment;
        } else {
            row.firstComment = firstComment;
            Matcher lm = TRAILING_COMMENT.matcher(last);
            if (lm.find()) {
                row.comment = _normalizeComment(lm.group(2));
            }
        }
        return row;
    }

    private static String _normalizeComment(String comment) {
        return comment.replaceFirst("//\\s?", "// ").trim();
    }
}
