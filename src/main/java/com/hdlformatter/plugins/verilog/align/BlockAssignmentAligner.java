package com.hdlformatter.plugins.verilog.align;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.plugins.verilog.LinePass;
import com.hdlformatter.util.Texts;

/**
 * Aligns assignments inside procedural code after indentation has been settled:
 * single-line case items, runs of statements at one indentation, and the bodies of an if/else chain.
 */
public class BlockAssignmentAligner implements LinePass {
    private static final Pattern CASE_START = Pattern.compile("^\\s*case[xz]?\\b");
    private static final Pattern CASE_END = Pattern.compile("^\\s*endcase\\b");
    private static final Pattern CASE_ITEM = Pattern.compile("^([\\w']+|default)\\s*:\\s*(.+)$");
    private static final Pattern OPERATOR = Pattern.compile("^(.*?)\\s*(<=|(?<![=!<>])=(?!=))\\s*(.*)$");
    private static final Pattern SIMPLE_ASSIGNMENT = Pattern.compile("^([\\w\\[\\]]+)\\s*(<=|(?<![=!<>])=(?!=))\\s*(.*)$");
    private static final Pattern EXCLUDED = Pattern.compile("^\\s*(assign|wire|reg|logic|input|output|inout|for)\\b");
    private static final Pattern TRAILING_COMMENT = Pattern.compile("^(.*?)(//.*)$");
    private static final Pattern IF_START = Pattern.compile("^if\\s*\\(");
    private static final Pattern ELSE_START = Pattern.compile("^else\\b");
    private static final Pattern BLOCK_BOUNDARY = Pattern.compile("^(end|endcase|endmodule)\\b");
    private static final Pattern LABEL = Pattern.compile("^\\w+\\s*:");
    private static final Pattern NON_LABEL = Pattern.compile("^(default|if|else|for|while)\\s*:");
    private static final Pattern BEGIN = Pattern.compile("\\bbegin\\b");
    private static final Pattern END = Pattern.compile("\\bend\\b");

    private record Statement(String indent, String label, String lhs, String op, String rhs, String comment) {
    }

    @Override
    public String getName() {
        return "block-assignments";
    }

    @Override
    public List<String> apply(List<String> lines) {
        return _alignBlockStatements(_alignCaseItems(lines));
    }

    private List<String> _alignCaseItems(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        List<Statement> group = new ArrayList<>();
        int caseDepth = 0;

        for (String line : lines) {
            if (CASE_START.matcher(line).find()) {
                _flushCaseItems(group, result);
                caseDepth++;
                result.add(line);
                continue;
            }
            if (CASE_END.matcher(line).find()) {
                _flushCaseItems(group, result);
                caseDepth = Math.max(0, caseDepth - 1);
                result.add(line);
                continue;
            }

            Statement item = caseDepth > 0 ? _parseCaseItem(line) : null;
            if (item != null && (group.isEmpty() || group.get(0).indent().equals(item.indent()))) {
                group.add(item);
                continue;
            }
            _flushCaseItems(group, result);
            if (item != null) {
                group.add(item);
            } else {
                result.add(line);
            }
        }
        _flushCaseItems(group, result);
        return result;
    }

    private static Statement _parseCaseItem(String line) {
        String trimmed = line.trim();
        Matcher item = CASE_ITEM.matcher(trimmed);
        if (!item.find() || BEGIN.matcher(trimmed).find() || !Texts.endsStatement(trimmed)) {
            return null;
        }
        Matcher op = OPERATOR.matcher(item.group(2));
        if (!op.find() || op.group(1).isBlank()) {
            return null;
        }
        return _statement(Texts.indentOf(line), item.group(1), op.group(1).trim(), op.group(2), op.group(3));
    }

    private static void _flushCaseItems(List<Statement> group, List<String> result) {
        if (group.isEmpty()) {
            return;
        }
        int maxLabel = group.stream().mapToInt(s -> s.label().length()).max().orElse(0);
        int maxLhs = group.stream().mapToInt(s -> s.lhs().length()).max().orElse(0);
        int maxRhs = group.stream().mapToInt(s -> s.rhs().length()).max().orElse(0);
        for (Statement s : group) {
            result.add(s.indent() + Texts.padEnd(s.label(), maxLabel) + ": " + Texts.padEnd(s.lhs(), maxLhs)
                    + " " + s.op() + " " + Texts.padEnd(s.rhs(), maxRhs) + ";" + _comment(s));
        }
        group.clear();
    }

    private List<String> _alignBlockStatements(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        int i = 0;
        while (i < lines.size()) {
            String trimmed = lines.get(i).trim();

            if (IF_START.matcher(trimmed).find()) {
                i = _alignIfChain(lines, i, result);
                continue;
            }

            if (_parseAssignment(lines.get(i)) == null) {
                result.add(lines.get(i));
                i++;
                continue;
            }

            String indent = Texts.indentOf(lines.get(i));
            List<Statement> group = new ArrayList<>();
            while (i < lines.size()) {
                String line = lines.get(i);
                Statement s = Texts.indentOf(line).equals(indent) ? _parseAssignment(line) : null;
                if (s == null) {
                    break;
                }
                group.add(s);
                i++;
            }

            if (group.size() == 1) {
                result.add(lines.get(i - 1));
                continue;
            }
            int maxLhs = group.stream().mapToInt(s -> s.lhs().length()).max().orElse(0);
            int maxRhs = group.stream().mapToInt(s -> s.rhs().length()).max().orElse(0);
            for (Statement s : group) {
                result.add(s.indent() + Texts.padEnd(s.lhs(), maxLhs) + " " + s.op() + " "
                        + Texts.padEnd(s.rhs(), maxRhs) + ";" + _comment(s));
            }
        }
        return result;
    }

    /**
     * Collects an if/else chain starting at {@code start}, pads the lhs of every assignment in it to one width
     * and returns the index after the chain.
     */
    private static int _alignIfChain(List<String> lines, int start, List<String> result) {
        List<String> collected = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();
        List<Statement> statements = new ArrayList<>();

        int depth = 0;
        int i = start;
        while (i < lines.size()) {
            String line = lines.get(i);
            String trimmed = line.trim();
            if (i > start && LABEL.matcher(trimmed).find() && !NON_LABEL.matcher(trimmed).find()) {
                break;
            }
            String code = Texts.stripComment(trimmed);
            if (BEGIN.matcher(code).find()) {
                depth++;
            }
            if (END.matcher(code).find()) {
                depth--;
            }

            collected.add(line);
            Statement s = _parseAssignment(line);
            if (s != null) {
                positions.add(collected.size() - 1);
                statements.add(s);
            }
            i++;

            if (depth <= 0) {
                boolean elseFollows = i < lines.size() && ELSE_START.matcher(lines.get(i).trim()).find();
                if (depth < 0 || !elseFollows) {
                    break;
                }
            }
        }

        if (statements.size() > 1) {
            int maxLhs = statements.stream().mapToInt(s -> s.lhs().length()).max().orElse(0);
            for (int k = 0; k < statements.size(); k++) {
                Statement s = statements.get(k);
                collected.set(positions.get(k),
                        s.indent() + Texts.padEnd(s.lhs(), maxLhs) + " " + s.op() + " " + s.rhs() + ";" + _comment(s));
            }
        }
        result.addAll(collected);
        return i;
    }

    /**
     * A terminated single-line {@code lhs = rhs;} or {@code lhs <= rhs;} with a plain lhs.
     */
    private static Statement _parseAssignment(String line) {
        String trimmed = line.trim();
        if (trimmed.contains(":") || EXCLUDED.matcher(trimmed).find()
                || BLOCK_BOUNDARY.matcher(trimmed).find() || !Texts.endsStatement(trimmed)) {
            return null;
        }
        Matcher m = SIMPLE_ASSIGNMENT.matcher(trimmed);
        if (!m.find()) {
            return null;
        }
        return _statement(Texts.indentOf(line), "", m.group(1).trim(), m.group(2), m.group(3));
    }

    private static Statement _statement(String indent, String label, String lhs, String op, String rhsWithSemi) {
        Matcher cm = TRAILING_COMMENT.matcher(rhsWithSemi);
        String rhs;
        String comment;
        if (cm.find()) {
            rhs = cm.group(1);
            comment = cm.group(2).trim();
        } else {
            rhs = rhsWithSemi;
            comment = "";
        }
        rhs = Texts.trimEnd(rhs);
        if (rhs.endsWith(";")) {
            rhs = Texts.trimEnd(rhs.substring(0, rhs.length() - 1));
        }
        return new Statement(indent, label, lhs, op, rhs.trim(), comment);
    }

    private static String _comment(Statement s) {
        return s.comment().isEmpty() ? "" : " " + s.comment();
    }
}
