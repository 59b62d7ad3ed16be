package com.hdlformatter.plugins.verilog.range;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.plugins.verilog.line.DeclarationKind;
import com.hdlformatter.plugins.verilog.line.LineClassifier;
import com.hdlformatter.util.Texts;

/**
 * Aligns every single-line assignment in a selection on one operator column and one semicolon column,
 * keeping each line's own indentation. Operators keep their spelling and are right-aligned.
 */
final class RangeAssignmentAligner {
    private static final Pattern ASSIGNMENT = Pattern.compile(
            "^(.+?)\\s*(<=|(?<![=!<>])=(?!=))\\s*(.+?)\\s*;\\s*(//.*)?$");

    private record Row(int index, String indent, String lhs, String op, String rhs, String comment) {
    }

    List<String> align(List<String> lines) {
        List<Row> rows = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!_isAssignment(line)) {
                continue;
            }
            Matcher m = ASSIGNMENT.matcher(line.trim());
            if (m.find()) {
                rows.add(new Row(i, Texts.indentOf(line), m.group(1).trim(), m.group(2), m.group(3).trim(),
                        m.group(4) == null ? "" : m.group(4)));
            }
        }
        if (rows.isEmpty()) {
            return lines;
        }

        int maxLhs = rows.stream().mapToInt(r -> r.lhs().length()).max().orElse(0);
        int maxOp = rows.stream().mapToInt(r -> r.op().length()).max().orElse(0);
        int maxRhs = rows.stream().mapToInt(r -> r.rhs().length()).max().orElse(0);

        List<String> result = new ArrayList<>(lines);
        for (Row r : rows) {
            result.set(r.index(), r.indent() + Texts.padEnd(r.lhs(), maxLhs) + " " + Texts.padStart(r.op(), maxOp)
                    + " " + Texts.padEnd(r.rhs(), maxRhs) + ";" + (r.comment().isEmpty() ? "" : " " + r.comment()));
        }
        return result;
    }

    private static boolean _isAssignment(String line) {
        return LineClassifier.declarationKind(line) == DeclarationKind.ASSIGNMENT
                || LineClassifier.isGenericAssignment(line);
    }
}
