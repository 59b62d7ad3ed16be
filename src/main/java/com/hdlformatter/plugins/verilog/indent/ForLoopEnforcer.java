package com.hdlformatter.plugins.verilog.indent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.plugins.verilog.LinePass;
import com.hdlformatter.util.Texts;

/**
 * Gives {@code for} loop bodies an explicit {@code begin}/{@code end}: {@code for (...) stmt;} is wrapped,
 * {@code for (...) if ...} is split so the {@code if} becomes the loop body, and a header followed by a standalone
 * {@code begin} or a single statement is completed.
 */
public class ForLoopEnforcer implements LinePass {
    private static final Pattern FOR_HEAD = Pattern.compile("^(\\s*)for\\s*\\(");
    private static final Pattern BEGIN_LINE = Pattern.compile("^begin\\s*(//.*)?$");
    private static final Pattern NESTED_BODY = Pattern.compile("^(for|if|else|case[xz]?|begin|end|fork|while|repeat)\\b");
    private static final Pattern LINE_START_END = Pattern.compile("^\\s*end\\b");

    private final String unit;

    public ForLoopEnforcer(FormatConfig config) {
        this.unit = config.indentUnit();
    }

    @Override
    public String getName() {
        return "for-blocks";
    }

    @Override
    public List<String> apply(List<String> lines) {
        List<String> out = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String code = Texts.stripComment(line);
            Matcher head = FOR_HEAD.matcher(code);
            int end = head.find() ? ControlSyntax.conditionEnd(code, head) : -1;
            if (end < 0) {
                out.add(line);
                continue;
            }

            String indent = head.group(1);
            String header = indent + "for " + code.substring(code.indexOf('(', head.end() - 1), end);
            String rest = code.substring(end).trim();
            String comment = ControlSyntax.comment(line);
            String trailing = comment.isEmpty() ? "" : " " + comment;

            if (rest.startsWith("begin")) {
                out.add(line);
            } else if (rest.isEmpty()) {
                i = _completeHeader(lines, i, header, comment, indent, out);
            } else if (_isSimpleStatement(rest)) {
                out.add(header + " begin" + trailing);
                out.add(indent + unit + rest);
                out.add(indent + "end");
            } else if (ControlSyntax.IF_START.matcher(rest).find()) {
                i = _splitIf(lines, i, header, rest, trailing, indent, out);
            } else {
                out.add(line);
            }
        }
        return out;
    }

    /**
     * {@code for (...) if (...) ...}: the if-part moves onto its own line inside the loop. When the if opens a
     * block, the loop's {@code end} goes after the block's matching {@code end}.
     */
    private int _splitIf(List<String> lines, int i, String header, String ifPart, String trailing, String indent,
                         List<String> out) {
        if (ifPart.endsWith(";")) {
            out.add(header + " begin");
            out.add(indent + unit + ifPart + trailing);
            out.add(indent + "end");
            return i;
        }
        if (!ControlSyntax.hasBegin(ifPart)) {
            out.add(lines.get(i));
            return i;
        }

        int depth = 1;
        int j = i + 1;
        for (; j < lines.size() && depth > 0; j++) {
            String code = Texts.stripComment(lines.get(j));
            if (LINE_START_END.matcher(code).find()) {
                depth--;
            }
            if (ControlSyntax.hasBegin(code)) {
                depth++;
            }
        }
        if (depth > 0) {
            out.add(lines.get(i));
            return i;
        }
        out.add(header + " begin");
        out.add(indent + unit + ifPart + trailing);
        for (int k = i + 1; k < j; k++) {
            out.add(lines.get(k));
        }
        out.add(indent + "end");
        return j - 1;
    }

    private int _completeHeader(List<String> lines, int i, String header, String comment, String indent,
                                List<String> out) {
        int next = ControlSyntax.nextNonBlank(lines, i + 1);
        if (next >= lines.size()) {
            out.add(lines.get(i));
            return i;
        }
        String nextTrimmed = lines.get(next).trim();
        Matcher begin = BEGIN_LINE.matcher(nextTrimmed);
        if (begin.find()) {
            String a = comment.replaceFirst("^//\\s?", "").trim();
            String b = begin.group(1) == null ? "" : begin.group(1).replaceFirst("^//\\s?", "").trim();
            String merged = (a + " " + b).trim();
            out.add(header + " begin" + (merged.isEmpty() ? "" : " // " + merged));
            return next;
        }
        String nextCode = ControlSyntax.code(nextTrimmed);
        if (_isSimpleStatement(nextCode)) {
            out.add(header + " begin" + (comment.isEmpty() ? "" : " " + comment));
            out.add(indent + unit + nextTrimmed);
            out.add(indent + "end");
            return next;
        }
        out.add(lines.get(i));
        return i;
    }

    private static boolean _isSimpleStatement(String code) {
        return code.endsWith(";") && code.indexOf(';') == code.length() - 1
                && !NESTED_BODY.matcher(code).find() && ControlSyntax.balanced(code);
    }
}
