package com.hdlformatter.plugins.verilog.indent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.plugins.verilog.LinePass;
import com.hdlformatter.util.Texts;

/**
 * Gives every {@code if}, {@code else if} and {@code else} body an explicit {@code begin}/{@code end}.
 * <ul>
 *   <li>{@code if (c) stmt;} becomes {@code if (c) begin}, the statement one unit deeper, {@code end}.</li>
 *   <li>A header followed by a standalone {@code begin} line gets the {@code begin} appended.</li>
 *   <li>A header followed by one terminated statement is wrapped like the single-line form.</li>
 *   <li>A bare {@code end} followed by {@code else ... begin} is joined into {@code end else ... begin}.</li>
 * </ul>
 * Bodies that are themselves control statements are left for the next round of the fixed-point loop.
 */
public class IfBlockEnforcer implements LinePass {
    private static final Pattern IF_HEAD = Pattern.compile("^(\\s*)((?:else\\s+)?if)\\s*\\(");
    private static final Pattern ELSE_STATEMENT = Pattern.compile("^(\\s*)else\\s+(?!if\\b)(?!begin\\b)([^;]+;)$");
    private static final Pattern BARE_ELSE = Pattern.compile("^(\\s*)else$");
    private static final Pattern BARE_END = Pattern.compile("^\\s*end\\s*(//.*)?$");
    private static final Pattern ELSE_WITH_BEGIN = Pattern.compile("^else\\b.*\\bbegin\\b");
    private static final Pattern BEGIN_LINE = Pattern.compile("^begin\\s*(//.*)?$");
    private static final Pattern NESTED_BODY = Pattern.compile("^(for|if|else|case[xz]?|begin|end|fork|while|repeat)\\b");

    private final String unit;

    public IfBlockEnforcer(FormatConfig config) {
        this.unit = config.indentUnit();
    }

    @Override
    public String getName() {
        return "if-blocks";
    }

    @Override
    public List<String> apply(List<String> lines) {
        return _joinEndElse(_expand(lines));
    }

    private List<String> _expand(List<String> lines) {
        List<String> out = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String code = Texts.stripComment(line);
            String comment = ControlSyntax.comment(line);
            if (ControlSyntax.hasBegin(code)) {
                out.add(line);
                continue;
            }

            Matcher head = IF_HEAD.matcher(code);
            if (head.find()) {
                String indent = head.group(1);
                String keyword = head.group(2).replaceAll("\\s+", " ");
                int end = ControlSyntax.conditionEnd(code, head);
                if (end < 0) {
                    out.add(line);
                    continue;
                }
                String condition = code.substring(code.indexOf('(', head.end() - 1), end);
                String rest = code.substring(end).trim();
                String header = indent + keyword + " " + condition;
                if (!rest.isEmpty()) {
                    if (_isSimpleStatement(rest)) {
                        _wrap(out, header, comment, rest, indent);
                    } else {
                        out.add(line);
                    }
                    continue;
                }
                i = _wrapFollowing(lines, i, header, comment, indent, out);
                continue;
            }

            Matcher elseStatement = ELSE_STATEMENT.matcher(Texts.trimEnd(code));
            if (elseStatement.find() && _isSimpleStatement(elseStatement.group(2).trim())) {
                String indent = elseStatement.group(1);
                _wrap(out, indent + "else", comment, elseStatement.group(2).trim(), indent);
                continue;
            }

            Matcher bareElse = BARE_ELSE.matcher(Texts.trimEnd(code));
            if (bareElse.find()) {
                i = _wrapFollowing(lines, i, bareElse.group(1) + "else", comment, bareElse.group(1), out);
                continue;
            }
            out.add(line);
        }
        return out;
    }

    /**
     * Handles a header whose body starts on a following line. Returns the index of the last consumed line.
     */
    private int _wrapFollowing(List<String> lines, int i, String header, String comment, String indent, List<String> out) {
        int next = ControlSyntax.nextNonBlank(lines, i + 1);
        if (next >= lines.size()) {
            out.add(lines.get(i));
            return i;
        }
        String nextTrimmed = lines.get(next).trim();
        if (ControlSyntax.LOGICAL_CONTINUATION.matcher(nextTrimmed).find()) {
            out.add(lines.get(i));
            return i;
        }

        Matcher begin = BEGIN_LINE.matcher(nextTrimmed);
        if (begin.find()) {
            String beginComment = begin.group(1) == null ? "" : begin.group(1);
            out.add(header + " begin" + _mergeComments(comment, beginComment));
            return next;
        }

        int body = ControlSyntax.nextExecutable(lines, next);
        if (body < 0 || body >= lines.size()) {
            out.add(lines.get(i));
            return i;
        }
        String bodyTrimmed = lines.get(body).trim();
        String bodyCode = ControlSyntax.code(bodyTrimmed);
        if (body > next && ControlSyntax.LOGICAL_CONTINUATION.matcher(bodyCode).find()
                || !_isSimpleStatement(bodyCode)) {
            out.add(lines.get(i));
            return i;
        }

        out.add(header + " begin" + (comment.isEmpty() ? "" : " " + comment));
        for (int j = next; j < body; j++) {
            String between = lines.get(j).trim();
            out.add(between.isEmpty() ? "" : indent + unit + between);
        }
        out.add(indent + unit + bodyTrimmed);
        out.add(indent + "end");
        return body;
    }

    private void _wrap(List<String> out, String header, String comment, String statement, String indent) {
        out.add(header + " begin" + (comment.isEmpty() ? "" : " " + comment));
        out.add(indent + unit + statement);
        out.add(indent + "end");
    }

    /**
     * One complete statement on one line, not itself a block or control construct.
     */
    private static boolean _isSimpleStatement(String code) {
        return code.endsWith(";") && code.indexOf(';') == code.length() - 1
                && !NESTED_BODY.matcher(code).find() && ControlSyntax.balanced(code);
    }

    private static String _mergeComments(String first, String second) {
        String a = first.replaceFirst("^//\\s?", "").trim();
        String b = second.replaceFirst("^//\\s?", "").trim();
        String merged = (a + " " + b).trim();
        return merged.isEmpty() ? "" : " // " + merged;
    }

    private List<String> _joinEndElse(List<String> lines) {
        List<String> out = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher end = BARE_END.matcher(line);
            if (end.find()) {
                int next = ControlSyntax.nextNonBlank(lines, i + 1);
                if (next < lines.size() && ELSE_WITH_BEGIN.matcher(lines.get(next).trim()).find()) {
                    String elsePart = lines.get(next).trim().replaceFirst("^else\\s+if\\b", "else if");
                    String endComment = end.group(1) == null ? "" : " " + end.group(1);
                    out.add(Texts.indentOf(line) + "end " + elsePart + endComment);
                    i = next;
                    continue;
                }
            }
            out.add(line);
        }
        return out;
    }
}
