package com.hdlformatter.plugins.verilog.align;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.plugins.verilog.line.DeclarationKind;
import com.hdlformatter.plugins.verilog.line.LineClassifier;
import com.hdlformatter.util.Texts;

/**
 * Aligns {@code parameter}/{@code localparam} declarations on {@code =} and semicolon.
 * Multi-line values continue at the column right after {@code " = "}.
 */
public class ParameterAligner {
    private static final Pattern KEYWORD = Pattern.compile("^(parameter|localparam)$");
    private static final Pattern TERMINATOR = Pattern.compile(";\\s*(//.*)?$");
    private static final Pattern SEMICOLON_TAIL = Pattern.compile(";\\s*$");
    private static final Pattern TRAILING_COMMENT = Pattern.compile("^(.*?)(//.*)$");
    private static final Pattern CLOSING_BRACE = Pattern.compile("^}[,;]?\\s*$");

    private static class ParamDecl {
        final List<String> originalLines;
        boolean isParam;
        String left = "";
        List<String> valueLines = new ArrayList<>();
        String comment = "";
        String firstComment = "";
        boolean terminated;

        ParamDecl(List<String> originalLines) {
            this.originalLines = originalLines;
        }
    }

    /**
     * Aligns one parameter group. Comments, blanks and directives pass through unchanged.
     */
    public List<String> align(List<String> lines) {
        if (lines.isEmpty()) {
            return lines;
        }

        List<ParamDecl> parsed = new ArrayList<>();
        for (List<String> block : _splitBlocks(lines)) {
            parsed.add(_parse(block));
        }

        List<ParamDecl> params = parsed.stream().filter(p -> p.isParam).toList();
        if (params.isEmpty()) {
            return lines;
        }

        String baseIndent = Texts.indentOf(params.get(0).originalLines.get(0));
        int maxLeft = params.stream().mapToInt(p -> p.left.length()).max().orElse(0);

        int maxSemicolon = 0;
        for (ParamDecl p : params) {
            if (p.valueLines.size() == 1) {
                maxSemicolon = Math.max(maxSemicolon, baseIndent.length() + maxLeft + 3 + p.valueLines.get(0).length());
            }
        }

        List<String> result = new ArrayList<>();
        for (ParamDecl p : parsed) {
            if (!p.isParam) {
                result.addAll(p.originalLines);
                continue;
            }
            String head = baseIndent + Texts.padEnd(p.left, maxLeft) + " = ";
            String comment = p.comment.isEmpty() ? "" : " " + p.comment;

            if (p.valueLines.size() == 1) {
                String before = head + p.valueLines.get(0);
                result.add((p.terminated ? Texts.padEnd(before, maxSemicolon) + ";" : Texts.trimEnd(before)) + comment);
                continue;
            }

            result.add(Texts.trimEnd(head + p.valueLines.get(0))
                    + (p.firstComment.isEmpty() ? "" : " " + p.firstComment));
            String continuation = Texts.spaces(head.length());
            for (int i = 1; i < p.valueLines.size(); i++) {
                boolean last = i == p.valueLines.size() - 1;
                result.add(continuation + p.valueLines.get(i) + (last && p.terminated ? ";" + comment : ""));
            }
        }
        return result;
    }

    private static List<List<String>> _splitBlocks(List<String> lines) {
        List<List<String>> blocks = new ArrayList<>();
        List<String> current = null;
        for (String l : lines) {
            if (current == null && LineClassifier.declarationKind(l) == DeclarationKind.PARAMETER) {
                current = new ArrayList<>();
            }
            if (current == null) {
                blocks.add(List.of(l));
                continue;
            }
            current.add(l);
            if (Texts.endsStatement(l)) {
                blocks.add(current);
                current = null;
            }
        }
        if (current != null) {
            blocks.add(current);
        }
        return blocks;
    }

    private static ParamDecl _parse(List<String> block) {
        ParamDecl p = new ParamDecl(block);
        String first = block.get(0);
        if (LineClassifier.declarationKind(first) != DeclarationKind.PARAMETER) {
            return p;
        }

        String body = Texts.stripComment(first).trim();
        int eq = body.indexOf('=');
        if (eq == -1) {
            return p;
        }
        String last = block.get(block.size() - 1);
        p.terminated = Texts.endsStatement(last);

        Matcher lastComment = TRAILING_COMMENT.matcher(last);
        String trailing = lastComment.find() ? _normalizeComment(lastComment.group(2)) : "";
        if (block.size() == 1) {
            p.comment = trailing;
        } else {
            Matcher fc = TRAILING_COMMENT.matcher(first);
            p.firstComment = fc.find() ? _normalizeComment(fc.group(2)) : "";
            p.comment = p.terminated ? trailing : "";
        }

        LinkedList<String> tokens = new LinkedList<>(Arrays.asList(body.substring(0, eq).trim().split("\\s+")));
        StringBuilder left = new StringBuilder();
        if (!tokens.isEmpty() && KEYWORD.matcher(tokens.getFirst()).matches()) {
            left.append(tokens.removeFirst());
        }
        for (String token : tokens) {
            if (left.length() > 0) {
                left.append(' ');
            }
            left.append(token);
        }
        p.left = left.toString();

        p.valueLines.add(SEMICOLON_TAIL.matcher(body.substring(eq + 1).trim()).replaceFirst(""));
        for (int i = 1; i < block.size(); i++) {
            String ln = block.get(i);
            String trimmed = (i == block.size() - 1 && p.terminated)
                    ? TERMINATOR.matcher(ln).replaceFirst("").trim()
                    : ln.trim();
            if (!trimmed.isEmpty()) {
                p.valueLines.add(trimmed);
            }
        }
        _mergeLoneBraces(p.valueLines);
        p.isParam = true;
        return p;
    }

    private static void _mergeLoneBraces(List<String> values) {
        for (int i = 0; i < values.size() - 1; i++) {
            if (values.get(i).trim().equals("{")) {
                values.set(i, "{ " + values.get(i + 1));
                values.remove(i + 1);
                i--;
            }
        }
        for (int i = 1; i < values.size(); i++) {
            if (CLOSING_BRACE.matcher(values.get(i).trim()).find()) {
                values.set(i - 1, values.get(i - 1) + " " + values.get(i).trim());
                values.remove(i);
                i--;
            }
        }
    }

    private static String _normalizeComment(String comment) {
        return comment.replaceFirst("//\\s?", "// ").trim();
    }
}
