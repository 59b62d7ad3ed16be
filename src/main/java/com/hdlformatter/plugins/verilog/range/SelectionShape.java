package com.hdlformatter.plugins.verilog.range;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.util.Texts;

/**
 * What a selected block of lines contains, judged from the selection alone.
 */
final class SelectionShape {
    private static final Pattern BEGIN = Pattern.compile("\\bbegin\\b");
    private static final Pattern END = Pattern.compile("\\bend\\b");
    private static final Pattern ELSE = Pattern.compile("\\belse\\b");
    private static final Pattern IF_START = Pattern.compile("^\\s*if\\s*\\(");
    private static final Pattern INSTANCE_FIRST = Pattern.compile("^([A-Za-z_]\\w*)\\s+(?:#\\s*\\(|([A-Za-z_]\\w*)\\s*(?:\\[[^\\]]*\\]\\s*)?\\()");
    private static final Pattern INSTANCE_LAST = Pattern.compile("\\)\\s*;\\s*(//.*)?$");
    private static final Pattern MODULE = Pattern.compile("^\\s*module\\s+\\w+");
    private static final Pattern HEADER_CLOSE = Pattern.compile("\\)\\s*;\\s*$");
    private static final Pattern INSTANCE_LINE = Pattern.compile(
            "^\\s*[A-Za-z_]\\w*\\s+#?\\s*\\(|^\\s*[A-Za-z_]\\w*\\s+[A-Za-z_]\\w*\\s*\\(");
    private static final Pattern INSTANCE_STRUCTURE = Pattern.compile("^\\s*\\w+\\s+#\\s*\\(|^\\s*\\)\\s+\\w+\\s*\\(");
    private static final Pattern PORT = Pattern.compile("^\\s*(input|output|inout)\\s+");
    private static final Pattern PROCEDURAL = Pattern.compile("^\\s*(always\\w*|initial)\\b");

    private static final Set<String> KEYWORDS = Set.of(
            "module", "macromodule", "if", "else", "for", "while", "case", "casex", "casez", "assign",
            "always", "always_ff", "always_comb", "always_latch", "initial", "wire", "reg", "logic",
            "input", "output", "inout", "parameter", "localparam", "function", "task", "begin", "end");

    private final List<String> lines;

    SelectionShape(List<String> lines) {
        this.lines = lines;
    }

    /**
     * True when the selection holds at least one construct whose indentation can be computed from the
     * selection itself.
     */
    boolean hasCompleteStructure() {
        return _balanced("always\\w*", true, null)
                || _balanced("initial", true, null)
                || _balanced("generate", false, "endgenerate")
                || _balanced("for", true, null)
                || _balanced("(?:unique\\s+|priority\\s+)?case[xz]?", false, "endcase")
                || hasCompleteIfElse()
                || hasCompleteInstantiation();
    }

    /**
     * A start keyword is present and the nesting it opens is closed again. Block constructs count
     * {@code begin}/{@code end}; keyword constructs count the start keyword against its closing keyword.
     */
    private boolean _balanced(String start, boolean beginEnd, String closer) {
        Pattern startPattern = Pattern.compile("^(" + start + ")\\b");
        Pattern closePattern = closer == null ? null : Pattern.compile("\\b" + closer + "\\b");
        boolean hasStart = false;
        int depth = 0;
        for (String line : lines) {
            String code = Texts.stripComment(line).trim();
            boolean starts = startPattern.matcher(code).find();
            hasStart |= starts;
            if (beginEnd) {
                depth += Texts.countMatches(BEGIN, code) - Texts.countMatches(END, code);
            } else {
                if (starts) {
                    depth++;
                }
                if (closePattern.matcher(code).find()) {
                    depth--;
                }
            }
        }
        return hasStart && depth == 0;
    }

    boolean hasCompleteIfElse() {
        boolean hasIf = false;
        boolean inChain = false;
        int depth = 0;
        for (String line : lines) {
            String code = Texts.stripComment(line).trim();
            if (IF_START.matcher(code).find()) {
                hasIf = true;
                inChain = true;
            }
            if (inChain) {
                depth += Texts.countMatches(BEGIN, code);
                int ends = Texts.countMatches(END, code);
                depth -= ends;
                if (ends > 0 && depth == 0 && !ELSE.matcher(code).find()) {
                    inChain = false;
                }
            }
            if (ELSE.matcher(code).find()) {
                inChain = true;
            }
        }
        return hasIf && depth == 0;
    }

    /**
     * First line starts an instantiation and the last line closes it with {@code );}.
     */
    boolean hasCompleteInstantiation() {
        if (lines.isEmpty()) {
            return false;
        }
        Matcher first = INSTANCE_FIRST.matcher(lines.get(0).trim());
        if (!first.find() || KEYWORDS.contains(first.group(1))
                || first.group(2) != null && KEYWORDS.contains(first.group(2))) {
            return false;
        }
        return INSTANCE_LAST.matcher(lines.get(lines.size() - 1).trim()).find();
    }

    boolean hasModuleHeader() {
        return lines.stream().anyMatch(l -> MODULE.matcher(l).find());
    }

    /**
     * A {@code module NAME} line and a closing {@code );} line are both selected.
     */
    boolean hasCompleteModuleHeader() {
        return hasModuleHeader() && lines.stream().anyMatch(l -> HEADER_CLOSE.matcher(l).find());
    }

    boolean hasModuleInstantiation() {
        return lines.stream().anyMatch(l -> INSTANCE_LINE.matcher(l).find() && !MODULE.matcher(l).find());
    }

    /**
     * Only connection lines are selected: no {@code MOD #(} or {@code ) inst (} structure.
     */
    boolean hasOnlyConnections() {
        return lines.stream().noneMatch(l -> INSTANCE_STRUCTURE.matcher(l).find());
    }

    boolean hasPortDeclarations() {
        return lines.stream().anyMatch(l -> PORT.matcher(l).find());
    }

    boolean hasProceduralBlock() {
        return lines.stream().anyMatch(l -> PROCEDURAL.matcher(l).find());
    }
}
