package com.hdlformatter.plugins.verilog.indent;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.util.Texts;

/**
 * Patterns and scanning helpers shared by the control-flow passes.
 */
final class ControlSyntax {
    static final Pattern BEGIN_TAIL = Pattern.compile("\\bbegin(\\s*:\\s*\\w+)?$");
    static final Pattern BEGIN_WORD = Pattern.compile("\\bbegin\\b");
    static final Pattern STANDALONE_BEGIN = Pattern.compile("^begin(\\s*:\\s*\\w+)?$");
    static final Pattern CLOSER = Pattern.compile("^(end|endcase|endgenerate|join|join_any|join_none)\\b");
    static final Pattern CASE = Pattern.compile("^(?:(?:unique0?|priority)\\s+)?(case[xz]?|randcase)\\b");
    static final Pattern FORK = Pattern.compile("^fork\\b");
    static final Pattern GENERATE = Pattern.compile("^generate\\b");
    static final Pattern ELSE = Pattern.compile("^else\\b");
    static final Pattern IF_START = Pattern.compile("^(?:else\\s+)?if\\b");
    static final Pattern PROCEDURAL = Pattern.compile("^\\s*(always(?:_ff|_comb|_latch)?|initial|final)\\b");
    static final Pattern CONDITION_HEADER = Pattern.compile("^(?:else\\s+)?(?:if|for|while|repeat|foreach|wait)\\s*\\(.*\\)$");
    static final Pattern BARE_HEADER = Pattern.compile("^(?:else|forever|always_comb|always_latch|initial|final|always\\w*\\s*@.*)$");
    static final Pattern CASE_LABEL = Pattern.compile("^(?:default|[\\w'{}\\[\\]\\s,.+\\-]+?)\\s*:$");
    static final Pattern CONTROL_START = Pattern.compile("^(if|else|for|while|repeat|case[xz]?|begin|end|endgenerate|generate|fork|join)\\b");
    private static final Pattern DIRECTIVE = Pattern.compile("^`(ifn?def|elsif|else|endif)\\b");
    static final Pattern LOGICAL_CONTINUATION = Pattern.compile("^(&&|\\|\\||&(?!&)|\\|(?!\\|))");

    private ControlSyntax() {
    }

    /**
     * Code part of a trimmed line, without its line comment.
     */
    static String code(String trimmed) {
        return Texts.stripComment(trimmed).trim();
    }

    /**
     * The line comment of a line, or an empty string.
     */
    static String comment(String line) {
        int at = line.indexOf("//");
        return at < 0 ? "" : line.substring(at).trim();
    }

    /**
     * Index of the parenthesis closing the one at {@code open}, or -1.
     */
    static int closingParen(String s, int open) {
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    static boolean balanced(String code) {
        return Texts.count(code, '(') == Texts.count(code, ')');
    }

    static boolean hasBegin(String code) {
        return BEGIN_WORD.matcher(code).find();
    }

    /**
     * True for a line that holds only a block comment fragment, line comment or directive.
     */
    static boolean isNonCode(String trimmed) {
        return trimmed.startsWith("//") || trimmed.startsWith("/*") || trimmed.startsWith("*")
                || (trimmed.startsWith("`") && DIRECTIVE.matcher(trimmed).find());
    }

    static boolean isDirective(String trimmed) {
        return DIRECTIVE.matcher(trimmed).find();
    }

    static int nextNonBlank(List<String> lines, int from) {
        int i = from;
        while (i < lines.size() && lines.get(i).trim().isEmpty()) {
            i++;
        }
        return i;
    }

    /**
     * Index of the first statement line at or after {@code from}, skipping comments and whole
     * {@code `ifdef ... `endif} blocks. Returns -1 when a control keyword comes first.
     */
    static int nextExecutable(List<String> lines, int from) {
        int i = nextNonBlank(lines, from);
        while (i < lines.size()) {
            String trimmed = lines.get(i).trim();
            if (trimmed.startsWith("//") || trimmed.startsWith("/*")) {
                i = nextNonBlank(lines, i + 1);
            } else if (trimmed.startsWith("`ifdef") || trimmed.startsWith("`ifndef")) {
                int depth = 1;
                i++;
                while (i < lines.size() && depth > 0) {
                    String t = lines.get(i).trim();
                    if (t.startsWith("`ifdef") || t.startsWith("`ifndef")) {
                        depth++;
                    } else if (t.startsWith("`endif")) {
                        depth--;
                    }
                    i++;
                }
                i = nextNonBlank(lines, i);
            } else if (trimmed.startsWith("`else") || trimmed.startsWith("`elsif")) {
                i = nextNonBlank(lines, i + 1);
            } else if (CONTROL_START.matcher(trimmed).find()) {
                return -1;
            } else {
                return i;
            }
        }
        return i;
    }

    /**
     * Splits {@code if (...) rest} style text after a keyword: returns the index just past the condition's
     * closing parenthesis, or -1 when the condition does not close on this line.
     */
    static int conditionEnd(String code, Matcher keyword) {
        int open = code.indexOf('(', keyword.end() - 1);
        if (open < 0) {
            return -1;
        }
        int close = closingParen(code, open);
        return close < 0 ? -1 : close + 1;
    }
}
