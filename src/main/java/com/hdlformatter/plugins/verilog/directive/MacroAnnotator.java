package com.hdlformatter.plugins.verilog.directive;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.util.Texts;

/**
 * Tags {@code `else} and {@code `endif} directives with the symbol of the {@code `ifdef}/{@code `ifndef}
 * that opened them. One instance covers one top-to-bottom scan; the symbol stack is never shared.
 */
public class MacroAnnotator {
    private static final Pattern ANY_DIRECTIVE = Pattern.compile("`(ifn?def|else|endif)\\b");
    private static final Pattern MID_LINE = Pattern.compile("^(.+?)(`ifn?def\\s+(\\w+).*|`else\\b.*|`endif\\b.*)$");
    private static final Pattern OPEN = Pattern.compile("^`ifn?def\\s+(\\w+)");
    private static final Pattern ELSE = Pattern.compile("^`else\\b");
    private static final Pattern ENDIF = Pattern.compile("^`endif\\b");
    private static final Pattern ENDIF_PREFIX = Pattern.compile("^`endif\\s*");
    private static final Pattern ELSE_PREFIX = Pattern.compile("^`else\\s*");

    private final Deque<String> symbols = new ArrayDeque<>();

    /**
     * Annotates one line, updating the symbol stack. Lines without a directive come back unchanged.
     */
    public String annotate(String line) {
        if (!ANY_DIRECTIVE.matcher(Texts.stripComment(line)).find()) {
            return line;
        }

        String leading = Texts.indentOf(line);
        String trimmed = line.trim();

        if (!trimmed.startsWith("`")) {
            Matcher mid = MID_LINE.matcher(trimmed);
            if (mid.find()) {
                return _annotateMidLine(line, leading, mid.group(1), mid.group(2));
            }
            return line;
        }

        Matcher open = OPEN.matcher(trimmed);
        if (open.find()) {
            symbols.push(open.group(1));
            return leading + trimmed;
        }

        if (ELSE.matcher(trimmed).find()) {
            String current = symbols.peek();
            if (current == null) {
                return line;
            }
            return leading + _tag("`else", ELSE_PREFIX.matcher(trimmed).replaceFirst(""), current);
        }

        if (ENDIF.matcher(trimmed).find()) {
            if (symbols.isEmpty()) {
                return line;
            }
            return leading + _tag("`endif", ENDIF_PREFIX.matcher(trimmed).replaceFirst(""), symbols.pop());
        }

        return line;
    }

    /**
     * Rebuilds a directive with its symbol as the trailing comment. Code after the directive stays
     * ahead of the comment and any previous comment text is replaced.
     */
    private static String _tag(String directive, String after, String symbol) {
        int commentAt = after.indexOf("//");
        String code = (commentAt >= 0 ? after.substring(0, commentAt) : after).trim();
        return directive + " " + (code.isEmpty() ? "" : code + " ") + "// " + symbol;
    }

    /**
     * Number of directives still open.
     */
    public int depth() {
        return symbols.size();
    }

    private String _annotateMidLine(String line, String leading, String before, String directive) {
        Matcher open = OPEN.matcher(directive);
        if (open.find()) {
            symbols.push(open.group(1));
            return leading + before + directive;
        }

        if (ELSE.matcher(directive).find()) {
            String current = symbols.peek();
            if (current == null) {
                return line;
            }
            return leading + before + _tag("`else", ELSE_PREFIX.matcher(directive).replaceFirst(""), current);
        }

        if (symbols.isEmpty()) {
            return line;
        }
        return leading + before + _tag("`endif", ENDIF_PREFIX.matcher(directive).replaceFirst(""), symbols.pop());
    }
}
