package com.hdlformatter.plugins.verilog.structure;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.plugins.verilog.LinePass;
import com.hdlformatter.util.Texts;

/**
 * Finds module instantiations and hands each one, from its first line to the terminating {@code ;},
 * to {@link InstanceRenderer}.
 * <p>
 * Recognized starts: {@code MOD #(}, {@code MOD inst (}, {@code MOD #} with {@code (} on the next line,
 * and {@code MOD} alone with {@code inst (} on the next line. An instantiation never closed before the end
 * of input is left as written.
 */
public class InstantiationFormatter implements LinePass {
    private static final Pattern PARAMETERIZED = Pattern.compile("^(\\s*)([A-Za-z_]\\w*)\\s+#\\s*\\(");
    private static final Pattern SIMPLE = Pattern.compile("^(\\s*)([A-Za-z_]\\w*)\\s+([A-Za-z_]\\w*)\\s*(?:\\[[^\\]]*\\]\\s*)?\\(");
    private static final Pattern HASH_ONLY = Pattern.compile("^(\\s*)([A-Za-z_]\\w*)\\s+#\\s*$");
    private static final Pattern NAME_ONLY = Pattern.compile("^(\\s*)([A-Za-z_]\\w*)\\s*$");
    private static final Pattern OPEN_PAREN_LINE = Pattern.compile("^\\s*(#\\s*)?\\(");
    private static final Pattern INSTANCE_LINE = Pattern.compile("^\\s*[A-Za-z_]\\w*\\s*\\(");
    private static final Pattern CONTROL = Pattern.compile("^\\s*(begin|always|always_ff|always_comb|always_latch|initial|if|else)\\b");
    private static final Pattern DECLARATION = Pattern.compile("^\\s*(wire|reg|logic|assign|input|output|inout|parameter|localparam)\\b");

    private static final Set<String> KEYWORDS = Set.of(
            "module", "macromodule", "endmodule", "function", "endfunction", "task", "endtask",
            "if", "else", "for", "while", "repeat", "forever", "case", "casex", "casez", "endcase", "return",
            "assign", "always", "always_ff", "always_comb", "always_latch", "initial", "final",
            "wire", "reg", "logic", "bit", "integer", "real", "genvar", "input", "output", "inout",
            "parameter", "localparam", "generate", "endgenerate", "begin", "end", "fork", "join",
            "and", "or", "not", "nand", "nor", "xor", "xnor", "buf", "bufif0", "bufif1", "notif0", "notif1",
            "assert", "assume", "cover", "property", "sequence", "typedef", "struct", "enum", "import", "default",
            "disable", "wait", "posedge", "negedge", "supply0", "supply1", "tri", "var", "automatic", "static");

    private static final int CONTEXT_LOOKBACK = 10;

    private final InstanceRenderer renderer;

    public InstantiationFormatter(FormatConfig config) {
        this.renderer = new InstanceRenderer(config.indentUnit());
    }

    @Override
    public String getName() {
        return "module-instantiations";
    }

    @Override
    public List<String> apply(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        int i = 0;
        while (i < lines.size()) {
            String own = _startIndent(lines, i);
            if (own == null) {
                result.add(lines.get(i));
                i++;
                continue;
            }
            int end = _findEnd(lines, i);
            if (end < 0) {
                result.add(lines.get(i));
                i++;
                continue;
            }
            String base = _baseIndent(lines, i, own);
            result.addAll(renderer.render(new ArrayList<>(lines.subList(i, end + 1)), base));
            i = end + 1;
        }
        return result;
    }

    /**
     * Indentation of the instantiation starting at {@code i}, or null when the line starts none.
     */
    private static String _startIndent(List<String> lines, int i) {
        String line = Texts.stripComment(lines.get(i));
        Matcher m = PARAMETERIZED.matcher(line);
        if (m.find() && !_isKeyword(m.group(2))) {
            return m.group(1);
        }
        m = SIMPLE.matcher(line);
        if (m.find() && !_isKeyword(m.group(2)) && !_isKeyword(m.group(3))) {
            return m.group(1);
        }
        if (i + 1 >= lines.size()) {
            return null;
        }
        String next = lines.get(i + 1);
        m = HASH_ONLY.matcher(line);
        if (m.find() && !_isKeyword(m.group(2)) && OPEN_PAREN_LINE.matcher(next).find()) {
            return m.group(1);
        }
        m = NAME_ONLY.matcher(line);
        if (m.find() && !_isKeyword(m.group(2)) && INSTANCE_LINE.matcher(next).find()
                && !_isKeyword(next.trim().split("[\\s(]")[0])) {
            return m.group(1);
        }
        return null;
    }

    private static boolean _isKeyword(String word) {
        return KEYWORDS.contains(word.toLowerCase());
    }

    /**
     * Index of the line closing the instantiation: parentheses balanced and a terminating {@code ;}.
     * Returns -1 when the input ends first.
     */
    private static int _findEnd(List<String> lines, int start) {
        int depth = 0;
        boolean opened = false;
        for (int j = start; j < lines.size(); j++) {
            String code = Texts.stripComment(lines.get(j));
            depth += Texts.count(code, '(') - Texts.count(code, ')');
            opened |= code.indexOf('(') >= 0;
            if (depth < 0) {
                return -1;
            }
            if (opened && depth == 0 && code.trim().endsWith(";")) {
                return j;
            }
        }
        return -1;
    }

    /**
     * Module-level instantiations take the indentation of the nearest declaration above them; inside a
     * procedural or conditional block the instantiation keeps its own.
     */
    private static String _baseIndent(List<String> lines, int i, String own) {
        for (int back = i - 1; back >= Math.max(0, i - CONTEXT_LOOKBACK); back--) {
            String prev = lines.get(back);
            String trimmed = prev.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("//")) {
                continue;
            }
            if (CONTROL.matcher(prev).find()) {
                return own;
            }
            if (DECLARATION.matcher(prev).find()) {
                return Texts.indentOf(prev);
            }
        }
        return own;
    }
}
