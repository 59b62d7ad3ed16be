package com.hdlformatter.plugins.verilog.directive;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

import com.hdlformatter.plugins.verilog.LinePass;
import com.hdlformatter.util.Texts;

/**
 * Re-indents {@code `ifdef}/{@code `ifndef}/{@code `elsif}/{@code `else}/{@code `endif} to the code they guard.
 * An opening directive takes the indentation of the next code line (or the previous one at end of input);
 * its {@code `else} and {@code `endif} reuse that exact value.
 * <p>
 * In module-level mode only directives directly inside a module body move. Directives in the module header,
 * inside blocks and outside any module keep their position; the block indenters place those.
 */
public class DirectiveIndentNormalizer implements LinePass {
    private static final Pattern LIST_CLOSER = Pattern.compile("^\\s*[)}]");
    private static final Pattern MODULE = Pattern.compile("^(module|macromodule)\\s+\\w+");
    private static final Pattern END_MODULE = Pattern.compile("^endmodule\\b");
    private static final Pattern OPENER = Pattern.compile(
            "(\\bbegin\\b|^(?:(?:unique0?|priority)\\s+)?case[xz]?\\b|^fork\\b|^generate\\b|^(?:(?:static|automatic|virtual)\\s+)*(?:function|task)\\b)");
    private static final Pattern CLOSER = Pattern.compile(
            "^(end|endcase|endgenerate|endfunction|endtask|join|join_any|join_none)\\b");

    private record Guard(String indent, boolean keep) {
    }

    private final boolean moduleLevelOnly;

    public DirectiveIndentNormalizer() {
        this(false);
    }

    public DirectiveIndentNormalizer(boolean moduleLevelOnly) {
        this.moduleLevelOnly = moduleLevelOnly;
    }

    @Override
    public String getName() {
        return "directive-indent";
    }

    @Override
    public boolean isApplicable(List<String> lines) {
        return lines.stream().anyMatch(l -> l.trim().startsWith("`"));
    }

    @Override
    public List<String> apply(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        Deque<Guard> guards = new ArrayDeque<>();
        boolean[] moduleLevel = moduleLevelOnly ? _moduleLevelLines(lines) : null;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String trimmed = line.trim();

            boolean opens = trimmed.startsWith("`ifdef") || trimmed.startsWith("`ifndef");
            boolean branches = trimmed.startsWith("`elsif") || trimmed.startsWith("`else");
            boolean closes = trimmed.startsWith("`endif");
            if (!opens && !branches && !closes) {
                result.add(line);
                continue;
            }

            // inside a parameter/port/concatenation list the structure formatters own the layout
            boolean inList = _nextNonBlankClosesList(lines, i);

            if (closes) {
                Guard guard = guards.isEmpty() ? null : guards.pop();
                result.add(guard == null || guard.keep() || inList ? line : guard.indent() + trimmed);
                continue;
            }

            if (branches) {
                Guard guard = guards.peek();
                result.add(guard == null || guard.keep() || inList ? line : guard.indent() + trimmed);
                continue;
            }

            if (inList || moduleLevel != null && !moduleLevel[i]) {
                guards.push(new Guard(Texts.indentOf(line), true));
                result.add(line);
                continue;
            }

            String target = _findCodeIndent(lines, i);
            if (target == null) {
                guards.push(new Guard(Texts.indentOf(line), false));
                result.add(line);
            } else {
                guards.push(new Guard(target, false));
                result.add(target + trimmed);
            }
        }

        return result;
    }

    /**
     * Marks the lines that sit directly in a module body: past the header, outside every block.
     */
    private static boolean[] _moduleLevelLines(List<String> lines) {
        boolean[] marks = new boolean[lines.size()];
        boolean inModule = false;
        boolean inHeader = false;
        int depth = 0;
        int parens = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String code = Texts.stripComment(line).trim();
            if (MODULE.matcher(code).find()) {
                inModule = true;
                inHeader = !Texts.endsStatement(line);
                depth = 0;
                parens = 0;
                continue;
            }
            if (inHeader) {
                inHeader = !Texts.endsStatement(line);
                continue;
            }
            if (END_MODULE.matcher(code).find()) {
                inModule = false;
                continue;
            }
            marks[i] = inModule && depth == 0 && parens == 0;
            if (code.startsWith("`")) {
                continue;
            }
            depth += Texts.countMatches(OPENER, code);
            if (CLOSER.matcher(code).find()) {
                depth = Math.max(0, depth - 1);
            }
            parens = Math.max(0, parens + Texts.count(code, '(') - Texts.count(code, ')'));
        }
        return marks;
    }

    private static boolean _nextNonBlankClosesList(List<String> lines, int index) {
        for (int j = index + 1; j < lines.size(); j++) {
            if (!Texts.isBlank(lines.get(j))) {
                return LIST_CLOSER.matcher(lines.get(j)).find();
            }
        }
        return false;
    }

    private static String _findCodeIndent(List<String> lines, int index) {
        for (int j = index + 1; j < lines.size(); j++) {
            String t = lines.get(j).trim();
            if (!t.isEmpty() && !t.startsWith("`")) {
                return Texts.indentOf(lines.get(j));
            }
        }
        for (int j = index - 1; j >= 0; j--) {
            String t = lines.get(j).trim();
            if (!t.isEmpty() && !t.startsWith("`")) {
                return Texts.indentOf(lines.get(j));
            }
        }
        return null;
    }
}
