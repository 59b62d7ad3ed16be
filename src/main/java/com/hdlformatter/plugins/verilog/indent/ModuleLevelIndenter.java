package com.hdlformatter.plugins.verilog.indent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.plugins.verilog.LinePass;
import com.hdlformatter.util.Texts;

/**
 * Indents module-body items that sit at column zero by one unit. Lines inside the module header and
 * inside {@code begin}/{@code end} blocks are not touched.
 * <p>
 * A declaration moves together with the continuation lines of its initializer, up to the terminating
 * {@code ;}. A generate region ({@code generate ... endgenerate}, or a {@code for}/{@code if} generate
 * construct opening a {@code begin} block) moves as a whole.
 */
public class ModuleLevelIndenter implements LinePass {
    private static final Pattern MODULE = Pattern.compile("^(module|macromodule)\\s+\\w+");
    private static final Pattern END_MODULE = Pattern.compile("^endmodule\\b");
    private static final Pattern DECLARATION = Pattern.compile(
            "^(wire|reg|logic|integer|genvar|input|output|inout|parameter|localparam|assign)\\b");
    private static final Pattern BLOCK_END = Pattern.compile("^end\\b");
    private static final Pattern GENERATE = Pattern.compile("^generate\\b");
    private static final Pattern END_GENERATE = Pattern.compile("^endgenerate\\b");
    private static final Pattern GENERATE_CONSTRUCT = Pattern.compile("^(for|if)\\s*\\(");

    private final String unit;

    public ModuleLevelIndenter(FormatConfig config) {
        this.unit = config.indentUnit();
    }

    @Override
    public String getName() {
        return "module-level-indent";
    }

    @Override
    public List<String> apply(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        boolean inModule = false;
        boolean inHeader = false;
        int depth = 0;

        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            String trimmed = line.trim();
            String code = ControlSyntax.code(trimmed);
            if (MODULE.matcher(code).find()) {
                inModule = true;
                inHeader = !Texts.endsStatement(line);
                depth = 0;
                result.add(line);
                i++;
                continue;
            }
            if (inHeader) {
                inHeader = !Texts.endsStatement(line);
                result.add(line);
                i++;
                continue;
            }
            if (END_MODULE.matcher(code).find()) {
                inModule = false;
                result.add(line);
                i++;
                continue;
            }

            boolean atTop = inModule && depth == 0 && line.equals(trimmed) && !trimmed.isEmpty();
            if (atTop && GENERATE.matcher(code).find()) {
                i = _shiftGenerate(lines, i, result);
                continue;
            }
            if (atTop && GENERATE_CONSTRUCT.matcher(code).find() && ControlSyntax.hasBegin(code)) {
                i = _shiftBlock(lines, i, result);
                continue;
            }

            if (ControlSyntax.hasBegin(code)) {
                depth++;
            }
            if (BLOCK_END.matcher(code).find()) {
                depth = Math.max(0, depth - 1);
            }
            if (atTop && DECLARATION.matcher(code).find()) {
                i = _shiftStatement(lines, i, result);
            } else {
                result.add(line);
                i++;
            }
        }
        return result;
    }

    /**
     * Shifts a declaration and the lines continuing it. Returns the index after the last shifted line.
     */
    private int _shiftStatement(List<String> lines, int start, List<String> out) {
        int i = start;
        while (i < lines.size()) {
            String line = lines.get(i);
            out.add(_shift(line));
            i++;
            if (Texts.endsStatement(line)) {
                break;
            }
            // a keyword line means the declaration was never terminated
            if (i < lines.size() && (lines.get(i).trim().isEmpty() || _startsItem(lines.get(i)))) {
                break;
            }
        }
        return i;
    }

    private int _shiftGenerate(List<String> lines, int start, List<String> out) {
        int i = start;
        while (i < lines.size()) {
            String line = lines.get(i);
            out.add(_shift(line));
            i++;
            if (END_GENERATE.matcher(ControlSyntax.code(line.trim())).find()) {
                break;
            }
        }
        return i;
    }

    /**
     * Shifts a {@code for}/{@code if} construct up to the {@code end} that closes its {@code begin}.
     */
    private int _shiftBlock(List<String> lines, int start, List<String> out) {
        int open = 0;
        int i = start;
        while (i < lines.size()) {
            String line = lines.get(i);
            String code = ControlSyntax.code(line.trim());
            open += Texts.countMatches(ControlSyntax.BEGIN_WORD, code);
            if (BLOCK_END.matcher(code).find()) {
                open--;
            }
            out.add(_shift(line));
            i++;
            if (open <= 0 && !_elseFollows(lines, i)) {
                break;
            }
        }
        return i;
    }

    private static boolean _elseFollows(List<String> lines, int from) {
        int j = ControlSyntax.nextNonBlank(lines, from);
        return j < lines.size() && ControlSyntax.ELSE.matcher(ControlSyntax.code(lines.get(j).trim())).find();
    }

    private static boolean _startsItem(String line) {
        String code = ControlSyntax.code(line.trim());
        return DECLARATION.matcher(code).find() || END_MODULE.matcher(code).find()
                || ControlSyntax.PROCEDURAL.matcher(code).find();
    }

    private String _shift(String line) {
        return line.trim().isEmpty() ? line : unit + line;
    }
}
