package com.hdlformatter.plugins.verilog.indent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.plugins.verilog.LinePass;
import com.hdlformatter.util.Texts;

/**
 * Re-indents the body of every {@code always}, {@code always_ff}, {@code always_comb}, {@code always_latch},
 * {@code initial} and {@code final} block relative to its header. A bare {@code end} followed by an
 * {@code else} line is merged into {@code end else ...}.
 * <p>
 * Generate regions get the same treatment: the body of {@code generate ... endgenerate} sits one unit under
 * the keyword, and a module-level {@code for (...) begin} or {@code if (...) begin} is laid out like a block.
 * Loops inside functions and tasks are left alone.
 */
public class AlwaysBlockIndenter implements LinePass {
    private static final Pattern GENERATE_CONSTRUCT = Pattern.compile("^(for|if)\\s*\\(");
    private static final Pattern SUBROUTINE = Pattern.compile("^(?:(?:static|automatic|virtual)\\s+)*(function|task)\\b");
    private static final Pattern END_SUBROUTINE = Pattern.compile("^end(function|task)\\b");

    private final String unit;

    public AlwaysBlockIndenter(FormatConfig config) {
        this.unit = config.indentUnit();
    }

    @Override
    public String getName() {
        return "always-blocks";
    }

    @Override
    public boolean isApplicable(List<String> lines) {
        return lines.stream().anyMatch(l -> ControlSyntax.PROCEDURAL.matcher(l).find()
                || _startsGenerate(ControlSyntax.code(l.trim())));
    }

    /**
     * True when some line opens an {@code always}/{@code initial}/{@code final} block.
     */
    public static boolean hasProceduralBlock(List<String> lines) {
        return lines.stream().anyMatch(l -> ControlSyntax.PROCEDURAL.matcher(l).find());
    }

    @Override
    public List<String> apply(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        boolean inSubroutine = false;
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            String code = ControlSyntax.code(line.trim());
            if (SUBROUTINE.matcher(code).find()) {
                inSubroutine = true;
            } else if (END_SUBROUTINE.matcher(code).find()) {
                inSubroutine = false;
            }

            if (ControlSyntax.PROCEDURAL.matcher(line).find()
                    || !inSubroutine && _startsGenerate(code)) {
                i = new BlockLayout(Texts.indentOf(line), unit, true).run(lines, i, result);
            } else {
                result.add(line);
                i++;
            }
        }
        return result;
    }

    private static boolean _startsGenerate(String code) {
        return ControlSyntax.GENERATE.matcher(code).find()
                || GENERATE_CONSTRUCT.matcher(code).find() && ControlSyntax.BEGIN_TAIL.matcher(code).find();
    }
}
