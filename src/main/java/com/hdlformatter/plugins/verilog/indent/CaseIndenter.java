package com.hdlformatter.plugins.verilog.indent;

import java.util.ArrayList;
import java.util.List;

import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.plugins.verilog.LinePass;
import com.hdlformatter.util.Texts;

/**
 * Lays out {@code case}/{@code casex}/{@code casez} statements: items one unit under {@code case}, item bodies
 * one unit further, {@code endcase} back at the {@code case} column. The {@code case} line keeps its position.
 */
public class CaseIndenter implements LinePass {
    private final String unit;

    public CaseIndenter(FormatConfig config) {
        this.unit = config.indentUnit();
    }

    @Override
    public String getName() {
        return "case-statements";
    }

    @Override
    public boolean isApplicable(List<String> lines) {
        return lines.stream().anyMatch(CaseIndenter::_startsCase);
    }

    @Override
    public List<String> apply(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (_startsCase(line)) {
                i = new BlockLayout(Texts.indentOf(line), unit, false).run(lines, i, result);
            } else {
                result.add(line);
                i++;
            }
        }
        return result;
    }

    private static boolean _startsCase(String line) {
        return ControlSyntax.CASE.matcher(ControlSyntax.code(line.trim())).find();
    }
}
