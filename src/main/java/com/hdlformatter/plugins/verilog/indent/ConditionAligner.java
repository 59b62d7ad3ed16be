package com.hdlformatter.plugins.verilog.indent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.plugins.verilog.LinePass;
import com.hdlformatter.util.Texts;

/**
 * Aligns the continuation lines of a multi-line {@code if}/{@code for}/{@code while} condition to the column
 * right after the condition's opening parenthesis. Module headers are skipped.
 */
public class ConditionAligner implements LinePass {
    private static final Pattern CONDITION_START = Pattern.compile("^(\\s*(?:end\\s+)?(?:else\\s+)?(?:if|for|while)\\s*\\()");
    private static final Pattern MODULE_START = Pattern.compile("^\\s*module\\s+\\w+");
    private static final Pattern MODULE_WITHOUT_PORTS = Pattern.compile("^\\s*module\\s+\\w+\\s*;\\s*$");

    @Override
    public String getName() {
        return "multiline-conditions";
    }

    @Override
    public List<String> apply(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        boolean inHeader = false;
        int column = -1;
        int balance = 0;

        for (String line : lines) {
            String trimmed = line.trim();
            String code = Texts.stripComment(line);
            if (trimmed.isEmpty() || trimmed.startsWith("//") || trimmed.startsWith("`")) {
                result.add(line);
                continue;
            }

            if (inHeader) {
                inHeader = !Texts.endsStatement(line);
                result.add(line);
                continue;
            }
            if (MODULE_START.matcher(line).find()) {
                inHeader = !MODULE_WITHOUT_PORTS.matcher(line).find() && !Texts.endsStatement(line);
                result.add(line);
                continue;
            }

            if (column >= 0) {
                balance += Texts.count(code, '(') - Texts.count(code, ')');
                result.add(Texts.spaces(column) + trimmed);
                if (balance <= 0) {
                    column = -1;
                }
                continue;
            }

            Matcher start = CONDITION_START.matcher(code);
            if (start.find()) {
                int open = Texts.count(code, '(') - Texts.count(code, ')');
                if (open > 0) {
                    column = start.group(1).length();
                    balance = open;
                }
            }
            result.add(line);
        }
        return result;
    }
}
