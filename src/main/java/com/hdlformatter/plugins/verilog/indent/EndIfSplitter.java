package com.hdlformatter.plugins.verilog.indent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.plugins.verilog.LinePass;
import com.hdlformatter.util.Texts;

/**
 * Splits {@code end if (...)} into {@code end} and {@code if (...)} at the same indentation.
 * {@code end else if} is left alone.
 */
public class EndIfSplitter implements LinePass {
    private static final Pattern END_IF = Pattern.compile("^end\\s+(if\\s*\\(.*)$");

    @Override
    public String getName() {
        return "end-if";
    }

    @Override
    public List<String> apply(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            Matcher m = END_IF.matcher(line.trim());
            if (m.find()) {
                String indent = Texts.indentOf(line);
                result.add(indent + "end");
                result.add(indent + m.group(1));
            } else {
                result.add(line);
            }
        }
        return result;
    }
}
