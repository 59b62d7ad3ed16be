package com.hdlformatter.plugins.verilog.indent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.hdlformatter.plugins.verilog.LinePass;
import com.hdlformatter.util.Texts;

/**
 * Moves a standalone {@code begin} up onto the previous code line when that line ends with {@code )},
 * dropping the blank lines in between. A comment on the previous line stays after the {@code begin}.
 */
public class BeginPlacement implements LinePass {
    private static final Pattern ENDS_WITH_PAREN = Pattern.compile("\\)\\s*$");

    @Override
    public String getName() {
        return "begin-placement";
    }

    @Override
    public List<String> apply(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.trim().equals("begin")) {
                int target = result.size() - 1;
                while (target >= 0 && result.get(target).trim().isEmpty()) {
                    target--;
                }
                if (target >= 0) {
                    String previous = result.get(target);
                    String code = Texts.trimEnd(Texts.stripComment(previous));
                    if (!code.trim().isEmpty() && ENDS_WITH_PAREN.matcher(code).find()) {
                        String comment = ControlSyntax.comment(previous);
                        result.set(target, code + " begin" + (comment.isEmpty() ? "" : " " + comment));
                        while (result.size() > target + 1) {
                            result.remove(result.size() - 1);
                        }
                        continue;
                    }
                }
            }
            result.add(line);
        }
        return result;
    }
}
