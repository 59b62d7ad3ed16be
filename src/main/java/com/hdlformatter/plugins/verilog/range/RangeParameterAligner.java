package com.hdlformatter.plugins.verilog.range;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.util.Texts;

/**
 * Aligns single-line {@code parameter}/{@code localparam} declarations of a selection, ended by either
 * {@code ,} or {@code ;}, into keyword, type, name and value columns.
 */
final class RangeParameterAligner {
    private static final Pattern PARAMETER = Pattern.compile(
            "^(parameter|localparam)\\s+(\\[[^\\]]+\\]\\s*|\\w+\\s+(?=[A-Za-z_]))?([A-Za-z_]\\w*)\\s*=\\s*(.+?)\\s*([,;])\\s*(//.*)?$");

    private record Param(int index, String indent, String keyword, String type, String name, String value,
                         String delimiter, String comment) {
    }

    List<String> align(List<String> lines) {
        List<Param> params = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher m = PARAMETER.matcher(line.trim());
            if (m.find()) {
                params.add(new Param(i, Texts.indentOf(line), m.group(1),
                        m.group(2) == null ? "" : m.group(2).trim(), m.group(3), m.group(4).trim(), m.group(5),
                        m.group(6) == null ? "" : m.group(6)));
            }
        }
        if (params.isEmpty()) {
            return lines;
        }

        int maxKeyword = params.stream().mapToInt(p -> p.keyword().length()).max().orElse(0);
        int maxType = params.stream().mapToInt(p -> p.type().length()).max().orElse(0);
        int maxName = params.stream().mapToInt(p -> p.name().length()).max().orElse(0);
        int maxValue = params.stream().mapToInt(p -> p.value().length()).max().orElse(0);

        List<String> result = new ArrayList<>(lines);
        for (Param p : params) {
            StringBuilder sb = new StringBuilder(p.indent()).append(Texts.padEnd(p.keyword(), maxKeyword)).append(' ');
            if (maxType > 0) {
                sb.append(Texts.padEnd(p.type(), maxType)).append(' ');
            }
            sb.append(Texts.padEnd(p.name(), maxName)).append(" = ")
                    .append(Texts.padEnd(p.value(), maxValue)).append(p.delimiter());
            if (!p.comment().isEmpty()) {
                sb.append(' ').append(p.comment());
            }
            result.set(p.index(), sb.toString());
        }
        return result;
    }
}
