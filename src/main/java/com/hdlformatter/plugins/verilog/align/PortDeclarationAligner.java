package com.hdlformatter.plugins.verilog.align;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.util.Texts;

/**
 * Aligns single-name {@code input}/{@code output}/{@code inout} declarations ending in {@code ,} or {@code ;}
 * into direction, type, range and name columns. Ranges are right-aligned so their closing brackets line up.
 * Lines that do not match are left untouched.
 */
public class PortDeclarationAligner {
    private static final Pattern PORT = Pattern.compile(
            "^(input|output|inout)\\s+(wire|reg|logic|bit)?\\s*(\\[[^\\]]+\\])?\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*([,;])\\s*(//.*)?$");

    private record Port(int index, String indent, String dir, String type, String range,
                        String name, String delimiter, String comment) {
    }

    public List<String> align(List<String> lines) {
        List<Port> ports = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher m = PORT.matcher(line.trim());
            if (m.find()) {
                ports.add(new Port(i, Texts.indentOf(line), m.group(1),
                        m.group(2) == null ? "" : m.group(2),
                        m.group(3) == null ? "" : m.group(3).trim(),
                        m.group(4), m.group(5),
                        m.group(6) == null ? "" : m.group(6)));
            }
        }
        if (ports.isEmpty()) {
            return lines;
        }

        int maxDir = ports.stream().mapToInt(p -> p.dir().length()).max().orElse(0);
        int maxType = ports.stream().mapToInt(p -> p.type().length()).max().orElse(0);
        int maxRange = ports.stream().mapToInt(p -> p.range().length()).max().orElse(0);
        int maxName = ports.stream().mapToInt(p -> p.name().length()).max().orElse(0);

        List<String> result = new ArrayList<>(lines);
        for (Port p : ports) {
            StringBuilder sb = new StringBuilder(p.indent()).append(Texts.padEnd(p.dir(), maxDir)).append(' ');
            if (maxType > 0) {
                sb.append(Texts.padEnd(p.type(), maxType)).append(' ');
            }
            if (maxRange > 0) {
                sb.append(Texts.padStart(p.range(), maxRange)).append(' ');
            }
            sb.append(Texts.padEnd(p.name(), maxName)).append(p.delimiter());
            if (!p.comment().isEmpty()) {
                sb.append(' ').append(p.comment());
            }
            result.set(p.index(), sb.toString());
        }
        return result;
    }
}
