package com.hdlformatter.plugins.verilog.structure;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.util.Texts;

/**
 * Renders the {@code #( ... )} list of a module header one parameter per line, with {@code =} and the
 * commas of single-line values aligned. Multi-line values continue right after {@code " = "}.
 */
class HeaderParameterAligner {
    private static final Pattern PARAMETER = Pattern.compile("^(?:(parameter|localparam)\\b\\s*)?(.*?)\\s*(?<![=!<>])=(?!=)\\s*(.*)$");

    private final boolean align;
    private final String unit;

    HeaderParameterAligner(boolean align, String unit) {
        this.align = align;
        this.unit = unit;
    }

    private record Parsed(String left, List<String> values) {
    }

    List<String> render(List<ListEntry> entries, String indent) {
        List<Parsed> parsed = new ArrayList<>();
        int maxLeft = 0;
        int maxValue = 0;
        for (ListEntry entry : entries) {
            Parsed p = entry.getKind() == ListEntry.Kind.ITEM ? _parse(entry) : null;
            parsed.add(p);
            if (p != null) {
                maxLeft = Math.max(maxLeft, p.left().length());
                if (p.values().size() == 1) {
                    maxValue = Math.max(maxValue, p.values().get(0).length());
                }
            }
        }

        List<String> out = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            ListEntry entry = entries.get(i);
            switch (entry.getKind()) {
                case BLANK -> out.add("");
                case SEPARATOR -> out.add(indent + ",");
                case DIRECTIVE, COMMENT -> out.add(indent + entry.display());
                case ITEM -> {
                    String comma = ListEntry.commaAfter(entries, i) ? "," : "";
                    Parsed p = parsed.get(i);
                    if (p == null || !align) {
                        _renderRaw(entry, indent, comma, out);
                    } else {
                        _renderAligned(entry, p, indent, comma, maxLeft, maxValue, out);
                    }
                }
            }
        }
        return out;
    }

    private void _renderAligned(ListEntry entry, Parsed p, String indent, String comma,
                                int maxLeft, int maxValue, List<String> out) {
        List<String> comments = entry.getComments();
        String head = indent + Texts.padEnd(p.left(), maxLeft) + " = ";
        if (p.values().size() == 1) {
            String value = p.values().get(0);
            String line = comma.isEmpty() ? head + value : head + Texts.padEnd(value, maxValue) + comma;
            out.add(_withComment(line, comments.get(0)));
            return;
        }
        out.add(_withComment(head + p.values().get(0), comments.get(0)));
        String continuation = Texts.spaces(head.length());
        for (int k = 1; k < p.values().size(); k++) {
            boolean last = k == p.values().size() - 1;
            out.add(_withComment(continuation + p.values().get(k) + (last ? comma : ""), comments.get(k)));
        }
    }

    private void _renderRaw(ListEntry entry, String indent, String comma, List<String> out) {
        List<String> lines = entry.getLines();
        for (int k = 0; k < lines.size(); k++) {
            String prefix = k == 0 ? indent : indent + unit;
            String text = lines.get(k) + (k == lines.size() - 1 ? comma : "");
            out.add(_withComment(prefix + text, entry.getComments().get(k)));
        }
    }

    private static Parsed _parse(ListEntry entry) {
        Matcher m = PARAMETER.matcher(entry.first());
        if (!m.find() || m.group(2).isBlank() || m.group(3).isEmpty() && !entry.isMultiLine()) {
            return null;
        }
        StringBuilder left = new StringBuilder(m.group(1) == null ? "" : m.group(1));
        for (String token : m.group(2).trim().split("\\s+")) {
            if (left.length() > 0) {
                left.append(' ');
            }
            left.append(token);
        }

        List<String> values = new ArrayList<>();
        values.add(m.group(3).trim());
        values.addAll(entry.getLines().subList(1, entry.getLines().size()));
        return new Parsed(left.toString(), values);
    }

    private static String _withComment(String line, String comment) {
        return comment.isEmpty() ? Texts.trimEnd(line) : Texts.trimEnd(line) + " " + comment;
    }
}
