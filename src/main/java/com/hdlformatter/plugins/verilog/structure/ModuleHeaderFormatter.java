package com.hdlformatter.plugins.verilog.structure;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.util.LoggerUtil;
import com.hdlformatter.util.Texts;

import java.util.logging.Logger;

/**
 * Rewrites a module declaration into one parameter and one port per line.
 * <p>
 * Layout:
 * <pre>
 * module name #(
 *   parameter WIDTH = 8 ,
 *   parameter DEPTH = 16
 *   )
 *   (
 *   input  wire [7:0] a,
 *   output reg        b
 *   );
 * </pre>
 * Ports are split into direction, type, range and name columns; ranges are right-aligned.
 * Headers that do not scan cleanly are returned unchanged.
 */
public class ModuleHeaderFormatter {
    private static final Logger logger = LoggerUtil.getLogger(ModuleHeaderFormatter.class);

    private static final Pattern MODULE_PREFIX = Pattern.compile("^(\\s*)(module|macromodule)\\s+((?:automatic|static)\\s+)?(\\w+)\\s*$");
    private static final Pattern PORT = Pattern.compile(
            "^(?:(input|output|inout|ref)\\b\\s*)?"
            + "(?:((?:wire|reg|logic|bit|tri|var|integer)(?:\\s+(?:signed|unsigned))?|signed|unsigned)\\b\\s*)?"
            + "((?:\\[[^\\]]*\\]\\s*)*)(.*)$");

    private final FormatConfig config;
    private final String unit;

    public ModuleHeaderFormatter(FormatConfig config) {
        this.config = config;
        this.unit = config.indentUnit();
    }

    private record Port(String dir, String type, String range, String name) {
    }

    /**
     * Formats the header lines, from the {@code module} keyword to the terminating {@code ;}.
     */
    public List<String> format(List<String> headerLines) {
        if (headerLines.isEmpty() || headerLines.stream().noneMatch(l -> l.contains("("))) {
            return headerLines;
        }
        if (!config.isWrapPortList() && headerLines.size() == 1) {
            return headerLines;
        }

        BracketScanner.Scan scan = BracketScanner.scan(headerLines);
        if (scan == null || !scan.suffix().trim().equals(";")) {
            logger.fine("Module header left as written: unbalanced or unterminated");
            return headerLines;
        }
        Matcher prefix = MODULE_PREFIX.matcher(scan.prefix());
        if (!prefix.find()) {
            return headerLines;
        }

        List<BracketScanner.BracketList> lists = scan.lists();
        BracketScanner.BracketList params = null;
        BracketScanner.BracketList ports = null;
        if (lists.size() == 1) {
            if (lists.get(0).isHashed()) {
                params = lists.get(0);
            } else {
                ports = lists.get(0);
            }
        } else if (lists.size() == 2 && lists.get(0).isHashed() && !lists.get(1).isHashed()
                && scan.outside().get(1).isBlank()) {
            params = lists.get(0);
            ports = lists.get(1);
        } else {
            return headerLines;
        }

        String moduleIndent = prefix.group(1);
        String listIndent = moduleIndent + unit;
        String name = prefix.group(2) + " " + (prefix.group(3) == null ? "" : prefix.group(3).trim() + " ") + prefix.group(4);
        String closing = scan.trailingComment().isEmpty() ? ");" : "); " + scan.trailingComment();

        List<String> out = new ArrayList<>();
        if (params != null) {
            out.add(moduleIndent + name + " #(");
            out.addAll(new HeaderParameterAligner(config.isAlignParameters(), unit)
                    .render(ListEntry.parse(params.getSegments()), listIndent));
            if (ports == null) {
                out.add(listIndent + closing);
                return out;
            }
            out.add(listIndent + ")");
            out.add(listIndent + "(");
        } else {
            out.add(moduleIndent + name + " (");
        }
        out.addAll(_renderPorts(ListEntry.parse(ports.getSegments()), listIndent));
        out.add(listIndent + closing);
        return out;
    }

    private List<String> _renderPorts(List<ListEntry> entries, String indent) {
        List<Port> parsed = new ArrayList<>();
        int maxDir = 0;
        int maxType = 0;
        int maxRange = 0;
        for (ListEntry entry : entries) {
            Port p = entry.getKind() == ListEntry.Kind.ITEM ? _parsePort(entry.first()) : null;
            parsed.add(p);
            if (p != null) {
                maxDir = Math.max(maxDir, p.dir().length());
                maxType = Math.max(maxType, p.type().length());
                maxRange = Math.max(maxRange, p.range().length());
            }
        }

        List<String> bases = new ArrayList<>();
        int maxBase = 0;
        for (int i = 0; i < entries.size(); i++) {
            Port p = parsed.get(i);
            String base = p == null ? null : _columns(p, maxDir, maxType, maxRange) + p.name();
            bases.add(base);
            if (base != null && !entries.get(i).isMultiLine()) {
                maxBase = Math.max(maxBase, base.length());
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
                    if (!config.isAlignPortList() || parsed.get(i) == null) {
                        _renderPlain(entry, indent, indent + unit, comma, out);
                    } else if (entry.isMultiLine()) {
                        Port p = parsed.get(i);
                        String continuation = indent + Texts.spaces(bases.get(i).length() - p.name().length());
                        List<String> lines = new ArrayList<>(entry.getLines());
                        lines.set(0, bases.get(i));
                        _renderLines(lines, entry.getComments(), indent, continuation, comma, out);
                    } else {
                        String comment = entry.getComments().get(0);
                        String body = Texts.padEnd(bases.get(i), maxBase) + comma;
                        out.add(comment.isEmpty()
                                ? Texts.trimEnd(indent + body)
                                : indent + Texts.padEnd(body, maxBase + 1) + " " + comment);
                    }
                }
            }
        }
        return out;
    }

    private static String _columns(Port p, int maxDir, int maxType, int maxRange) {
        StringBuilder sb = new StringBuilder();
        if (maxDir > 0) {
            sb.append(Texts.padEnd(p.dir(), maxDir)).append(' ');
        }
        if (maxType > 0) {
            sb.append(Texts.padEnd(p.type(), maxType)).append(' ');
        }
        if (maxRange > 0) {
            sb.append(Texts.padStart(p.range(), maxRange)).append(' ');
        }
        return sb.toString();
    }

    private static Port _parsePort(String text) {
        Matcher m = PORT.matcher(text);
        if (!m.find() || m.group(4).isBlank()) {
            return null;
        }
        return new Port(
                m.group(1) == null ? "" : m.group(1),
                m.group(2) == null ? "" : m.group(2).trim().replaceAll("\\s+", " "),
                m.group(3).trim(),
                m.group(4).trim());
    }

    private static void _renderPlain(ListEntry entry, String indent, String continuation, String comma, List<String> out) {
        _renderLines(entry.getLines(), entry.getComments(), indent, continuation, comma, out);
    }

    private static void _renderLines(List<String> lines, List<String> comments, String indent, String continuation,
                                     String comma, List<String> out) {
        for (int k = 0; k < lines.size(); k++) {
            String text = (k == 0 ? indent : continuation) + lines.get(k) + (k == lines.size() - 1 ? comma : "");
            String comment = comments.get(k);
            out.add(comment.isEmpty() ? Texts.trimEnd(text) : Texts.trimEnd(text) + " " + comment);
        }
    }
}
