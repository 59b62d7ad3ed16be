package com.hdlformatter.plugins.verilog.structure;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.util.Texts;

/**
 * Renders one collected instantiation. Named connections {@code .port (signal)} get their port names padded
 * to a common width and every closing parenthesis of a list placed on one column. Concatenation values
 * spanning several lines continue right after their opening brace, with leaf tokens padded so commas line up.
 * Anything that does not scan as {@code MOD [#(...)] inst (...);} comes back untouched.
 */
final class InstanceRenderer {
    private static final Pattern NAME = Pattern.compile("^\\s*([A-Za-z_]\\w*)\\s*$");
    private static final Pattern INSTANCE = Pattern.compile("^\\s*([A-Za-z_]\\w*\\s*(?:\\[[^\\]]*\\])?)\\s*$");
    private static final Pattern MODULE_AND_INSTANCE = Pattern.compile("^\\s*([A-Za-z_]\\w*)\\s+([A-Za-z_]\\w*\\s*(?:\\[[^\\]]*\\])?)\\s*$");
    private static final Pattern CONNECTION_HEAD = Pattern.compile("^\\.([A-Za-z_]\\w*)\\s*\\((.*)$");
    private static final Pattern LEAF = Pattern.compile(
            "^(,\\s*)?(\\{\\s*[\\w']+\\s*\\{[^{}]*\\}\\s*\\}|\\d+'\\w+[\\da-fA-F_]+|[A-Za-z_][\\w.$]*(?:\\[[^\\]]*\\])*|\\([^()]*\\)|\\d+)\\s*(.*)$");
    private static final Pattern DIRECTIVE_THEN_CLOSE = Pattern.compile("^(`(?:ifn?def\\s+\\w+|else|endif))\\s*(\\}+)$");
    private static final Pattern BRACES_ONLY = Pattern.compile("^\\}+$");

    private final String unit;

    InstanceRenderer(String unit) {
        this.unit = unit;
    }

    /**
     * One named connection split into its value lines, with the final {@code )} removed.
     * Only values spanning several lines are laid out as concatenations.
     */
    private record Connection(String port, List<String> values, List<String> comments) {

        boolean isConcatenation() {
            return values.size() > 1 && values.get(0).startsWith("{");
        }
    }

    List<String> render(List<String> lines, String base) {
        BracketScanner.Scan scan = BracketScanner.scan(lines);
        if (scan == null || !scan.suffix().trim().equals(";")) {
            return lines;
        }
        List<BracketScanner.BracketList> lists = scan.lists();
        String closing = scan.trailingComment().isEmpty() ? ");" : "); " + scan.trailingComment();
        List<String> out = new ArrayList<>();

        if (lists.size() == 2 && lists.get(0).isHashed() && !lists.get(1).isHashed()) {
            Matcher module = NAME.matcher(scan.prefix());
            Matcher instance = INSTANCE.matcher(scan.outside().get(1));
            if (!module.find() || !instance.find()) {
                return lines;
            }
            String inner = base + unit;
            out.add(base + module.group(1) + " #(");
            out.addAll(_renderList(ListEntry.parse(lists.get(0).getSegments()), inner));
            out.add(inner + ")");
            out.add(inner + instance.group(1).replaceAll("\\s+", " ") + "(");
            out.addAll(_renderList(ListEntry.parse(lists.get(1).getSegments()), inner + unit));
            out.add(inner + unit + closing);
            return out;
        }

        if (lists.size() == 1 && !lists.get(0).isHashed()) {
            Matcher names = MODULE_AND_INSTANCE.matcher(scan.prefix());
            if (!names.find()) {
                return lines;
            }
            out.add(base + names.group(1) + " " + names.group(2).replaceAll("\\s+", " ") + "(");
            out.addAll(_renderList(ListEntry.parse(lists.get(0).getSegments()), base + unit));
            out.add(base + unit + closing);
            return out;
        }
        return lines;
    }

    private List<String> _renderList(List<ListEntry> entries, String indent) {
        List<Connection> connections = new ArrayList<>();
        int maxPort = 0;
        int maxSignal = 0;
        for (ListEntry entry : entries) {
            Connection c = entry.getKind() == ListEntry.Kind.ITEM ? _parse(entry) : null;
            connections.add(c);
            if (c == null) {
                continue;
            }
            maxPort = Math.max(maxPort, c.port().length());
            if (c.isConcatenation()) {
                for (int k = 0; k < c.values().size(); k++) {
                    String value = k == 0 ? c.values().get(0).substring(1).trim() : c.values().get(k);
                    Matcher leaf = LEAF.matcher(value);
                    if (leaf.find()) {
                        maxSignal = Math.max(maxSignal, leaf.group(2).length());
                    }
                }
            }
        }

        int contentCol = indent.length() + 1 + maxPort + 2;
        List<List<String>> bodies = new ArrayList<>();
        int closingCol = 0;
        for (int i = 0; i < entries.size(); i++) {
            Connection c = connections.get(i);
            List<String> body = c == null ? null : _body(c, indent, maxPort, maxSignal, contentCol);
            bodies.add(body);
            if (body != null && !_isBracesOnly(body.get(body.size() - 1))) {
                closingCol = Math.max(closingCol, body.get(body.size() - 1).length());
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
                    Connection c = connections.get(i);
                    if (c == null) {
                        _renderRaw(entry, indent, comma, out);
                    } else {
                        _emit(c, bodies.get(i), closingCol, contentCol, comma, out);
                    }
                }
            }
        }
        return out;
    }

    private List<String> _body(Connection c, String indent, int maxPort, int maxSignal, int contentCol) {
        List<String> body = new ArrayList<>();
        String head = indent + "." + Texts.padEnd(c.port(), maxPort) + " (";
        List<String> values = c.values();
        if (!c.isConcatenation()) {
            body.add(head + values.get(0));
            for (int k = 1; k < values.size(); k++) {
                body.add(Texts.spaces(contentCol) + values.get(k));
            }
            return body;
        }

        String concatIndent = Texts.spaces(contentCol + 1);
        body.add(head + "{" + _padLeaf(values.get(0).substring(1).trim(), maxSignal));
        for (int k = 1; k < values.size(); k++) {
            String value = values.get(k);
            Matcher split = DIRECTIVE_THEN_CLOSE.matcher(value);
            if (k == values.size() - 1 && split.find()) {
                body.add(concatIndent + split.group(1));
                body.add(split.group(2));
            } else if (value.isEmpty() || value.startsWith("`")) {
                body.add(concatIndent + value);
            } else if (k == values.size() - 1 && _isBracesOnly(value)) {
                body.add(value);
            } else {
                body.add(concatIndent + _padLeaf(value, maxSignal));
            }
        }
        return body;
    }

    private void _emit(Connection c, List<String> body, int closingCol, int contentCol, String comma, List<String> out) {
        // a directive split off a closing brace adds a line without a comment slot
        int shift = body.size() - c.values().size();
        int last = body.size() - 1;
        for (int k = 0; k < body.size(); k++) {
            String comment = _commentFor(c, k, shift, last);
            String text;
            if (k == last) {
                String line = body.get(k);
                String lead = _isBracesOnly(line)
                        ? Texts.padStart(line, Math.max(closingCol, contentCol + line.length()))
                        : Texts.padEnd(line, closingCol);
                text = lead + ")" + comma;
            } else {
                text = Texts.trimEnd(body.get(k));
            }
            out.add(comment.isEmpty() ? text : text + " " + comment);
        }
    }

    private static String _commentFor(Connection c, int k, int shift, int last) {
        if (shift == 0) {
            return c.comments().get(k);
        }
        // directive line keeps the comment of its source line; the split-off braces carry none
        return k == last ? "" : c.comments().get(Math.min(k, c.comments().size() - 1));
    }

    private static String _padLeaf(String value, int maxSignal) {
        Matcher leaf = LEAF.matcher(value);
        if (!leaf.find()) {
            return value;
        }
        String lead = leaf.group(1) == null ? "" : ", ";
        String rest = leaf.group(3);
        if (rest.isEmpty()) {
            return lead + leaf.group(2);
        }
        return lead + Texts.padEnd(leaf.group(2), maxSignal) + rest;
    }

    private static boolean _isBracesOnly(String line) {
        return BRACES_ONLY.matcher(line).matches();
    }

    private void _renderRaw(ListEntry entry, String indent, String comma, List<String> out) {
        List<String> lines = entry.getLines();
        for (int k = 0; k < lines.size(); k++) {
            String text = (k == 0 ? indent : indent + unit) + lines.get(k) + (k == lines.size() - 1 ? comma : "");
            String comment = entry.getComments().get(k);
            out.add(comment.isEmpty() ? Texts.trimEnd(text) : Texts.trimEnd(text) + " " + comment);
        }
    }

    /**
     * Splits a named connection into value lines. Returns null for positional or wildcard connections, or when
     * the parentheses of the value do not balance.
     */
    private static Connection _parse(ListEntry entry) {
        List<String> lines = entry.getLines();
        Matcher head = CONNECTION_HEAD.matcher(lines.get(0));
        String tail = lines.get(lines.size() - 1);
        if (!head.find() || !tail.endsWith(")")) {
            return null;
        }
        List<String> values = new ArrayList<>();
        List<String> comments = new ArrayList<>(entry.getComments());
        if (lines.size() == 1) {
            String v = head.group(2);
            values.add(v.substring(0, v.length() - 1).trim());
        } else {
            values.add(head.group(2).trim());
            values.addAll(lines.subList(1, lines.size() - 1));
            values.add(tail.substring(0, tail.length() - 1).trim());
        }

        int depth = 0;
        for (String v : values) {
            depth += Texts.count(v, '(') - Texts.count(v, ')');
        }
        if (depth != 0) {
            return null;
        }

        // ".p (v" followed by a lone ")" collapses onto one line
        while (values.size() > 1 && values.get(values.size() - 1).isEmpty()) {
            values.remove(values.size() - 1);
            String dropped = comments.remove(comments.size() - 1);
            if (!dropped.isEmpty() && comments.get(comments.size() - 1).isEmpty()) {
                comments.set(comments.size() - 1, dropped);
            }
        }
        if (values.get(0).isEmpty() && values.size() > 1) {
            return null;
        }
        return new Connection(head.group(1), values, comments);
    }
}
