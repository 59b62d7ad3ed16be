package com.hdlformatter.plugins.verilog.align;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.plugins.verilog.line.LineClassifier;
import com.hdlformatter.util.Texts;

/**
 * Aligns a group of {@code wire}/{@code reg}/{@code logic}/{@code integer}/port declarations into
 * keyword, type, range and name columns with a shared {@code =} and semicolon column.
 * Comments and directives inside the group pass through untouched.
 */
public class WireDeclarationAligner {
    private static final Pattern DECL = Pattern.compile(
            "^(input|output|inout|wire|reg|logic|integer)\\s*(?:(wire|reg|logic)\\s*)?(?:(signed|unsigned)\\s*)?(\\[[^\\]]+\\])?\\s*(.*)$");
    private static final Pattern DIRECTION = Pattern.compile("^(input|output|inout)$");
    private static final Pattern UNPACKED = Pattern.compile("^([A-Za-z_][A-Za-z0-9_$]*)(\\s+\\[.+\\])$");
    private static final Pattern NAME_WITH_INIT = Pattern.compile("^([A-Za-z_][A-Za-z0-9_$]*)\\s*=\\s*(.*)$");
    private static final Pattern TERMINATOR = Pattern.compile(";\\s*(//.*)?$");
    private static final Pattern SEMICOLON_TAIL = Pattern.compile(";\\s*$");
    private static final Pattern TRAILING_COMMENT = Pattern.compile("^(.*?)(//.*)$");
    private static final Pattern CLOSING_BRACE = Pattern.compile("^}[,;]?\\s*$");

    private final int lineLength;

    private static class DeclRow {
        final List<String> originalLines;
        String indent = "";
        String keyword = "";
        String typeKeyword = "";
        String range = "";
        String name = "";
        String unpackedDim = "";
        List<String> initLines = new ArrayList<>();
        boolean hasInit;
        String comment = "";
        String firstComment = "";
        boolean multiNames;
        String namesList = "";
        boolean passthrough;

        DeclRow(List<String> originalLines) {
            this.originalLines = originalLines;
        }

        String fullName() {
            return name + unpackedDim;
        }
    }

    public WireDeclarationAligner(FormatConfig config) {
        this.lineLength = config.getLineLength();
    }

    /**
     * Aligns one declaration group; returns the input unchanged when it is already aligned.
     */
    public List<String> align(List<String> lines) {
        List<DeclRow> rows = new ArrayList<>();
        for (List<String> block : _splitBlocks(lines)) {
            rows.add(_parseRow(block));
        }

        List<DeclRow> decls = rows.stream().filter(r -> !r.passthrough).toList();
        if (decls.isEmpty()) {
            return lines;
        }

        List<String> rendered = _allSimple(decls) ? _renderSimple(rows, decls) : _renderColumns(rows, decls);
        return rendered.equals(lines) ? lines : rendered;
    }

    private List<List<String>> _splitBlocks(List<String> lines) {
        List<List<String>> blocks = new ArrayList<>();
        List<String> current = null;
        for (String l : lines) {
            if (current == null && LineClassifier.declarationKind(l).isWireFamily()) {
                current = new ArrayList<>();
                current.add(l);
                if (Texts.endsStatement(l)) {
                    blocks.add(current);
                    current = null;
                }
                continue;
            }
            if (current != null) {
                current.add(l);
                if (Texts.endsStatement(l)) {
                    blocks.add(current);
                    current = null;
                }
                continue;
            }
            blocks.add(List.of(l));
        }
        if (current != null) {
            blocks.add(current);
        }
        return blocks;
    }

    private DeclRow _parseRow(List<String> block) {
        DeclRow r = new DeclRow(block);
        String first = block.get(0);
        r.indent = Texts.indentOf(first);
        String last = block.get(block.size() - 1);

        if (!LineClassifier.declarationKind(first).isWireFamily() || !Texts.endsStatement(last)) {
            r.passthrough = true;
            return r;
        }

        Matcher lastComment = TRAILING_COMMENT.matcher(last);
        r.comment = lastComment.find() ? _normalizeComment(lastComment.group(2)) : "";
        Matcher firstCommentMatcher = TRAILING_COMMENT.matcher(first);
        if (block.size() > 1 && firstCommentMatcher.find()) {
            r.firstComment = _normalizeComment(firstCommentMatcher.group(2));
        }

        String bodyFirst = Texts.stripComment(first).trim();
        Matcher m = DECL.matcher(bodyFirst);
        if (!m.find()) {
            r.passthrough = true;
            return r;
        }

        String firstKeyword = m.group(1);
        String second = m.group(2) == null ? "" : m.group(2);
        String sign = m.group(3) == null ? "" : m.group(3);
        r.keyword = firstKeyword;
        if (DIRECTION.matcher(firstKeyword).matches()) {
            r.typeKeyword = (second + " " + sign).trim();
        } else if (!second.isEmpty()) {
            // "wire logic" and similar are left alone
            r.passthrough = true;
            return r;
        } else {
            r.typeKeyword = sign;
        }
        r.range = m.group(4) == null ? "" : m.group(4).trim();
        String remainder = m.group(5).trim();

        boolean hasEquals = remainder.contains("=");
        if (!hasEquals && remainder.contains(",")) {
            // a name list broken over several lines keeps its own line breaks
            if (block.size() > 1) {
                r.passthrough = true;
                return r;
            }
            r.multiNames = true;
            r.namesList = SEMICOLON_TAIL.matcher(remainder).replaceFirst("").trim();
            return r;
        }

        if (!hasEquals && block.size() > 1) {
            r.passthrough = true;
            return r;
        }

        r.name = SEMICOLON_TAIL.matcher(remainder).replaceFirst("").trim();
        if (hasEquals) {
            Matcher nm = NAME_WITH_INIT.matcher(remainder);
            if (!nm.find()) {
                r.passthrough = true;
                return r;
            }
            r.name = nm.group(1);
            r.initLines.add(SEMICOLON_TAIL.matcher(nm.group(2)).replaceFirst(""));
            r.hasInit = true;
            for (int k = 1; k < block.size(); k++) {
                String cont = block.get(k);
                String trimmed = k == block.size() - 1
                        ? TERMINATOR.matcher(cont).replaceFirst("").trim()
                        : cont.trim();
                if (!trimmed.isEmpty()) {
                    r.initLines.add(trimmed);
                }
            }
            _mergeLoneBraces(r.initLines);
        } else {
            Matcher um = UNPACKED.matcher(r.name);
            if (um.find()) {
                r.name = um.group(1);
                r.unpackedDim = um.group(2);
            }
        }
        return r;
    }

    /**
     * A lone opening brace joins the next line; a lone closing brace joins the previous one.
     */
    private static void _mergeLoneBraces(List<String> initLines) {
        for (int i = 0; i < initLines.size() - 1; i++) {
            if (initLines.get(i).trim().equals("{")) {
                initLines.set(i, "{ " + initLines.get(i + 1));
                initLines.remove(i + 1);
                i--;
            }
        }
        for (int i = 1; i < initLines.size(); i++) {
            if (CLOSING_BRACE.matcher(initLines.get(i).trim()).find()) {
                initLines.set(i - 1, initLines.get(i - 1) + " " + initLines.get(i).trim());
                initLines.remove(i);
                i--;
            }
        }
    }

    private static boolean _allSimple(List<DeclRow> decls) {
        return decls.stream().allMatch(r -> r.range.isEmpty() && r.typeKeyword.isEmpty()
                && !r.hasInit && !r.multiNames && r.unpackedDim.isEmpty());
    }

    private List<String> _renderSimple(List<DeclRow> rows, List<DeclRow> decls) {
        int maxName = decls.stream().mapToInt(r -> r.name.length()).max().orElse(0);
        int maxKeyword = decls.stream().mapToInt(r -> r.keyword.length()).max().orElse(0);
        boolean sameKeyword = decls.stream().allMatch(r -> r.keyword.equals(decls.get(0).keyword));

        List<String> out = new ArrayList<>();
        for (DeclRow r : rows) {
            if (r.passthrough) {
                out.addAll(r.originalLines);
                continue;
            }
            String keywordPart = sameKeyword ? r.keyword : Texts.padEnd(r.keyword, maxKeyword);
            out.add(r.indent + keywordPart + " " + Texts.padEnd(r.name, maxName) + ";" + _suffix(r.comment));
        }
        return out;
    }

    private List<String> _renderColumns(List<DeclRow> rows, List<DeclRow> decls) {
        Columns c = new Columns();
        c.maxKeyword = decls.stream().mapToInt(r -> r.keyword.length()).max().orElse(0);
        c.maxType = decls.stream().mapToInt(r -> r.typeKeyword.length()).max().orElse(0);
        c.maxRange = decls.stream().mapToInt(r -> r.range.length()).max().orElse(0);

        List<DeclRow> withInit = decls.stream().filter(r -> !r.multiNames && r.hasInit).toList();
        int maxInitName = withInit.stream().mapToInt(r -> r.fullName().length()).max().orElse(0);
        c.maxBeforeEquals = withInit.stream()
                .mapToInt(r -> _lead(r, c, Texts.padEnd(r.fullName(), maxInitName)).length())
                .max().orElse(0);

        int maxSemicolon = 0;
        for (DeclRow r : decls) {
            int pos;
            if (r.hasInit && r.initLines.size() > 1) {
                continue;
            }
            pos = _lineBeforeSemicolon(r, c).length();
            if (pos + 1 + _commentWidth(r) <= lineLength) {
                maxSemicolon = Math.max(maxSemicolon, pos);
            }
        }

        List<String> out = new ArrayList<>();
        for (DeclRow r : rows) {
            if (r.passthrough) {
                out.addAll(r.originalLines);
                continue;
            }
            if (r.hasInit && r.initLines.size() > 1) {
                String head = r.indent + Texts.padEnd(_lead(r, c, r.fullName()), c.maxBeforeEquals) + " = ";
                out.add(Texts.trimEnd(head + r.initLines.get(0).trim()) + _suffix(r.firstComment));
                String continuation = Texts.spaces(head.length());
                for (int k = 1; k < r.initLines.size(); k++) {
                    String cont = continuation + r.initLines.get(k).trim();
                    if (k == r.initLines.size() - 1) {
                        cont += ";" + _suffix(r.comment);
                    }
                    out.add(cont);
                }
                continue;
            }
            String before = _lineBeforeSemicolon(r, c);
            boolean tooLong = before.length() + 1 + _commentWidth(r) > lineLength;
            String padded = tooLong ? before : Texts.padEnd(before, maxSemicolon);
            out.add(padded + ";" + _suffix(r.comment));
        }
        return out;
    }

    private static class Columns {
        int maxKeyword;
        int maxType;
        int maxRange;
        int maxBeforeEquals;
    }

    private static String _lead(DeclRow r, Columns c, String nameColumn) {
        StringBuilder sb = new StringBuilder(Texts.padEnd(r.keyword, c.maxKeyword));
        if (c.maxType > 0) {
            sb.append(' ').append(Texts.padEnd(r.typeKeyword, c.maxType));
        }
        if (c.maxRange > 0) {
            sb.append(' ').append(Texts.padStart(r.range, c.maxRange));
        }
        sb.append(' ').append(nameColumn);
        return sb.toString();
    }

    private static String _lineBeforeSemicolon(DeclRow r, Columns c) {
        if (r.multiNames) {
            return r.indent + _lead(r, c, r.namesList);
        }
        if (r.hasInit) {
            return r.indent + Texts.padEnd(_lead(r, c, r.fullName()), c.maxBeforeEquals) + " = " + r.initLines.get(0).trim();
        }
        return r.indent + _lead(r, c, r.fullName());
    }

    private static int _commentWidth(DeclRow r) {
        return r.comment.isEmpty() ? 0 : r.comment.length() + 1;
    }

    private static String _suffix(String comment) {
        return comment.isEmpty() ? "" : " " + comment;
    }

    private static String _normalizeComment(String comment) {
        return comment.replaceFirst("//\\s?", "// ").trim();
    }
}
