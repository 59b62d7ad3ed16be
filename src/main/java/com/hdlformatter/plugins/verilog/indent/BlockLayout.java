package com.hdlformatter.plugins.verilog.indent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;

import com.hdlformatter.util.Texts;

import static com.hdlformatter.plugins.verilog.indent.ControlSyntax.BARE_HEADER;
import static com.hdlformatter.plugins.verilog.indent.ControlSyntax.BEGIN_TAIL;
import static com.hdlformatter.plugins.verilog.indent.ControlSyntax.CASE;
import static com.hdlformatter.plugins.verilog.indent.ControlSyntax.CASE_LABEL;
import static com.hdlformatter.plugins.verilog.indent.ControlSyntax.CLOSER;
import static com.hdlformatter.plugins.verilog.indent.ControlSyntax.CONDITION_HEADER;
import static com.hdlformatter.plugins.verilog.indent.ControlSyntax.CONTROL_START;
import static com.hdlformatter.plugins.verilog.indent.ControlSyntax.ELSE;
import static com.hdlformatter.plugins.verilog.indent.ControlSyntax.FORK;
import static com.hdlformatter.plugins.verilog.indent.ControlSyntax.GENERATE;
import static com.hdlformatter.plugins.verilog.indent.ControlSyntax.IF_START;
import static com.hdlformatter.plugins.verilog.indent.ControlSyntax.STANDALONE_BEGIN;

/**
 * Lays out one region, starting at its first line (an {@code always}/{@code initial} header, a {@code case}
 * statement, a {@code generate} keyword or a generate {@code for}/{@code if}) and ending where that construct
 * closes.
 * <p>
 * Nesting is tracked with a stack of frames, one per open {@code begin}, {@code case}, {@code fork} or
 * {@code generate}. Inside a
 * frame, headers without {@code begin} ({@code if (...)}, {@code else}, {@code for (...)}, a bare case label)
 * are kept as pending single-statement headers: each adds one level to the next statement only. An {@code else}
 * takes the level of the {@code if} it belongs to. Lines continuing an unfinished statement keep their offset
 * relative to the statement's first line.
 */
final class BlockLayout {

    private record Header(int level, boolean ifHeader) {
    }

    private static final class Frame {
        private final int level;
        private final boolean ifFrame;
        private final Deque<Header> singles = new ArrayDeque<>();
        private int lastClosedIf = -1;

        private Frame(int level, boolean ifFrame) {
            this.level = level;
            this.ifFrame = ifFrame;
        }

        int nextLevel() {
            return singles.isEmpty() ? level + 1 : singles.peek().level() + 1;
        }

        int innermostIf() {
            for (Header h : singles) {
                if (h.ifHeader()) {
                    return h.level();
                }
            }
            return -1;
        }
    }

    private static final class Statement {
        private final int level;
        private final int delta;
        private final StringBuilder joined;

        private Statement(int level, int delta, String code) {
            this.level = level;
            this.delta = delta;
            this.joined = new StringBuilder(code);
        }
    }

    private final String base;
    private final String unit;
    private final boolean mergeEndElse;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final Frame root = new Frame(-1, false);
    private Statement pending;

    BlockLayout(String base, String unit, boolean mergeEndElse) {
        this.base = base;
        this.unit = unit;
        this.mergeEndElse = mergeEndElse;
        frames.push(root);
    }

    /**
     * Lays out the region starting at {@code start}, appending to {@code out}.
     *
     * @return index of the first line after the region
     */
    int run(List<String> lines, int start, List<String> out) {
        int i = start;
        boolean first = true;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (!first && _regionClosed(line)) {
                break;
            }
            first = false;

            int next = i + 1;
            if (mergeEndElse && pending == null && ControlSyntax.code(line.trim()).equals("end")
                    && !line.contains("//")) {
                int j = ControlSyntax.nextNonBlank(lines, i + 1);
                if (j < lines.size() && ELSE.matcher(lines.get(j).trim()).find()) {
                    line = Texts.indentOf(line) + "end " + lines.get(j).trim();
                    next = j + 1;
                }
            }
            out.add(_layoutLine(line));
            i = next;
        }
        return i;
    }

    private boolean _regionClosed(String line) {
        if (frames.size() > 1 || !root.singles.isEmpty() || pending != null) {
            return false;
        }
        return !(root.lastClosedIf >= 0 && ELSE.matcher(ControlSyntax.code(line.trim())).find());
    }

    private String _layoutLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        String code = ControlSyntax.code(trimmed);

        if (pending != null) {
            if (ControlSyntax.isNonCode(trimmed)) {
                return _shift(line, pending.delta);
            }
            if (!CONTROL_START.matcher(code).find()) {
                Statement s = pending;
                s.joined.append(' ').append(code);
                if (_isComplete(s.joined.toString())) {
                    pending = null;
                    _classify(s.joined.toString(), s.level);
                }
                return _shift(line, s.delta);
            }
            // a keyword at line start ends the unfinished statement
            Statement s = pending;
            pending = null;
            _classify(s.joined.toString(), s.level);
        }

        Frame top = frames.peek();
        if (ControlSyntax.isNonCode(trimmed) || code.isEmpty()) {
            return _indent(top.nextLevel()) + trimmed;
        }

        Matcher closer = CLOSER.matcher(code);
        if (closer.find()) {
            return _close(line, code.substring(closer.end()).trim());
        }

        if (ELSE.matcher(code).find()) {
            int level = top.lastClosedIf >= 0 ? top.lastClosedIf : top.nextLevel();
            top.lastClosedIf = -1;
            _start(code, level, line);
            return _indent(level) + trimmed;
        }
        top.lastClosedIf = -1;

        if (STANDALONE_BEGIN.matcher(code).find()) {
            int level;
            boolean ifFrame = false;
            if (!top.singles.isEmpty()) {
                Header header = top.singles.pop();
                level = header.level();
                ifFrame = header.ifHeader();
            } else {
                level = top.nextLevel();
            }
            frames.push(new Frame(level, ifFrame));
            return _indent(level) + trimmed;
        }

        int level = top.nextLevel();
        _start(code, level, line);
        return _indent(level) + trimmed;
    }

    private String _close(String line, String rest) {
        String trimmed = line.trim();
        if (frames.size() == 1) {
            return _indent(0) + trimmed;
        }
        Frame closed = frames.pop();
        Frame parent = frames.peek();
        parent.lastClosedIf = closed.ifFrame ? closed.level : parent.innermostIf();
        parent.singles.clear();

        if (ELSE.matcher(rest).find()) {
            parent.lastClosedIf = -1;
            _start(rest, closed.level, line);
            return _indent(closed.level) + trimmed.replaceFirst("^end\\s+else\\b", "end else");
        }
        return _indent(closed.level) + trimmed;
    }

    private void _start(String code, int level, String line) {
        int delta = (base.length() + unit.length() * level) - Texts.indentOf(line).length();
        if (_isComplete(code)) {
            _classify(code, level);
        } else {
            pending = new Statement(level, delta, code);
        }
    }

    private void _classify(String code, int level) {
        Frame top = frames.peek();
        boolean ifLike = IF_START.matcher(code).find() || ELSE.matcher(code).find();
        if (BEGIN_TAIL.matcher(code).find() || CASE.matcher(code).find() || FORK.matcher(code).find()
                || GENERATE.matcher(code).find()) {
            frames.push(new Frame(level, ifLike && BEGIN_TAIL.matcher(code).find()));
            return;
        }
        if (_isHeader(code)) {
            top.singles.push(new Header(level, ifLike));
            return;
        }
        top.lastClosedIf = IF_START.matcher(code).find() ? level : top.innermostIf();
        top.singles.clear();
    }

    private static boolean _isHeader(String code) {
        if (code.endsWith(";")) {
            return false;
        }
        return CONDITION_HEADER.matcher(code).find() && _conditionClosesAtEnd(code)
                || BARE_HEADER.matcher(code).find()
                || CASE_LABEL.matcher(code).find() && code.indexOf('?') < 0;
    }

    private static boolean _conditionClosesAtEnd(String code) {
        int open = code.indexOf('(');
        return ControlSyntax.closingParen(code, open) == code.length() - 1;
    }

    private static boolean _isComplete(String code) {
        if (!ControlSyntax.balanced(code)) {
            return false;
        }
        return code.endsWith(";")
                || code.startsWith("`")
                || BEGIN_TAIL.matcher(code).find()
                || code.matches(".*\\bend$")
                || CASE.matcher(code).find()
                || FORK.matcher(code).find()
                || GENERATE.matcher(code).find()
                || _isHeader(code);
    }

    private String _indent(int level) {
        return base + unit.repeat(Math.max(0, level));
    }

    private static String _shift(String line, int delta) {
        String indent = Texts.indentOf(line);
        return Texts.spaces(indent.length() + delta) + line.trim();
    }
}
