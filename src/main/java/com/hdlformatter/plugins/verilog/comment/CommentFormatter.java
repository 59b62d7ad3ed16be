package com.hdlformatter.plugins.verilog.comment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.util.Texts;

/**
 * Places trailing comments on a fixed column and wraps over-long comment lines.
 */
public class CommentFormatter {
    private static final Pattern COMMENT_LINE = Pattern.compile("^(\\s*//)(\\s*)(.*)$");
    private static final Pattern COMMENT_MARK = Pattern.compile("//\\s?");

    private final int commentColumn;
    private final int lineLength;

    public CommentFormatter(FormatConfig config) {
        this.commentColumn = config.getCommentColumn();
        this.lineLength = config.getLineLength();
    }

    /**
     * Moves a trailing {@code //} comment to the configured column; one space when the code already reaches it.
     * Disabled when the column is zero.
     */
    public String applyCommentColumn(String line) {
        if (commentColumn <= 0) {
            return line;
        }
        int idx = line.indexOf("//");
        if (idx == -1) {
            return line;
        }
        String prefix = Texts.trimEnd(line.substring(0, idx));
        if (prefix.isBlank()) {
            // comment-only lines keep their indentation
            return line;
        }
        String comment = COMMENT_MARK.matcher(line.substring(idx)).replaceFirst("// ");
        if (prefix.length() >= commentColumn) {
            return prefix + " " + comment;
        }
        return prefix + Texts.spaces(commentColumn - prefix.length()) + comment;
    }

    /**
     * Word-wraps a comment-only line that exceeds the line length. Returns one or more lines.
     */
    public List<String> wrapComment(String line) {
        List<String> lines = new ArrayList<>();
        Matcher m = COMMENT_LINE.matcher(line);
        if (!m.find() || line.length() <= lineLength) {
            lines.add(line);
            return lines;
        }
        String lead = m.group(1) + m.group(2);
        String[] words = m.group(3).trim().split("\\s+");

        StringBuilder current = new StringBuilder();
        for (String word : words) {
            if (current.length() > 0 && lead.length() + current.length() + word.length() + 1 > lineLength) {
                lines.add(lead + current.toString().trim());
                current.setLength(0);
            }
            current.append(word).append(' ');
        }
        if (!current.toString().isBlank()) {
            lines.add(lead + current.toString().trim());
        }
        return lines;
    }
}
