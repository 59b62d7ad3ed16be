package com.hdlformatter.plugins.verilog.comment;

import com.hdlformatter.config.FormatConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommentFormatterTest {

    private static CommentFormatter withColumn(int column) {
        return new CommentFormatter(FormatConfig.builder().commentColumn(column).build());
    }

    @Test
    void trailing_comment_moves_to_the_configured_column() {
        String result = withColumn(20).applyCommentColumn("  x = 1; //set");

        assertEquals("  x = 1;            // set", result);
        assertEquals(20, result.indexOf("//"));
    }

    @Test
    void code_past_the_column_keeps_one_space_before_the_comment() {
        assertEquals("  x = 1; // set", withColumn(4).applyCommentColumn("  x = 1;    // set"));
    }

    @Test
    void comment_only_lines_are_left_alone() {
        assertEquals("    // note", withColumn(20).applyCommentColumn("    // note"));
    }

    @Test
    void column_zero_disables_the_rule() {
        String line = "  x = 1; //set";
        assertSame(line, withColumn(0).applyCommentColumn(line));
    }

    @Test
    void long_comment_lines_are_wrapped_on_word_boundaries() {
        CommentFormatter formatter = new CommentFormatter(FormatConfig.builder().lineLength(20).build());

        List<String> lines = formatter.wrapComment("// one two three four five six");

        assertEquals(List.of("// one two three", "// four five six"), lines);
    }

    @Test
    void short_or_code_lines_are_not_wrapped() {
        CommentFormatter formatter = new CommentFormatter(FormatConfig.builder().lineLength(20).build());

        assertEquals(List.of("// short"), formatter.wrapComment("// short"));
        assertEquals(List.of("assign a_long_signal = b & c;"), formatter.wrapComment("assign a_long_signal = b & c;"));
    }
}
