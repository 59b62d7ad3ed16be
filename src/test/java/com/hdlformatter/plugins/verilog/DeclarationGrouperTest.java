package com.hdlformatter.plugins.verilog;

import com.hdlformatter.config.FormatConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeclarationGrouperTest {

    private final DeclarationGrouper grouper = new DeclarationGrouper(FormatConfig.builder().build());

    @Test
    void comments_between_declarations_keep_one_group() {
        List<String> result = grouper.apply(List.of("wire a;", "// note", "wire [3:0] bb;"));

        assertEquals("// note", result.get(1));
        assertEquals(result.get(0).indexOf(';'), result.get(2).indexOf(';'));
    }

    @Test
    void long_run_of_comments_closes_a_net_group() {
        List<String> result = grouper.apply(List.of(
                "wire a;", "// 1", "// 2", "// 3", "// 4", "wire [3:0] bb;"));

        assertEquals("wire a;", result.get(0));
        assertEquals("wire [3:0] bb;", result.get(5));
    }

    @Test
    void trailing_whitespace_is_removed_and_directives_annotated() {
        List<String> result = grouper.apply(List.of("`ifdef SIM   ", "  initial $display(\"x\");  ", "`endif"));

        assertEquals(List.of("`ifdef SIM", "  initial $display(\"x\");", "`endif // SIM"), result);
    }

    @Test
    void trailing_comments_move_to_the_comment_column() {
        DeclarationGrouper withColumn = new DeclarationGrouper(FormatConfig.builder().commentColumn(20).build());

        List<String> result = withColumn.apply(List.of("  x = y; // keep"));

        assertEquals(20, result.get(0).indexOf("//"));
    }

    @Test
    void procedural_assignments_are_left_for_later_stages() {
        List<String> input = List.of("always @(*) begin", "x = 1;", "yy = 2;", "end");

        assertEquals(input, grouper.apply(input));
    }

    @Test
    void blank_lines_beyond_the_limit_are_dropped() {
        List<String> result = grouper.apply(List.of("wire a;", "", "", "", "assign b = c;"));

        assertEquals(List.of("wire a;", "", "assign b = c;"), result);
    }

    @Test
    void semicolon_in_a_header_comment_does_not_end_the_header() {
        List<String> result = grouper.apply(List.of(
                "module m (",
                "input a, // note;",
                "input b",
                ");",
                "endmodule"));

        assertEquals(List.of(
                "module m (",
                "  input a, // note;",
                "  input b",
                "  );"), result.subList(0, 4));
        assertEquals("endmodule", result.get(result.size() - 1));
    }

    @Test
    void broken_port_lists_keep_one_line_per_input_line() {
        List<String> input = List.of(
                "input a,",
                "      b;",
                "input clk,",
                "wire c;");

        assertEquals(input, grouper.apply(input));
    }
}
