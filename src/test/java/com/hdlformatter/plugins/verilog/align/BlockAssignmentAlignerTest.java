package com.hdlformatter.plugins.verilog.align;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockAssignmentAlignerTest {

    private final BlockAssignmentAligner aligner = new BlockAssignmentAligner();

    @Test
    void consecutive_statements_at_one_indent_align_their_operator() {
        List<String> result = aligner.apply(List.of(
                "  always @(posedge clk) begin",
                "    a <= 1;",
                "    bbb <= 2;",
                "  end"));

        assertEquals(List.of(
                "  always @(posedge clk) begin",
                "    a   <= 1;",
                "    bbb <= 2;",
                "  end"), result);
    }

    @Test
    void single_line_case_items_align_label_lhs_and_rhs() {
        List<String> result = aligner.apply(List.of(
                "  case (sel)",
                "    2'b00: out = a;",
                "    default: out = bb;",
                "  endcase"));

        assertEquals(List.of(
                "  case (sel)",
                "    2'b00  : out = a ;",
                "    default: out = bb;",
                "  endcase"), result);
    }

    @Test
    void if_else_branches_share_one_lhs_width() {
        List<String> result = aligner.apply(List.of(
                "if (rst) begin",
                "  q <= 0;",
                "  count <= 0;",
                "end else begin",
                "  q <= d;",
                "end"));

        assertEquals(List.of(
                "if (rst) begin",
                "  q     <= 0;",
                "  count <= 0;",
                "end else begin",
                "  q     <= d;",
                "end"), result);
    }

    @Test
    void a_lone_statement_is_left_as_written() {
        List<String> input = List.of("  x   =  y;");

        assertEquals(input, aligner.apply(input));
    }
}
