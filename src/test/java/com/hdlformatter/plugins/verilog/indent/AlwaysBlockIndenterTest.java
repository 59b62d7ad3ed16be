package com.hdlformatter.plugins.verilog.indent;

import com.hdlformatter.config.FormatConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlwaysBlockIndenterTest {

    private final AlwaysBlockIndenter pass = new AlwaysBlockIndenter(FormatConfig.builder().build());

    @Test
    void nested_blocks_are_indented_and_end_else_is_merged() {
        List<String> result = pass.apply(List.of(
                "always @(posedge clk) begin",
                "if (rst) begin",
                "q <= 0;",
                "end",
                "else begin",
                "q <= d;",
                "end",
                "end",
                "assign x = y;"));

        assertEquals(List.of(
                "always @(posedge clk) begin",
                "  if (rst) begin",
                "    q <= 0;",
                "  end else begin",
                "    q <= d;",
                "  end",
                "end",
                "assign x = y;"), result);
    }

    @Test
    void single_statement_headers_indent_only_the_next_statement() {
        List<String> result = pass.apply(List.of(
                "always @(*)",
                "if (a)",
                "x = 1;",
                "else",
                "x = 0;"));

        assertEquals(List.of(
                "always @(*)",
                "  if (a)",
                "    x = 1;",
                "  else",
                "    x = 0;"), result);
    }

    @Test
    void block_keeps_the_indentation_of_its_header() {
        List<String> result = pass.apply(List.of(
                "  always_ff @(posedge clk) begin",
                "q <= d;",
                "end"));

        assertEquals(List.of(
                "  always_ff @(posedge clk) begin",
                "    q <= d;",
                "  end"), result);
    }

    @Test
    void not_applicable_without_procedural_blocks() {
        assertFalse(pass.isApplicable(List.of("assign a = b;")));
    }

    @Test
    void laid_out_block_is_stable() {
        List<String> once = pass.apply(List.of(
                "always @(posedge clk) begin",
                "if (rst) begin",
                "q <= 0;",
                "end",
                "else begin",
                "q <= d;",
                "end",
                "end"));

        assertEquals(once, pass.apply(once));
    }

    @Test
    void generate_body_sits_one_unit_under_the_keyword() {
        List<String> result = pass.apply(List.of(
                "module m;",
                "generate",
                "for (g=0;g<4;g=g+1) begin : gl",
                "assign o[g] = i[g];",
                "end",
                "endgenerate",
                "endmodule"));

        assertEquals(List.of(
                "module m;",
                "generate",
                "  for (g=0;g<4;g=g+1) begin : gl",
                "    assign o[g] = i[g];",
                "  end",
                "endgenerate",
                "endmodule"), result);
    }

    @Test
    void module_level_if_generate_is_laid_out_like_a_block() {
        List<String> result = pass.apply(List.of(
                "if (W > 1) begin : wide",
                "assign y = a;",
                "end",
                "else begin : narrow",
                "assign y = b;",
                "end"));

        assertEquals(List.of(
                "if (W > 1) begin : wide",
                "  assign y = a;",
                "end else begin : narrow",
                "  assign y = b;",
                "end"), result);
    }

    @Test
    void generate_alone_makes_the_pass_applicable() {
        assertTrue(pass.isApplicable(List.of("generate", "endgenerate")));
        assertFalse(AlwaysBlockIndenter.hasProceduralBlock(List.of("generate", "endgenerate")));
    }

    @Test
    void loops_inside_functions_are_left_alone() {
        List<String> input = List.of(
                "function integer f;",
                "for (i = 0; i < 4; i = i + 1) begin",
                "f = i;",
                "end",
                "endfunction");

        assertEquals(input, pass.apply(input));
    }
}
