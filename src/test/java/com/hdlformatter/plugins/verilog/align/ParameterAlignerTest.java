package com.hdlformatter.plugins.verilog.align;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParameterAlignerTest {

    private final ParameterAligner aligner = new ParameterAligner();

    @Test
    void parameters_align_equals_and_semicolon() {
        List<String> result = aligner.align(List.of(
                "localparam A = 1;",
                "localparam BB = 16'hFF;"));

        assertEquals(List.of(
                "localparam A  = 1     ;",
                "localparam BB = 16'hFF;"), result);
    }

    @Test
    void group_uses_the_indent_of_its_first_parameter() {
        List<String> result = aligner.align(List.of(
                "  parameter WIDTH = 8;",
                "parameter DEPTH_LOG2 = 4; // log2"));

        assertEquals("  parameter WIDTH      = 8;", result.get(0));
        assertEquals("  parameter DEPTH_LOG2 = 4; // log2", result.get(1));
    }

    @Test
    void multi_line_value_continues_after_the_equals() {
        List<String> result = aligner.align(List.of(
                "localparam INIT = {",
                "  8'h01,",
                "  8'h02",
                "};"));

        assertEquals(List.of(
                "localparam INIT = { 8'h01,",
                "                  8'h02 };"), result);
    }

    @Test
    void non_parameter_lines_are_left_alone() {
        List<String> input = List.of("// only a comment", "");

        assertEquals(input, aligner.align(input));
    }
}
