package com.hdlformatter.plugins.verilog.indent;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConditionAlignerTest {

    private final ConditionAligner pass = new ConditionAligner();

    @Test
    void continuation_lines_align_after_the_opening_parenthesis() {
        List<String> result = pass.apply(List.of(
                "    if (a &&",
                "b &&",
                "            c) begin",
                "      x = 1;"));

        assertEquals(List.of(
                "    if (a &&",
                "        b &&",
                "        c) begin",
                "      x = 1;"), result);
    }

    @Test
    void else_if_conditions_use_their_own_column() {
        List<String> result = pass.apply(List.of("  end else if (a ||", "  b) begin"));

        assertEquals("               b) begin", result.get(1));
    }

    @Test
    void module_header_lines_are_skipped() {
        List<String> input = List.of(
                "module m (input a,",
                "    input b);",
                "endmodule");

        assertEquals(input, pass.apply(input));
    }

    @Test
    void single_line_conditions_are_untouched() {
        List<String> input = List.of("  if (a) begin", "  x = 1;", "  end");

        assertEquals(input, pass.apply(input));
    }
}
