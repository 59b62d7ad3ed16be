package com.hdlformatter.plugins.verilog.directive;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DirectiveIndentNormalizerTest {

    private final DirectiveIndentNormalizer normalizer = new DirectiveIndentNormalizer();

    @Test
    void directives_take_the_indent_of_the_guarded_code() {
        List<String> input = List.of(
                "always @(posedge clk) begin",
                "`ifdef SIM",
                "    x <= 1;",
                "      `else // SIM",
                "    x <= 0;",
                "`endif // SIM",
                "end");

        List<String> result = normalizer.apply(input);

        assertEquals(List.of(
                "always @(posedge clk) begin",
                "    `ifdef SIM",
                "    x <= 1;",
                "    `else // SIM",
                "    x <= 0;",
                "    `endif // SIM",
                "end"), result);
    }

    @Test
    void directive_at_end_of_input_uses_previous_code_line() {
        List<String> input = List.of(
                "  assign a = b;",
                "`ifdef SIM",
                "`endif");

        List<String> result = normalizer.apply(input);

        assertEquals("  `ifdef SIM", result.get(1));
        assertEquals("  `endif", result.get(2));
    }

    @Test
    void directives_inside_an_open_list_keep_their_indent() {
        List<String> input = List.of(
                "  foo u_foo (",
                "    .a(a)",
                "`ifdef EXTRA",
                "  );");

        assertEquals(input, normalizer.apply(input));
    }

    @Test
    void unmatched_endif_is_left_alone() {
        List<String> input = List.of(
                "  wire a;",
                "     `endif");

        assertEquals(input, normalizer.apply(input));
    }

    @Test
    void only_applies_when_a_directive_is_present() {
        assertFalse(normalizer.isApplicable(List.of("wire a;", "assign a = b;")));
        assertTrue(normalizer.isApplicable(List.of("  `ifdef X")));
    }

    @Test
    void module_level_mode_moves_only_directives_in_the_module_body() {
        DirectiveIndentNormalizer moduleLevel = new DirectiveIndentNormalizer(true);

        List<String> result = moduleLevel.apply(List.of(
                "module m;",
                "`ifdef X",
                "  wire a;",
                "`endif // X",
                "always @(posedge clk) begin",
                "`ifdef SIM",
                "    x <= 1;",
                "`endif",
                "end",
                "endmodule"));

        assertEquals(List.of(
                "module m;",
                "  `ifdef X",
                "  wire a;",
                "  `endif // X",
                "always @(posedge clk) begin",
                "`ifdef SIM",
                "    x <= 1;",
                "`endif",
                "end",
                "endmodule"), result);
    }

    @Test
    void module_level_mode_leaves_header_and_file_level_directives() {
        DirectiveIndentNormalizer moduleLevel = new DirectiveIndentNormalizer(true);
        List<String> input = List.of(
                "`ifdef TOP",
                "module m (",
                "`ifdef X",
                "  input a,",
                "`endif",
                "  input b",
                ");",
                "endmodule",
                "`endif");

        assertEquals(input, moduleLevel.apply(input));
    }
}
