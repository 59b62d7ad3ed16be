package com.hdlformatter.plugins.verilog.align;

import com.hdlformatter.config.FormatConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WireDeclarationAlignerTest {

    private final WireDeclarationAligner aligner = new WireDeclarationAligner(FormatConfig.builder().build());

    @Test
    void simple_declarations_align_their_semicolons() {
        List<String> result = aligner.align(List.of(
                "  wire a;",
                "  wire long_name;"));

        assertEquals(List.of(
                "  wire a        ;",
                "  wire long_name;"), result);
    }

    @Test
    void ranges_are_right_aligned_so_brackets_line_up() {
        List<String> result = aligner.align(List.of(
                "wire [3:0] a;",
                "wire [15:0] bb;"));

        assertEquals(List.of(
                "wire  [3:0] a ;",
                "wire [15:0] bb;"), result);
    }

    @Test
    void initializers_share_the_equals_column() {
        List<String> result = aligner.align(List.of(
                "wire a = b;",
                "wire [3:0] cc = d;"));

        assertEquals(List.of(
                "wire       a  = b;",
                "wire [3:0] cc = d;"), result);
    }

    @Test
    void comments_between_declarations_pass_through() {
        List<String> input = List.of(
                "  reg a;",
                "  // keep me",
                "  reg bcd;");

        List<String> result = aligner.align(input);

        assertEquals("  // keep me", result.get(1));
        assertEquals(result.get(0).indexOf(';'), result.get(2).indexOf(';'));
    }

    @Test
    void aligned_input_is_returned_as_is() {
        List<String> input = List.of(
                "wire  [3:0] a ;",
                "wire [15:0] bb;");

        assertSame(input, aligner.align(input));
    }

    @Test
    void over_long_line_keeps_its_semicolon_next_to_the_code() {
        WireDeclarationAligner narrow = new WireDeclarationAligner(FormatConfig.builder().lineLength(40).build());

        List<String> result = narrow.align(List.of(
                "wire [3:0] a;",
                "wire [3:0] a_really_long_signal_name_that_overflows;"));

        assertEquals("wire [3:0] a_really_long_signal_name_that_overflows;", result.get(1));
        assertEquals("wire [3:0] a;", result.get(0));
    }

    @Test
    void name_list_over_several_lines_keeps_its_line_breaks() {
        List<String> input = List.of(
                "input a,",
                "      b;");

        assertEquals(input, aligner.align(input));
    }

    @Test
    void unterminated_port_followed_by_a_net_is_not_joined() {
        List<String> input = List.of(
                "input clk,",
                "wire a;");

        assertEquals(input, aligner.align(input));
    }

    @Test
    void semicolon_inside_a_comment_does_not_end_the_declaration() {
        List<String> input = List.of(
                "wire a, // first;",
                "     b;");

        assertEquals(input, aligner.align(input));
    }

    @Test
    void trailing_comment_with_semicolon_keeps_a_single_terminator() {
        List<String> result = aligner.align(List.of(
                "wire a; // keep;",
                "wire bb;"));

        assertEquals(List.of(
                "wire a ; // keep;",
                "wire bb;"), result);
    }
}
