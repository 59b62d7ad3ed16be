package com.hdlformatter.plugins.verilog.align;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentAlignerTest {

    private final AssignmentAligner aligner = new AssignmentAligner();

    @Test
    void assign_statements_share_operator_and_semicolon_columns() {
        List<String> result = aligner.align(List.of(
                "  assign a = b;",
                "  assign long_name = c & d;"));

        assertEquals(List.of(
                "  assign a         = b    ;",
                "  assign long_name = c & d;"), result);
    }

    @Test
    void plain_statements_are_padded_to_their_own_width() {
        List<String> result = aligner.align(List.of(
                "  x = 1;",
                "  yy <= 2;"));

        assertEquals(List.of(
                "  x  = 1 ;",
                "  yy <= 2;"), result);
    }

    @Test
    void comments_inside_the_group_are_reindented_and_trailing_comments_normalized() {
        List<String> result = aligner.align(List.of(
                "  assign a = b; //first",
                "     // between",
                "  assign cc = d;"));

        assertEquals("  assign a  = b; // first", result.get(0));
        assertEquals("  // between", result.get(1));
        assertEquals("  assign cc = d;", result.get(2));
    }

    @Test
    void multi_line_right_hand_side_continues_under_the_first_value() {
        List<String> result = aligner.align(List.of(
                "assign sum = a +",
                "  b +",
                "  c;"));

        assertEquals(List.of(
                "assign sum = a +",
                "             b +",
                "             c;"), result);
    }

    @Test
    void comparison_operators_are_not_taken_for_assignment() {
        List<String> result = aligner.align(List.of(
                "assign eq = (a == b);",
                "assign ne_flag = (a != b);"));

        assertEquals("assign eq      = (a == b);", result.get(0));
        assertEquals("assign ne_flag = (a != b);", result.get(1));
    }
}
