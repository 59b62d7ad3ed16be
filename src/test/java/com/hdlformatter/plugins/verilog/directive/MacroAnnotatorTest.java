package com.hdlformatter.plugins.verilog.directive;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MacroAnnotatorTest {

    @Test
    void else_and_endif_are_tagged_with_the_opening_symbol() {
        MacroAnnotator annotator = new MacroAnnotator();

        assertEquals("`ifdef SIM", annotator.annotate("`ifdef SIM"));
        assertEquals("  wire a;", annotator.annotate("  wire a;"));
        assertEquals("`else // SIM", annotator.annotate("`else"));
        assertEquals("`endif // SIM", annotator.annotate("`endif"));
        assertEquals(0, annotator.depth());
    }

    @Test
    void nested_directives_use_their_own_symbols() {
        MacroAnnotator annotator = new MacroAnnotator();

        annotator.annotate("`ifdef OUTER");
        annotator.annotate("  `ifndef INNER");
        assertEquals("  `endif // INNER", annotator.annotate("  `endif"));
        assertEquals("`else // OUTER", annotator.annotate("`else"));
        assertEquals("`endif // OUTER", annotator.annotate("`endif"));
    }

    @Test
    void existing_comment_is_replaced_by_the_symbol() {
        MacroAnnotator annotator = new MacroAnnotator();

        annotator.annotate("`ifdef FPGA");
        assertEquals("`endif // FPGA", annotator.annotate("`endif // end of fpga part"));
    }

    @Test
    void already_annotated_lines_are_stable() {
        MacroAnnotator annotator = new MacroAnnotator();

        annotator.annotate("`ifdef FPGA");
        assertEquals("`else // FPGA", annotator.annotate("`else // FPGA"));
        assertEquals("`endif // FPGA", annotator.annotate("`endif // FPGA"));
    }

    @Test
    void unmatched_endif_passes_through_unchanged() {
        MacroAnnotator annotator = new MacroAnnotator();

        assertEquals("  `endif", annotator.annotate("  `endif"));
        assertEquals("`else", annotator.annotate("`else"));
    }

    @Test
    void directive_inside_a_comment_is_ignored() {
        MacroAnnotator annotator = new MacroAnnotator();

        assertEquals("// `endif is not code", annotator.annotate("// `endif is not code"));
    }
}
