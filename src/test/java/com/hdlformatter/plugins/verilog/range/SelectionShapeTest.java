package com.hdlformatter.plugins.verilog.range;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SelectionShapeTest {

    @Test
    void balanced_always_block_is_complete() {
        assertTrue(new SelectionShape(List.of("always @(*) begin", "  x = 1;", "end")).hasCompleteStructure());
        assertFalse(new SelectionShape(List.of("always @(*) begin", "  x = 1;")).hasCompleteStructure());
    }

    @Test
    void case_needs_its_endcase() {
        assertTrue(new SelectionShape(List.of("case (s)", "  1: x = 1;", "endcase")).hasCompleteStructure());
        assertFalse(new SelectionShape(List.of("case (s)", "  1: x = 1;")).hasCompleteStructure());
    }

    @Test
    void if_else_chain_is_complete_once_every_block_closes() {
        assertTrue(new SelectionShape(List.of(
                "if (a) begin", "  x = 1;", "end else begin", "  x = 0;", "end")).hasCompleteIfElse());
        assertFalse(new SelectionShape(List.of("if (a) begin", "  x = 1;")).hasCompleteIfElse());
    }

    @Test
    void instantiation_must_start_and_end_inside_the_selection() {
        assertTrue(new SelectionShape(List.of("fifo u_fifo (", "  .clk(clk)", ");")).hasCompleteInstantiation());
        assertFalse(new SelectionShape(List.of("  .clk(clk)", ");")).hasCompleteInstantiation());
        assertFalse(new SelectionShape(List.of("assign x (", ");")).hasCompleteInstantiation());
    }

    @Test
    void module_header_is_complete_with_its_closing_line() {
        SelectionShape complete = new SelectionShape(List.of("module m (", "  input a", ");"));
        SelectionShape open = new SelectionShape(List.of("module m (", "  input a"));

        assertTrue(complete.hasCompleteModuleHeader());
        assertFalse(open.hasCompleteModuleHeader());
        assertTrue(open.hasModuleHeader());
        assertTrue(open.hasPortDeclarations());
    }

    @Test
    void plain_declarations_have_no_structure() {
        SelectionShape shape = new SelectionShape(List.of("wire a;", "assign a = b;"));

        assertFalse(shape.hasCompleteStructure());
        assertFalse(shape.hasModuleInstantiation());
        assertFalse(shape.hasProceduralBlock());
    }
}
