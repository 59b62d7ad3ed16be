package com.hdlformatter.plugins.verilog.line;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineClassifierTest {

    @Test
    void classify_recognizes_each_line_role() {
        assertEquals(LineKind.BLANK, LineClassifier.classify("   ", false));
        assertEquals(LineKind.COMMENT, LineClassifier.classify("  // note", false));
        assertEquals(LineKind.DIRECTIVE, LineClassifier.classify("`ifdef SIM", false));
        assertEquals(LineKind.DECLARATION_START, LineClassifier.classify("  wire [3:0] bus;", false));
        assertEquals(LineKind.OTHER, LineClassifier.classify("  always @(*) begin", false));
    }

    @Test
    void continuing_wins_over_every_other_role() {
        assertEquals(LineKind.CONTINUATION, LineClassifier.classify("  // inside initializer", true));
        assertEquals(LineKind.CONTINUATION, LineClassifier.classify("", true));
    }

    @Test
    void declaration_kind_distinguishes_families() {
        assertEquals(DeclarationKind.PORT, LineClassifier.declarationKind("input wire clk,"));
        assertEquals(DeclarationKind.NET, LineClassifier.declarationKind("  reg [7:0] count;"));
        assertEquals(DeclarationKind.NET, LineClassifier.declarationKind("logic valid;"));
        assertEquals(DeclarationKind.PARAMETER, LineClassifier.declarationKind("  localparam W = 8;"));
        assertEquals(DeclarationKind.ASSIGNMENT, LineClassifier.declarationKind("  assign y = a & b;"));
        assertEquals(DeclarationKind.NONE, LineClassifier.declarationKind("  wirex = 1;"));
        assertTrue(DeclarationKind.PORT.isWireFamily());
        assertFalse(DeclarationKind.PARAMETER.isWireFamily());
    }

    @Test
    void generic_assignment_excludes_control_lines_and_declarations() {
        assertTrue(LineClassifier.isGenericAssignment("  q <= d;"));
        assertTrue(LineClassifier.isGenericAssignment("  x = y + 1; // next"));
        assertFalse(LineClassifier.isGenericAssignment("  if (a) q <= d;"));
        assertFalse(LineClassifier.isGenericAssignment("  wire w = a;"));
        assertFalse(LineClassifier.isGenericAssignment("  parameter P = 1;"));
        assertFalse(LineClassifier.isGenericAssignment("  q <= d"));
    }

    @Test
    void initializer_detection_ignores_comments() {
        assertTrue(LineClassifier.hasInitializer("wire a = b;"));
        assertFalse(LineClassifier.hasInitializer("wire a; // a = b"));
    }
}
