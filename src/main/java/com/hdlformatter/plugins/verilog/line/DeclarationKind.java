package com.hdlformatter.plugins.verilog.line;

/**
 * Kind of declaration or statement that opens an alignment group.
 */
public enum DeclarationKind {
    /** {@code wire}, {@code reg}, {@code logic}, {@code integer}. */
    NET,
    /** {@code input}, {@code output}, {@code inout}. */
    PORT,
    /** {@code parameter}, {@code localparam}. */
    PARAMETER,
    /** {@code assign} or a module-level blocking/non-blocking statement. */
    ASSIGNMENT,
    NONE;

    public boolean isWireFamily() {
        return this == NET || this == PORT;
    }
}
