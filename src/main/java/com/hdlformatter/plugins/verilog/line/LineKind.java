package com.hdlformatter.plugins.verilog.line;

/**
 * Role of a single physical line as seen by the grouping scan.
 */
public enum LineKind {
    COMMENT,
    DIRECTIVE,
    BLANK,
    DECLARATION_START,
    CONTINUATION,
    OTHER
}
