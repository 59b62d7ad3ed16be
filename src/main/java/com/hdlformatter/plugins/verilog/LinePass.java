package com.hdlformatter.plugins.verilog;

import java.util.List;

/**
 * One stage of the formatting pipeline: consumes an ordered list of lines and produces the next one.
 */
public interface LinePass {
    /**
     * Short name used in logs and in the applied-pass report.
     */
    String getName();

    /**
     * Whether the pass should run on this input at all.
     */
    default boolean isApplicable(List<String> lines) {
        return true;
    }

    /**
     * Runs the pass. Implementations never mutate the argument.
     */
    List<String> apply(List<String> lines);
}
