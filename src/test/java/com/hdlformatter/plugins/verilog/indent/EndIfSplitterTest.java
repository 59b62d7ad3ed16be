package com.hdlformatter.plugins.verilog.indent;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EndIfSplitterTest {

    private final EndIfSplitter pass = new EndIfSplitter();

    @Test
    void end_if_is_split_at_the_same_indentation() {
        assertEquals(List.of("    end", "    if (b) begin"), pass.apply(List.of("    end if (b) begin")));
    }

    @Test
    void end_else_if_is_kept() {
        List<String> input = List.of("    end else if (b) begin");

        assertEquals(input, pass.apply(input));
    }
}
