package com.hdlformatter.plugins.verilog.range;

import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.plugins.verilog.PassRunner;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RangeFormatterTest {

    private final RangeFormatter formatter = new RangeFormatter(FormatConfig.builder().build());

    @Test
    void partial_selection_aligns_without_reindenting() {
        List<String> result = formatter.format(List.of("    x <= 1;", "  yy = 2;"), new PassRunner());

        assertEquals(List.of("    x  <= 1;", "  yy  = 2;"), result);
    }

    @Test
    void continuous_assignments_share_one_operator_column() {
        List<String> result = formatter.format(
                List.of("  assign a = b;", "  assign long_name = c;"), new PassRunner());

        assertEquals(List.of("  assign a         = b;", "  assign long_name = c;"), result);
    }

    @Test
    void complete_block_goes_through_the_full_pipeline() {
        List<String> result = formatter.format(
                List.of("always @(posedge clk) begin", "q <= d;", "end"), new PassRunner());

        assertEquals(List.of("always @(posedge clk) begin", "  q <= d;", "end"), result);
    }

    @Test
    void blank_lines_are_compressed_inside_the_selection() {
        List<String> result = formatter.format(List.of("wire a;", "", "", "wire b;"), new PassRunner());

        assertEquals(List.of("wire a;", "", "wire b;"), result);
    }

    @Test
    void disabled_rules_return_the_selection() {
        List<String> selected = List.of("  if (a) x = 1;   ");

        assertSame(selected, new RangeFormatter(FormatConfig.allDisabled()).format(selected, new PassRunner()));
    }
}
