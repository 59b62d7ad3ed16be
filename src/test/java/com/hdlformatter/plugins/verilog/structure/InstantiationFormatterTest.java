package com.hdlformatter.plugins.verilog.structure;

import com.hdlformatter.config.FormatConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InstantiationFormatterTest {

    private final InstantiationFormatter formatter = new InstantiationFormatter(FormatConfig.builder().build());

    @Test
    void named_connections_align_port_names_and_closing_parentheses() {
        List<String> result = formatter.apply(List.of(
                "  fifo u_fifo (.clk(clk), .data_in(din), .full(full_o));"));

        assertEquals(List.of(
                "  fifo u_fifo(",
                "    .clk     (clk   ),",
                "    .data_in (din   ),",
                "    .full    (full_o)",
                "    );"), result);
    }

    @Test
    void parameter_overrides_get_their_own_list() {
        List<String> result = formatter.apply(List.of(
                "counter #(.WIDTH(8)) u_cnt (.clk(clk), .q(q));"));

        assertEquals(List.of(
                "counter #(",
                "  .WIDTH (8)",
                "  )",
                "  u_cnt(",
                "    .clk (clk),",
                "    .q   (q  )",
                "    );"), result);
    }

    @Test
    void module_level_instance_takes_the_indent_of_the_declarations_above() {
        List<String> result = formatter.apply(List.of(
                "  wire a;",
                "inv u_inv (.i(a), .o(b));"));

        assertEquals("  inv u_inv(", result.get(1));
        assertEquals("    .i (a),", result.get(2));
    }

    @Test
    void keywords_are_not_taken_for_module_names() {
        List<String> input = List.of(
                "  always @(posedge clk) begin",
                "    if (a) b <= c;",
                "  end");

        assertEquals(input, formatter.apply(input));
    }

    @Test
    void unterminated_instantiation_is_left_as_written() {
        List<String> input = List.of(
                "fifo u_fifo (",
                "  .clk(clk)");

        assertEquals(input, formatter.apply(input));
    }

    @Test
    void formatting_its_own_output_is_stable() {
        List<String> once = formatter.apply(List.of(
                "counter #(.WIDTH(8)) u_cnt (.clk(clk), .q(q));"));

        assertEquals(once, formatter.apply(once));
    }
}
