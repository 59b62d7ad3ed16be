package com.hdlformatter.plugins.verilog.indent;

import com.hdlformatter.config.FormatConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModuleLevelIndenterTest {

    private final ModuleLevelIndenter pass = new ModuleLevelIndenter(FormatConfig.builder().build());

    @Test
    void column_zero_declarations_inside_a_module_get_one_unit() {
        List<String> result = pass.apply(List.of(
                "wire outside;",
                "module m (input a);",
                "wire b;",
                "  wire c;",
                "assign b = a;",
                "always @(*) begin",
                "reg_x = 1;",
                "end",
                "endmodule"));

        assertEquals(List.of(
                "wire outside;",
                "module m (input a);",
                "  wire b;",
                "  wire c;",
                "  assign b = a;",
                "always @(*) begin",
                "reg_x = 1;",
                "end",
                "endmodule"), result);
    }

    @Test
    void multi_line_header_is_left_alone() {
        List<String> input = List.of(
                "module m (",
                "input a,",
                "output b",
                ");",
                "endmodule");

        assertEquals(input, pass.apply(input));
    }

    @Test
    void declaration_moves_with_its_continuation_lines() {
        List<String> result = pass.apply(List.of(
                "module m;",
                "wire [7:0] b = {a,",
                "  c};",
                "wire [1:0] dd = 2'b01;",
                "endmodule"));

        assertEquals(List.of(
                "module m;",
                "  wire [7:0] b = {a,",
                "    c};",
                "  wire [1:0] dd = 2'b01;",
                "endmodule"), result);
        assertEquals(result, pass.apply(result));
    }

    @Test
    void generate_region_moves_as_a_whole() {
        List<String> result = pass.apply(List.of(
                "module m;",
                "genvar g;",
                "generate",
                "  for (g=0;g<4;g=g+1) begin : gl",
                "    assign o[g] = i[g];",
                "  end",
                "endgenerate",
                "endmodule"));

        assertEquals(List.of(
                "module m;",
                "  genvar g;",
                "  generate",
                "    for (g=0;g<4;g=g+1) begin : gl",
                "      assign o[g] = i[g];",
                "    end",
                "  endgenerate",
                "endmodule"), result);
        assertEquals(result, pass.apply(result));
    }

    @Test
    void if_generate_moves_through_its_else_branch() {
        List<String> result = pass.apply(List.of(
                "module m;",
                "if (W > 1) begin : wide",
                "  assign y = a;",
                "end",
                "else begin : narrow",
                "  assign y = b;",
                "end",
                "endmodule"));

        assertEquals(List.of(
                "module m;",
                "  if (W > 1) begin : wide",
                "    assign y = a;",
                "  end",
                "  else begin : narrow",
                "    assign y = b;",
                "  end",
                "endmodule"), result);
    }
}
