package com.hdlformatter.plugins.verilog;

import com.hdlformatter.api.EditResult;
import com.hdlformatter.api.FormatterResult;
import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.config.FormatterConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VerilogFormatterTest {

    private static final Path FILE = Paths.get("top.v");

    private static FormatterConfig configWith(Map<String, Object> verilog) {
        Map<String, Map<String, Object>> plugins = new HashMap<>();
        plugins.put(FormatConfig.PLUGIN_NAME, verilog);
        return new FormatterConfig(new HashMap<>(), plugins);
    }

    @Test
    void static_format_returns_a_full_replacement() {
        EditResult edit = VerilogFormatter.format("if (a) foo = 1;", FormatConfig.builder().build());

        assertTrue(edit.isChanged());
        assertEquals("if (a) begin\n  foo = 1;\nend", edit.getReplacement().orElseThrow());
    }

    @Test
    void static_format_reports_no_change_for_formatted_text() {
        EditResult edit = VerilogFormatter.format("wire a;\n", FormatConfig.builder().build());

        assertFalse(edit.isChanged());
        assertSame(EditResult.noChange(), edit);
    }

    @Test
    void disabled_rules_give_no_change() {
        EditResult edit = VerilogFormatter.format("if (a) foo = 1;   \n\n\n", FormatConfig.allDisabled());

        assertSame(EditResult.noChange(), edit);
    }

    @Test
    void plugin_reads_its_section_of_the_configuration() {
        Map<String, Object> verilog = new HashMap<>();
        verilog.put("indentSize", 4);
        verilog.put("alignAssignments", false);
        VerilogFormatter plugin = new VerilogFormatter();

        plugin.initialize(configWith(verilog));

        assertEquals(4, plugin.getFormatConfig().getIndentSize());
        assertTrue(plugin.getFormatConfig().isIndentSizeExplicit());
        assertFalse(plugin.getFormatConfig().isAlignAssignments());
        assertEquals("if (a) begin\n    foo = 1;\nend",
                plugin.format(FILE, "if (a) foo = 1;").getFormattedCode());
    }

    @Test
    void repeated_requests_are_served_from_the_cache_until_reinitialized() {
        VerilogFormatter plugin = new VerilogFormatter();
        plugin.initialize(configWith(new HashMap<>()));

        FormatterResult first = plugin.format(FILE, "if (a) foo = 1;");
        assertSame(first, plugin.format(FILE, "if (a) foo = 1;"));
        assertNotSame(first, plugin.format(Paths.get("other.v"), "if (a) foo = 1;"));

        plugin.initialize(configWith(new HashMap<>()));
        assertNotSame(first, plugin.format(FILE, "if (a) foo = 1;"));
        plugin.close();
    }

    @Test
    void range_outside_the_document_is_rejected() {
        FormatConfig config = FormatConfig.builder().build();
        String source = "wire a;\nwire b;";

        assertThrows(IllegalArgumentException.class, () -> VerilogFormatter.formatRange(source, -1, 0, config));
        assertThrows(IllegalArgumentException.class, () -> VerilogFormatter.formatRange(source, 2, 2, config));
        assertThrows(IllegalArgumentException.class, () -> VerilogFormatter.formatRange(source, 1, 0, config));
    }

    @Test
    void range_end_past_the_document_is_clamped() {
        String[] lines = VerilogFormatter.formatRange("wire a;\nwire b;", 1, 40, FormatConfig.builder().build());

        assertArrayEquals(new String[]{"wire b;"}, lines);
    }

    @Test
    void range_uses_the_editor_tab_size_unless_configured() {
        FormatConfig defaults = FormatConfig.builder().build();
        FormatConfig explicit = FormatConfig.builder().indentSize(2).indentSizeExplicit(true).build();

        assertArrayEquals(new String[]{"if (a) begin", "    foo = 1;", "end"},
                VerilogFormatter.formatRange("if (a) foo = 1;", 0, 0, defaults, 4));
        assertArrayEquals(new String[]{"if (a) begin", "  foo = 1;", "end"},
                VerilogFormatter.formatRange("if (a) foo = 1;", 0, 0, explicit, 4));
    }

    @Test
    void range_text_keeps_crlf_line_endings() {
        String source = "x = 1;\r\nif (a) foo = 1;\r\ny = 2;\r\n";

        String text = VerilogFormatter.formatRangeText(source, 1, 1, FormatConfig.builder().build());

        assertEquals("if (a) begin\r\n  foo = 1;\r\nend", text);
    }
}
