package com.hdlformatter.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FormatConfigTest {

    @Test
    void editor_tab_size_applies_only_without_explicit_indent() {
        FormatConfig defaults = FormatConfig.builder().build();
        FormatConfig explicit = FormatConfig.builder().indentSize(3).indentSizeExplicit(true).build();

        assertEquals("    ", defaults.withEditorTabSize(4).indentUnit());
        assertSame(defaults, defaults.withEditorTabSize(null));
        assertSame(defaults, defaults.withEditorTabSize(0));
        assertSame(explicit, explicit.withEditorTabSize(8));
    }

    @Test
    void all_disabled_has_no_feature_left() {
        assertFalse(FormatConfig.allDisabled().hasAnyFeatureEnabled());
        assertFalse(FormatConfig.allDisabled().compressesBlankLines());
        assertTrue(FormatConfig.allDisabled().toBuilder().commentColumn(40).build().hasAnyFeatureEnabled());
        assertTrue(FormatConfig.builder().build().hasAnyFeatureEnabled());
    }

    @Test
    void string_booleans_and_numbers_are_coerced() {
        Map<String, Object> verilog = new HashMap<>();
        verilog.put("alignParameters", "false");
        verilog.put("lineLength", 120L);
        verilog.put("wrapPortList", "sometimes");
        Map<String, Map<String, Object>> plugins = new HashMap<>();
        plugins.put(FormatConfig.PLUGIN_NAME, verilog);

        FormatConfig config = FormatConfig.from(new FormatterConfig(new HashMap<>(), plugins));

        assertFalse(config.isAlignParameters());
        assertEquals(120, config.getLineLength());
        assertTrue(config.isWrapPortList());
        assertFalse(config.isIndentSizeExplicit());
    }
}
