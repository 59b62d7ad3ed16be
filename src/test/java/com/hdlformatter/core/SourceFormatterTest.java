package com.hdlformatter.core;

import com.hdlformatter.api.FormatterPlugin;
import com.hdlformatter.api.FormatterResult;
import com.hdlformatter.api.error.Severity;
import com.hdlformatter.config.FormatterConfig;
import com.hdlformatter.plugins.FileType;
import com.hdlformatter.plugins.verilog.VerilogFormatter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceFormatterTest {

    @TempDir
    Path tempDir;

    private SourceFormatter formatter;

    private static FormatterConfig config(List<String> ignoreFiles) {
        Map<String, Object> general = new HashMap<>();
        general.put("threads", 2);
        general.put("ignoreFiles", new ArrayList<>(ignoreFiles));
        return new FormatterConfig(general, new HashMap<>());
    }

    @BeforeEach
    void setUp() {
        formatter = new SourceFormatter(config(List.of("vendor/**")));
        VerilogFormatter plugin = new VerilogFormatter();
        formatter.registerPlugin(FileType.VERILOG, plugin);
        formatter.registerPlugin(FileType.SYSTEMVERILOG, plugin);
    }

    @AfterEach
    void tearDown() throws Exception {
        formatter.close();
        FileType.clearCache();
    }

    @Test
    void file_is_dispatched_to_the_plugin_for_its_type() {
        FormatterResult result = formatter.formatFile(Paths.get("top.v"), "if (a) foo = 1;");

        assertTrue(result.isSuccessful());
        assertTrue(result.isChanged());
        assertEquals("if (a) begin\n  foo = 1;\nend", result.getFormattedCode());
        assertEquals(1, formatter.getProcessedFileCount());
        assertEquals(1, formatter.getChangedCount());
    }

    @Test
    void type_without_plugin_gives_an_error_and_the_original_text() {
        FormatterResult result = formatter.formatFile(Paths.get("defs.vh"), "`define A 1");

        assertFalse(result.isSuccessful());
        assertEquals("`define A 1", result.getFormattedCode());
        assertEquals(Severity.ERROR, result.getErrors().get(0).getSeverity());
        assertFalse(formatter.hasPluginFor(FileType.VERILOG_HEADER));
    }

    @Test
    void plugin_crash_becomes_a_fatal_result() {
        formatter.registerPlugin(FileType.SYSTEMVERILOG_HEADER, new FormatterPlugin() {
            @Override
            public void initialize(FormatterConfig config) {
            }

            @Override
            public FormatterResult format(Path filePath, String sourceCode) {
                throw new IllegalStateException("broken plugin");
            }

            @Override
            public String[] formatRange(Path filePath, String sourceCode, int startLine, int endLine) {
                throw new IllegalStateException("broken plugin");
            }
        });

        FormatterResult result = formatter.formatFile(Paths.get("pkg.svh"), "typedef int t;");

        assertFalse(result.isSuccessful());
        assertEquals("typedef int t;", result.getFormattedCode());
        assertEquals(Severity.FATAL, result.getErrors().get(0).getSeverity());
        assertTrue(result.getErrors().get(0).getMessage().contains("broken plugin"));
        assertEquals(1, formatter.getErrorCount());
    }

    @Test
    void directory_run_formats_supported_files_and_skips_ignored_ones() throws IOException {
        Files.createDirectories(tempDir.resolve("rtl"));
        Files.createDirectories(tempDir.resolve("vendor"));
        Files.writeString(tempDir.resolve("rtl/a.v"), "if (a) foo = 1;\n");
        Files.writeString(tempDir.resolve("rtl/b.sv"), "wire b;\n");
        Files.writeString(tempDir.resolve("vendor/ip.v"), "if (x) y = 1;\n");
        Files.writeString(tempDir.resolve("README.md"), "# docs\n");

        Map<Path, FormatterResult> results = formatter.formatDirectory(tempDir);

        assertEquals(2, results.size());
        assertTrue(results.get(tempDir.resolve("rtl/a.v")).isChanged());
        assertFalse(results.get(tempDir.resolve("rtl/b.sv")).isChanged());
        assertFalse(results.containsKey(tempDir.resolve("vendor/ip.v")));
    }

    @Test
    void found_files_are_sorted() throws IOException {
        Files.writeString(tempDir.resolve("z.v"), "wire z;\n");
        Files.writeString(tempDir.resolve("a.sv"), "wire a;\n");

        assertEquals(List.of(tempDir.resolve("a.sv"), tempDir.resolve("z.v")), formatter.findFiles(tempDir));
    }

    @Test
    void missing_directory_gives_no_results() {
        assertTrue(formatter.formatDirectory(tempDir.resolve("absent")).isEmpty());
    }
}
