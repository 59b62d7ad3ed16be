package com.hdlformatter.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FormatterCliTest {

    @TempDir
    Path tempDir;

    private String configOption;

    @BeforeEach
    void writeConfig() throws IOException {
        Path config = tempDir.resolve("cfg.yml");
        Files.writeString(config, "plugins:\n  verilog:\n    indentSize: 2\n");
        configOption = "--config=" + config;
    }

    @Test
    void check_reports_unformatted_files_without_touching_them() throws IOException {
        Path file = tempDir.resolve("top.v");
        Files.writeString(file, "if (a) foo = 1;\n");

        assertEquals(FormatterCli.EXIT_FAILURE, FormatterCli.run(new String[]{"check", tempDir.toString(), configOption, "--ci"}));
        assertEquals("if (a) foo = 1;\n", Files.readString(file));
    }

    @Test
    void format_rewrites_files_and_a_second_check_passes() throws IOException {
        Path file = tempDir.resolve("top.v");
        Files.writeString(file, "if (a) foo = 1;\n");

        assertEquals(FormatterCli.EXIT_OK, FormatterCli.run(new String[]{"format", tempDir.toString(), configOption, "--ci"}));
        assertEquals("if (a) begin\n  foo = 1;\nend\n", Files.readString(file));
        assertEquals(FormatterCli.EXIT_OK, FormatterCli.run(new String[]{"check", tempDir.toString(), configOption, "--ci"}));
    }

    @Test
    void include_glob_limits_the_files() throws IOException {
        Path verilog = tempDir.resolve("a.v");
        Path system = tempDir.resolve("b.sv");
        Files.writeString(verilog, "if (a) foo = 1;\n");
        Files.writeString(system, "if (b) bar = 1;\n");

        FormatterCli.run(new String[]{"format", tempDir.toString(), configOption, "--include=*.sv", "--ci"});

        assertEquals("if (a) foo = 1;\n", Files.readString(verilog));
        assertEquals("if (b) begin\n  bar = 1;\nend\n", Files.readString(system));
    }

    @Test
    void range_option_formats_only_the_given_lines() throws IOException {
        Path file = tempDir.resolve("top.v");
        Files.writeString(file, "if (x) y = 1;\nif (a) foo = 1;\n");

        assertEquals(FormatterCli.EXIT_OK,
                FormatterCli.run(new String[]{"format", file.toString(), configOption, "--range=2:2", "--ci"}));
        assertEquals("if (x) y = 1;\nif (a) begin\n  foo = 1;\nend\n", Files.readString(file));
    }

    @Test
    void range_outside_the_file_fails() throws IOException {
        Path file = tempDir.resolve("top.v");
        Files.writeString(file, "wire a;\n");

        assertEquals(FormatterCli.EXIT_FAILURE,
                FormatterCli.run(new String[]{"format", file.toString(), configOption, "--range=9:12", "--ci"}));
        assertEquals(FormatterCli.EXIT_FAILURE,
                FormatterCli.run(new String[]{"format", file.toString(), configOption, "--range=a:b", "--ci"}));
    }

    @Test
    void init_writes_the_default_configuration_once() throws IOException {
        Path target = tempDir.resolve("new.yml");
        String option = "--config=" + target;

        assertEquals(FormatterCli.EXIT_OK, FormatterCli.run(new String[]{"init", option}));
        assertTrue(Files.readString(target).contains("verilog:"));
        assertEquals(FormatterCli.EXIT_FAILURE, FormatterCli.run(new String[]{"init", option}));
        assertEquals(FormatterCli.EXIT_OK, FormatterCli.run(new String[]{"init", option, "--force"}));
    }

    @Test
    void bad_invocations_fail() {
        assertEquals(FormatterCli.EXIT_FAILURE, FormatterCli.run(new String[0]));
        assertEquals(FormatterCli.EXIT_FAILURE, FormatterCli.run(new String[]{"reformat"}));
        assertEquals(FormatterCli.EXIT_FAILURE, FormatterCli.run(new String[]{"check"}));
        assertEquals(FormatterCli.EXIT_FAILURE,
                FormatterCli.run(new String[]{"check", tempDir.resolve("missing").toString(), "--ci"}));
        assertEquals(FormatterCli.EXIT_OK, FormatterCli.run(new String[]{"--version"}));
    }
}
