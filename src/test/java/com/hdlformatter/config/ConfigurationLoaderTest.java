package com.hdlformatter.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String yaml) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, yaml, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void defaults_come_from_the_embedded_file() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();
        FormatConfig format = FormatConfig.from(config);

        assertEquals(4, (int) config.getGeneralConfig("threads", 0));
        assertEquals(List.of(), config.getGeneralConfig("ignoreFiles", new ArrayList<String>()));
        assertEquals(2, format.getIndentSize());
        assertFalse(format.isIndentSizeExplicit());
        assertEquals(1, format.getMaxBlankLines());
        assertEquals(160, format.getLineLength());
        assertTrue(format.isAnnotateIfdefComments());
    }

    @Test
    void file_values_override_defaults_and_invalid_ones_are_replaced() throws IOException {
        Path file = write("fmt.yml", """
                general:
                  threads: 2
                  ignoreFiles: ["gen/**"]
                plugins:
                  verilog:
                    indentSize: 4
                    lineLength: 10
                    alignAssignments: "maybe"
                    enforceBeginEnd: false
                """);

        FormatterConfig config = ConfigurationLoader.loadConfig(file);
        FormatConfig format = FormatConfig.from(config);

        assertEquals(2, (int) config.getGeneralConfig("threads", 0));
        assertEquals(List.of("gen/**"), config.getGeneralConfig("ignoreFiles", new ArrayList<String>()));
        assertEquals(4, format.getIndentSize());
        assertTrue(format.isIndentSizeExplicit());
        assertEquals(160, format.getLineLength());
        assertTrue(format.isAlignAssignments());
        assertFalse(format.isEnforceBeginEnd());
    }

    @Test
    void missing_or_broken_files_fall_back_to_defaults() throws IOException {
        Path broken = write("broken.yml", "plugins: [unclosed");

        assertSame(ConfigurationLoader.loadDefaultConfig(), ConfigurationLoader.loadConfig(tempDir.resolve("none.yml")));
        assertSame(ConfigurationLoader.loadDefaultConfig(), ConfigurationLoader.loadConfig(broken));
        assertSame(ConfigurationLoader.loadDefaultConfig(), ConfigurationLoader.loadConfig(null));
    }

    @Test
    void project_file_is_picked_up_from_the_directory() throws IOException {
        write(ConfigurationLoader.PROJECT_CONFIG_FILE, """
                plugins:
                  verilog:
                    commentColumn: 40
                """);

        FormatConfig format = FormatConfig.from(ConfigurationLoader.loadProjectConfig(tempDir));

        assertEquals(40, format.getCommentColumn());
        assertTrue(format.isAlignPortList());
    }

    @Test
    void saved_configuration_loads_back() throws IOException {
        Path file = tempDir.resolve("nested/saved.yml");
        FormatterConfig original = ConfigurationLoader.loadConfig(write("in.yml", """
                plugins:
                  verilog:
                    indentSize: 3
                """));

        ConfigurationLoader.saveConfig(original, file);
        FormatConfig reloaded = FormatConfig.from(ConfigurationLoader.loadConfig(file));

        assertEquals(3, reloaded.getIndentSize());
    }

    @Test
    void default_text_is_the_embedded_yaml() throws IOException {
        String text = ConfigurationLoader.defaultConfigText();

        assertTrue(text.contains("plugins:"));
        assertTrue(text.contains("verilog:"));
    }
}
