package com.hdlformatter.api;

import java.nio.file.Path;

import com.hdlformatter.config.FormatterConfig;

/**
 * Interface for language-specific formatter plugins.
 */
public interface FormatterPlugin {
    /**
     * Initialize the plugin with the configuration.
     */
    void initialize(FormatterConfig config);

    /**
     * Format the provided source code according to the configured rules.
     */
    FormatterResult format(Path filePath, String sourceCode);

    /**
     * Format only lines {@code startLine..endLine} (0-based, inclusive) of the source.
     * Returns the replacement lines for that range.
     */
    String[] formatRange(Path filePath, String sourceCode, int startLine, int endLine);
}
