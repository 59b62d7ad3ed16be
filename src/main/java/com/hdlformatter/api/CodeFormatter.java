package com.hdlformatter.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * The main formatter interface: dispatches files to the plugin for their type.
 */
public interface CodeFormatter {
    FormatterResult formatFile(Path filePath, String sourceCode);
    Map<Path, FormatterResult> formatDirectory(Path directory);
}
