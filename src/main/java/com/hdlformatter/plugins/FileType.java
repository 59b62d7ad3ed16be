package com.hdlformatter.plugins;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.hdlformatter.util.LoggerUtil;

/**
 * Hardware description source types, detected by extension with a content fallback.
 */
public enum FileType {
    VERILOG("v", false),
    VERILOG_HEADER("vh", false),
    SYSTEMVERILOG("sv", true),
    SYSTEMVERILOG_HEADER("svh", true),
    UNKNOWN("", false);

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);

    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;
    private static final int CONTENT_SCAN_LINES = 200;

    private static final Pattern MODULE_PATTERN = Pattern.compile("^\\s*(module|macromodule)\\s+\\w+");
    private static final Pattern ENDMODULE_PATTERN = Pattern.compile("^\\s*endmodule\\b");
    private static final Pattern SYSTEMVERILOG_PATTERN = Pattern.compile(
            "\\b(logic|always_ff|always_comb|always_latch|interface|package|typedef|import\\s+\\w+::)\\b");

    private final String extension;
    private final boolean systemVerilog;

    FileType(String extension, boolean systemVerilog) {
        this.extension = extension;
        this.systemVerilog = systemVerilog;
    }

    public String getExtension() {
        return extension;
    }

    public boolean isSystemVerilog() {
        return systemVerilog;
    }

    public boolean isSupported() {
        return this != UNKNOWN;
    }

    /**
     * Detects the type of {@code filePath}: by extension first, then by looking for a
     * {@code module}/{@code endmodule} pair in the first lines. Results are cached per path.
     */
    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType type = detectByExtension(filePath);
        if (type == UNKNOWN && Files.isRegularFile(filePath)) {
            type = detectByContent(filePath);
        }
        typeCache.put(filePath, type);
        return type;
    }

    /**
     * Detection by file name only; never touches the file system.
     */
    public static FileType detectByExtension(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return UNKNOWN;
        }
        String name = fileName.toString().toLowerCase();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }

        return switch (name.substring(dot + 1)) {
            case "v" -> VERILOG;
            case "vh" -> VERILOG_HEADER;
            case "sv" -> SYSTEMVERILOG;
            case "svh" -> SYSTEMVERILOG_HEADER;
            default -> UNKNOWN;
        };
    }

    /**
     * Detection from source text: a module declaration followed by {@code endmodule}.
     */
    public static FileType detectByContent(String content) {
        boolean module = false;
        boolean systemVerilogSyntax = false;
        for (String line : content.split("\\r?\\n")) {
            if (!module && MODULE_PATTERN.matcher(line).find()) {
                module = true;
            }
            if (SYSTEMVERILOG_PATTERN.matcher(line).find()) {
                systemVerilogSyntax = true;
            }
            if (module && ENDMODULE_PATTERN.matcher(line).find()) {
                return systemVerilogSyntax ? SYSTEMVERILOG : VERILOG;
            }
        }
        return UNKNOWN;
    }

    private static FileType detectByContent(Path filePath) {
        StringBuilder content = new StringBuilder();
        try (BufferedReader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8)) {
            String line;
            int count = 0;
            while ((line = reader.readLine()) != null && count++ < CONTENT_SCAN_LINES) {
                content.append(line).append('\n');
            }
        } catch (IOException e) {
            logger.log(Level.FINE, "Could not read file for type detection: " + filePath, e);
            return UNKNOWN;
        }
        return detectByContent(content.toString());
    }

    public static void clearCache() {
        typeCache.clear();
        logger.fine("File type detection cache cleared");
    }

    public static int getCacheSize() {
        return typeCache.size();
    }

    /**
     * Get a human-readable description of the file type.
     */
    public String getDescription() {
        return switch (this) {
            case VERILOG -> "Verilog source file";
            case VERILOG_HEADER -> "Verilog header file";
            case SYSTEMVERILOG -> "SystemVerilog source file";
            case SYSTEMVERILOG_HEADER -> "SystemVerilog header file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
