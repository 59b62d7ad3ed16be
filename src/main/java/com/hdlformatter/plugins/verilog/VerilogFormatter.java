package com.hdlformatter.plugins.verilog;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.hdlformatter.api.EditResult;
import com.hdlformatter.api.FormatterPlugin;
import com.hdlformatter.api.FormatterResult;
import com.hdlformatter.config.FormatConfig;
import com.hdlformatter.config.FormatterConfig;
import com.hdlformatter.plugins.verilog.range.RangeFormatter;
import com.hdlformatter.util.LoggerUtil;

/**
 * Verilog/SystemVerilog formatter plugin.
 * <p>
 * The static {@link #format(String, FormatConfig)} and {@link #formatRange(String, int, int, FormatConfig)} entry
 * points are stateless and safe to call from any thread. A plugin instance adds configuration from
 * {@link FormatterConfig} and a small cache of recent results keyed by path and content.
 */
public class VerilogFormatter implements FormatterPlugin, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(VerilogFormatter.class);

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final int CACHE_SIZE = 64;

    private volatile FormatConfig formatConfig = FormatConfig.builder().build();

    private final Map<String, FormatterResult> resultCache =
            new LinkedHashMap<String, FormatterResult>(CACHE_SIZE, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, FormatterResult> eldest) {
                    return size() > CACHE_SIZE;
                }
            };

    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = cacheLock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = cacheLock.writeLock();

    @Override
    public void initialize(FormatterConfig config) {
        this.formatConfig = FormatConfig.from(config);
        _clearCache();
        logger.fine(() -> "Verilog formatter initialized, indent unit '" + formatConfig.indentUnit() + "'");
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        String cacheKey = filePath + ":" + sourceCode.hashCode() + ":" + sourceCode.length();

        readLock.lock();
        try {
            FormatterResult cached = resultCache.get(cacheKey);
            if (cached != null) {
                logger.finest(() -> "Result cache hit for " + filePath);
                return cached;
            }
        } finally {
            readLock.unlock();
        }

        FormatterResult result = new DocumentFormatter(formatConfig).format(sourceCode);

        writeLock.lock();
        try {
            resultCache.put(cacheKey, result);
        } finally {
            writeLock.unlock();
        }
        return result;
    }

    @Override
    public String[] formatRange(Path filePath, String sourceCode, int startLine, int endLine) {
        return formatRange(sourceCode, startLine, endLine, formatConfig);
    }

    /**
     * Formats a whole document.
     *
     * @return no change when the formatted text is byte-identical to {@code sourceText}, a full replacement otherwise
     */
    public static EditResult format(String sourceText, FormatConfig config) {
        return new DocumentFormatter(config).format(sourceText).toEdit();
    }

    /**
     * Formats lines {@code startLine..endLine} (0-based, inclusive) using only those lines as context.
     *
     * @return the replacement lines for the range
     * @throws IllegalArgumentException if {@code startLine} is outside the document or after {@code endLine}
     */
    public static String[] formatRange(String sourceText, int startLine, int endLine, FormatConfig config) {
        return formatRange(sourceText, startLine, endLine, config, null);
    }

    /**
     * Same as {@link #formatRange(String, int, int, FormatConfig)}, with the editor's tab size used as the indent
     * unit unless the configuration sets one explicitly.
     */
    public static String[] formatRange(String sourceText, int startLine, int endLine, FormatConfig config,
                                       Integer editorTabSize) {
        String[] lines = LINE_BREAK.split(sourceText, -1);
        if (startLine < 0 || startLine >= lines.length) {
            throw new IllegalArgumentException("Start line " + startLine + " outside document of " + lines.length + " lines");
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException("End line " + endLine + " before start line " + startLine);
        }
        int last = Math.min(endLine, lines.length - 1);

        List<String> selected = new ArrayList<>(Arrays.asList(lines).subList(startLine, last + 1));
        PassRunner runner = new PassRunner();
        List<String> formatted = new RangeFormatter(config.withEditorTabSize(editorTabSize)).format(selected, runner);
        if (!runner.getErrors().isEmpty()) {
            logger.fine(() -> runner.getErrors().size() + " passes failed while formatting lines "
                    + startLine + "-" + last);
        }
        return formatted.toArray(new String[0]);
    }

    /**
     * The range replacement joined with the document's own line ending.
     */
    public static String formatRangeText(String sourceText, int startLine, int endLine, FormatConfig config) {
        String separator = sourceText.contains("\r\n") ? "\r\n" : "\n";
        return String.join(separator, formatRange(sourceText, startLine, endLine, config));
    }

    public FormatConfig getFormatConfig() {
        return formatConfig;
    }

    @Override
    public void close() {
        _clearCache();
    }

    private void _clearCache() {
        writeLock.lock();
        try {
            resultCache.clear();
        } finally {
            writeLock.unlock();
        }
    }
}
