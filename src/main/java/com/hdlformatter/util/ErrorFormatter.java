package com.hdlformatter.util;

import com.hdlformatter.api.Refactoring;
import com.hdlformatter.api.error.FormatterError;
import com.hdlformatter.api.error.Severity;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Renders formatter errors and applied passes for the console.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * @param useColors whether to wrap output in ANSI colour codes
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * One error as {@code SEVERITY file:line:column: message}, followed by the suggestion on its own line.
     * Line 0 stands for the whole file and is printed without a position.
     */
    public String formatError(Path file, FormatterError error) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(_color(error.getSeverity()), error.getSeverity().name())).append(' ');
        if (file != null) {
            sb.append(file);
        }
        if (error.getLine() > 0) {
            sb.append(':').append(error.getLine());
            if (error.getColumn() > 0) {
                sb.append(':').append(error.getColumn());
            }
        }
        if (file != null || error.getLine() > 0) {
            sb.append(": ");
        }
        sb.append(error.getMessage());

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n    ").append(colorize(ANSI_GREEN, "hint: ")).append(error.getSuggestion());
        }
        return sb.toString();
    }

    public String formatError(FormatterError error) {
        return formatError(null, error);
    }

    /**
     * A pass that changed the text, e.g. {@code case-indent (lines 12-30)}.
     */
    public String formatRefactoring(Refactoring refactoring) {
        String span = refactoring.getStartLine() == refactoring.getEndLine()
                ? "line " + refactoring.getStartLine()
                : "lines " + refactoring.getStartLine() + "-" + refactoring.getEndLine();
        return refactoring.getType() + " (" + span + ")";
    }

    /**
     * Per-file counts by severity, files sorted by path, then a total line.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, "Issue summary:")).append('\n');

        Map<Severity, Integer> totals = new EnumMap<>(Severity.class);
        for (Map.Entry<Path, List<FormatterError>> entry : new TreeMap<>(fileErrors).entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            Map<Severity, Integer> counts = countBySeverity(entry.getValue());
            counts.forEach((severity, count) -> totals.merge(severity, count, Integer::sum));
            sb.append("  ").append(entry.getKey()).append(": ").append(_counts(counts)).append('\n');
        }

        sb.append("Total: ").append(totals.isEmpty() ? "no issues" : _counts(totals));
        return sb.toString();
    }

    public Map<Severity, List<FormatterError>> groupBySeverity(List<FormatterError> errors) {
        return errors.stream().collect(Collectors.groupingBy(FormatterError::getSeverity,
                () -> new EnumMap<>(Severity.class), Collectors.toList()));
    }

    public Map<Severity, Integer> countBySeverity(List<FormatterError> errors) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (FormatterError error : errors) {
            counts.merge(error.getSeverity(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Applies ANSI colour to text if colours are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }

    private String _counts(Map<Severity, Integer> counts) {
        StringJoiner joiner = new StringJoiner(", ");
        counts.forEach((severity, count) ->
                joiner.add(colorize(_color(severity), count + " " + severity.name().toLowerCase())));
        return joiner.toString();
    }

    private static String _color(Severity severity) {
        return switch (severity) {
            case FATAL, ERROR -> ANSI_RED;
            case WARNING -> ANSI_YELLOW;
            case INFO -> ANSI_BLUE;
        };
    }
}
