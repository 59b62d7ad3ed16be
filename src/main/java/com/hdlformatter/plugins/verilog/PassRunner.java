package com.hdlformatter.plugins.verilog;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.hdlformatter.api.Refactoring;
import com.hdlformatter.api.error.FormatterError;
import com.hdlformatter.api.error.Severity;
import com.hdlformatter.util.LoggerUtil;

/**
 * Runs passes one after another inside a guard. A pass that throws is logged and reported as a warning,
 * and its input goes on to the next stage. Passes that change the text are recorded as refactorings.
 */
public class PassRunner {
    private static final Logger logger = LoggerUtil.getLogger(PassRunner.class);

    private final List<FormatterError> errors = new ArrayList<>();
    private final List<Refactoring> applied = new ArrayList<>();

    /**
     * Runs {@code pass} over {@code input} if it applies; otherwise returns the input.
     */
    public List<String> run(LinePass pass, List<String> input) {
        try {
            if (!pass.isApplicable(input)) {
                return input;
            }
            List<String> output = pass.apply(input);
            if (!output.equals(input)) {
                applied.add(_describe(pass, input, output));
                logger.finest(() -> "Pass " + pass.getName() + " changed " + input.size() + " -> " + output.size() + " lines");
            }
            return output;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Pass " + pass.getName() + " failed; its input is kept", e);
            errors.add(new FormatterError(Severity.WARNING,
                    "Formatting pass '" + pass.getName() + "' failed: " + e.getMessage(), 0, 0,
                    "Disable the rule behind this pass or report the input"));
            return input;
        }
    }

    /**
     * Runs {@code pass} only when {@code enabled}.
     */
    public List<String> runIf(boolean enabled, LinePass pass, List<String> input) {
        return enabled ? run(pass, input) : input;
    }

    private static Refactoring _describe(LinePass pass, List<String> before, List<String> after) {
        // Common prefix
        int first = 0;
        int limit = Math.min(before.size(), after.size());
        while (first < limit && before.get(first).equals(after.get(first))) {
            first++;
        }
        // Common suffix, not overlapping the prefix
        int fromEnd = 0;
        while (fromEnd < limit - first
                && before.get(before.size() - 1 - fromEnd).equals(after.get(after.size() - 1 - fromEnd))) {
            fromEnd++;
        }
        int last = Math.max(first, after.size() - fromEnd - 1);
        return new Refactoring(pass.getName(), first + 1, last + 1,
                "Lines " + (first + 1) + "-" + (last + 1) + " rewritten (" + before.size() + " -> " + after.size() + " lines)");
    }

    // Getters
    public List<FormatterError> getErrors() { return errors; }
    public List<Refactoring> getApplied() { return applied; }
}
