package com.hdlformatter.plugins.verilog;

import java.util.List;
import java.util.logging.Logger;

import com.hdlformatter.util.LoggerUtil;

/**
 * Re-applies a sequence of passes until one round leaves the text unchanged, or until the iteration cap.
 * On hitting the cap the last computed state is returned.
 */
public class FixedPointLoop implements LinePass {
    private static final Logger logger = LoggerUtil.getLogger(FixedPointLoop.class);

    public static final int DEFAULT_MAX_ITERATIONS = 10;

    private final String name;
    private final List<LinePass> passes;
    private final int maxIterations;

    private int iterations;
    private boolean converged;

    public FixedPointLoop(String name, List<LinePass> passes, int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.name = name;
        this.passes = List.copyOf(passes);
        this.maxIterations = maxIterations;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<String> apply(List<String> lines) {
        iterations = 0;
        converged = false;
        List<String> current = lines;
        while (iterations < maxIterations) {
            List<String> next = current;
            for (LinePass pass : passes) {
                next = pass.apply(next);
            }
            iterations++;
            if (next.equals(current)) {
                converged = true;
                return next;
            }
            current = next;
        }
        logger.fine(() -> name + " did not settle after " + maxIterations + " rounds; keeping the last state");
        return current;
    }

    /**
     * Rounds run by the last {@link #apply} call.
     */
    public int getIterations() {
        return iterations;
    }

    /**
     * Whether the last {@link #apply} call reached a round without changes.
     */
    public boolean isConverged() {
        return converged;
    }
}
