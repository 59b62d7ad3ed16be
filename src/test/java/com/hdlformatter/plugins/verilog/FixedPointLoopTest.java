package com.hdlformatter.plugins.verilog;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FixedPointLoopTest {

    /** Appends one "x" per round until a line reaches the given length. */
    private static LinePass growTo(int length) {
        return new LinePass() {
            @Override
            public String getName() {
                return "grow";
            }

            @Override
            public List<String> apply(List<String> lines) {
                List<String> out = new ArrayList<>(lines);
                if (out.get(0).length() < length) {
                    out.set(0, out.get(0) + "x");
                }
                return out;
            }
        };
    }

    @Test
    void stops_at_the_first_round_without_changes() {
        FixedPointLoop loop = new FixedPointLoop("grow-loop", List.of(growTo(3)), 10);

        List<String> result = loop.apply(List.of(""));

        assertEquals(List.of("xxx"), result);
        assertTrue(loop.isConverged());
        assertEquals(4, loop.getIterations());
    }

    @Test
    void returns_the_last_state_when_the_cap_is_hit() {
        FixedPointLoop loop = new FixedPointLoop("grow-loop", List.of(growTo(100)), 5);

        List<String> result = loop.apply(List.of(""));

        assertEquals(List.of("xxxxx"), result);
        assertFalse(loop.isConverged());
        assertEquals(5, loop.getIterations());
    }

    @Test
    void rejects_a_non_positive_cap() {
        assertThrows(IllegalArgumentException.class, () -> new FixedPointLoop("x", List.of(), 0));
    }
}
