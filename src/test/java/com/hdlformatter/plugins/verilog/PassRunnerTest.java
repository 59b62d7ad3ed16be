package com.hdlformatter.plugins.verilog;

import com.hdlformatter.api.Refactoring;
import com.hdlformatter.api.error.FormatterError;
import com.hdlformatter.api.error.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class PassRunnerTest {

    private static LinePass pass(String name, UnaryOperator<List<String>> body) {
        return new LinePass() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public List<String> apply(List<String> lines) {
                return body.apply(lines);
            }
        };
    }

    @Test
    void failing_pass_becomes_a_warning_and_its_input_is_forwarded() {
        PassRunner runner = new PassRunner();
        List<String> input = List.of("wire a;");

        List<String> output = runner.run(pass("broken", lines -> {
            throw new IllegalStateException("boom");
        }), input);

        assertSame(input, output);
        assertEquals(1, runner.getErrors().size());
        FormatterError error = runner.getErrors().get(0);
        assertEquals(Severity.WARNING, error.getSeverity());
        assertTrue(error.getMessage().contains("broken"));
        assertTrue(error.getMessage().contains("boom"));
        assertTrue(runner.getApplied().isEmpty());
    }

    @Test
    void changing_pass_is_recorded_with_the_changed_line_span() {
        PassRunner runner = new PassRunner();
        List<String> input = List.of("a", "b", "c", "d");

        runner.run(pass("upper", lines -> {
            List<String> out = new ArrayList<>(lines);
            out.set(1, "B");
            out.set(2, "C");
            return out;
        }), input);

        assertEquals(1, runner.getApplied().size());
        Refactoring refactoring = runner.getApplied().get(0);
        assertEquals("upper", refactoring.getType());
        assertEquals(2, refactoring.getStartLine());
        assertEquals(3, refactoring.getEndLine());
    }

    @Test
    void unchanged_output_is_not_recorded() {
        PassRunner runner = new PassRunner();

        runner.run(pass("identity", lines -> lines), List.of("a"));

        assertTrue(runner.getApplied().isEmpty());
        assertTrue(runner.getErrors().isEmpty());
    }

    @Test
    void inapplicable_or_disabled_passes_are_skipped() {
        PassRunner runner = new PassRunner();
        List<String> input = List.of("a");
        LinePass never = new LinePass() {
            @Override
            public String getName() {
                return "never";
            }

            @Override
            public boolean isApplicable(List<String> lines) {
                return false;
            }

            @Override
            public List<String> apply(List<String> lines) {
                throw new AssertionError("must not run");
            }
        };

        assertSame(input, runner.run(never, input));
        assertSame(input, runner.runIf(false, pass("x", lines -> List.of("changed")), input));
        assertTrue(runner.getErrors().isEmpty());
    }
}
