package com.hdlformatter.api;

import com.hdlformatter.api.error.FormatterError;
import com.hdlformatter.api.error.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormatterResultTest {

    @Test
    void builder_collects_errors_and_refactorings() {
        FormatterResult result = FormatterResult.builder()
                .successful(true)
                .changed(true)
                .formattedCode("wire a;")
                .addError(new FormatterError(Severity.WARNING, "pass failed", 0, 0))
                .addRefactoring(new Refactoring("case-statements", 2, 5, "Lines 2-5 rewritten"))
                .build();

        assertEquals(1, result.getErrors().size());
        assertEquals("case-statements", result.getAppliedRefactorings().get(0).getType());
    }

    @Test
    void blocking_severities() {
        assertTrue(Severity.FATAL.isBlocking());
        assertTrue(Severity.ERROR.isBlocking());
        assertFalse(Severity.WARNING.isBlocking());
        assertEquals(List.of(Severity.FATAL, Severity.ERROR, Severity.WARNING, Severity.INFO), List.of(Severity.values()));
    }
}
