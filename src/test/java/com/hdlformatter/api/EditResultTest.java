package com.hdlformatter.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EditResultTest {

    @Test
    void identical_text_is_no_change() {
        EditResult edit = EditResult.between("wire a;", "wire a;");

        assertFalse(edit.isChanged());
        assertTrue(edit.getReplacement().isEmpty());
        assertEquals("wire a;", edit.applyTo("wire a;"));
    }

    @Test
    void different_text_replaces_the_whole_document() {
        EditResult edit = EditResult.between("wire  a;", "wire a;");

        assertTrue(edit.isChanged());
        assertEquals("wire a;", edit.getReplacement().orElseThrow());
        assertEquals("wire a;", edit.applyTo("anything"));
    }

    @Test
    void replacement_must_not_be_null() {
        assertThrows(NullPointerException.class, () -> EditResult.replaceAll(null));
    }

    @Test
    void result_converts_to_an_edit() {
        FormatterResult unchanged = FormatterResult.builder().successful(true).changed(false).formattedCode("x").build();
        FormatterResult changed = FormatterResult.builder().successful(true).changed(true).formattedCode("y").build();

        assertSame(EditResult.noChange(), unchanged.toEdit());
        assertEquals("y", changed.toEdit().getReplacement().orElseThrow());
    }
}
