package com.hdlformatter.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of formatting a whole document: either no change, or one replacement of the full text.
 */
public final class EditResult {
    private static final EditResult NO_CHANGE = new EditResult(null);

    private final String replacement;

    private EditResult(String replacement) {
        this.replacement = replacement;
    }

    public static EditResult noChange() {
        return NO_CHANGE;
    }

    public static EditResult replaceAll(String replacement) {
        return new EditResult(Objects.requireNonNull(replacement, "replacement"));
    }

    /**
     * No change when both texts are byte-identical, a full replacement otherwise.
     */
    public static EditResult between(String original, String formatted) {
        return original.equals(formatted) ? NO_CHANGE : replaceAll(formatted);
    }

    public boolean isChanged() {
        return replacement != null;
    }

    public Optional<String> getReplacement() {
        return Optional.ofNullable(replacement);
    }

    /**
     * The text after applying this edit to {@code original}.
     */
    public String applyTo(String original) {
        return replacement == null ? original : replacement;
    }

    @Override
    public String toString() {
        return replacement == null ? "EditResult[no change]" : "EditResult[replace " + replacement.length() + " chars]";
    }
}
