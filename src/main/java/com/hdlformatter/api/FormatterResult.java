package com.hdlformatter.api;

import java.util.ArrayList;
import java.util.List;

import com.hdlformatter.api.error.FormatterError;

/**
 * Result of a formatting operation. {@code formattedCode} holds the formatted source, or the original
 * when nothing could be done; it is null only when the file could not be read.
 */
public class FormatterResult {
    private final boolean successful;
    private final boolean changed;
    private final String formattedCode;
    private final List<FormatterError> errors;
    private final List<Refactoring> appliedRefactorings;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.changed = builder.changed;
        this.formattedCode = builder.formattedCode;
        // Snapshot the builder lists
        this.errors = List.copyOf(builder.errors);
        this.appliedRefactorings = List.copyOf(builder.appliedRefactorings);
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * True when the formatted code differs from the input.
     */
    public boolean isChanged() {
        return changed;
    }

    public String getFormattedCode() {
        return formattedCode;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    public List<Refactoring> getAppliedRefactorings() {
        return appliedRefactorings;
    }

    /**
     * The same outcome as an editor edit.
     */
    public EditResult toEdit() {
        return changed ? EditResult.replaceAll(formattedCode) : EditResult.noChange();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private boolean changed;
        private String formattedCode;
        private List<FormatterError> errors = new ArrayList<>();
        private List<Refactoring> appliedRefactorings = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder changed(boolean changed) {
            this.changed = changed;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        // Replace the whole error list
        public Builder errors(List<FormatterError> errors) {
            this.errors = new ArrayList<>(errors); // copy, callers keep their list
            return this;
        }

        public Builder addRefactoring(Refactoring refactoring) {
            this.appliedRefactorings.add(refactoring);
            return this;
        }

        // Replace the whole refactoring list
        public Builder appliedRefactorings(List<Refactoring> refactorings) {
            this.appliedRefactorings = new ArrayList<>(refactorings); // copy
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
