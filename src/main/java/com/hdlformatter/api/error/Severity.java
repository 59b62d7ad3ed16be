package com.hdlformatter.api.error;

public enum Severity {
    FATAL,   // Source could not be formatted at all; original text returned
    ERROR,   // File could not be read, written or dispatched
    WARNING, // A pass failed and was skipped; the rest of the pipeline ran
    INFO;    // Informational, e.g. a structure left as written

    /**
     * True for severities that make a result unsuccessful.
     */
    public boolean isBlocking() {
        return this == FATAL || this == ERROR;
    }
}
