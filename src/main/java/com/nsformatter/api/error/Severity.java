package com.nsformatter.api.error;

public enum Severity {
    FATAL,   // The file could not be read at all
    ERROR,   // A header form was left unformatted
    WARNING, // Deprecated directives that were rewritten
    INFO;    // Informational notes about a rewrite

    /**
     * True for severities that make a formatting run unsuccessful.
     */
    public boolean isBlocking() {
        return this == FATAL || this == ERROR;
    }
}
