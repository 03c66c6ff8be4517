package com.nsformatter.api.error;

/**
 * A problem or note reported while formatting, positioned at a line and column.
 */
public class FormatterError {
    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;

    public FormatterError(Severity severity, String message, int line, int column) {
        this(severity, message, line, column, null);
    }

    public FormatterError(Severity severity, String message, int line, int column, String suggestion) {
        this.severity = severity;
        this.message = message;
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
    }

    /**
     * Returns a copy of this error moved to the given position.
     */
    public FormatterError at(int line, int column) {
        return new FormatterError(severity, message, line, column, suggestion);
    }

    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getSuggestion() { return suggestion; }

    @Override
    public String toString() {
        return severity + ": " + message + " (" + line + ":" + column + ")";
    }
}
