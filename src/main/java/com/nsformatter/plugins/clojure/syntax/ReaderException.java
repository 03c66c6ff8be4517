package com.nsformatter.plugins.clojure.syntax;

/**
 * Thrown when source text cannot be read into a syntax tree.
 */
public class ReaderException extends RuntimeException {
    private final int line;
    private final int column;

    public ReaderException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
