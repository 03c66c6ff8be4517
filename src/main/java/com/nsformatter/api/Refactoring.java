package com.nsformatter.api;

/**
 * A rewrite that was applied to a source file, with the line span it covered.
 */
public class Refactoring {
    public static final String NS_FORM_REWRITE = "NS_FORM_REWRITE";

    private final String type;
    private final int startLine;
    private final int endLine;
    private final String description;

    public Refactoring(String type, int startLine, int endLine, String description) {
        this.type = type;
        this.startLine = startLine;
        this.endLine = endLine;
        this.description = description;
    }

    public String getType() { return type; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public String getDescription() { return description; }

    @Override
    public String toString() {
        return type + "[" + startLine + "-" + endLine + "]: " + description;
    }
}
