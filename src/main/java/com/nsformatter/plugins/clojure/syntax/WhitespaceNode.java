package com.nsformatter.plugins.clojure.syntax;

/**
 * A run of spaces, tabs or commas on a single line.
 */
public class WhitespaceNode extends SyntaxNode {
    private final String text;

    public WhitespaceNode(String text) {
        super(NodeTag.WHITESPACE);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public void appendTo(StringBuilder out) {
        out.append(text);
    }
}
