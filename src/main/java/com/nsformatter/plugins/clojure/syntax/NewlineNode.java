package com.nsformatter.plugins.clojure.syntax;

public class NewlineNode extends SyntaxNode {
    private final String text;

    public NewlineNode(String text) {
        super(NodeTag.NEWLINE);
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
