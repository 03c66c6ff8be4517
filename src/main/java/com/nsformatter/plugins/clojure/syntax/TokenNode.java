package com.nsformatter.plugins.clojure.syntax;

/**
 * A symbol, number, character, boolean, nil or any other atom read verbatim.
 */
public class TokenNode extends SyntaxNode {
    private final String value;

    public TokenNode(String value) {
        super(NodeTag.TOKEN);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public void appendTo(StringBuilder out) {
        out.append(value);
    }
}
