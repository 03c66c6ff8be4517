package com.nsformatter.plugins.clojure.syntax;

/**
 * A string literal, kept with its quotes and escapes exactly as written.
 */
public class StringNode extends SyntaxNode {
    private final String raw;

    public StringNode(String raw) {
        super(NodeTag.STRING);
        this.raw = raw;
    }

    public String getRaw() {
        return raw;
    }

    /**
     * String contents between the quotes, escapes left in place.
     */
    public String getContent() {
        return raw.substring(1, raw.length() - 1);
    }

    @Override
    public void appendTo(StringBuilder out) {
        out.append(raw);
    }
}
