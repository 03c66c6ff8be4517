package com.nsformatter.plugins.clojure.syntax;

/**
 * A keyword such as {@code :require} or {@code ::alias/key}. The raw text keeps its colons.
 */
public class KeywordNode extends SyntaxNode {
    private final String text;

    public KeywordNode(String text) {
        super(NodeTag.KEYWORD);
        if (text == null || !text.startsWith(":")) {
            throw new IllegalArgumentException("Keyword text must start with ':' but was: " + text);
        }
        this.text = text;
    }

    public String getText() {
        return text;
    }

    /**
     * Keyword name without the leading colons.
     */
    public String getName() {
        int i = 0;
        while (i < text.length() && text.charAt(i) == ':') {
            i++;
        }
        return text.substring(i);
    }

    @Override
    public void appendTo(StringBuilder out) {
        out.append(text);
    }
}
