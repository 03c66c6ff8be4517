package com.nsformatter.plugins.clojure.syntax;

/**
 * A line comment. The text excludes the leading marker and the line break.
 */
public class CommentNode extends SyntaxNode {
    public static final String LINE_MARKER = ";";
    public static final String SHEBANG_MARKER = "#!";

    private final String marker;
    private final String text;

    public CommentNode(String marker, String text) {
        super(NodeTag.COMMENT);
        this.marker = marker;
        this.text = text;
    }

    public CommentNode(String text) {
        this(LINE_MARKER, text);
    }

    public String getMarker() {
        return marker;
    }

    public String getText() {
        return text;
    }

    @Override
    public void appendTo(StringBuilder out) {
        out.append(marker).append(text);
    }
}
