package com.nsformatter.plugins.clojure.syntax;

import java.util.List;

/**
 * Metadata attached to a form: {@code ^meta inner}. The children hold the metadata form,
 * any whitespace or comments after it, and the inner form last.
 */
public class MetaNode extends SyntaxNode {
    public static final String MARKER = "^";
    public static final String LEGACY_MARKER = "#^";

    private final String marker;
    private final List<SyntaxNode> children;

    public MetaNode(String marker, List<SyntaxNode> children) {
        super(NodeTag.META);
        this.marker = marker;
        this.children = List.copyOf(children);
        if (getContentChildren().size() != 2) {
            throw new IllegalArgumentException("Meta node needs a metadata form and an inner form");
        }
    }

    public String getMarker() {
        return marker;
    }

    public SyntaxNode getMeta() {
        return getContentChildren().get(0);
    }

    public SyntaxNode getInner() {
        return getContentChildren().get(1);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children;
    }

    @Override
    public void appendTo(StringBuilder out) {
        out.append(marker);
        for (SyntaxNode child : children) {
            child.appendTo(out);
        }
    }
}
