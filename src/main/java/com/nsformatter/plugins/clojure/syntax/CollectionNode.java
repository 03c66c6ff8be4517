package com.nsformatter.plugins.clojure.syntax;

import java.util.List;

/**
 * A delimited collection: list, vector, map, set or anonymous function literal.
 */
public class CollectionNode extends SyntaxNode {
    private final List<SyntaxNode> children;

    public CollectionNode(NodeTag tag, List<SyntaxNode> children) {
        super(tag);
        if (!tag.isCollection()) {
            throw new IllegalArgumentException("Not a collection tag: " + tag);
        }
        this.children = List.copyOf(children);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children;
    }

    @Override
    public void appendTo(StringBuilder out) {
        out.append(getTag().getOpen());
        for (SyntaxNode child : children) {
            child.appendTo(out);
        }
        out.append(getTag().getClose());
    }
}
