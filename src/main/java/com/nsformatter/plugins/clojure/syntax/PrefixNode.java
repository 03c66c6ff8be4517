package com.nsformatter.plugins.clojure.syntax;

import java.util.List;

/**
 * A form behind a reader prefix: quote, syntax-quote, unquote, deref, var-quote,
 * discard or eval. Whitespace between the prefix and the form is kept as children.
 */
public class PrefixNode extends SyntaxNode {
    private final List<SyntaxNode> children;

    public PrefixNode(NodeTag tag, List<SyntaxNode> children) {
        super(tag);
        if (!tag.isPrefix()) {
            throw new IllegalArgumentException("Not a prefix tag: " + tag);
        }
        this.children = List.copyOf(children);
    }

    public SyntaxNode getInner() {
        List<SyntaxNode> content = getContentChildren();
        return content.get(content.size() - 1);
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
    }
}
