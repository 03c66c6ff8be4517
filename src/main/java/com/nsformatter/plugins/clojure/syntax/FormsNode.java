package com.nsformatter.plugins.clojure.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a read file: every top-level form with the text between them.
 */
public class FormsNode extends SyntaxNode {
    private final List<SyntaxNode> children;

    public FormsNode(List<SyntaxNode> children) {
        super(NodeTag.FORMS);
        this.children = List.copyOf(children);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children;
    }

    /**
     * Returns a copy of this root with the child at {@code index} replaced.
     */
    public FormsNode replaceChild(int index, SyntaxNode replacement) {
        List<SyntaxNode> copy = new ArrayList<>(children);
        copy.set(index, replacement);
        return new FormsNode(copy);
    }

    @Override
    public void appendTo(StringBuilder out) {
        for (SyntaxNode child : children) {
            child.appendTo(out);
        }
    }
}
