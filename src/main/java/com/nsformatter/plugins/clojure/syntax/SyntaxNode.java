package com.nsformatter.plugins.clojure.syntax;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Base class of the lossless Clojure syntax tree.
 * Whitespace, newlines and comments are ordinary nodes, so printing a tree
 * reproduces the text it was read from.
 */
public abstract class SyntaxNode {
    private final NodeTag tag;

    protected SyntaxNode(NodeTag tag) {
        this.tag = tag;
    }

    public NodeTag getTag() {
        return tag;
    }

    /**
     * Child nodes in source order. Leaf nodes have none.
     */
    public List<SyntaxNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Children with whitespace, newlines and comments removed.
     */
    public List<SyntaxNode> getContentChildren() {
        return getChildren().stream()
                .filter(child -> !child.isWhitespaceOrComment())
                .collect(Collectors.toList());
    }

    /**
     * Appends the exact source text of this node.
     */
    public abstract void appendTo(StringBuilder out);

    public String toSource() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }

    public boolean isWhitespace() {
        return tag == NodeTag.WHITESPACE || tag == NodeTag.NEWLINE;
    }

    public boolean isComment() {
        return tag == NodeTag.COMMENT;
    }

    public boolean isWhitespaceOrComment() {
        return isWhitespace() || isComment();
    }

    /**
     * Number of characters this node occupies in source.
     */
    public int length() {
        return toSource().length();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SyntaxNode)) {
            return false;
        }
        SyntaxNode other = (SyntaxNode) o;
        return tag == other.tag && toSource().equals(other.toSource());
    }

    @Override
    public int hashCode() {
        return 31 * tag.hashCode() + toSource().hashCode();
    }

    @Override
    public String toString() {
        return tag + "<" + toSource() + ">";
    }
}
