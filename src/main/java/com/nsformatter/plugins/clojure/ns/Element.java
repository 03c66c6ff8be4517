package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.NodeTag;
import com.nsformatter.plugins.clojure.syntax.Nodes;
import com.nsformatter.plugins.clojure.syntax.ReaderConditionalNode;
import com.nsformatter.plugins.clojure.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A content node from a directive list together with the comments that preceded it.
 * The element owns its comments: wherever the node is moved, they move with it.
 */
public final class Element {
    private final SyntaxNode node;
    private final ParsedList nested;
    private final List<String> comments;
    private final List<String> trailingComments;
    private final boolean spliced;
    private final boolean qualified;

    private Element(SyntaxNode node, ParsedList nested, List<String> comments,
                    List<String> trailingComments, boolean spliced, boolean qualified) {
        this.node = node;
        this.nested = nested;
        this.comments = Collections.unmodifiableList(new ArrayList<>(comments));
        this.trailingComments = Collections.unmodifiableList(new ArrayList<>(trailingComments));
        this.spliced = spliced;
        this.qualified = qualified;
    }

    public static Element of(SyntaxNode node) {
        return of(node, Collections.emptyList());
    }

    public static Element of(SyntaxNode node, List<String> comments) {
        boolean spliced = node instanceof ReaderConditionalNode && ((ReaderConditionalNode) node).isSpliced();
        return new Element(node, null, comments, Collections.emptyList(), spliced, false);
    }

    /**
     * Element for a nested list whose own children were parsed with comments attached.
     */
    public static Element ofList(SyntaxNode node, ParsedList nested, List<String> comments) {
        return new Element(node, nested, comments, Collections.emptyList(), false, false);
    }

    public SyntaxNode getNode() {
        return node;
    }

    public NodeTag getTag() {
        return node.getTag();
    }

    /**
     * Parsed children when this element is a list, otherwise {@code null}.
     */
    public ParsedList getNested() {
        return nested;
    }

    public List<String> getComments() {
        return comments;
    }

    /**
     * Comments found after the last element of the enclosing list.
     */
    public List<String> getTrailingComments() {
        return trailingComments;
    }

    public boolean isSpliced() {
        return spliced;
    }

    /**
     * True for an import written as one fully qualified token rather than inside a package group.
     */
    public boolean isQualified() {
        return qualified;
    }

    public boolean hasComments() {
        return !comments.isEmpty() || !trailingComments.isEmpty();
    }

    /**
     * Same comments and flags around a different node.
     */
    public Element withNode(SyntaxNode replacement) {
        return new Element(replacement, null, comments, trailingComments, spliced, qualified);
    }

    public Element withLeadingComments(List<String> leading) {
        if (leading.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(leading);
        merged.addAll(comments);
        return new Element(node, nested, merged, trailingComments, spliced, qualified);
    }

    public Element withTrailingComments(List<String> trailing) {
        if (trailing.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(trailingComments);
        merged.addAll(trailing);
        return new Element(node, nested, comments, merged, spliced, qualified);
    }

    /**
     * Takes over the comments of an element that is merged into this one. Its leading comments
     * follow this element's own.
     */
    public Element absorbComments(Element other) {
        if (!other.hasComments()) {
            return this;
        }
        List<String> leading = new ArrayList<>(comments);
        leading.addAll(other.comments);
        List<String> trailing = new ArrayList<>(trailingComments);
        trailing.addAll(other.trailingComments);
        return new Element(node, nested, leading, trailing, spliced, qualified);
    }

    public Element asQualified() {
        return new Element(node, nested, comments, trailingComments, spliced, true);
    }

    /**
     * The node preceded by its comments and followed by its trailing comments, as nodes.
     */
    public List<SyntaxNode> expandComments() {
        List<SyntaxNode> result = new ArrayList<>();
        for (String comment : comments) {
            result.add(Nodes.comment(comment));
        }
        result.add(node);
        for (String comment : trailingComments) {
            result.add(Nodes.comment(comment));
        }
        return result;
    }

    @Override
    public String toString() {
        return comments.isEmpty() ? node.toSource() : comments + " " + node.toSource();
    }
}
