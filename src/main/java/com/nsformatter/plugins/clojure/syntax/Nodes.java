package com.nsformatter.plugins.clojure.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Factory methods for the nodes the formatter builds from scratch.
 */
public final class Nodes {

    private Nodes() {
    }

    public static TokenNode token(String value) {
        return new TokenNode(value);
    }

    /**
     * Creates a keyword node from its name, e.g. {@code keyword("require")} is {@code :require}.
     */
    public static KeywordNode keyword(String name) {
        return new KeywordNode(":" + name);
    }

    /**
     * Creates a token or keyword node depending on the leading colon of {@code text}.
     */
    public static SyntaxNode atom(String text) {
        return text.startsWith(":") ? new KeywordNode(text) : new TokenNode(text);
    }

    public static CollectionNode list(List<? extends SyntaxNode> children) {
        return new CollectionNode(NodeTag.LIST, new ArrayList<>(children));
    }

    public static CollectionNode vector(List<? extends SyntaxNode> children) {
        return new CollectionNode(NodeTag.VECTOR, new ArrayList<>(children));
    }

    public static CollectionNode map(List<? extends SyntaxNode> children) {
        return new CollectionNode(NodeTag.MAP, new ArrayList<>(children));
    }

    public static WhitespaceNode spaces(int count) {
        return new WhitespaceNode(" ".repeat(count));
    }

    public static NewlineNode newline() {
        return new NewlineNode("\n");
    }

    public static CommentNode comment(String text) {
        return new CommentNode(text);
    }

    public static MetaNode meta(SyntaxNode meta, SyntaxNode inner) {
        return new MetaNode(MetaNode.MARKER, List.of(meta, spaces(1), inner));
    }

    public static ReaderConditionalNode readerConditional(boolean spliced, List<? extends SyntaxNode> children) {
        String discriminator = spliced
                ? ReaderConditionalNode.SPLICE_DISCRIMINATOR
                : ReaderConditionalNode.DISCRIMINATOR;
        return new ReaderConditionalNode(discriminator, list(children));
    }

    /**
     * Joins nodes with a single space, as in {@code (:refer-clojure :exclude [map])}.
     */
    public static List<SyntaxNode> interposeSpaces(List<? extends SyntaxNode> nodes) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode node : nodes) {
            if (!result.isEmpty()) {
                result.add(spaces(1));
            }
            result.add(node);
        }
        return result;
    }
}
