package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.CollectionNode;
import com.nsformatter.plugins.clojure.syntax.Nodes;
import com.nsformatter.plugins.clojure.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared line layout for rendered ns sections.
 */
final class BlockLayout {

    private BlockLayout() {
    }

    /**
     * Renders {@code (head item item ...)} on one line.
     */
    static CollectionNode inline(SyntaxNode head, List<SyntaxNode> items) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(head);
        children.addAll(items);
        return Nodes.list(Nodes.interposeSpaces(children));
    }

    /**
     * Renders {@code head} followed by each item on its own line at column {@code itemIndent}.
     */
    static CollectionNode block(SyntaxNode head, List<SyntaxNode> items, int itemIndent) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(head);
        appendLines(children, items, itemIndent);
        return Nodes.list(children);
    }

    /**
     * Appends each item on a fresh line. A comment in last position gets a line break after it
     * so the closing delimiter is not swallowed by the comment.
     */
    static void appendLines(List<SyntaxNode> children, List<SyntaxNode> items, int indent) {
        for (SyntaxNode item : items) {
            children.add(Nodes.newline());
            children.add(Nodes.spaces(indent));
            children.add(item);
        }
        closeAfterComment(children, indent);
    }

    static void closeAfterComment(List<SyntaxNode> children, int indent) {
        if (!children.isEmpty() && children.get(children.size() - 1).isComment()) {
            children.add(Nodes.newline());
            children.add(Nodes.spaces(indent));
        }
    }

    static List<SyntaxNode> commentNodes(List<String> comments) {
        List<SyntaxNode> nodes = new ArrayList<>();
        for (String comment : comments) {
            nodes.add(Nodes.comment(comment));
        }
        return nodes;
    }
}
