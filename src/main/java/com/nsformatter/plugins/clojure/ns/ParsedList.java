package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A list or vector split into its head and the elements after it.
 */
public final class ParsedList {
    private final SyntaxNode head;
    private final List<Element> elements;
    private final List<String> danglingComments;

    public ParsedList(SyntaxNode head, List<Element> elements, List<String> danglingComments) {
        this.head = head;
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.danglingComments = Collections.unmodifiableList(new ArrayList<>(danglingComments));
    }

    /**
     * First content node, or {@code null} for an empty list.
     */
    public SyntaxNode getHead() {
        return head;
    }

    public List<Element> getElements() {
        return elements;
    }

    /**
     * Comments in a list that has no element to attach them to.
     */
    public List<String> getDanglingComments() {
        return danglingComments;
    }
}
