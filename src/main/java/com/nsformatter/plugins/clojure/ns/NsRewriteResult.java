package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.api.error.FormatterError;
import com.nsformatter.plugins.clojure.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rewritten ns form together with the notes raised while rewriting it. Note positions
 * are relative to nothing; the caller moves them onto the form's location.
 */
public class NsRewriteResult {
    private final SyntaxNode node;
    private final String namespace;
    private final List<FormatterError> notes;

    public NsRewriteResult(SyntaxNode node, String namespace, List<FormatterError> notes) {
        this.node = node;
        this.namespace = namespace;
        this.notes = Collections.unmodifiableList(new ArrayList<>(notes));
    }

    public SyntaxNode getNode() {
        return node;
    }

    public String getNamespace() {
        return namespace;
    }

    public List<FormatterError> getNotes() {
        return notes;
    }
}
