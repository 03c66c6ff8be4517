package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.NodeTag;
import com.nsformatter.plugins.clojure.syntax.SyntaxNode;

/**
 * Raised when one ns form cannot be rewritten. Only that form is affected; the caller
 * leaves it as written and reports the problem.
 */
public class NsFormatException extends RuntimeException {

    public enum Kind {
        /** A list child is not a token, vector, map, nested list or reader conditional. */
        UNRECOGNIZED_ELEMENT,
        /** A reader conditional has a key without a clause. */
        MALFORMED_CONDITIONAL,
        /** A top-level child of the ns form is not a docstring, directive list or reader conditional. */
        UNKNOWN_SECTION,
        /** The ns form has no namespace symbol. */
        MISSING_NAME,
        /** A require prefix list holds something other than symbols and vectors. */
        INVALID_REQUIRE_GROUP
    }

    private final Kind kind;
    private final NodeTag tag;

    public NsFormatException(Kind kind, NodeTag tag, String message) {
        super(message);
        this.kind = kind;
        this.tag = tag;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Tag of the offending node, or {@code null} when there was none.
     */
    public NodeTag getTag() {
        return tag;
    }

    static NsFormatException unrecognizedElement(SyntaxNode node) {
        return new NsFormatException(Kind.UNRECOGNIZED_ELEMENT, node.getTag(),
                "Unrecognized list element: " + node.toSource());
    }

    static NsFormatException malformedConditional(SyntaxNode node) {
        return new NsFormatException(Kind.MALFORMED_CONDITIONAL, node.getTag(),
                "Reader conditional has an odd number of forms: " + node.toSource());
    }

    static NsFormatException unknownSection(SyntaxNode node) {
        return new NsFormatException(Kind.UNKNOWN_SECTION, node.getTag(),
                "Unknown ns node form " + node.getTag() + ": " + node.toSource());
    }

    static NsFormatException missingName(SyntaxNode node) {
        return new NsFormatException(Kind.MISSING_NAME, node == null ? null : node.getTag(),
                node == null ? "ns form has no namespace name" : "Invalid namespace name: " + node.toSource());
    }

    static NsFormatException invalidRequireGroup(SyntaxNode node) {
        return new NsFormatException(Kind.INVALID_REQUIRE_GROUP, node.getTag(),
                "Cannot expand require group element: " + node.toSource());
    }
}
