package com.nsformatter.plugins.clojure.syntax;

import java.util.List;

/**
 * A reader conditional, {@code #?(...)} or the splicing {@code #?@(...)}.
 * The children are those of the list body: alternating platform keys and clauses
 * interleaved with whitespace and comments.
 */
public class ReaderConditionalNode extends SyntaxNode {
    public static final String DISCRIMINATOR = "?";
    public static final String SPLICE_DISCRIMINATOR = "?@";

    private final String discriminator;
    private final CollectionNode body;

    public ReaderConditionalNode(String discriminator, CollectionNode body) {
        super(NodeTag.READER_CONDITIONAL);
        if (!DISCRIMINATOR.equals(discriminator) && !SPLICE_DISCRIMINATOR.equals(discriminator)) {
            throw new IllegalArgumentException("Unknown reader conditional discriminator: " + discriminator);
        }
        if (body.getTag() != NodeTag.LIST) {
            throw new IllegalArgumentException("Reader conditional body must be a list, got " + body.getTag());
        }
        this.discriminator = discriminator;
        this.body = body;
    }

    public String getDiscriminator() {
        return discriminator;
    }

    public boolean isSpliced() {
        return SPLICE_DISCRIMINATOR.equals(discriminator);
    }

    public CollectionNode getBody() {
        return body;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return body.getChildren();
    }

    @Override
    public void appendTo(StringBuilder out) {
        out.append('#').append(discriminator);
        body.appendTo(out);
    }
}
