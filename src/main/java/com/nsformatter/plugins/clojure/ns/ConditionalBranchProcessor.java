package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.CollectionNode;
import com.nsformatter.plugins.clojure.syntax.KeywordNode;
import com.nsformatter.plugins.clojure.syntax.NodeTag;
import com.nsformatter.plugins.clojure.syntax.Nodes;
import com.nsformatter.plugins.clojure.syntax.ReaderConditionalNode;
import com.nsformatter.plugins.clojure.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders top-level reader conditionals of an ns form. Branches holding a require or import
 * clause are formatted with the same organizers as the top-level sections.
 */
public class ConditionalBranchProcessor {
    /** Width of {@code #?(}. */
    private static final int MARKER_WIDTH = 3;
    /** Width of {@code #?@(}. */
    private static final int SPLICE_MARKER_WIDTH = 4;

    private final NsFormatOptions options;
    private final RequireOrganizer requireOrganizer;
    private final ImportOrganizer importOrganizer;

    public ConditionalBranchProcessor(NsFormatOptions options,
                                      RequireOrganizer requireOrganizer,
                                      ImportOrganizer importOrganizer) {
        this.options = options;
        this.requireOrganizer = requireOrganizer;
        this.importOrganizer = importOrganizer;
    }

    /**
     * Renders one branch set with its branches in key order, each key followed by its clause
     * on the next line, aligned just inside the opening paren.
     */
    public ReaderConditionalNode render(BranchSet branchSet) {
        int baseIndent = options.getIndentSize()
                + (branchSet.isSpliced() ? SPLICE_MARKER_WIDTH : MARKER_WIDTH);

        List<SyntaxNode> children = new ArrayList<>();
        for (BranchSet.Branch branch : branchSet.getBranches().values()) {
            if (!children.isEmpty()) {
                children.add(Nodes.newline());
                children.add(Nodes.spaces(baseIndent));
            }
            for (SyntaxNode comment : BlockLayout.commentNodes(branch.getComments())) {
                children.add(comment);
                children.add(Nodes.newline());
                children.add(Nodes.spaces(baseIndent));
            }
            children.add(branch.getKey());
            children.add(Nodes.newline());
            children.add(Nodes.spaces(baseIndent));
            children.add(renderClause(baseIndent, branch.getClause()));
        }
        List<SyntaxNode> trailing = BlockLayout.commentNodes(branchSet.getTrailingComments());
        if (children.isEmpty()) {
            for (SyntaxNode comment : trailing) {
                if (!children.isEmpty()) {
                    children.add(Nodes.newline());
                    children.add(Nodes.spaces(baseIndent));
                }
                children.add(comment);
            }
            BlockLayout.closeAfterComment(children, baseIndent);
        } else {
            BlockLayout.appendLines(children, trailing, baseIndent);
        }
        return Nodes.readerConditional(branchSet.isSpliced(), children);
    }

    /**
     * Formats a branch clause whose head is {@code :import}, {@code :require} or
     * {@code :require-macros}; returns any other clause unchanged.
     */
    SyntaxNode renderClause(int baseIndent, SyntaxNode clause) {
        if (clause.getTag() != NodeTag.LIST) {
            return clause;
        }
        List<SyntaxNode> content = clause.getContentChildren();
        if (content.isEmpty() || !(content.get(0) instanceof KeywordNode)) {
            return clause;
        }

        String directive = ((KeywordNode) content.get(0)).getName();
        CollectionNode rendered = null;
        if (Directive.IMPORT.equals(directive)) {
            List<Element> elements = NsParser.parseListWithComments(clause).getElements();
            rendered = importOrganizer.render(baseIndent, elements);
        } else if (Directive.isRequireLike(directive)) {
            List<Element> elements = NsParser.parseListWithComments(clause).getElements();
            rendered = requireOrganizer.render(baseIndent, directive, elements);
        }
        return rendered != null ? rendered : clause;
    }
}
