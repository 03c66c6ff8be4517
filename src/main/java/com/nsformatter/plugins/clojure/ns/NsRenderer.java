package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.CollectionNode;
import com.nsformatter.plugins.clojure.syntax.KeywordNode;
import com.nsformatter.plugins.clojure.syntax.Nodes;
import com.nsformatter.plugins.clojure.syntax.SyntaxNode;
import com.nsformatter.plugins.clojure.syntax.TokenNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Builds the canonical ns form from a parsed header. Sections always come out in the order
 * name, docstring, refer-clojure, gen-class, require, require-macros, import, other
 * directives, reader conditionals, each on a new line one indent step in.
 */
public class NsRenderer {
    private final NsFormatOptions options;
    private final RequireOrganizer requireOrganizer;
    private final ImportOrganizer importOrganizer;
    private final ConditionalBranchProcessor conditionalProcessor;

    public NsRenderer(NsFormatOptions options) {
        this.options = options;
        this.requireOrganizer = new RequireOrganizer(options);
        this.importOrganizer = new ImportOrganizer(options);
        this.conditionalProcessor = new ConditionalBranchProcessor(options, requireOrganizer, importOrganizer);
    }

    public CollectionNode render(ParsedHeader header) {
        int indent = options.getIndentSize();
        List<SyntaxNode> children = new ArrayList<>();
        children.add(Nodes.token(NsParser.HEADER_MARKER));
        children.add(Nodes.spaces(1));
        children.add(renderName(header));

        appendSection(children, header.getDocComments(), header.getDoc());
        appendSection(children, header.getSectionComments(Directive.REFER_CLOJURE),
                renderReferClojure(header.getSection(Directive.REFER_CLOJURE)));
        appendSection(children, header.getSectionComments(Directive.GEN_CLASS),
                header.hasSection(Directive.GEN_CLASS)
                        ? renderPairs(Directive.GEN_CLASS, header.getSection(Directive.GEN_CLASS))
                        : null);
        for (String directive : List.of(Directive.REQUIRE, Directive.REQUIRE_MACROS)) {
            appendSection(children, header.getSectionComments(directive),
                    requireOrganizer.render(indent, directive, header.getSection(directive)));
        }
        appendSection(children, header.getSectionComments(Directive.IMPORT),
                importOrganizer.render(indent, header.getSection(Directive.IMPORT)));

        for (Map.Entry<String, List<Element>> section : header.getSections().entrySet()) {
            if (!Directive.RENDER_ORDER.contains(section.getKey())) {
                appendSection(children, header.getSectionComments(section.getKey()),
                        renderOtherDirective(section.getKey(), section.getValue()));
            }
        }

        for (BranchSet branchSet : header.getTopLevelConditionals()) {
            appendSection(children, branchSet.getComments(), conditionalProcessor.render(branchSet));
        }

        BlockLayout.appendLines(children, BlockLayout.commentNodes(header.getTrailingComments()), indent);
        BlockLayout.closeAfterComment(children, indent);
        return Nodes.list(children);
    }

    /**
     * Renders the namespace symbol. Flag metadata such as {@code ^:no-doc} wraps the symbol
     * directly, in ascending key order; any other metadata wraps the result as one map.
     */
    SyntaxNode renderName(ParsedHeader header) {
        List<SyntaxNode> flags = new ArrayList<>();
        List<SyntaxNode> other = new ArrayList<>();
        for (Map.Entry<SyntaxNode, SyntaxNode> entry : header.getMetadata().entrySet()) {
            if (isFlag(entry.getKey(), entry.getValue())) {
                flags.add(entry.getKey());
            } else {
                other.add(entry.getKey());
                other.add(entry.getValue());
            }
        }

        SyntaxNode node = header.getName();
        flags.sort(Comparator.comparing(SyntaxNode::toSource).reversed());
        for (SyntaxNode flag : flags) {
            node = Nodes.meta(flag, node);
        }
        if (!other.isEmpty()) {
            node = Nodes.meta(Nodes.map(Nodes.interposeSpaces(other)), node);
        }
        return node;
    }

    private static boolean isFlag(SyntaxNode key, SyntaxNode value) {
        return key instanceof KeywordNode
                && value instanceof TokenNode
                && "true".equals(((TokenNode) value).getValue());
    }

    private void appendSection(List<SyntaxNode> children, List<String> comments, SyntaxNode section) {
        int indent = options.getIndentSize();
        for (SyntaxNode comment : BlockLayout.commentNodes(comments)) {
            children.add(Nodes.newline());
            children.add(Nodes.spaces(indent));
            children.add(comment);
        }
        if (section != null) {
            children.add(Nodes.newline());
            children.add(Nodes.spaces(indent));
            children.add(section);
        }
    }

    /**
     * {@code (:refer-clojure :exclude [map])} on one line, or one option pair per line once a
     * comment has to be kept.
     */
    private CollectionNode renderReferClojure(List<Element> elements) {
        if (elements.stream().anyMatch(Element::hasComments)) {
            return renderPairs(Directive.REFER_CLOJURE, elements);
        }
        return renderDirectiveInline(Directive.REFER_CLOJURE, elements);
    }

    /**
     * Single-line rendering, e.g. {@code (:refer-global :only [x])}. Falls back to one
     * element per line when an element carries comments.
     */
    private CollectionNode renderDirectiveInline(String directive, List<Element> elements) {
        if (elements.isEmpty()) {
            return null;
        }
        boolean commented = elements.stream().anyMatch(Element::hasComments);
        List<SyntaxNode> items = new ArrayList<>();
        for (Element element : elements) {
            if (commented) {
                items.addAll(element.expandComments());
            } else {
                items.add(element.getNode());
            }
        }
        return commented
                ? BlockLayout.block(Nodes.keyword(directive), items, 2 * options.getIndentSize())
                : BlockLayout.inline(Nodes.keyword(directive), items);
    }

    private CollectionNode renderOtherDirective(String directive, List<Element> elements) {
        CollectionNode rendered = renderDirectiveInline(directive, elements);
        return rendered != null ? rendered : Nodes.list(List.of(Nodes.keyword(directive)));
    }

    /**
     * Renders directive options as key/value pairs, one pair per line, as used by
     * {@code :gen-class} and a commented {@code :refer-clojure}.
     */
    private CollectionNode renderPairs(String directive, List<Element> elements) {
        int itemIndent = 2 * options.getIndentSize();
        List<SyntaxNode> children = new ArrayList<>();
        children.add(Nodes.keyword(directive));

        for (int i = 0; i < elements.size(); i += 2) {
            Element key = elements.get(i);
            Element value = i + 1 < elements.size() ? elements.get(i + 1) : null;

            List<String> comments = new ArrayList<>(key.getComments());
            List<String> trailing = new ArrayList<>(key.getTrailingComments());
            if (value != null) {
                comments.addAll(value.getComments());
                trailing.addAll(value.getTrailingComments());
            }

            List<SyntaxNode> line = new ArrayList<>(BlockLayout.commentNodes(comments));
            for (SyntaxNode comment : line) {
                children.add(Nodes.newline());
                children.add(Nodes.spaces(itemIndent));
                children.add(comment);
            }
            children.add(Nodes.newline());
            children.add(Nodes.spaces(itemIndent));
            children.add(key.getNode());
            if (value != null) {
                children.add(Nodes.spaces(1));
                children.add(value.getNode());
            }
            BlockLayout.appendLines(children, BlockLayout.commentNodes(trailing), itemIndent);
        }
        BlockLayout.closeAfterComment(children, itemIndent);
        return Nodes.list(children);
    }
}
