package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.KeywordNode;
import com.nsformatter.plugins.clojure.syntax.NodeTag;
import com.nsformatter.plugins.clojure.syntax.Nodes;
import com.nsformatter.plugins.clojure.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites the legacy {@code :load} and {@code :use} directives into {@code :require} entries.
 */
public final class DirectiveNormalizer {

    private DirectiveNormalizer() {
    }

    /**
     * Applies {@link #absorbLoad} then {@link #absorbUse}.
     */
    public static ParsedHeader normalize(ParsedHeader header) {
        return absorbUse(absorbLoad(header));
    }

    /**
     * Moves every {@code :load} entry, expanded to namespace vectors, into {@code :require}.
     */
    public static ParsedHeader absorbLoad(ParsedHeader header) {
        if (!header.hasSection(Directive.LOAD)) {
            return header;
        }

        List<Element> requires = new ArrayList<>();
        for (Element element : header.getSection(Directive.LOAD)) {
            requires.addAll(RequireOrganizer.expandGroup(element));
        }
        return header.toBuilder()
                .appendElements(Directive.REQUIRE, requires)
                .moveSectionComments(Directive.LOAD, Directive.REQUIRE)
                .removeSection(Directive.LOAD)
                .build();
    }

    /**
     * Moves every {@code :use} entry into {@code :require} with {@code :refer :all}. A
     * {@code :only} list becomes {@code :refer} instead.
     */
    public static ParsedHeader absorbUse(ParsedHeader header) {
        if (!header.hasSection(Directive.USE)) {
            return header;
        }

        List<Element> requires = new ArrayList<>();
        for (Element element : header.getSection(Directive.USE)) {
            for (Element expanded : RequireOrganizer.expandGroup(element)) {
                requires.add(expanded.getTag() == NodeTag.VECTOR ? referAll(expanded) : expanded);
            }
        }
        return header.toBuilder()
                .appendElements(Directive.REQUIRE, requires)
                .moveSectionComments(Directive.USE, Directive.REQUIRE)
                .removeSection(Directive.USE)
                .build();
    }

    private static Element referAll(Element vector) {
        List<SyntaxNode> children = new ArrayList<>();
        boolean refers = false;
        for (SyntaxNode child : vector.getNode().getChildren()) {
            if (child instanceof KeywordNode) {
                String name = ((KeywordNode) child).getName();
                if ("only".equals(name)) {
                    child = Nodes.keyword("refer");
                    refers = true;
                } else if ("refer".equals(name)) {
                    refers = true;
                }
            }
            children.add(child);
        }

        if (!refers) {
            while (!children.isEmpty() && children.get(children.size() - 1).isWhitespace()) {
                children.remove(children.size() - 1);
            }
            children.add(Nodes.spaces(1));
            children.add(Nodes.keyword("refer"));
            children.add(Nodes.spaces(1));
            children.add(Nodes.keyword("all"));
        }
        return vector.withNode(Nodes.vector(children));
    }
}
