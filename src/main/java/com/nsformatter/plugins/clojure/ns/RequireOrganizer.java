package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.CollectionNode;
import com.nsformatter.plugins.clojure.syntax.NodeTag;
import com.nsformatter.plugins.clojure.syntax.Nodes;
import com.nsformatter.plugins.clojure.syntax.SyntaxNode;
import com.nsformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Expands prefix lists in {@code :require} style sections into one vector per namespace,
 * sorts them by namespace and renders them one per line.
 */
public class RequireOrganizer {
    private static final Logger logger = LoggerUtil.getLogger(RequireOrganizer.class);

    private final NsFormatOptions options;

    public RequireOrganizer(NsFormatOptions options) {
        this.options = options;
    }

    /**
     * Expands one require element into namespace vectors.
     * <ul>
     *   <li>{@code a.b} becomes {@code [a.b]}</li>
     *   <li>{@code [a.b :as x]} is returned as is</li>
     *   <li>{@code (a b [c :as x])} becomes {@code [a.b]} and {@code [a.c :as x]}</li>
     * </ul>
     * Keyword flags and reader conditionals pass through unchanged.
     *
     * @throws NsFormatException for maps, or prefix lists holding anything but symbols and vectors
     */
    public static List<Element> expandGroup(Element element) {
        switch (element.getTag()) {
            case TOKEN:
            case STRING:
                return List.of(element.withNode(Nodes.vector(List.of(element.getNode()))));
            case VECTOR:
            case KEYWORD:
            case READER_CONDITIONAL:
                return List.of(element);
            case LIST:
                return expandPrefixList(element);
            default:
                throw NsFormatException.invalidRequireGroup(element.getNode());
        }
    }

    private static List<Element> expandPrefixList(Element element) {
        ParsedList group = element.getNested();
        if (group == null || group.getHead() == null) {
            throw NsFormatException.invalidRequireGroup(element.getNode());
        }
        String prefix = group.getHead().toSource();

        List<Element> expanded = new ArrayList<>();
        for (Element child : group.getElements()) {
            SyntaxNode nsSym;
            List<SyntaxNode> more = new ArrayList<>();
            if (child.getTag() == NodeTag.TOKEN) {
                nsSym = child.getNode();
            } else if (child.getTag() == NodeTag.VECTOR) {
                List<SyntaxNode> children = child.getNode().getChildren();
                int first = indexOfFirstContent(children);
                if (first < 0) {
                    throw NsFormatException.invalidRequireGroup(child.getNode());
                }
                nsSym = children.get(first);
                more.addAll(children.subList(first + 1, children.size()));
            } else {
                throw NsFormatException.invalidRequireGroup(child.getNode());
            }

            List<SyntaxNode> vector = new ArrayList<>();
            vector.add(Nodes.token(prefix + "." + nsSym.toSource()));
            vector.addAll(more);
            expanded.add(child.withNode(Nodes.vector(vector)));
        }

        if (!expanded.isEmpty()) {
            expanded.set(0, expanded.get(0).withLeadingComments(element.getComments()));
            int last = expanded.size() - 1;
            expanded.set(last, expanded.get(last)
                    .withTrailingComments(element.getTrailingComments())
                    .withTrailingComments(group.getDanglingComments()));
        } else if (element.hasComments()) {
            logger.warning("Dropping comments of empty require group " + element.getNode().toSource());
        }
        return expanded;
    }

    /**
     * Stable sort by the text of each vector's leading symbol. Reader conditionals sort by the
     * leading symbol of their first clause; keyword flags go last in their original order.
     */
    public List<Element> sort(List<Element> elements) {
        List<Element> sorted = elements.stream()
                .filter(e -> e.getTag() != NodeTag.KEYWORD)
                .sorted(Comparator.comparing(RequireOrganizer::sortKey))
                .collect(Collectors.toCollection(ArrayList::new));
        elements.stream()
                .filter(e -> e.getTag() == NodeTag.KEYWORD)
                .forEach(sorted::add);
        return sorted;
    }

    /**
     * Renders a require-style section, or returns {@code null} when it has nothing to require.
     *
     * @param baseIndent column of the section's opening paren
     * @param directive  {@code require} or {@code require-macros}
     */
    public CollectionNode render(int baseIndent, String directive, List<Element> elements) {
        List<Element> expanded = new ArrayList<>();
        for (Element element : elements) {
            expanded.addAll(expandGroup(element));
        }
        if (expanded.isEmpty()) {
            return null;
        }

        List<SyntaxNode> items = new ArrayList<>();
        for (Element element : sort(expanded)) {
            items.addAll(element.expandComments());
        }
        logger.fine("Rendering :" + directive + " with " + expanded.size() + " namespaces");
        return BlockLayout.block(Nodes.keyword(directive), items, baseIndent + options.getIndentSize());
    }

    static String sortKey(Element element) {
        SyntaxNode node = element.getNode();
        if (node.getTag() == NodeTag.READER_CONDITIONAL) {
            List<SyntaxNode> content = node.getContentChildren();
            node = content.size() > 1 ? content.get(1) : null;
            if (node == null) {
                return "";
            }
        }
        if (node.getTag() == NodeTag.VECTOR || node.getTag() == NodeTag.LIST) {
            List<SyntaxNode> content = node.getContentChildren();
            return content.isEmpty() ? "" : content.get(0).toSource();
        }
        return node.toSource();
    }

    private static int indexOfFirstContent(List<SyntaxNode> children) {
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).isWhitespaceOrComment()) {
                return i;
            }
        }
        return -1;
    }
}
