package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.CollectionNode;
import com.nsformatter.plugins.clojure.syntax.NodeTag;
import com.nsformatter.plugins.clojure.syntax.Nodes;
import com.nsformatter.plugins.clojure.syntax.SyntaxNode;
import com.nsformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Groups imported classes by package and renders each package as one group, keeping
 * short fully qualified single imports on one line.
 */
public class ImportOrganizer {
    private static final Logger logger = LoggerUtil.getLogger(ImportOrganizer.class);

    private final NsFormatOptions options;

    public ImportOrganizer(NsFormatOptions options) {
        this.options = options;
    }

    /**
     * Expands {@code (java.util Date List)} or {@code [java.util Date List]} into one qualified
     * token per class, each keeping the comments of its class token. Anything else is marked
     * as already qualified and returned alone.
     */
    public static List<Element> expandImport(Element element) {
        if (element.getTag() == NodeTag.READER_CONDITIONAL) {
            return List.of(element);
        }
        if (element.getTag() != NodeTag.LIST && element.getTag() != NodeTag.VECTOR) {
            return List.of(element.asQualified());
        }

        ParsedList group = element.getNested() != null
                ? element.getNested()
                : NsParser.parseListWithComments(element.getNode());
        if (group.getHead() == null) {
            return List.of();
        }
        String packageName = group.getHead().toSource();

        List<Element> expanded = new ArrayList<>();
        for (Element className : group.getElements()) {
            expanded.add(className.withNode(Nodes.token(packageName + "." + className.getNode().toSource())));
        }
        if (!expanded.isEmpty()) {
            expanded.set(0, expanded.get(0).withLeadingComments(element.getComments()));
            int last = expanded.size() - 1;
            expanded.set(last, expanded.get(last)
                    .withTrailingComments(element.getTrailingComments())
                    .withTrailingComments(group.getDanglingComments()));
        }
        return expanded;
    }

    /**
     * Splits qualified class elements at their last dot and groups the class names by package.
     * Packages and class names come out sorted. A class imported twice keeps its first occurrence,
     * which takes over the comments of the later ones.
     */
    public SortedMap<String, SortedMap<String, Element>> group(List<Element> imports) {
        SortedMap<String, SortedMap<String, Element>> groups = new TreeMap<>();
        for (Element element : imports) {
            String qualified = element.getNode().toSource();
            int separator = qualified.lastIndexOf('.');
            String packageName = separator < 0 ? "" : qualified.substring(0, separator);
            String className = qualified.substring(separator + 1);

            groups.computeIfAbsent(packageName, k -> new TreeMap<>())
                    .merge(className, element.withNode(Nodes.token(className)), Element::absorbComments);
        }
        return groups;
    }

    /**
     * Renders an {@code :import} section, or returns {@code null} when nothing is imported.
     *
     * @param baseIndent column of the section's opening paren
     */
    public CollectionNode render(int baseIndent, List<Element> elements) {
        List<Element> classes = new ArrayList<>();
        List<Element> conditionals = new ArrayList<>();
        List<String> carried = new ArrayList<>();
        for (Element element : elements) {
            List<Element> expansion = expandImport(element);
            if (expansion.isEmpty()) {
                carried.addAll(emptyGroupComments(element));
                continue;
            }
            for (Element expanded : expansion) {
                if (!carried.isEmpty()) {
                    expanded = expanded.withLeadingComments(carried);
                    carried = new ArrayList<>();
                }
                if (expanded.getTag() == NodeTag.READER_CONDITIONAL) {
                    conditionals.add(expanded);
                } else {
                    classes.add(expanded);
                }
            }
        }
        if (!carried.isEmpty()) {
            List<Element> owner = !conditionals.isEmpty() ? conditionals : classes;
            if (owner.isEmpty()) {
                logger.warning("Dropping comments of empty :import section: " + carried);
            } else {
                int last = owner.size() - 1;
                owner.set(last, owner.get(last).withTrailingComments(carried));
            }
        }

        List<SyntaxNode> items = new ArrayList<>();
        SortedMap<String, SortedMap<String, Element>> groups = group(classes);
        for (Map.Entry<String, SortedMap<String, Element>> entry : groups.entrySet()) {
            items.addAll(formatImportGroup(baseIndent, entry.getKey(), entry.getValue()));
        }
        for (Element conditional : conditionals) {
            items.addAll(conditional.expandComments());
        }

        if (items.isEmpty()) {
            return null;
        }
        logger.fine("Rendering :import with " + groups.size() + " package groups");
        return BlockLayout.block(Nodes.keyword(Directive.IMPORT), items, baseIndent + options.getIndentSize());
    }

    /**
     * Every comment written in or around a package group that names no class.
     */
    private static List<String> emptyGroupComments(Element element) {
        List<String> comments = new ArrayList<>(element.getComments());
        if (element.getTag() == NodeTag.LIST || element.getTag() == NodeTag.VECTOR) {
            ParsedList group = element.getNested() != null
                    ? element.getNested()
                    : NsParser.parseListWithComments(element.getNode());
            comments.addAll(group.getDanglingComments());
        }
        comments.addAll(element.getTrailingComments());
        return comments;
    }

    private List<SyntaxNode> formatImportGroup(int baseIndent, String packageName,
                                               SortedMap<String, Element> classNames) {
        if (packageName.isEmpty()) {
            List<SyntaxNode> bare = new ArrayList<>();
            classNames.values().forEach(e -> bare.addAll(e.expandComments()));
            return bare;
        }

        if (classNames.size() == 1) {
            Element className = classNames.get(classNames.firstKey());
            String qualified = packageName + "." + className.getNode().toSource();
            if (className.isQualified() && qualified.length() <= options.getSingleImportBreakWidth()) {
                return className.withNode(Nodes.token(qualified)).expandComments();
            }
        }
        return List.of(formatImportGroupBlock(baseIndent, packageName, classNames));
    }

    private CollectionNode formatImportGroupBlock(int baseIndent, String packageName,
                                                  SortedMap<String, Element> classNames) {
        List<SyntaxNode> items = new ArrayList<>();
        for (Element className : classNames.values()) {
            items.addAll(className.expandComments());
        }
        return BlockLayout.block(Nodes.token(packageName), items, baseIndent + 2 * options.getIndentSize());
    }
}
