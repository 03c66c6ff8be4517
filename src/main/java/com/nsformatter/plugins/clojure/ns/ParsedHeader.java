package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.SyntaxNode;
import com.nsformatter.plugins.clojure.syntax.TokenNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured contents of one ns form. Built once by {@link NsParser}, derived into new
 * instances by the normalizer, consumed by the renderer.
 */
public final class ParsedHeader {
    private final TokenNode name;
    private final Map<SyntaxNode, SyntaxNode> metadata;
    private final SyntaxNode doc;
    private final List<String> docComments;
    private final Map<String, List<Element>> sections;
    private final Map<String, Integer> sectionOccurrences;
    private final Map<String, List<String>> sectionComments;
    private final List<BranchSet> topLevelConditionals;
    private final List<String> trailingComments;

    private ParsedHeader(Builder builder) {
        this.name = builder.name;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.doc = builder.doc;
        this.docComments = Collections.unmodifiableList(new ArrayList<>(builder.docComments));
        this.sections = freeze(builder.sections);
        this.sectionOccurrences = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sectionOccurrences));
        this.sectionComments = freeze(builder.sectionComments);
        this.topLevelConditionals = Collections.unmodifiableList(new ArrayList<>(builder.topLevelConditionals));
        this.trailingComments = Collections.unmodifiableList(new ArrayList<>(builder.trailingComments));
    }

    private static <T> Map<String, List<T>> freeze(Map<String, List<T>> source) {
        Map<String, List<T>> copy = new LinkedHashMap<>();
        source.forEach((key, values) -> copy.put(key, Collections.unmodifiableList(new ArrayList<>(values))));
        return Collections.unmodifiableMap(copy);
    }

    public TokenNode getName() {
        return name;
    }

    /**
     * Metadata on the namespace symbol, keyed by metadata key node. Empty when there is none.
     */
    public Map<SyntaxNode, SyntaxNode> getMetadata() {
        return metadata;
    }

    /**
     * The docstring node, or {@code null}.
     */
    public SyntaxNode getDoc() {
        return doc;
    }

    /**
     * Comments written before the docstring.
     */
    public List<String> getDocComments() {
        return docComments;
    }

    /**
     * Directive sections in encounter order. Repeated directives are concatenated.
     */
    public Map<String, List<Element>> getSections() {
        return sections;
    }

    public boolean hasSection(String key) {
        return sections.containsKey(key);
    }

    public List<Element> getSection(String key) {
        return sections.getOrDefault(key, Collections.emptyList());
    }

    /**
     * How many separate lists contributed to each section in the source.
     */
    public Map<String, Integer> getSectionOccurrences() {
        return sectionOccurrences;
    }

    public List<String> getSectionComments(String key) {
        return sectionComments.getOrDefault(key, Collections.emptyList());
    }

    public List<BranchSet> getTopLevelConditionals() {
        return topLevelConditionals;
    }

    /**
     * Comments between the last section and the closing paren.
     */
    public List<String> getTrailingComments() {
        return trailingComments;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .name(name)
                .doc(doc)
                .addDocComments(docComments);
        builder.metadata.putAll(metadata);
        sections.forEach((key, values) -> builder.sections.put(key, new ArrayList<>(values)));
        builder.sectionOccurrences.putAll(sectionOccurrences);
        sectionComments.forEach((key, values) -> builder.sectionComments.put(key, new ArrayList<>(values)));
        builder.topLevelConditionals.addAll(topLevelConditionals);
        builder.trailingComments.addAll(trailingComments);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private TokenNode name;
        private final Map<SyntaxNode, SyntaxNode> metadata = new LinkedHashMap<>();
        private SyntaxNode doc;
        private final List<String> docComments = new ArrayList<>();
        private final Map<String, List<Element>> sections = new LinkedHashMap<>();
        private final Map<String, Integer> sectionOccurrences = new LinkedHashMap<>();
        private final Map<String, List<String>> sectionComments = new LinkedHashMap<>();
        private final List<BranchSet> topLevelConditionals = new ArrayList<>();
        private final List<String> trailingComments = new ArrayList<>();

        public Builder name(TokenNode name) {
            this.name = name;
            return this;
        }

        public Builder metadata(Map<SyntaxNode, SyntaxNode> metadata) {
            this.metadata.clear();
            this.metadata.putAll(metadata);
            return this;
        }

        public Builder doc(SyntaxNode doc) {
            this.doc = doc;
            return this;
        }

        public Builder addDocComments(List<String> comments) {
            docComments.addAll(comments);
            return this;
        }

        /**
         * Records one occurrence of a directive list and appends its elements.
         */
        public Builder addSection(String key, List<Element> elements) {
            appendElements(key, elements);
            sectionOccurrences.merge(key, 1, Integer::sum);
            return this;
        }

        /**
         * Appends elements to a section, creating it if absent, without counting an occurrence.
         */
        public Builder appendElements(String key, List<Element> elements) {
            sections.computeIfAbsent(key, k -> new ArrayList<>()).addAll(elements);
            return this;
        }

        public Builder removeSection(String key) {
            sections.remove(key);
            sectionOccurrences.remove(key);
            List<String> comments = sectionComments.remove(key);
            if (comments != null && !comments.isEmpty()) {
                throw new IllegalStateException("Comments of section :" + key + " must be moved before removing it");
            }
            return this;
        }

        public Builder addSectionComments(String key, List<String> comments) {
            if (!comments.isEmpty()) {
                sectionComments.computeIfAbsent(key, k -> new ArrayList<>()).addAll(comments);
            }
            return this;
        }

        /**
         * Moves the comments recorded for {@code from} to the end of those for {@code to}.
         */
        public Builder moveSectionComments(String from, String to) {
            List<String> comments = sectionComments.remove(from);
            if (comments != null) {
                addSectionComments(to, comments);
            }
            return this;
        }

        public Builder addConditional(BranchSet branchSet) {
            topLevelConditionals.add(branchSet);
            return this;
        }

        public Builder addTrailingComments(List<String> comments) {
            trailingComments.addAll(comments);
            return this;
        }

        public ParsedHeader build() {
            if (name == null) {
                throw new IllegalStateException("Namespace name is required");
            }
            return new ParsedHeader(this);
        }
    }
}
