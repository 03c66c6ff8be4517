package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.ClojureReader;
import com.nsformatter.plugins.clojure.syntax.NodeTag;
import com.nsformatter.plugins.clojure.syntax.Nodes;
import com.nsformatter.plugins.clojure.syntax.ReaderConditionalNode;
import com.nsformatter.plugins.clojure.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NsParserTest {

    private static ParsedHeader parse(String... lines) {
        return NsParser.parseHeader(ClojureReader.readForm(String.join("\n", lines)));
    }

    private static List<String> sources(List<Element> elements) {
        return elements.stream().map(e -> e.getNode().toSource()).toList();
    }

    @Test
    void isHeaderForm_matchesOnlyNsLists() {
        assertTrue(NsParser.isHeaderForm(ClojureReader.readForm("(ns foo)")));
        assertTrue(NsParser.isHeaderForm(ClojureReader.readForm("( ; odd\n ns foo)")));
        assertFalse(NsParser.isHeaderForm(ClojureReader.readForm("(nsx foo)")));
        assertFalse(NsParser.isHeaderForm(ClojureReader.readForm("[ns foo]")));
        assertFalse(NsParser.isHeaderForm(ClojureReader.readForm("(:ns foo)")));
        assertFalse(NsParser.isHeaderForm(ClojureReader.readForm("()")));
        assertFalse(NsParser.isHeaderForm(null));
    }

    @Test
    void parseHeader_readsNameDocAndSections() {
        ParsedHeader header = parse(
                "(ns foo.core",
                "  \"The docs.\"",
                "  (:require [b.c] a.b)",
                "  (:import (java.util Date))",
                "  (:gen-class))");

        assertEquals("foo.core", header.getName().getValue());
        assertEquals("\"The docs.\"", header.getDoc().toSource());
        assertEquals(List.of("require", "import", "gen-class"), List.copyOf(header.getSections().keySet()));
        assertEquals(List.of("[b.c]", "a.b"), sources(header.getSection("require")));
        assertEquals(NodeTag.LIST, header.getSection("import").get(0).getTag());
        assertTrue(header.hasSection("gen-class"));
        assertTrue(header.getSection("gen-class").isEmpty());
        assertTrue(header.getMetadata().isEmpty());
    }

    @Test
    void parseHeader_mergesRepeatedDirectives() {
        ParsedHeader header = parse("(ns foo (:import a.B) (:require [x]) (:import c.D))");

        assertEquals(List.of("a.B", "c.D"), sources(header.getSection("import")));
        assertEquals(2, header.getSectionOccurrences().get("import"));
        assertEquals(1, header.getSectionOccurrences().get("require"));
    }

    @Test
    void parseHeader_attachesCommentsToFollowingElement() {
        ParsedHeader header = parse(
                "(ns foo",
                "  (:require",
                "   ;; first",
                "   ; second",
                "   [a.b]",
                "   [c.d] ; after c",
                "   ))");

        List<Element> require = header.getSection("require");
        assertEquals(List.of("; first", " second"), require.get(0).getComments());
        assertTrue(require.get(1).getComments().isEmpty());
        assertEquals(List.of(" after c"), require.get(1).getTrailingComments());
    }

    @Test
    void parseHeader_keepsSectionAndTrailingComments() {
        ParsedHeader header = parse(
                "(ns foo",
                "  ;; deps",
                "  (:require [a])",
                "  ;; the end",
                "  )");

        assertEquals(List.of("; deps"), header.getSectionComments("require"));
        assertEquals(List.of("; the end"), header.getTrailingComments());
    }

    @Test
    void parseHeader_unwrapsQuotedElements() {
        ParsedHeader header = parse("(ns foo (:require 'a.b '[c.d :as d]))");

        assertEquals(List.of("a.b", "[c.d :as d]"), sources(header.getSection("require")));
    }

    @Test
    void parseHeader_symbolHeadedDirective() {
        ParsedHeader header = parse("(ns foo (require [a]))");

        assertEquals(List.of("[a]"), sources(header.getSection("require")));
    }

    @Test
    void parseHeader_readsNameMetadata() {
        ParsedHeader header = parse("(ns ^{:doc \"x\" :a false} ^:no-doc ^String foo)");
        Map<SyntaxNode, SyntaxNode> metadata = header.getMetadata();

        assertEquals("foo", header.getName().getValue());
        assertEquals("String", metadata.get(Nodes.keyword("tag")).toSource());
        assertEquals("true", metadata.get(Nodes.keyword("no-doc")).toSource());
        assertEquals("\"x\"", metadata.get(Nodes.keyword("doc")).toSource());
        assertEquals("false", metadata.get(Nodes.keyword("a")).toSource());
    }

    @Test
    void parseHeader_outerMetadataWins() {
        ParsedHeader header = parse("(ns ^{:a 1} ^{:a 2} foo)");

        assertEquals("1", header.getMetadata().get(Nodes.keyword("a")).toSource());
    }

    @Test
    void parseHeader_collectsTopLevelConditionals() {
        ParsedHeader header = parse(
                "(ns foo",
                "  ;; platform deps",
                "  #?(:cljs (:require [b]) :clj (:require [a])))");

        BranchSet branchSet = header.getTopLevelConditionals().get(0);
        assertFalse(branchSet.isSpliced());
        assertEquals(List.of(":clj", ":cljs"), List.copyOf(branchSet.getBranches().keySet()));
        assertEquals(List.of("; platform deps"), branchSet.getComments());
    }

    @Test
    void parseBranchSet_lastDuplicateKeyWins() {
        BranchSet branchSet = NsParser.parseBranchSet(
                (ReaderConditionalNode) ClojureReader.readForm("#?@(:clj [a] :clj [b])"));

        assertTrue(branchSet.isSpliced());
        assertEquals("[b]", branchSet.getBranches().get(":clj").getClause().toSource());
    }

    @Test
    void parseBranchSet_rejectsOddChildren() {
        NsFormatException e = assertThrows(NsFormatException.class, () -> NsParser.parseBranchSet(
                (ReaderConditionalNode) ClojureReader.readForm("#?(:clj a :cljs)")));

        assertEquals(NsFormatException.Kind.MALFORMED_CONDITIONAL, e.getKind());
    }

    @Test
    void parseHeader_rejectsUnknownSection() {
        NsFormatException e = assertThrows(NsFormatException.class, () -> parse("(ns foo [:require a])"));

        assertEquals(NsFormatException.Kind.UNKNOWN_SECTION, e.getKind());
        assertEquals(NodeTag.VECTOR, e.getTag());
    }

    @Test
    void parseHeader_rejectsUnrecognizedElement() {
        NsFormatException e = assertThrows(NsFormatException.class, () -> parse("(ns foo (:require #{a}))"));

        assertEquals(NsFormatException.Kind.UNRECOGNIZED_ELEMENT, e.getKind());
        assertEquals(NodeTag.SET, e.getTag());
    }

    @Test
    void parseHeader_requiresName() {
        NsFormatException missing = assertThrows(NsFormatException.class, () -> parse("(ns)"));
        NsFormatException invalid = assertThrows(NsFormatException.class, () -> parse("(ns (:require [a]))"));

        assertEquals(NsFormatException.Kind.MISSING_NAME, missing.getKind());
        assertNull(missing.getTag());
        assertEquals(NodeTag.LIST, invalid.getTag());
    }

    @Test
    void parseListWithComments_recursesIntoNestedLists() {
        ParsedList parsed = NsParser.parseListWithComments(
                ClojureReader.readForm("(:require (a ;; b first\n b [c :as c]))"));

        Element group = parsed.getElements().get(0);
        assertEquals(":require", parsed.getHead().toSource());
        assertEquals("a", group.getNested().getHead().toSource());
        assertEquals(List.of("; b first"), group.getNested().getElements().get(0).getComments());
        assertEquals(2, group.getNested().getElements().size());
    }
}
