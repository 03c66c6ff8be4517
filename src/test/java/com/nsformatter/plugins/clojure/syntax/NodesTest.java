package com.nsformatter.plugins.clojure.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class NodesTest {

    @Test
    void builtNodesPrintAsClojure() {
        SyntaxNode list = Nodes.list(Nodes.interposeSpaces(List.of(
                Nodes.keyword("refer-clojure"),
                Nodes.keyword("exclude"),
                Nodes.vector(List.of(Nodes.token("map"))))));

        assertEquals("(:refer-clojure :exclude [map])", list.toSource());
        assertEquals("^:no-doc foo", Nodes.meta(Nodes.keyword("no-doc"), Nodes.token("foo")).toSource());
        assertEquals("#?@(:clj [a])", Nodes.readerConditional(true, Nodes.interposeSpaces(List.of(
                Nodes.keyword("clj"), Nodes.vector(List.of(Nodes.token("a")))))).toSource());
    }

    @Test
    void atomPicksKeywordByLeadingColon() {
        assertEquals(NodeTag.KEYWORD, Nodes.atom(":as").getTag());
        assertEquals(NodeTag.TOKEN, Nodes.atom("as").getTag());
        assertEquals("as", ((KeywordNode) Nodes.atom("::as")).getName());
    }

    @Test
    void equalityIsTagAndSource() {
        assertEquals(Nodes.token("a.b"), ClojureReader.readForm("a.b"));
        assertEquals(Nodes.keyword("tag"), ClojureReader.readForm(":tag"));
        assertNotEquals(Nodes.token(":tag"), Nodes.keyword("tag"));
    }

    @Test
    void keywordRequiresColon() {
        assertThrows(IllegalArgumentException.class, () -> new KeywordNode("require"));
    }

    @Test
    void replaceChildLeavesOriginalUntouched() {
        FormsNode forms = ClojureReader.read("(ns a) (b)");
        FormsNode replaced = forms.replaceChild(0, Nodes.token("x"));

        assertEquals("x (b)", replaced.toSource());
        assertEquals("(ns a) (b)", forms.toSource());
    }
}
