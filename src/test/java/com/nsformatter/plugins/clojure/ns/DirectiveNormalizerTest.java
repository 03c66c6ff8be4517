package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.ClojureReader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

public class DirectiveNormalizerTest {

    private static ParsedHeader parse(String source) {
        return NsParser.parseHeader(ClojureReader.readForm(source));
    }

    private static List<String> requires(ParsedHeader header) {
        return header.getSection(Directive.REQUIRE).stream().map(e -> e.getNode().toSource()).toList();
    }

    @Test
    void absorbUse_appendsReferAll() {
        ParsedHeader header = DirectiveNormalizer.absorbUse(
                parse("(ns foo (:require [z]) (:use a.b (c d e) [f.g :as g]))"));

        assertFalse(header.hasSection(Directive.USE));
        assertEquals(List.of("[z]", "[a.b :refer :all]", "[c.d :refer :all]", "[c.e :refer :all]",
                "[f.g :as g :refer :all]"), requires(header));
    }

    // A :use entry that already names what it refers keeps that list instead of getting
    // :refer :all appended, so (:use [a.b :only [x]]) still refers only x.
    @Test
    void absorbUse_turnsOnlyIntoRefer() {
        ParsedHeader header = DirectiveNormalizer.absorbUse(
                parse("(ns foo (:use [a.b :only [x y]] [c.d :refer [z]]))"));

        assertEquals(List.of("[a.b :refer [x y]]", "[c.d :refer [z]]"), requires(header));
    }

    @Test
    void absorbLoad_expandsGroups() {
        ParsedHeader header = DirectiveNormalizer.absorbLoad(parse("(ns foo (:load (a b c) d))"));

        assertFalse(header.hasSection(Directive.LOAD));
        assertEquals(List.of("[a.b]", "[a.c]", "[d]"), requires(header));
    }

    @Test
    void normalize_movesSectionComments() {
        ParsedHeader header = DirectiveNormalizer.normalize(parse("(ns foo\n  ;; legacy\n  (:use a.b))"));

        assertEquals(List.of("; legacy"), header.getSectionComments(Directive.REQUIRE));
        assertEquals(List.of(), header.getSectionComments(Directive.USE));
    }

    @Test
    void normalize_isNoOpWithoutLegacyDirectives() {
        ParsedHeader header = parse("(ns foo (:require [a]))");

        assertSame(header, DirectiveNormalizer.normalize(header));
    }
}
