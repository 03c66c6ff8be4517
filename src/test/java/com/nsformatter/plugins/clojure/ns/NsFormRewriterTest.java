package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.api.error.FormatterError;
import com.nsformatter.api.error.Severity;
import com.nsformatter.plugins.clojure.syntax.ClojureReader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NsFormRewriterTest {
    private final NsFormRewriter rewriter = new NsFormRewriter(NsFormatOptions.defaults());

    private String format(String... lines) {
        return rewriter.rewriteNode(ClojureReader.readForm(String.join("\n", lines))).toSource();
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    private static int occurrences(String text, String needle) {
        int count = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) {
            count++;
        }
        return count;
    }

    @Test
    void rewrite_ordersSectionsAndSortsClauses() {
        String formatted = format(
                "(ns foo.core",
                "  (:import java.util.Date (java.io InputStream File))",
                "  (:require [b.c :as c] (a b [c :refer [x]]))",
                "  (:refer-clojure :exclude [map])",
                "  \"Docs.\")");

        assertEquals(lines(
                "(ns foo.core",
                "  \"Docs.\"",
                "  (:refer-clojure :exclude [map])",
                "  (:require",
                "    [a.b]",
                "    [a.c :refer [x]]",
                "    [b.c :as c])",
                "  (:import",
                "    (java.io",
                "      File",
                "      InputStream)",
                "    java.util.Date))"), formatted);
    }

    @Test
    void rewrite_requireExample() {
        assertEquals("(ns foo\n  (:require\n    [a.b]\n    [b.c]))", format("(ns foo (:require [b.c] [a.b]))"));
    }

    @Test
    void rewrite_conditionalExample() {
        assertEquals(lines(
                "(ns foo",
                "  #?(:clj",
                "     (:require",
                "       [a])",
                "     :cljs",
                "     (:require",
                "       [b])))"),
                format("(ns foo #?(:cljs (:require [b]) :clj (:require [a])))"));
    }

    @Test
    void rewrite_isIdempotent() {
        String[] inputs = {
                "(ns foo (:require [b.c] [a.b]))",
                "(ns ^:b ^{:author \"x\"} ^:a foo \"doc\" (:gen-class :main true) (:use a.b) (:import (java.util Date) x.Y))",
                "(ns foo\n  ;; deps\n  (:require\n   ;; zed\n   [z] [a] ; tail\n  )\n  #?@(:clj [(:import java.util.Date)])\n  ;; end\n  )",
                "(ns foo (:refer-global :only [x]) #?(;; jvm\n :clj (:import (java.io File))))"
        };
        for (String input : inputs) {
            String once = format(input);
            assertEquals(once, format(once), "not idempotent for: " + input);
        }
    }

    @Test
    void rewrite_useEqualsRequireReferAll() {
        String expected = format("(ns foo (:require [a.b :refer :all]))");

        assertEquals(expected, format("(ns foo (:use a.b))"));
        assertEquals(expected, format("(ns foo (:use 'a.b))"));
        assertEquals(expected, format("(ns foo (:require '[a.b :refer :all]))"));
    }

    @Test
    void rewrite_loadEqualsRequire() {
        assertEquals(format("(ns foo (:require [a.b] [a.c]))"), format("(ns foo (:load (a b c)))"));
    }

    @Test
    void rewrite_keepsEveryCommentExactlyOnce() {
        String formatted = format(
                "(ns foo",
                "  ;; about requires",
                "  (:require",
                "   ;; zed comes last",
                "   [z.z]",
                "   ;; group",
                "   (a b",
                "      ;; see c",
                "      c)",
                "   [m.m] ; trailing",
                "   )",
                "  (:import",
                "   (java.util List",
                "              ;; dates",
                "              Date))",
                "  ;; closing",
                "  )");

        assertEquals(lines(
                "(ns foo",
                "  ;; about requires",
                "  (:require",
                "    ;; group",
                "    [a.b]",
                "    ;; see c",
                "    [a.c]",
                "    [m.m]",
                "    ; trailing",
                "    ;; zed comes last",
                "    [z.z])",
                "  (:import",
                "    (java.util",
                "      ;; dates",
                "      Date",
                "      List))",
                "  ;; closing",
                "  )"), formatted);
        for (String comment : List.of(";; about requires", ";; zed comes last", ";; group", ";; see c",
                "; trailing", ";; dates", ";; closing")) {
            assertEquals(1, occurrences(formatted, comment), comment);
        }
    }

    @Test
    void rewrite_spliceFidelity() {
        assertTrue(format("(ns foo #?@(:clj [(:import java.util.Date)]))").contains("#?@(:clj\n      [(:import"));
        assertTrue(format("(ns foo #?(:clj (:import java.util.Date)))").contains("  #?(:clj\n     (:import"));
    }

    @Test
    void rewrite_nameMetadata() {
        assertEquals("(ns ^{:author \"x\"} ^:a ^:b foo)", format("(ns ^:b ^{:author \"x\"} ^:a foo)"));
        assertEquals("(ns ^:no-doc foo)", format("(ns ^{:no-doc true} foo)"));
        assertEquals("(ns ^{:tag String} foo)", format("(ns ^String foo)"));
    }

    @Test
    void rewrite_genClassPairsAndEmptyForm() {
        assertEquals("(ns foo\n  (:gen-class\n    :name Foo\n    :main true))",
                format("(ns foo (:gen-class :name Foo :main true))"));
        assertEquals("(ns foo\n  (:gen-class))", format("(ns foo (:gen-class))"));
    }

    @Test
    void rewrite_commentedReferClojureKeepsOptionPairsTogether() {
        assertEquals(lines(
                "(ns foo",
                "  (:refer-clojure",
                "    ;; shadowed below",
                "    :exclude [map]",
                "    :rename {filter keep}))"),
                format("(ns foo (:refer-clojure ;; shadowed below\n :exclude [map] :rename {filter keep}))"));
    }

    @Test
    void rewrite_docDirectiveCommentsAreNotTakenForDocstringComments() {
        String formatted = format("(ns foo ;; c\n (:doc \"x\"))");

        assertEquals("(ns foo\n  ;; c\n  (:doc \"x\"))", formatted);
        assertEquals(formatted, format(formatted));
    }

    @Test
    void rewrite_docstringCommentsStayWithDocstring() {
        String formatted = format("(ns foo (:require [a]) ;; about\n \"Docs.\" (:doc \"y\"))");

        assertEquals(lines(
                "(ns foo",
                "  ;; about",
                "  \"Docs.\"",
                "  (:require",
                "    [a])",
                "  (:doc \"y\"))"), formatted);
        assertEquals(formatted, format(formatted));
    }

    @Test
    void rewrite_otherDirectivesFollowImport() {
        assertEquals("(ns foo\n  (:require\n    [a])\n  (:refer-global :only [x]))",
                format("(ns foo (:refer-global :only [x]) (:require [a]))"));
    }

    @Test
    void rewrite_omitsEmptySections() {
        assertEquals("(ns foo)", format("(ns foo (:require) (:import))"));
    }

    @Test
    void rewrite_reportsMergedAndLegacyDirectives() {
        NsRewriteResult result = rewriter.rewrite(ClojureReader.readForm(
                "(ns foo (:import a.B) (:import c.D) (:use x) (:load y))"));
        List<FormatterError> notes = result.getNotes();

        assertEquals("foo", result.getNamespace());
        assertEquals(3, notes.size());
        assertEquals(Severity.INFO, notes.get(0).getSeverity());
        assertEquals("Merged 2 :import lists", notes.get(0).getMessage());
        assertEquals(Severity.WARNING, notes.get(1).getSeverity());
        assertEquals(Severity.INFO, notes.get(2).getSeverity());
    }

    @Test
    void rewrite_propagatesEngineErrors() {
        NsFormatException e = assertThrows(NsFormatException.class,
                () -> format("(ns foo :require)"));

        assertEquals(NsFormatException.Kind.UNKNOWN_SECTION, e.getKind());
    }
}
