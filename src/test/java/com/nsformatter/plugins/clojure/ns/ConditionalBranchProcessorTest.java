package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.ClojureReader;
import com.nsformatter.plugins.clojure.syntax.ReaderConditionalNode;
import com.nsformatter.plugins.clojure.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConditionalBranchProcessorTest {
    private final NsFormatOptions options = NsFormatOptions.defaults();
    private final ConditionalBranchProcessor processor = new ConditionalBranchProcessor(
            options, new RequireOrganizer(options), new ImportOrganizer(options));

    private String render(String conditional) {
        BranchSet branchSet = NsParser.parseBranchSet((ReaderConditionalNode) ClojureReader.readForm(conditional));
        return processor.render(branchSet).toSource();
    }

    @Test
    void render_sortsBranchesAndFormatsRequires() {
        assertEquals(String.join("\n",
                "#?(:clj",
                "     (:require",
                "       [a]",
                "       [c])",
                "     :cljs",
                "     (:require",
                "       [b]))"),
                render("#?(:cljs (:require [b]) :clj (:require [c] a))"));
    }

    @Test
    void render_formatsImportBranches() {
        assertEquals(String.join("\n",
                "#?(:clj",
                "     (:import",
                "       (java.util",
                "         Date",
                "         List)))"),
                render("#?(:clj (:import (java.util List Date)))"));
    }

    @Test
    void render_spliceKeepsDiscriminatorAndWiderIndent() {
        String rendered = render("#?@(:cljs [b] :clj [a])");

        assertEquals("#?@(:clj\n      [a]\n      :cljs\n      [b])", rendered);
        assertTrue(((ReaderConditionalNode) ClojureReader.readForm(rendered)).isSpliced());
    }

    @Test
    void render_branchCommentsPrecedeTheirKey() {
        assertEquals(String.join("\n",
                "#?(;; jvm",
                "     :clj",
                "     x",
                "     :cljs",
                "     y",
                "     ;; done",
                "     )"),
                render("#?(:cljs y\n ;; jvm\n :clj x\n ;; done\n)"));
    }

    @Test
    void renderClause_leavesOtherClausesUnchanged() {
        SyntaxNode referClojure = ClojureReader.readForm("(:refer-clojure   :exclude [map])");
        SyntaxNode vector = ClojureReader.readForm("[a b]");
        SyntaxNode emptyRequire = ClojureReader.readForm("(:require)");

        assertSame(referClojure, processor.renderClause(5, referClojure));
        assertSame(vector, processor.renderClause(5, vector));
        assertSame(emptyRequire, processor.renderClause(5, emptyRequire));
    }
}
