package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.ClojureReader;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RequireOrganizerTest {
    private final RequireOrganizer organizer = new RequireOrganizer(NsFormatOptions.defaults());

    private static List<Element> elements(String directiveList) {
        return NsParser.parseListWithComments(ClojureReader.readForm(directiveList)).getElements();
    }

    private static List<String> expandAll(String directiveList) {
        List<String> result = new ArrayList<>();
        for (Element element : elements(directiveList)) {
            RequireOrganizer.expandGroup(element).forEach(e -> result.add(e.getNode().toSource()));
        }
        return result;
    }

    @Test
    void expandGroup_wrapsBareSymbolsAndKeepsVectors() {
        assertEquals(List.of("[a.b]", "[c.d :as d]", "[\"react\"]", ":reload"),
                expandAll("(:require a.b [c.d :as d] \"react\" :reload)"));
    }

    @Test
    void expandGroup_joinsPrefixWithEachChild() {
        assertEquals(List.of("[clojure.set]", "[clojure.string :as str :refer [join]]"),
                expandAll("(:require (clojure set [string :as str :refer [join]]))"));
    }

    @Test
    void expandGroup_movesGroupCommentsToFirstChild() {
        List<Element> expanded = RequireOrganizer.expandGroup(
                elements("(:require\n ;; group\n (a ;; bee\n b c))").get(0));

        assertEquals(List.of("; group", "; bee"), expanded.get(0).getComments());
        assertEquals(List.of(), expanded.get(1).getComments());
    }

    @Test
    void expandGroup_rejectsMapsAndNonSymbolPrefixChildren() {
        NsFormatException map = assertThrows(NsFormatException.class,
                () -> RequireOrganizer.expandGroup(elements("(:require {:a 1})").get(0)));
        NsFormatException keyword = assertThrows(NsFormatException.class,
                () -> RequireOrganizer.expandGroup(elements("(:require (a :b))").get(0)));

        assertEquals(NsFormatException.Kind.INVALID_REQUIRE_GROUP, map.getKind());
        assertEquals(NsFormatException.Kind.INVALID_REQUIRE_GROUP, keyword.getKind());
    }

    @Test
    void sort_isStableAndPutsFlagsLast() {
        List<Element> sorted = organizer.sort(elements("(:require [b] :reload [a] [b :as x] #?(:clj [a.c]))"));

        assertEquals(List.of("[a]", "#?(:clj [a.c])", "[b]", "[b :as x]", ":reload"),
                sorted.stream().map(e -> e.getNode().toSource()).toList());
    }

    @Test
    void render_oneNamespacePerLine() {
        assertEquals("(:require\n    [a.b]\n    [b.c])",
                organizer.render(2, "require", elements("(:require [b.c] [a.b])")).toSource());
    }

    @Test
    void render_keepsCommentsWithTheirVector() {
        String rendered = organizer.render(2, "require",
                elements("(:require\n ;; zed\n [z.z]\n ;; alpha\n [a.a] ; tail\n)")).toSource();

        assertEquals(String.join("\n",
                "(:require",
                "    ;; alpha",
                "    [a.a]",
                "    ; tail",
                "    ;; zed",
                "    [z.z])"), rendered);
    }

    @Test
    void render_trailingCommentDoesNotSwallowCloser() {
        String rendered = organizer.render(2, "require-macros", elements("(:require-macros [m] ; last\n)")).toSource();

        assertEquals("(:require-macros\n    [m]\n    ; last\n    )", rendered);
    }

    @Test
    void render_emptySectionIsOmitted() {
        assertNull(organizer.render(2, "require", elements("(:require)")));
        assertNull(organizer.render(2, "require", elements("(:require (a))")));
    }
}
