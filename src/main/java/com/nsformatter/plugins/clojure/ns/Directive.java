package com.nsformatter.plugins.clojure.ns;

import java.util.List;

/**
 * Directive keys of an ns form, written without the leading colon.
 */
public final class Directive {
    public static final String REFER_CLOJURE = "refer-clojure";
    public static final String GEN_CLASS = "gen-class";
    public static final String REQUIRE = "require";
    public static final String REQUIRE_MACROS = "require-macros";
    public static final String IMPORT = "import";
    public static final String USE = "use";
    public static final String LOAD = "load";

    /** Sections with a fixed slot in the rendered form, in rendering order. */
    public static final List<String> RENDER_ORDER =
            List.of(REFER_CLOJURE, GEN_CLASS, REQUIRE, REQUIRE_MACROS, IMPORT);

    private Directive() {
    }

    public static boolean isRequireLike(String key) {
        return REQUIRE.equals(key) || REQUIRE_MACROS.equals(key);
    }
}
