package com.nsformatter.plugins.clojure.syntax;

/**
 * Tags for every kind of node the reader produces.
 */
public enum NodeTag {
    TOKEN,
    KEYWORD,
    STRING,
    COMMENT,
    WHITESPACE,
    NEWLINE,
    LIST("(", ")"),
    VECTOR("[", "]"),
    MAP("{", "}"),
    SET("#{", "}"),
    FN("#(", ")"),
    READER_CONDITIONAL,
    META,
    QUOTE("'", null),
    SYNTAX_QUOTE("`", null),
    UNQUOTE("~", null),
    UNQUOTE_SPLICING("~@", null),
    DEREF("@", null),
    VAR("#'", null),
    UNEVAL("#_", null),
    EVAL("#=", null),
    FORMS;

    private final String open;
    private final String close;

    NodeTag() {
        this(null, null);
    }

    NodeTag(String open, String close) {
        this.open = open;
        this.close = close;
    }

    /**
     * Opening delimiter for collections, reader prefix for prefixed forms.
     */
    public String getOpen() {
        return open;
    }

    public String getClose() {
        return close;
    }

    public boolean isCollection() {
        return close != null;
    }

    public boolean isPrefix() {
        return open != null && close == null;
    }
}
