package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.config.ConfigurationLoader;
import com.nsformatter.config.FormatterConfig;

/**
 * Layout settings passed explicitly to every stage of the ns rewrite.
 */
public final class NsFormatOptions {
    /** Columns per indent step. Not configurable. */
    public static final int INDENT_SIZE = 2;

    private final int indentSize;
    private final int singleImportBreakWidth;

    public NsFormatOptions(int singleImportBreakWidth) {
        if (singleImportBreakWidth < 1) {
            throw new IllegalArgumentException("singleImportBreakWidth must be positive: " + singleImportBreakWidth);
        }
        this.indentSize = INDENT_SIZE;
        this.singleImportBreakWidth = singleImportBreakWidth;
    }

    public static NsFormatOptions defaults() {
        return new NsFormatOptions(ConfigurationLoader.DEFAULT_SINGLE_IMPORT_BREAK_WIDTH);
    }

    public static NsFormatOptions fromConfig(FormatterConfig config) {
        int width = config.getPluginConfig(FormatterConfig.CLOJURE_PLUGIN,
                ConfigurationLoader.SINGLE_IMPORT_BREAK_WIDTH,
                ConfigurationLoader.DEFAULT_SINGLE_IMPORT_BREAK_WIDTH);
        return new NsFormatOptions(width);
    }

    public int getIndentSize() {
        return indentSize;
    }

    /**
     * Longest fully qualified class name that may stay a bare, ungrouped import.
     */
    public int getSingleImportBreakWidth() {
        return singleImportBreakWidth;
    }

    @Override
    public String toString() {
        return "NsFormatOptions{indentSize=" + indentSize + ", singleImportBreakWidth=" + singleImportBreakWidth + "}";
    }
}
