package com.nsformatter.api;

import java.nio.file.Path;

import com.nsformatter.config.FormatterConfig;

/**
 * Interface for dialect-specific formatter plugins.
 */
public interface FormatterPlugin {
    /**
     * Initialize the plugin with the configuration.
     */
    void initialize(FormatterConfig config);

    /**
     * Format the provided source code. Implementations never throw for bad input;
     * problems are reported through {@link FormatterResult#getErrors()}.
     */
    FormatterResult format(Path filePath, String sourceCode);
}
