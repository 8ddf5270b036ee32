package com.cljformatter.api;

import java.nio.file.Path;

import com.cljformatter.config.FormatterConfig;

/**
 * A formatter for one family of file types.
 */
public interface FormatterPlugin {
    /**
     * Initialize the plugin with the configuration.
     */
    void initialize(FormatterConfig config);

    /**
     * Name of the plugin section in the configuration file.
     */
    String getName();

    /**
     * Format the provided source code. Never throws for invalid input; problems are reported
     * as errors of the result.
     */
    FormatterResult format(Path filePath, String sourceCode);
}
