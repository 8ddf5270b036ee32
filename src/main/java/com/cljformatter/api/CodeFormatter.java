package com.cljformatter.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Formats single files and whole source trees. Implementations never write files.
 */
public interface CodeFormatter {

    /**
     * Formats {@code sourceCode} with the plugin registered for the type of {@code filePath}.
     */
    FormatterResult formatFile(Path filePath, String sourceCode);

    /**
     * Formats every supported file under {@code directory}, keyed by path.
     */
    Map<Path, FormatterResult> formatDirectory(Path directory);

    /**
     * Whether a plugin is registered for the type of {@code filePath}.
     */
    boolean supports(Path filePath);
}
