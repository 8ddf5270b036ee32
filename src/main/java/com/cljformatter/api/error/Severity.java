package com.cljformatter.api.error;

/**
 * How bad a {@link FormatterError} is, most severe first.
 */
public enum Severity {
    /** The source could not be read; nothing was formatted. */
    FATAL,
    /** The file could not be processed, e.g. an I/O failure or a missing plugin. */
    ERROR,
    WARNING,
    INFO
}
