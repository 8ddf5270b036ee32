package com.cljformatter.api.error;

/**
 * A problem found while formatting a file. Line and column are 1-based, and 0 when unknown.
 */
public class FormatterError {
    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;

    public FormatterError(Severity severity, String message, int line, int column) {
        this(severity, message, line, column, null);
    }

    public FormatterError(Severity severity, String message, int line, int column, String suggestion) {
        this.severity = severity;
        this.message = message;
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
    }

    /**
     * An error that is not tied to a position in the source.
     */
    public static FormatterError of(Severity severity, String message) {
        return new FormatterError(severity, message, 0, 0);
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * How to fix the problem, or {@code null}.
     */
    public String getSuggestion() {
        return suggestion;
    }

    @Override
    public String toString() {
        return line > 0 ? severity + " " + line + ":" + column + " " + message : severity + " " + message;
    }
}
