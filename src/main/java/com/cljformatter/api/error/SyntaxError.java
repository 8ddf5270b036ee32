package com.cljformatter.api.error;

/**
 * Raised by the reader when source text is not syntactically valid.
 * Formatting aborts; there is no partial output.
 */
public class SyntaxError extends Exception {
    private final int line;
    private final int column;
    private final String reason;

    /**
     * @param reason what is wrong, without position information
     * @param line 1-based line of the offending character
     * @param column 1-based column of the offending character
     */
    public SyntaxError(String reason, int line, int column) {
        super(reason + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
        this.reason = reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Converts this error into the result error reported by formatter plugins.
     */
    public FormatterError toFormatterError() {
        return new FormatterError(Severity.FATAL, "Syntax error: " + reason, line, column,
                "Fix the source so that it can be read before formatting");
    }
}
