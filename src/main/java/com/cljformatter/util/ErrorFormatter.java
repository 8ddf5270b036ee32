package com.cljformatter.util;

import com.cljformatter.api.error.FormatterError;
import com.cljformatter.api.error.Severity;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Console rendering of formatter errors, with optional ANSI colors.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * One error, e.g. {@code FATAL: Syntax error: Unmatched delimiter: ) (line 3, column 7)},
     * followed by an indented suggestion line when the error has one.
     */
    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder()
                .append(colorize(_color(error.getSeverity()), error.getSeverity().name()))
                .append(": ")
                .append(error.getMessage())
                .append(_position(error));
        String suggestion = error.getSuggestion();
        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: ")).append(suggestion);
        }
        return sb.toString();
    }

    /**
     * One line per file with errors, then the totals, e.g. {@code src/a.clj: 1 fatal}.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder(colorize(ANSI_BOLD, "Error Summary:")).append("\n");
        Map<Severity, Long> total = new EnumMap<>(Severity.class);
        fileErrors.forEach((file, errors) -> {
            if (errors.isEmpty()) {
                return;
            }
            Map<Severity, Long> counts = _count(errors);
            counts.forEach((severity, count) -> total.merge(severity, count, Long::sum));
            sb.append(file).append(": ").append(_describe(counts)).append("\n");
        });
        return sb.append("\nTotal: ").append(_describe(total)).toString();
    }

    public String colorize(String color, String message) {
        return useColors ? color + message + ANSI_RESET : message;
    }

    private static String _position(FormatterError error) {
        if (error.getLine() <= 0) {
            return "";
        }
        return error.getColumn() > 0
                ? " (line " + error.getLine() + ", column " + error.getColumn() + ")"
                : " (line " + error.getLine() + ")";
    }

    private static String _color(Severity severity) {
        return switch (severity) {
            case FATAL, ERROR -> ANSI_RED;
            case WARNING -> ANSI_YELLOW;
            case INFO -> ANSI_BLUE;
        };
    }

    private static Map<Severity, Long> _count(List<FormatterError> errors) {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (FormatterError error : errors) {
            counts.merge(error.getSeverity(), 1L, Long::sum);
        }
        return counts;
    }

    /**
     * Counts in severity order, informational messages left out.
     */
    private String _describe(Map<Severity, Long> counts) {
        StringJoiner joiner = new StringJoiner(", ");
        counts.forEach((severity, count) -> {
            String label = switch (severity) {
                case FATAL -> count + " fatal";
                case ERROR -> count + " errors";
                case WARNING -> count + " warnings";
                case INFO -> null;
            };
            if (label != null) {
                joiner.add(colorize(_color(severity), label));
            }
        });
        return joiner.length() == 0 ? "no errors" : joiner.toString();
    }
}
