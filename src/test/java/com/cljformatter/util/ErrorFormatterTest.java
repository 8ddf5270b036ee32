package com.cljformatter.util;

import com.cljformatter.api.error.FormatterError;
import com.cljformatter.api.error.Severity;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorFormatterTest {
    private final ErrorFormatter plain = new ErrorFormatter(false);

    @Test
    void formatsPositionAndSuggestion() {
        FormatterError error = new FormatterError(Severity.FATAL, "Syntax error: Unmatched delimiter: )", 3, 7, "Fix it");
        assertEquals("FATAL: Syntax error: Unmatched delimiter: ) (line 3, column 7)\n  Suggestion: Fix it",
                plain.formatError(error));
    }

    @Test
    void omitsUnknownPosition() {
        assertEquals("ERROR: No plugin", plain.formatError(new FormatterError(Severity.ERROR, "No plugin", 0, 0)));
        assertEquals("WARNING: Odd (line 2)", plain.formatError(new FormatterError(Severity.WARNING, "Odd", 2, 0)));
    }

    @Test
    void summarizesPerFileAndInTotal() {
        Map<Path, List<FormatterError>> errors = new TreeMap<>();
        errors.put(Path.of("a.clj"), List.of(new FormatterError(Severity.FATAL, "x", 1, 1)));
        errors.put(Path.of("b.clj"), List.of(
                new FormatterError(Severity.ERROR, "y", 1, 1),
                new FormatterError(Severity.WARNING, "z", 1, 1)));
        errors.put(Path.of("c.clj"), List.of());

        assertEquals("Error Summary:\n"
                        + "a.clj: 1 fatal\n"
                        + "b.clj: 1 errors, 1 warnings\n"
                        + "\nTotal: 1 fatal, 1 errors, 1 warnings",
                plain.formatErrorSummary(errors));
    }

    @Test
    void colorsOnlyWhenEnabled() {
        assertEquals("text", plain.colorize(ErrorFormatter.ANSI_RED, "text"));
        String colored = new ErrorFormatter(true).colorize(ErrorFormatter.ANSI_RED, "text");
        assertTrue(colored.startsWith(ErrorFormatter.ANSI_RED) && colored.endsWith(ErrorFormatter.ANSI_RESET));
    }
}
