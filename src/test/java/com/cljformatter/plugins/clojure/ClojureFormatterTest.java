package com.cljformatter.plugins.clojure;

import com.cljformatter.api.FormatterResult;
import com.cljformatter.api.error.FormatterError;
import com.cljformatter.api.error.Severity;
import com.cljformatter.config.ConfigurationLoader;
import com.cljformatter.config.FormatterConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClojureFormatterTest {
    private static final Path FILE = Path.of("src/example.clj");

    private static ClojureFormatter formatter(boolean finalNewline) {
        Map<String, Object> general = new HashMap<>();
        general.put(FormatterConfig.FINAL_NEWLINE, finalNewline);
        ClojureFormatter formatter = new ClojureFormatter();
        formatter.initialize(new FormatterConfig(general, new HashMap<>()));
        return formatter;
    }

    @Test
    void appendsFinalNewline() {
        FormatterResult result = formatter(true).format(FILE, "(def x 1)");
        assertTrue(result.isSuccessful());
        assertTrue(result.isChanged());
        assertEquals("(def x\n  1)\n", result.getFormattedCode());
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void finalNewlineCanBeDisabled() {
        FormatterResult result = formatter(false).format(FILE, "(def x 1)");
        assertEquals("(def x\n  1)", result.getFormattedCode());
    }

    @Test
    void canonicalFileIsUnchanged() {
        FormatterResult result = formatter(true).format(FILE, "(def x\n  1)\n");
        assertTrue(result.isSuccessful());
        assertFalse(result.isChanged());
    }

    @Test
    void emptyFileStaysEmpty() {
        FormatterResult result = formatter(true).format(FILE, "\n\n");
        assertEquals("", result.getFormattedCode());
        assertTrue(result.isChanged());
    }

    @Test
    void unreadableSourceIsReportedAndKept() {
        String source = "(defn f [x]\n  (inc x)";
        FormatterResult result = formatter(true).format(FILE, source);
        assertFalse(result.isSuccessful());
        assertEquals(source, result.getFormattedCode());
        assertEquals(1, result.getErrors().size());
        FormatterError error = result.getErrors().get(0);
        assertEquals(Severity.FATAL, error.getSeverity());
        assertTrue(error.getMessage().startsWith("Syntax error: EOF while reading"), error.getMessage());
        assertEquals(2, error.getLine());
    }

    @Test
    void reportsItsConfigurationName() {
        assertEquals(ConfigurationLoader.CLOJURE_PLUGIN, new ClojureFormatter().getName());
    }
}
