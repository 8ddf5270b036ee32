package com.cljformatter.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigurationLoaderTest {

    @TempDir
    Path dir;

    private FormatterConfig load(String yaml) throws IOException {
        Path file = dir.resolve(ConfigurationLoader.DEFAULT_CONFIG_FILE);
        Files.writeString(file, yaml);
        return ConfigurationLoader.loadConfig(file);
    }

    @Test
    void missingFileFallsBackToEmbeddedDefaults() {
        FormatterConfig config = ConfigurationLoader.loadConfig(dir.resolve("absent.yml"));
        assertSame(ConfigurationLoader.loadDefaultConfig(), config);
        assertEquals(4, config.getThreads());
        assertTrue(config.isFinalNewline());
        assertEquals(List.of("clj", "cljs", "cljc", "edn"), config.getPluginExtensions(ConfigurationLoader.CLOJURE_PLUGIN));
        assertTrue(config.getIgnoreFiles().contains("target/**"));
    }

    @Test
    void readsGeneralAndPluginSections() throws IOException {
        FormatterConfig config = load("general:\n"
                + "  threads: 2\n"
                + "  finalNewline: false\n"
                + "  ignoreFiles:\n"
                + "    - \"gen/**\"\n"
                + "plugins:\n"
                + "  clojure:\n"
                + "    extensions: [clj]\n");
        assertEquals(2, config.getThreads());
        assertFalse(config.isFinalNewline());
        assertEquals(List.of("gen/**"), config.getIgnoreFiles());
        assertEquals(List.of("clj"), config.getPluginExtensions(ConfigurationLoader.CLOJURE_PLUGIN));
    }

    @Test
    void outOfRangeThreadsAreReplaced() throws IOException {
        FormatterConfig config = load("general:\n  threads: 500\n");
        assertEquals(Math.min(ConfigurationLoader.MAX_THREADS, Runtime.getRuntime().availableProcessors()),
                config.getThreads());
    }

    @Test
    void invalidGlobPatternsAreDropped() throws IOException {
        FormatterConfig config = load("general:\n  ignoreFiles: [\"[unclosed\", \"ok/**\"]\n");
        assertEquals(List.of("ok/**"), config.getIgnoreFiles());
    }

    @Test
    void nonMappingSectionsAreIgnored() throws IOException {
        FormatterConfig config = load("general: 3\nplugins:\n  clojure: [clj]\n");
        assertTrue(config.isFinalNewline());
        assertEquals(4, config.getPluginExtensions(ConfigurationLoader.CLOJURE_PLUGIN).size());
    }

    @Test
    void emptyExtensionListIsReplaced() throws IOException {
        FormatterConfig config = load("plugins:\n  clojure:\n    extensions: []\n");
        assertEquals(4, config.getPluginExtensions(ConfigurationLoader.CLOJURE_PLUGIN).size());
    }

    @Test
    void emptySectionsGetBuiltInDefaults() throws IOException {
        FormatterConfig config = load("general: {}\nplugins: {}\n");
        assertTrue(config.isFinalNewline());
        assertTrue(config.getIgnoreFiles().isEmpty());
        assertEquals(4, config.getPluginExtensions(ConfigurationLoader.CLOJURE_PLUGIN).size());
    }

    @Test
    void malformedYamlFallsBackToDefaults() throws IOException {
        FormatterConfig config = load("general: [unclosed\n");
        assertSame(ConfigurationLoader.loadDefaultConfig(), config);
    }

    @Test
    void savedConfigurationLoadsBack() throws IOException {
        Map<String, Object> general = new HashMap<>();
        general.put(FormatterConfig.THREADS, 3);
        general.put(FormatterConfig.FINAL_NEWLINE, false);
        Map<String, Map<String, Object>> plugins = new HashMap<>();
        Map<String, Object> clojure = new HashMap<>();
        clojure.put(FormatterConfig.EXTENSIONS, List.of("clj", "edn"));
        plugins.put(ConfigurationLoader.CLOJURE_PLUGIN, clojure);

        Path file = dir.resolve("nested/config.yml");
        ConfigurationLoader.saveConfig(new FormatterConfig(general, plugins), file);

        FormatterConfig loaded = ConfigurationLoader.loadConfig(file);
        assertEquals(3, loaded.getThreads());
        assertFalse(loaded.isFinalNewline());
        assertEquals(List.of("clj", "edn"), loaded.getPluginExtensions(ConfigurationLoader.CLOJURE_PLUGIN));
    }
}
