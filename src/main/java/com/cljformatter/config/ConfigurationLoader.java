package com.cljformatter.config;

import com.cljformatter.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

/**
 * Reads {@code .cljsculptor.yml}. Invalid or missing values are replaced by defaults and
 * reported as warnings; a configuration file never stops a run.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    public static final String DEFAULT_CONFIG_FILE = ".cljsculptor.yml";
    public static final String CLOJURE_PLUGIN = "clojure";
    public static final int MAX_THREADS = 64;

    private static final String GENERAL = "general";
    private static final String PLUGINS = "plugins";
    private static final List<String> DEFAULT_EXTENSIONS = Arrays.asList("clj", "cljs", "cljc", "edn");

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * The configuration in {@code configPath}, or the embedded defaults when the file is absent
     * or cannot be parsed.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            if (configPath != null) {
                logger.warning("Configuration file not found: " + configPath + ", using defaults");
            }
            return loadDefaultConfig();
        }

        Map<String, Object> document;
        try {
            document = _read(Files.newInputStream(configPath));
        } catch (IOException e) {
            logger.log(Level.WARNING, "Cannot parse " + configPath + ": " + e.getMessage(), e);
            return loadDefaultConfig();
        }
        logger.fine("Loaded configuration from " + configPath);
        return _build(document);
    }

    /**
     * The configuration embedded in the jar. Parsed once.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (_cachedDefaultConfig == null) {
            InputStream in = ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE);
            Map<String, Object> document = new HashMap<>();
            if (in == null) {
                logger.severe("Missing resource " + DEFAULT_CONFIG_RESOURCE + ", using built-in values");
            } else {
                try {
                    document = _read(in);
                } catch (IOException e) {
                    logger.log(Level.SEVERE, "Cannot parse " + DEFAULT_CONFIG_RESOURCE, e);
                }
            }
            _cachedDefaultConfig = _build(document);
        }
        return _cachedDefaultConfig;
    }

    /**
     * Writes the configuration as YAML, sections first and keys sorted, creating parent
     * directories as needed.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(GENERAL, new TreeMap<>(config.getGeneralConfigMap()));
        document.put(PLUGINS, new TreeMap<>(config.getPluginConfigsMap()));
        yaml.writeValue(configPath.toFile(), document);
        logger.fine("Configuration written to " + configPath);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> _read(InputStream in) throws IOException {
        try (InputStream stream = in) {
            Map<String, Object> document = yaml.readValue(stream, Map.class);
            return document == null ? new HashMap<>() : document;
        }
    }

    private static FormatterConfig _build(Map<String, Object> document) {
        Map<String, Object> general = _mapping(document.get(GENERAL), "'" + GENERAL + "' section");
        Map<String, Map<String, Object>> plugins = new HashMap<>();
        for (Map.Entry<String, Object> entry : _mapping(document.get(PLUGINS), "'" + PLUGINS + "' section").entrySet()) {
            plugins.put(entry.getKey(), _mapping(entry.getValue(), "settings of plugin '" + entry.getKey() + "'"));
        }

        _validateThreads(general);
        _validateIgnoreFiles(general);
        _validateExtensions(plugins.get(CLOJURE_PLUGIN));

        general.putIfAbsent(FormatterConfig.IGNORE_FILES, new ArrayList<String>());
        general.putIfAbsent(FormatterConfig.THREADS, Math.min(MAX_THREADS, Runtime.getRuntime().availableProcessors()));
        general.putIfAbsent(FormatterConfig.FINAL_NEWLINE, Boolean.TRUE);
        plugins.computeIfAbsent(CLOJURE_PLUGIN, k -> new HashMap<>())
                .putIfAbsent(FormatterConfig.EXTENSIONS, new ArrayList<>(DEFAULT_EXTENSIONS));
        return new FormatterConfig(general, plugins);
    }

    /**
     * A mutable copy of a YAML mapping; empty when the value is missing or not a mapping.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> _mapping(Object value, String description) {
        if (value instanceof Map) {
            return new HashMap<>((Map<String, Object>) value);
        }
        if (value != null) {
            logger.warning("Ignoring " + description + ": expected a mapping");
        }
        return new HashMap<>();
    }

    private static void _validateThreads(Map<String, Object> general) {
        Object threads = general.get(FormatterConfig.THREADS);
        if (threads == null) {
            return;
        }
        if (!(threads instanceof Number)
                || ((Number) threads).intValue() < 1 || ((Number) threads).intValue() > MAX_THREADS) {
            logger.warning("'" + FormatterConfig.THREADS + "' must be between 1 and " + MAX_THREADS
                    + ", ignoring " + threads);
            general.remove(FormatterConfig.THREADS);
        }
    }

    /**
     * Keeps the glob patterns that compile; a non-list value is dropped entirely.
     */
    private static void _validateIgnoreFiles(Map<String, Object> general) {
        Object value = general.get(FormatterConfig.IGNORE_FILES);
        if (value == null) {
            return;
        }
        if (!(value instanceof List)) {
            logger.warning("'" + FormatterConfig.IGNORE_FILES + "' must be a list of glob patterns");
            general.remove(FormatterConfig.IGNORE_FILES);
            return;
        }
        List<String> valid = new ArrayList<>();
        for (Object pattern : (List<?>) value) {
            try {
                FileSystems.getDefault().getPathMatcher("glob:" + pattern);
                valid.add(String.valueOf(pattern));
            } catch (PatternSyntaxException e) {
                logger.warning("Ignoring invalid glob pattern '" + pattern + "': " + e.getDescription());
            }
        }
        general.put(FormatterConfig.IGNORE_FILES, valid);
    }

    private static void _validateExtensions(Map<String, Object> clojure) {
        if (clojure == null || !clojure.containsKey(FormatterConfig.EXTENSIONS)) {
            return;
        }
        Object extensions = clojure.get(FormatterConfig.EXTENSIONS);
        if (!(extensions instanceof List) || ((List<?>) extensions).isEmpty()) {
            logger.warning("No usable extensions for plugin '" + CLOJURE_PLUGIN + "', using "
                    + DEFAULT_EXTENSIONS);
            clojure.remove(FormatterConfig.EXTENSIONS);
        }
    }
}
