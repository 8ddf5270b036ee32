package com.cljformatter.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Operational settings of a formatting run. The formatting style itself is fixed and has no
 * settings.
 */
public class FormatterConfig {
    public static final String IGNORE_FILES = "ignoreFiles";
    public static final String THREADS = "threads";
    public static final String FINAL_NEWLINE = "finalNewline";
    public static final String EXTENSIONS = "extensions";

    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> pluginConfigs;

    public FormatterConfig(Map<String, Object> generalConfig,
                           Map<String, Map<String, Object>> pluginConfigs) {
        this.generalConfig = generalConfig;
        this.pluginConfigs = pluginConfigs;
    }

    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Deep copy of the per-plugin sections.
     */
    public Map<String, Map<String, Object>> getPluginConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        pluginConfigs.forEach((plugin, settings) -> result.put(plugin, new HashMap<>(settings)));
        return result;
    }

    /**
     * Glob patterns, relative to the formatted directory, of files to leave alone.
     */
    public List<String> getIgnoreFiles() {
        return _stringList(generalConfig.get(IGNORE_FILES));
    }

    public int getThreads() {
        Object threads = generalConfig.get(THREADS);
        return threads instanceof Number
                ? ((Number) threads).intValue()
                : Runtime.getRuntime().availableProcessors();
    }

    /**
     * Whether formatted files end with a newline.
     */
    public boolean isFinalNewline() {
        Object finalNewline = generalConfig.get(FINAL_NEWLINE);
        if (finalNewline instanceof String) {
            return Boolean.parseBoolean((String) finalNewline);
        }
        return !Boolean.FALSE.equals(finalNewline);
    }

    /**
     * File extensions, without the dot, handled by a plugin.
     */
    public List<String> getPluginExtensions(String plugin) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        return pluginConfig == null ? new ArrayList<>() : _stringList(pluginConfig.get(EXTENSIONS));
    }

    private static List<String> _stringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object element : (List<?>) value) {
                if (element != null) {
                    result.add(element.toString());
                }
            }
        }
        return result;
    }
}
