package com.hdlformatter.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Loaded configuration: a {@code general} section and one section per plugin.
 */
public class FormatterConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> pluginConfigs;

    public FormatterConfig(Map<String, Object> generalConfig,
                           Map<String, Map<String, Object>> pluginConfigs) {
        this.generalConfig = generalConfig;
        this.pluginConfigs = pluginConfigs;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the plugin configs map.
     */
    public Map<String, Map<String, Object>> getPluginConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : pluginConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public <T> T getGeneralConfig(String key, T defaultValue) {
        Object value = generalConfig.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue instanceof Integer && value instanceof Number) {
            return (T) Integer.valueOf(((Number) value).intValue());
        }
        return defaultValue == null || defaultValue.getClass().isInstance(value) ? (T) value : defaultValue;
    }

    /**
     * True when the plugin section sets {@code key} itself.
     */
    public boolean hasPluginConfig(String plugin, String key) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        return pluginConfig != null && pluginConfig.get(key) != null;
    }

    /**
     * Reads one plugin setting. Numbers are narrowed to {@code Integer} and {@code "true"}/{@code "false"}
     * strings are read as booleans when the default has that type; any other mismatch yields the default.
     */
    @SuppressWarnings("unchecked")
    public <T> T getPluginConfig(String plugin, String key, T defaultValue) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        if (pluginConfig == null) {
            return defaultValue;
        }

        Object value = pluginConfig.get(key);
        if (value == null) {
            return defaultValue;
        }

        if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
            if (defaultValue instanceof Integer && value instanceof Number) {
                return (T) Integer.valueOf(((Number) value).intValue());
            } else if (defaultValue instanceof Boolean && value instanceof String) {
                String text = value.toString().trim();
                return text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")
                        ? (T) Boolean.valueOf(text) : defaultValue;
            } else if (defaultValue instanceof String) {
                return (T) value.toString();
            }
            return defaultValue;
        }

        return (T) value;
    }
}
