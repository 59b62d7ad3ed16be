package com.hdlformatter.config;

import com.hdlformatter.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads the YAML configuration, fills in defaults and replaces out-of-range values.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class.getName());
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    /** Name of the per-project configuration file looked up in the working directory. */
    public static final String PROJECT_CONFIG_FILE = ".hdlformatter.yml";

    private static final List<String> VERILOG_FLAGS = List.of(
            "alignPortList", "alignParameters", "wrapPortList", "removeTrailingWhitespace",
            "alignAssignments", "alignWireDeclSemicolons", "formatModuleInstantiations",
            "formatModuleHeaders", "indentAlwaysBlocks", "enforceBeginEnd", "indentCaseStatements",
            "annotateIfdefComments");

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file with fallback to defaults.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.warning("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.warning("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);
            if (config == null) {
                logger.warning("Configuration file is empty: " + configPath + ", using default configuration");
                return loadDefaultConfig();
            }

            FormatterConfig formatterConfig = _createConfigFromMap(config);
            logger.info("Configuration loaded successfully with " +
                    formatterConfig.getPluginConfigsMap().size() + " plugin configurations");

            return formatterConfig;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads {@value #PROJECT_CONFIG_FILE} from {@code directory} when present, the embedded defaults otherwise.
     */
    public static FormatterConfig loadProjectConfig(Path directory) {
        Path candidate = directory.resolve(PROJECT_CONFIG_FILE);
        return Files.isRegularFile(candidate) ? loadConfig(candidate) : loadDefaultConfig();
    }

    /**
     * Loads the embedded default configuration with caching.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    /**
     * The embedded default configuration file, verbatim.
     */
    public static String defaultConfigText() throws IOException {
        try (InputStream in = ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                throw new IOException("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Creates a configuration from a parsed Map, with validation.
     */
    @SuppressWarnings("unchecked")
    static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else {
            logger.warning("Missing or invalid 'general' section in config, using defaults");
        }

        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> pluginConfigs = new HashMap<>();
        if (config.get("plugins") instanceof Map) {
            Map<String, Object> pluginsMap = (Map<String, Object>) config.get("plugins");

            for (Map.Entry<String, Object> entry : pluginsMap.entrySet()) {
                if (entry.getValue() instanceof Map) {
                    pluginConfigs.put(entry.getKey(), new HashMap<>((Map<String, Object>) entry.getValue()));
                } else {
                    logger.warning("Invalid configuration for plugin '" + entry.getKey() + "', using defaults");
                    pluginConfigs.put(entry.getKey(), new HashMap<>());
                }
            }
        } else {
            logger.warning("Missing or invalid 'plugins' section in config, using defaults");
        }

        _validateConfigurationValues(generalConfig, pluginConfigs);

        _ensureDefaultPluginConfigs(pluginConfigs);

        return new FormatterConfig(generalConfig, pluginConfigs);
    }

    /**
     * Validates configuration values to ensure they are within acceptable ranges.
     */
    private static void _validateConfigurationValues(Map<String, Object> generalConfig,
                                                     Map<String, Map<String, Object>> pluginConfigs) {
        _validateIntRange(generalConfig, "threads", 1, 64);

        Map<String, Object> verilogConfig = pluginConfigs.get(FormatConfig.PLUGIN_NAME);
        if (verilogConfig != null) {
            _validateIntRange(verilogConfig, "indentSize", 1, 8);
            _validateIntRange(verilogConfig, "maxBlankLines", 0, 1000);
            _validateIntRange(verilogConfig, "lineLength", 40, 400);
            _validateIntRange(verilogConfig, "commentColumn", 0, 200);
            for (String flag : VERILOG_FLAGS) {
                _validateBoolean(verilogConfig, flag);
            }
        }
    }

    /**
     * Validates that an integer configuration value is within the specified range.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        Object value = config.get(key);
        if (value == null) {
            return;
        }
        if (!(value instanceof Number)) {
            logger.warning("Configuration value '" + key + "' is not a number: " + value + ". Using default value.");
            config.remove(key);
            return;
        }
        int number = ((Number) value).intValue();
        if (number < min || number > max) {
            logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                    "(" + min + "-" + max + "). Using default value.");
            config.remove(key);
        }
    }

    private static void _validateBoolean(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value != null && !(value instanceof Boolean)) {
            logger.warning("Configuration value '" + key + "' is not true/false: " + value + ". Using default value.");
            config.remove(key);
        }
    }

    /**
     * Creates an empty configuration with minimum defaults.
     */
    private static FormatterConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> pluginConfigs = new HashMap<>();
        _ensureDefaultPluginConfigs(pluginConfigs);

        return new FormatterConfig(generalConfig, pluginConfigs);
    }

    /**
     * Ensures that general configuration has all required default values.
     */
    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        if (!(generalConfig.get("threads") instanceof Number)) {
            generalConfig.put("threads", Runtime.getRuntime().availableProcessors());
        }
        if (!(generalConfig.get("ignoreFiles") instanceof List)) {
            generalConfig.put("ignoreFiles", new ArrayList<String>());
        }
    }

    /**
     * Ensures the verilog section exists and carries every rule. {@code indentSize} is only present when the
     * file sets it, so an editor tab size can take its place.
     */
    private static void _ensureDefaultPluginConfigs(Map<String, Map<String, Object>> pluginConfigs) {
        Map<String, Object> verilogConfig = pluginConfigs.computeIfAbsent(FormatConfig.PLUGIN_NAME, k -> new HashMap<>());
        FormatConfig defaults = FormatConfig.builder().build();
        verilogConfig.putIfAbsent("maxBlankLines", defaults.getMaxBlankLines());
        verilogConfig.putIfAbsent("lineLength", defaults.getLineLength());
        verilogConfig.putIfAbsent("commentColumn", defaults.getCommentColumn());
        for (String flag : VERILOG_FLAGS) {
            verilogConfig.putIfAbsent(flag, true);
        }
    }

    /**
     * Saves configuration to a file with better error handling.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", new TreeMap<>(config.getGeneralConfigMap()));
            Map<String, Object> plugins = new TreeMap<>();
            config.getPluginConfigsMap().forEach((name, section) -> plugins.put(name, new TreeMap<>(section)));
            configMap.put("plugins", plugins);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
