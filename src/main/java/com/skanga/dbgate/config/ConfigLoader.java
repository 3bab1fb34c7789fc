package com.skanga.dbgate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link GatewayConfig} from the process environment.
 * Uses priority order: environment variables (DB_HOSTS) > env file (.env) > system properties (-Ddb.hosts=) > hard coded defaults.
 * The env file follows the usual dotenv layout: one KEY=VALUE per line, # comments, optional quotes.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String ENV_FILE_VARIABLE = "DBGATE_ENV_FILE";
    public static final String DEFAULT_ENV_FILE = ".env";

    private final Map<String, String> environment;
    private final Map<String, String> fileConfig;

    /**
     * Creates a loader over explicit sources. Useful for tests, where the real environment cannot be changed.
     *
     * @param environment variables that take precedence over everything else
     * @param fileConfig  values read from an env file, may be empty
     */
    public ConfigLoader(Map<String, String> environment, Map<String, String> fileConfig) {
        this.environment = environment != null ? environment : Map.of();
        this.fileConfig = fileConfig != null ? fileConfig : Map.of();
    }

    /**
     * Loads configuration from the real process environment and the optional env file.
     * A missing env file is not an error; an unreadable one is.
     *
     * @return the gateway configuration
     * @throws IOException if the env file exists but cannot be read
     */
    public static GatewayConfig load() throws IOException {
        Map<String, String> processEnv = System.getenv();
        String envFileName = processEnv.getOrDefault(ENV_FILE_VARIABLE, DEFAULT_ENV_FILE);
        Path envFile = Path.of(envFileName);

        Map<String, String> fileConfig = Map.of();
        if (Files.isRegularFile(envFile)) {
            try {
                fileConfig = loadConfigFile(envFile);
            } catch (IOException e) {
                logger.error("Failed to load configuration file: {}", envFile, e);
                throw new IOException(ResourceManager.getErrorMessage("config.file.load.failed", envFile), e);
            }
        } else {
            logger.debug("No env file at {}, using environment and defaults", envFile.toAbsolutePath());
        }
        return new ConfigLoader(processEnv, fileConfig).loadConfiguration();
    }

    /**
     * Resolves every recognized option and builds the configuration.
     *
     * @return the gateway configuration
     * @throws IllegalArgumentException if a numeric or boolean value cannot be parsed or is out of range
     */
    public GatewayConfig loadConfiguration() {
        TargetLists targetLists = new TargetLists(
                getListValue("DB_HOSTS", "DB_HOST", "localhost"),
                getListValue("DB_PORTS", "DB_PORT", "3306"),
                getListValue("DB_USERS", "DB_USER", ""),
                getListValue("DB_PASSWORDS", "DB_PASSWORD", ""),
                getListValue("DB_NAMES", "DB_NAME", ""),
                getListValue("DB_CHARSETS", "DB_CHARSET", ""),
                getListValue("DB_URLS", "DB_URL", ""),
                getConfigValue("DB_TYPE", "mariadb"));

        GatewayConfig gatewayConfig = new GatewayConfig(targetLists,
                parseIntegerConfig("DB_CONNECT_TIMEOUT", GatewayConfig.DEFAULT_CONNECT_TIMEOUT),
                parseIntegerConfig("DB_READ_TIMEOUT", GatewayConfig.DEFAULT_READ_TIMEOUT),
                parseIntegerConfig("DB_WRITE_TIMEOUT", GatewayConfig.DEFAULT_WRITE_TIMEOUT),
                parseIntegerConfig("DB_ACQUIRE_TIMEOUT", GatewayConfig.DEFAULT_ACQUIRE_TIMEOUT),
                parseIntegerConfig("DB_SHUTDOWN_TIMEOUT", GatewayConfig.DEFAULT_SHUTDOWN_TIMEOUT),
                parseLongConfig("DB_IDLE_TIMEOUT_MS", GatewayConfig.DEFAULT_IDLE_TIMEOUT_MS),
                parseLongConfig("DB_MAX_LIFETIME_MS", GatewayConfig.DEFAULT_MAX_LIFETIME_MS),
                parseBooleanConfig("MCP_READ_ONLY", true),
                parseIntegerConfig("MCP_MAX_POOL_SIZE", GatewayConfig.DEFAULT_MAX_POOL_SIZE),
                parseIntegerConfig("MCP_MAX_RESULTS", GatewayConfig.DEFAULT_MAX_RESULTS));

        logger.info("Read-only mode: {}", gatewayConfig.readOnly());
        logger.info("Pool size: {}, max results: {}, timeouts (connect/read/write/acquire): {}s/{}s/{}s/{}s",
                gatewayConfig.maxPoolSize(), gatewayConfig.maxResults(), gatewayConfig.connectTimeoutSeconds(),
                gatewayConfig.readTimeoutSeconds(), gatewayConfig.writeTimeoutSeconds(),
                gatewayConfig.acquireTimeoutSeconds());
        return gatewayConfig;
    }

    /**
     * Gets a configuration value using the priority order:
     * environment > env file > system properties > default.
     *
     * @param varName      config parameter name (uppercase)
     * @param defaultValue default value if not found in any source
     * @return the configuration value from the highest priority source
     */
    String getConfigValue(String varName, String defaultValue) {
        // 1. Environment variable
        String envValue = environment.get(varName);
        if (envValue != null) {
            return envValue;
        }

        // 2. Env file
        String fileValue = fileConfig.get(varName.toUpperCase());
        if (fileValue != null) {
            return fileValue;
        }

        // 3. System property (envVar.lower().replace('_', '.'))
        String propValue = System.getProperty(varName.toLowerCase().replace('_', '.'));
        if (propValue != null) {
            return propValue;
        }

        // 4. Default
        return defaultValue;
    }

    /**
     * Reads a comma separated list, preferring the plural key and falling back to the singular one.
     * Entries are trimmed; empty entries are kept so positions stay aligned across lists.
     */
    List<String> getListValue(String pluralName, String singularName, String defaultValue) {
        String rawValue = getConfigValue(pluralName, null);
        if (rawValue == null) {
            rawValue = getConfigValue(singularName, defaultValue);
        }
        List<String> listValues = new ArrayList<>();
        for (String listEntry : rawValue.split(",", -1)) {
            listValues.add(listEntry.trim());
        }
        return listValues;
    }

    /**
     * Loads configuration parameters from a file.
     * Each line should be in KEY=VALUE format. Lines starting with # are treated as comments.
     * Empty lines are ignored, and a leading {@code export } is tolerated.
     *
     * @param configFilePath path to the configuration file
     * @return map of configuration key-value pairs
     * @throws IOException if the file cannot be read
     */
    public static Map<String, String> loadConfigFile(Path configFilePath) throws IOException {
        Map<String, String> configMap = new HashMap<>();

        try (BufferedReader bufferedReader = Files.newBufferedReader(configFilePath, StandardCharsets.UTF_8)) {
            String currLine;
            int lineNumber = 0;

            while ((currLine = bufferedReader.readLine()) != null) {
                lineNumber++;
                currLine = currLine.trim();

                if (currLine.isEmpty() || currLine.startsWith("#")) {
                    continue;
                }
                if (currLine.startsWith("export ")) {
                    currLine = currLine.substring("export ".length()).trim();
                }

                String[] lineParts = currLine.split("=", 2);
                if (lineParts.length != 2) {
                    logger.warn("Invalid config line {} in file {}: {}", lineNumber, configFilePath, currLine);
                    continue;
                }

                String paramKey = lineParts[0].trim().toUpperCase();
                String paramValue = lineParts[1].trim();

                if (paramKey.isEmpty()) {
                    logger.warn("Key cannot be empty. Invalid config on line {} in file {}", lineNumber, configFilePath);
                    continue;
                }

                if (paramValue.length() >= 2 && ((paramValue.startsWith("\"") && paramValue.endsWith("\""))
                        || (paramValue.startsWith("'") && paramValue.endsWith("'")))) {
                    paramValue = paramValue.substring(1, paramValue.length() - 1);
                }

                configMap.put(paramKey, paramValue);
                logger.debug("Loaded config: {} = {}", paramKey, paramKey.contains("PASSWORD") ? "***" : paramValue);
            }
        }

        logger.info("Loaded {} configuration parameters from file: {}", configMap.size(), configFilePath);
        return configMap;
    }

    private int parseIntegerConfig(String paramName, int defaultValue) {
        String paramValue = getConfigValue(paramName, String.valueOf(defaultValue));
        try {
            return Integer.parseInt(paramValue.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.parse.integer.failed", paramName, paramValue), e);
        }
    }

    private long parseLongConfig(String paramName, long defaultValue) {
        String paramValue = getConfigValue(paramName, String.valueOf(defaultValue));
        try {
            return Long.parseLong(paramValue.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.parse.integer.failed", paramName, paramValue), e);
        }
    }

    private boolean parseBooleanConfig(String paramName, boolean defaultValue) {
        String paramValue = getConfigValue(paramName, String.valueOf(defaultValue));
        String lowerValue = paramValue.toLowerCase().trim();
        if ("true".equals(lowerValue) || "false".equals(lowerValue)) {
            return Boolean.parseBoolean(lowerValue);
        }
        throw new IllegalArgumentException(
                ResourceManager.getErrorMessage("config.parse.boolean.failed", paramName, paramValue));
    }
}
