package io.mustlink.api.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mustlink.api.clients.MustApiBase;
import io.mustlink.api.clients.MustProvidersClient;

/**
 * Configuration for MUSTlink client operations.
 * Sources with precedence:
 * 1. System properties (command line -D, {@code mustlink.*})
 * 2. Environment variables
 * 3. Properties file (mustlink.properties on the classpath)
 * 4. Default values
 */
public class MustClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(MustClientConfig.class);

    public static final String URL = "mustlink.url";
    public static final String CREDENTIALS_FILE = "mustlink.credentialsFile";
    public static final String PROXY = "mustlink.proxy";
    public static final String DEFAULT_PROVIDER = "mustlink.defaultProvider";
    public static final String DEBUG_LEVEL = "mustlink.debugLevel";
    public static final String EXCLUDED_PROVIDER_USERS = "mustlink.excludedProviderUsers";

    public static final String ENV_URL = "MUSTLINK_URL";
    public static final String ENV_CREDENTIALS = "MUSTLINK_CREDENTIALS";
    public static final String ENV_PROXY = "MUSTLINK_PROXY";
    public static final String ENV_PROVIDER = "MUSTLINK_PROVIDER";

    public static final String DEFAULT_PROPERTIES_FILE = "mustlink.properties";
    public static final String DEFAULT_CREDENTIALS_FILE = "mustlink.yml";

    private static MustClientConfig instance;
    private final Properties properties;
    private final Map<String, String> environment;

    MustClientConfig(Properties fileProperties, Map<String, String> environment, Properties systemProperties) {
        this.environment = environment;
        this.properties = new Properties();
        properties.putAll(fileProperties);
        mapEnvToProperty(ENV_URL, URL);
        mapEnvToProperty(ENV_CREDENTIALS, CREDENTIALS_FILE);
        mapEnvToProperty(ENV_PROXY, PROXY);
        mapEnvToProperty(ENV_PROVIDER, DEFAULT_PROVIDER);
        systemProperties.stringPropertyNames().stream()
                .filter(key -> key.startsWith("mustlink."))
                .forEach(key -> properties.setProperty(key, systemProperties.getProperty(key)));
    }

    private MustClientConfig(MustClientConfig base, Map<String, String> overrides) {
        this.environment = base.environment;
        this.properties = new Properties();
        properties.putAll(base.properties);
        overrides.forEach((key, value) -> {
            if (value != null) {
                properties.setProperty(key, value);
            }
        });
    }

    /**
     * Get singleton instance built from the classpath file, the environment and system properties.
     */
    public static synchronized MustClientConfig getInstance() {
        if (instance == null) {
            instance = new MustClientConfig(loadPropertiesFile(), System.getenv(), System.getProperties());
            instance.logConfigurationStatus();
        }
        return instance;
    }

    /**
     * Configuration from explicit properties only, ignoring environment and system properties.
     */
    public static MustClientConfig fromProperties(Properties properties) {
        return new MustClientConfig(properties, Map.of(), new Properties());
    }

    /**
     * Copy of this configuration with the given keys replaced; {@code null} values are ignored.
     */
    public MustClientConfig withOverrides(Map<String, String> overrides) {
        return new MustClientConfig(this, overrides);
    }

    private static Properties loadPropertiesFile() {
        Properties config = new Properties();
        try (InputStream input = MustClientConfig.class.getClassLoader().getResourceAsStream(DEFAULT_PROPERTIES_FILE)) {
            if (input != null) {
                config.load(input);
                logger.info("Loaded configuration from {}", DEFAULT_PROPERTIES_FILE);
            } else {
                logger.debug("Properties file {} not found in classpath", DEFAULT_PROPERTIES_FILE);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties file {}: {}", DEFAULT_PROPERTIES_FILE, e.getMessage());
        }
        return config;
    }

    private void mapEnvToProperty(String envKey, String propKey) {
        String envValue = environment.get(envKey);
        if (envValue != null && !envValue.trim().isEmpty()) {
            properties.setProperty(propKey, envValue);
        }
    }

    private void logConfigurationStatus() {
        logger.info("MUSTlink Configuration Status:");
        logger.info("  URL: {}", getUrl());
        logger.info("  Credentials file: {}", getCredentialsFile());
        logger.info("  Proxy: {}", getProxy() != null ? getProxy() : "none");
        logger.info("  Default provider: {}", getDefaultProvider() != null ? getDefaultProvider() : "not set");
    }

    // Getters for configuration values

    public String getUrl() {
        return properties.getProperty(URL, MustApiBase.DEFAULT_URL);
    }

    public Path getCredentialsFile() {
        String configured = getProperty(CREDENTIALS_FILE);
        if (configured != null) {
            return Paths.get(configured);
        }
        return defaultConfigDirectory().resolve(DEFAULT_CREDENTIALS_FILE);
    }

    public String getProxy() {
        return getProperty(PROXY);
    }

    public String getDefaultProvider() {
        return getProperty(DEFAULT_PROVIDER);
    }

    /**
     * Request logging level; a value that is not an integer counts as 0.
     */
    public int getDebugLevel() {
        String configured = getProperty(DEBUG_LEVEL);
        if (configured == null) {
            return 0;
        }
        try {
            return Integer.parseInt(configured);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid {} '{}', using 0", DEBUG_LEVEL, configured);
            return 0;
        }
    }

    public Set<String> getExcludedProviderUsers() {
        String configured = getProperty(EXCLUDED_PROVIDER_USERS);
        if (configured == null) {
            return Set.of(MustProvidersClient.SCRIPTING_ENGINE_USER);
        }
        Set<String> users = new LinkedHashSet<>();
        Arrays.stream(configured.split(","))
                .map(String::trim)
                .filter(user -> !user.isEmpty())
                .forEach(users::add);
        return users;
    }

    /**
     * Blank values count as unset.
     */
    public String getProperty(String key) {
        String value = properties.getProperty(key);
        return value != null && !value.trim().isEmpty() ? value.trim() : null;
    }

    /**
     * $APPDATA on Windows, else $XDG_CONFIG_HOME, else ~/.config.
     */
    Path defaultConfigDirectory() {
        String appData = environment.get("APPDATA");
        if (appData != null && !appData.isEmpty()) {
            return Paths.get(appData);
        }
        String xdg = environment.get("XDG_CONFIG_HOME");
        if (xdg != null && !xdg.isEmpty()) {
            return Paths.get(xdg);
        }
        return Paths.get(System.getProperty("user.home"), ".config");
    }
}
