package me.christianrobert.shellast.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory limits for parsing and normalization. Values are read on every parse, so a change
 * applies to the next call.
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String MAX_SCRIPT_SIZE = "parse.max-script-size";
    public static final String MAX_DEPTH = "normalize.max-depth";
    public static final String MAX_LIST_LENGTH = "normalize.max-list-length";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        configuration.put(MAX_SCRIPT_SIZE, 10 * 1024 * 1024);
        configuration.put(MAX_DEPTH, 256);
        configuration.put(MAX_LIST_LENGTH, 100_000);
        log.info("Configuration service initialized with default limits");
    }

    public Integer getConfigValueAsInteger(String key) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value {} is not an integer: '{}'", key, value);
                return null;
            }
        }
        return null;
    }

    /**
     * Gets a configuration value as a positive integer.
     * Falls back to the given default if the value is missing, not a number or not positive.
     *
     * @param key Configuration key
     * @param defaultValue Value to use when the configured one is unusable
     * @return Configured value or the default
     */
    public int getPositiveInteger(String key, int defaultValue) {
        Integer value = getConfigValueAsInteger(key);
        if (value == null || value <= 0) {
            return defaultValue;
        }
        return value;
    }

    /**
     * Sets one limit. A null value removes the key, so readers fall back to their default.
     */
    public void setConfigValue(String key, Object value) {
        Object oldValue = value != null ? configuration.put(key, value) : configuration.remove(key);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }
}
