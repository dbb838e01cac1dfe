package com.mimecast.shuttle.config;

import javax.naming.ConfigurationException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Map backed container providing type safe accessors to configuration values.
 * <p>Keys may be dotted paths to reach into nested maps, e.g. <i>migration.search.maxAttempts</i>.
 * <p>Numbers are accepted in any numeric form since Gson yields doubles and SnakeYAML integers.
 *
 * @see ConfigLoader
 */
public class ConfigFoundation {

    /**
     * Configuration map.
     */
    protected final Map<String, Object> map;

    /**
     * Constructs a new empty ConfigFoundation instance.
     */
    public ConfigFoundation() {
        this.map = new LinkedHashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map != null ? new LinkedHashMap<>(map) : new LinkedHashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance from a JSON or YAML file.
     *
     * @param path File path.
     * @throws ConfigurationException Unable to read or parse file.
     */
    public ConfigFoundation(Path path) throws ConfigurationException {
        this.map = ConfigLoader.load(path);
    }

    /**
     * Gets map.
     *
     * @return Unmodifiable map view.
     */
    public Map<String, Object> getMap() {
        return Collections.unmodifiableMap(map);
    }

    /**
     * Checks if the configuration is empty.
     *
     * @return Boolean.
     */
    public boolean isEmpty() {
        return map.isEmpty();
    }

    /**
     * Checks if property exists and is not null.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return lookup(name) != null;
    }

    /**
     * Gets property as string.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets property as string with default.
     *
     * @param name     Property name.
     * @param fallback Default value.
     * @return String.
     */
    public String getStringProperty(String name, String fallback) {
        Object value = lookup(name);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Double && ((Double) value) == Math.rint((Double) value)) {
            // Gson reads every number as double, avoid "993.0" style strings.
            return String.valueOf(((Double) value).longValue());
        }
        return String.valueOf(value);
    }

    /**
     * Gets property as long with default.
     *
     * @param name     Property name.
     * @param fallback Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long fallback) {
        Object value = lookup(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Property " + name + " is not a number: " + value, e);
            }
        }
        return fallback;
    }

    /**
     * Gets property as int within bounds.
     *
     * @param name     Property name.
     * @param fallback Default value.
     * @param min      Lowest accepted value.
     * @param max      Highest accepted value.
     * @return Integer.
     * @throws ConfigurationException Not a number or out of bounds.
     */
    public int getIntProperty(String name, int fallback, int min, int max) throws ConfigurationException {
        long value;
        try {
            value = getLongProperty(name, (long) fallback);
        } catch (IllegalArgumentException e) {
            ConfigurationException ce = new ConfigurationException(e.getMessage());
            ce.setRootCause(e);
            throw ce;
        }
        if (value < min || value > max) {
            throw new ConfigurationException("Property " + name + " must be between " + min + " and " + max + ": " + value);
        }
        return (int) value;
    }

    /**
     * Gets property as boolean with default.
     *
     * @param name     Property name.
     * @param fallback Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean fallback) {
        Object value = lookup(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String && !((String) value).isBlank()) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return fallback;
    }

    /**
     * Gets property as map.
     *
     * @param name Property name.
     * @return Map, empty if absent or not a map.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = lookup(name);
        Map<String, Object> result = new LinkedHashMap<>();
        if (value instanceof Map) {
            ((Map<?, ?>) value).forEach((key, val) -> result.put(String.valueOf(key), val));
        }
        return result;
    }

    /**
     * Gets property as list.
     *
     * @param name Property name.
     * @return List, empty if absent or not a list.
     */
    public List<Object> getListProperty(String name) {
        Object value = lookup(name);
        if (value instanceof List) {
            return new ArrayList<>((List<?>) value);
        }
        return new ArrayList<>();
    }

    /**
     * Resolves a plain or dotted property name.
     * <p>A literal key containing dots takes precedence over path traversal.
     *
     * @param name Property name.
     * @return Object or null.
     */
    protected Object lookup(String name) {
        if (name == null) {
            return null;
        }
        if (map.containsKey(name)) {
            return map.get(name);
        }

        Object current = map;
        for (String part : name.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(part);
        }
        return current;
    }
}
