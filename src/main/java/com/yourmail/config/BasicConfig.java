package com.yourmail.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Map backed configuration container.
 *
 * <p>Provides typed accessors with defaults over a configuration map.
 * <p>Numbers read from JSON5 arrive as doubles, integers set in code arrive as integers,
 * so numeric getters accept any {@link Number} and numeric strings.
 */
@SuppressWarnings("unchecked")
public class BasicConfig {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new BasicConfig instance.
     */
    public BasicConfig() {
    }

    /**
     * Constructs a new BasicConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public BasicConfig(Map<String, Object> map) {
        if (map != null) {
            this.map = map;
        }
    }

    /**
     * Gets configuration map.
     *
     * @return Map of String, Object.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Checks if property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name);
    }

    /**
     * Gets property as Object.
     *
     * @param name Property name.
     * @return Object or null.
     */
    public Object getProperty(String name) {
        return map.get(name);
    }

    /**
     * Gets String property.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets String property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = map.get(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets Long property.
     *
     * @param name Property name.
     * @return Long or null.
     */
    public Long getLongProperty(String name) {
        return getLongProperty(name, null);
    }

    /**
     * Gets Long property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Object value = map.get(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return (long) Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Gets Boolean property.
     *
     * @param name Property name.
     * @return Boolean, false if missing.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets Boolean property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        Object value = map.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    /**
     * Gets List property.
     *
     * @param name Property name.
     * @return List, empty if missing.
     */
    public List<?> getListProperty(String name) {
        Object value = map.get(name);
        return value instanceof List ? (List<?>) value : new ArrayList<>();
    }

    /**
     * Gets Map property.
     *
     * @param name Property name.
     * @return Map, empty if missing.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = map.get(name);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }
}
