package com.dcv.config;

import com.google.gson.GsonBuilder;
import com.google.gson.Strictness;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Wraps a map parsed from a JSON5 file and provides type safe accessors.
 * <p>Property names may use dots to reach into nested objects, e.g. <i>rateGate.permits</i>.
 * <p>Gson reads numbers as doubles so numeric getters accept any {@link Number}.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new empty ConfigFoundation instance.
     */
    public ConfigFoundation() {
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        if (map != null) {
            this.map = map;
        }
    }

    /**
     * Constructs a new ConfigFoundation instance from a JSON5 file.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public ConfigFoundation(String path) throws IOException {
        String json = Files.readString(Path.of(path), StandardCharsets.UTF_8);
        Map<String, Object> parsed = new GsonBuilder()
                .setStrictness(Strictness.LENIENT)
                .create()
                .fromJson(json, MAP_TYPE);

        if (parsed != null) {
            this.map = parsed;
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
        return getProperty(name) != null;
    }

    /**
     * Gets property by name, walking nested maps for dotted names.
     *
     * @param name Property name.
     * @return Object or null if not found.
     */
    public Object getProperty(String name) {
        if (map.containsKey(name)) {
            return map.get(name);
        }

        Object current = map;
        for (String part : name.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(part);
        }

        return current;
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
     * @param name Property name.
     * @param def  Default value.
     * @return String.
     */
    public String getStringProperty(String name, String def) {
        Object value = getProperty(name);
        return value != null ? String.valueOf(value) : def;
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
     * @param name Property name.
     * @param def  Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long def) {
        Object value = getProperty(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Property " + name + " is not a number: " + value, e);
            }
        }
        return def;
    }

    /**
     * Gets Boolean property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets Boolean property with default.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean def) {
        Object value = getProperty(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return def;
    }

    /**
     * Gets List property.
     *
     * @param name Property name.
     * @return List, empty if not found.
     */
    public List<Object> getListProperty(String name) {
        Object value = getProperty(name);
        return value instanceof List ? (List<Object>) value : new ArrayList<>();
    }

    /**
     * Gets Map property.
     *
     * @param name Property name.
     * @return Map, empty if not found.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = getProperty(name);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }
}
