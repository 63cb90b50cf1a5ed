package com.yourmail.config;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Loads JSON5 files into the underlying map.
 * <p>Parsing is lenient so comments, unquoted keys and trailing commas are accepted.
 */
public class ConfigFoundation extends BasicConfig {

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {
    }.getType();

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
        super();
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration file path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ConfigFoundation(String path) throws IOException {
        super(read(Path.of(path)));
    }

    /**
     * Reads a JSON5 file into a map.
     *
     * @param path File path.
     * @return Map of String, Object.
     * @throws IOException Unable to read or parse file.
     */
    public static Map<String, Object> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            JsonReader jsonReader = new JsonReader(reader);
            jsonReader.setLenient(true);
            Map<String, Object> map = new Gson().fromJson(jsonReader, MAP_TYPE);
            return map != null ? map : new HashMap<>();
        } catch (RuntimeException e) {
            throw new IOException("Unable to parse config file " + path + ": " + e.getMessage(), e);
        }
    }
}
