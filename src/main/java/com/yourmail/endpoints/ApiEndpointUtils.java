package com.yourmail.endpoints;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Utility methods shared across API endpoint handlers.
 */
public final class ApiEndpointUtils {
    private static final Logger log = LogManager.getLogger(ApiEndpointUtils.class);

    private ApiEndpointUtils() {
        // Utility class - prevent instantiation.
    }

    /**
     * Reads the full request body.
     *
     * @param is       Input stream of the request body.
     * @param maxBytes Largest accepted body.
     * @return Body bytes.
     * @throws IOException If an I/O error occurs or the body is too large.
     */
    public static byte[] readBody(InputStream is, long maxBytes) throws IOException {
        try (is) {
            byte[] bytes = is.readNBytes((int) Math.min(Integer.MAX_VALUE - 8, maxBytes + 1));
            if (bytes.length > maxBytes) {
                throw new IOException("Request body exceeds " + maxBytes + " bytes");
            }
            log.debug("Read request body ({} bytes)", bytes.length);
            return bytes;
        }
    }

    /**
     * Parses the query string from a URI into a map of key-value pairs.
     *
     * @param uri Request URI.
     * @return Map of query parameter names to values.
     */
    public static Map<String, String> parseQuery(URI uri) {
        Map<String, String> map = new HashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) {
            return map;
        }
        for (String pair : query.split("&")) {
            int idx = pair.indexOf('=');
            if (idx > 0) {
                map.put(urlDecode(pair.substring(0, idx)), urlDecode(pair.substring(idx + 1)));
            } else {
                map.put(urlDecode(pair), "");
            }
        }
        return map;
    }

    /**
     * URL-decodes a string using UTF-8 encoding.
     *
     * @param s Encoded string.
     * @return Decoded string.
     */
    public static String urlDecode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }

    /**
     * Parses a long path segment.
     *
     * @param segment Path segment.
     * @return Optional of Long, empty if not a positive number.
     */
    public static Optional<Long> parseId(String segment) {
        try {
            long id = Long.parseLong(segment);
            return id > 0 ? Optional.of(id) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Reads an integer query parameter, falling back when absent, malformed or out of range.
     *
     * @param query        Parsed query.
     * @param name         Parameter name.
     * @param defaultValue Fallback value.
     * @param min          Smallest accepted value.
     * @param max          Largest accepted value.
     * @return Integer.
     */
    public static int intParam(Map<String, String> query, String name, int defaultValue, int min, int max) {
        String value = query.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed < min || parsed > max ? defaultValue : parsed;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
