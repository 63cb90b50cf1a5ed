package com.yourmail.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.time.Instant;

/**
 * Shared Gson instance for HTTP bodies, events and relay payloads.
 */
public final class Json {

    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(Instant.class, new InstantTypeAdapter())
            .disableHtmlEscaping()
            .create();

    private Json() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets the shared Gson instance.
     *
     * @return Gson instance.
     */
    public static Gson gson() {
        return GSON;
    }

    /**
     * Serializes to JSON.
     *
     * @param object Object to serialize.
     * @return JSON string.
     */
    public static String toJson(Object object) {
        return GSON.toJson(object);
    }
}
