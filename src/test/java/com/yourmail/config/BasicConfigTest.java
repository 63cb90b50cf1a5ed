package com.yourmail.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BasicConfigTest {

    private BasicConfig config() {
        Map<String, Object> map = new HashMap<>();
        map.put("name", "yourmail");
        map.put("port", 7777.0);
        map.put("text", "42");
        map.put("enabled", true);
        map.put("list", List.of("a", "b"));
        map.put("map", Map.of("key", "value"));
        return new BasicConfig(map);
    }

    @Test
    void strings() {
        assertEquals("yourmail", config().getStringProperty("name"));
        assertEquals("fallback", config().getStringProperty("missing", "fallback"));
        assertNull(config().getStringProperty("missing"));
    }

    @Test
    void longs() {
        assertEquals(7777L, config().getLongProperty("port"));
        assertEquals(42L, config().getLongProperty("text"));
        assertEquals(5L, config().getLongProperty("missing", 5L));
    }

    @Test
    void booleansListsMaps() {
        assertTrue(config().getBooleanProperty("enabled"));
        assertFalse(config().getBooleanProperty("missing"));
        assertTrue(config().getBooleanProperty("missing", true));
        assertEquals(2, config().getListProperty("list").size());
        assertTrue(config().getListProperty("missing").isEmpty());
        assertEquals("value", config().getMapProperty("map").get("key"));
        assertTrue(config().getMapProperty("missing").isEmpty());
        assertTrue(config().hasProperty("name"));
        assertFalse(config().hasProperty("missing"));
    }
}
