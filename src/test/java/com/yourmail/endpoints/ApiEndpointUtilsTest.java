package com.yourmail.endpoints;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ApiEndpointUtilsTest {

    @Test
    void parseQuery() {
        Map<String, String> query = ApiEndpointUtils.parseQuery(URI.create("http://h/api?limit=10&token=a%2Bb&flag"));

        assertEquals("10", query.get("limit"));
        assertEquals("a+b", query.get("token"));
        assertTrue(query.containsKey("flag"));
        assertTrue(ApiEndpointUtils.parseQuery(URI.create("http://h/api")).isEmpty());
    }

    @Test
    void parseId() {
        assertEquals(Optional.of(12L), ApiEndpointUtils.parseId("12"));
        assertEquals(Optional.empty(), ApiEndpointUtils.parseId("0"));
        assertEquals(Optional.empty(), ApiEndpointUtils.parseId("-3"));
        assertEquals(Optional.empty(), ApiEndpointUtils.parseId("abc"));
        assertEquals(Optional.empty(), ApiEndpointUtils.parseId(null));
    }

    @Test
    void intParam() {
        Map<String, String> query = Map.of("limit", "20", "big", "500", "bad", "x");

        assertEquals(20, ApiEndpointUtils.intParam(query, "limit", 50, 1, 100));
        assertEquals(50, ApiEndpointUtils.intParam(query, "big", 50, 1, 100));
        assertEquals(50, ApiEndpointUtils.intParam(query, "bad", 50, 1, 100));
        assertEquals(50, ApiEndpointUtils.intParam(query, "missing", 50, 1, 100));
    }

    @Test
    void readBodyLimit() throws IOException {
        assertArrayEquals(new byte[]{1, 2, 3}, ApiEndpointUtils.readBody(new ByteArrayInputStream(new byte[]{1, 2, 3}), 3));
        assertThrows(IOException.class, () -> ApiEndpointUtils.readBody(new ByteArrayInputStream(new byte[4]), 3));
    }
}
