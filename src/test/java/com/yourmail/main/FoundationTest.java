package com.yourmail.main;

import com.yourmail.config.server.ServerConfig;
import org.junit.jupiter.api.Test;

import javax.naming.ConfigurationException;

import static org.junit.jupiter.api.Assertions.*;

class FoundationTest {

    @Test
    void loadsServerConfig() throws ConfigurationException {
        Foundation.init("src/test/resources/cfg/");
        ServerConfig config = Config.getServer();

        assertEquals("example.test", config.getHostname());
        assertEquals("127.0.0.1", config.getBind());
        assertEquals(0, config.getSessionPort());
        assertEquals(5, config.getListener().getReadTimeout());
        assertEquals(50, config.getListener().getTransactionsLimit());
        assertEquals(2, config.getApi().getDefaultLimit());
        assertEquals(5, config.getApi().getMaxLimit());
        assertEquals(10, config.getApi().getBacklog());
        assertFalse(config.getRelay().isEnabled());
        assertEquals(1, config.getHub().getKeepaliveSeconds());
        assertEquals(1024L, config.getMaxAttachmentBytes());
        assertEquals(2, config.getUsers().getList().size());
        assertEquals("bob@example.test", config.getUsers().getList().get(1).getEmail());
        assertEquals("alice", config.getUsers().getTokens().get("alice-token"));
    }

    @Test
    void defaults() {
        ServerConfig config = new ServerConfig();

        assertEquals("localhost", config.getHostname());
        assertEquals(7777, config.getSessionPort());
        assertEquals(8080, config.getApi().getPort(8080));
        assertEquals(50, config.getApi().getDefaultLimit());
        assertEquals(100, config.getApi().getMaxLimit());
        assertTrue(config.getRelay().isEnabled());
        assertEquals(8080, config.getRelay().getPort());
        assertEquals(30, config.getHub().getKeepaliveSeconds());
        assertEquals("jdbc:sqlite:yourmail.db", config.getDatabase().getJdbcUrl());
    }

    @Test
    void missingDirectory() {
        assertThrows(ConfigurationException.class, () -> Foundation.init("src/test/resources/missing/"));
    }
}
