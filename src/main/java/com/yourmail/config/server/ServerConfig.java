package com.yourmail.config.server;

import com.yourmail.config.ConfigFoundation;

import java.io.File;
import java.io.IOException;
import java.util.Map;

/**
 * Server configuration.
 *
 * <p>This class provides type safe access to server configuration.
 * <p>Sections are mapped to their own config classes on access.
 *
 * @see ListenerConfig
 * @see EndpointConfig
 * @see DatabaseConfig
 * @see RelayConfig
 * @see HubConfig
 * @see UsersConfig
 */
public class ServerConfig extends ConfigFoundation {

    /**
     * Configuration directory.
     */
    private String configDir;

    /**
     * Constructs a new ServerConfig instance.
     */
    public ServerConfig() {
        super();
    }

    /**
     * Constructs a new ServerConfig instance.
     *
     * @param map Configuration map.
     */
    public ServerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ServerConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ServerConfig(String path) throws IOException {
        super(path);
        this.configDir = new File(path).getParent();
    }

    /**
     * Gets configuration directory.
     *
     * @return Directory path or null if built from a map.
     */
    public String getConfigDir() {
        return configDir;
    }

    /**
     * Gets hostname.
     * <p>Addresses whose domain equals this value are local.
     *
     * @return Hostname.
     */
    public String getHostname() {
        return getStringProperty("hostname", "localhost");
    }

    /**
     * Gets bind address.
     *
     * @return Bind address string.
     */
    public String getBind() {
        return getStringProperty("bind", "0.0.0.0");
    }

    /**
     * Gets session protocol port.
     *
     * @return Port number, 0 disables the listener.
     */
    public int getSessionPort() {
        return Math.toIntExact(getLongProperty("sessionPort", 7777L));
    }

    /**
     * Gets session listener configuration.
     *
     * @return ListenerConfig instance.
     */
    public ListenerConfig getListener() {
        return new ListenerConfig(getMapProperty("listener"));
    }

    /**
     * Gets API endpoint configuration.
     *
     * @return EndpointConfig instance.
     */
    public EndpointConfig getApi() {
        return new EndpointConfig(getMapProperty("api"));
    }

    /**
     * Gets database configuration.
     *
     * @return DatabaseConfig instance.
     */
    public DatabaseConfig getDatabase() {
        return new DatabaseConfig(getMapProperty("database"));
    }

    /**
     * Gets relay client configuration.
     *
     * @return RelayConfig instance.
     */
    public RelayConfig getRelay() {
        return new RelayConfig(getMapProperty("relay"));
    }

    /**
     * Gets fan-out hub configuration.
     *
     * @return HubConfig instance.
     */
    public HubConfig getHub() {
        return new HubConfig(getMapProperty("hub"));
    }

    /**
     * Gets seed users and API tokens.
     *
     * @return UsersConfig instance.
     */
    public UsersConfig getUsers() {
        return new UsersConfig(getMapProperty("users"));
    }

    /**
     * Gets maximum accepted attachment size in bytes.
     *
     * @return Size in bytes.
     */
    public long getMaxAttachmentBytes() {
        return getMapLong("attachments", "maxBytes", 50L * 1024 * 1024);
    }

    private long getMapLong(String section, String key, long defaultValue) {
        Object value = getMapProperty(section).get(key);
        return value instanceof Number ? ((Number) value).longValue() : defaultValue;
    }
}
