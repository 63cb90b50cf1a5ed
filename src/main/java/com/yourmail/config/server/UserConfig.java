package com.yourmail.config.server;

import com.yourmail.config.BasicConfig;

import java.util.Map;

/**
 * Seed user configuration.
 */
public class UserConfig extends BasicConfig {

    /**
     * Constructs a new UserConfig instance.
     *
     * @param map Configuration map.
     */
    public UserConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets username.
     *
     * @return Username.
     */
    public String getName() {
        return getStringProperty("name");
    }

    /**
     * Gets password.
     *
     * @return Password in clear.
     */
    public String getPass() {
        return getStringProperty("pass");
    }

    /**
     * Gets email address, if configured.
     *
     * @return Address or null.
     */
    public String getEmail() {
        return getStringProperty("email");
    }
}
