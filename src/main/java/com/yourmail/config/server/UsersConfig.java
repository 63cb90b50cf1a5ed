package com.yourmail.config.server;

import com.yourmail.config.BasicConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Users configuration.
 *
 * <p>Holds the accounts seeded at startup and the static API tokens.
 *
 * @see UserConfig
 */
@SuppressWarnings("unchecked")
public class UsersConfig extends BasicConfig {

    /**
     * Constructs a new UsersConfig instance.
     *
     * @param map Configuration map.
     */
    public UsersConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets seed users list.
     *
     * @return List of UserConfig instances.
     */
    public List<UserConfig> getList() {
        List<UserConfig> users = new ArrayList<>();
        for (Object entry : getListProperty("list")) {
            if (entry instanceof Map) {
                users.add(new UserConfig((Map<String, Object>) entry));
            }
        }
        return users;
    }

    /**
     * Gets token to username mapping.
     *
     * @return Map of token to username.
     */
    public Map<String, String> getTokens() {
        Map<String, String> tokens = new HashMap<>();
        getMapProperty("tokens").forEach((token, username) -> tokens.put(token, String.valueOf(username)));
        return tokens;
    }
}
