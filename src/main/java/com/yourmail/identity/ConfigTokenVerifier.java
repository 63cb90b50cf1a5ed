package com.yourmail.identity;

import com.yourmail.store.PersistenceException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Token verifier over a static token to username map from configuration.
 */
public class ConfigTokenVerifier implements TokenVerifier {

    private final Map<String, String> tokens;
    private final IdentityResolver resolver;

    /**
     * Constructs a new ConfigTokenVerifier instance.
     *
     * @param tokens   Map of token to username.
     * @param resolver Identity resolver.
     */
    public ConfigTokenVerifier(Map<String, String> tokens, IdentityResolver resolver) {
        this.tokens = new HashMap<>(tokens);
        this.resolver = resolver;
    }

    @Override
    public Optional<Account> verify(String token) throws PersistenceException {
        if (token == null || !tokens.containsKey(token)) {
            return Optional.empty();
        }
        return resolver.findByUsername(tokens.get(token));
    }
}
