package com.yourmail.identity;

import com.yourmail.store.PersistenceException;

import java.util.Optional;

/**
 * Verifies bearer tokens.
 *
 * @see ConfigTokenVerifier
 */
public interface TokenVerifier {

    /**
     * Verifies a token.
     *
     * @param token Token string.
     * @return Optional of Account, empty if the token is unknown.
     * @throws PersistenceException Lookup failure.
     */
    Optional<Account> verify(String token) throws PersistenceException;
}
