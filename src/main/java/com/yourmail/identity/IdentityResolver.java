package com.yourmail.identity;

import com.yourmail.store.PersistenceException;

import java.util.Optional;

/**
 * Resolves addresses and credentials to local accounts.
 *
 * @see SqlIdentityResolver
 */
public interface IdentityResolver {

    /**
     * Resolves an address to a local account.
     * <p>An address is local only when its domain is this server's hostname and the user exists.
     *
     * @param address Address string.
     * @return Optional of Account, empty when not local.
     * @throws PersistenceException Lookup failure.
     */
    Optional<Account> resolve(String address) throws PersistenceException;

    /**
     * Finds an account by id.
     *
     * @param id Account id.
     * @return Optional of Account.
     * @throws PersistenceException Lookup failure.
     */
    Optional<Account> findById(long id) throws PersistenceException;

    /**
     * Finds an account by username.
     *
     * @param username Username.
     * @return Optional of Account.
     * @throws PersistenceException Lookup failure.
     */
    Optional<Account> findByUsername(String username) throws PersistenceException;

    /**
     * Checks credentials.
     *
     * @param username Username.
     * @param password Password in clear.
     * @return Optional of Account, empty on bad credentials.
     * @throws PersistenceException Lookup failure.
     */
    Optional<Account> authenticate(String username, String password) throws PersistenceException;

    /**
     * Gets this server's hostname.
     *
     * @return Hostname.
     */
    String getHostname();
}
