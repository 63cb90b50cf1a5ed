package com.yourmail.identity;

/**
 * Local account.
 */
public class Account {

    private final long id;
    private final String username;
    private final String email;

    /**
     * Constructs a new Account instance.
     *
     * @param id       Account id.
     * @param username Username, the local part of the account address.
     * @param email    Contact email.
     */
    public Account(long id, String username, String email) {
        this.id = id;
        this.username = username;
        this.email = email;
    }

    public long getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public String getEmail() {
        return email;
    }

    /**
     * Gets the address other users write to.
     *
     * @param hostname Server hostname.
     * @return username@hostname.
     */
    public String getAddress(String hostname) {
        return username + "@" + hostname;
    }

    @Override
    public String toString() {
        return "Account{id=" + id + ", username=" + username + "}";
    }
}
