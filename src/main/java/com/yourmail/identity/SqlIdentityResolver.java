package com.yourmail.identity;

import com.yourmail.config.server.UserConfig;
import com.yourmail.store.PersistenceException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bouncycastle.crypto.generators.OpenBSDBCrypt;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * SQL backed identity resolver.
 *
 * <p>Accounts live in the users table with BCrypt password hashes.
 */
public class SqlIdentityResolver implements IdentityResolver {
    private static final Logger log = LogManager.getLogger(SqlIdentityResolver.class);

    private static final int COST = 10;
    private static final SecureRandom random = new SecureRandom();

    private final DataSource dataSource;
    private final String hostname;

    /**
     * Constructs a new SqlIdentityResolver instance.
     *
     * @param dataSource DataSource instance.
     * @param hostname   Server hostname.
     */
    public SqlIdentityResolver(DataSource dataSource, String hostname) {
        this.dataSource = dataSource;
        this.hostname = hostname;
    }

    @Override
    public String getHostname() {
        return hostname;
    }

    @Override
    public Optional<Account> resolve(String address) throws PersistenceException {
        Optional<MailAddress> parsed = MailAddress.parse(address);
        if (parsed.isEmpty() || !parsed.get().getDomain().equalsIgnoreCase(hostname)) {
            return Optional.empty();
        }
        return findByUsername(parsed.get().getLocal());
    }

    @Override
    public Optional<Account> findById(long id) throws PersistenceException {
        return findOne("SELECT id, username, email FROM users WHERE id = ?", ps -> ps.setLong(1, id));
    }

    @Override
    public Optional<Account> findByUsername(String username) throws PersistenceException {
        return findOne("SELECT id, username, email FROM users WHERE username = ?", ps -> ps.setString(1, username));
    }

    @Override
    public Optional<Account> authenticate(String username, String password) throws PersistenceException {
        if (StringUtils.isAnyBlank(username, password)) {
            return Optional.empty();
        }

        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT id, username, email, password_hash FROM users WHERE username = ?")) {
            ps.setString(1, username);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next() && OpenBSDBCrypt.checkPassword(rs.getString("password_hash"),
                        password.getBytes(StandardCharsets.UTF_8))) {
                    return Optional.of(map(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Authentication lookup failed for {}: {}", username, e.getMessage());
            throw new PersistenceException("Authentication lookup failed", e);
        }

        log.debug("Authentication failed for {}", username);
        return Optional.empty();
    }

    /**
     * Creates the account unless the username is taken.
     *
     * @param username Username.
     * @param password Password in clear.
     * @param email    Contact email, defaults to username@hostname.
     * @return Account, existing or created.
     * @throws PersistenceException Storage failure.
     */
    public Account createIfMissing(String username, String password, String email) throws PersistenceException {
        Optional<Account> existing = findByUsername(username);
        if (existing.isPresent()) {
            return existing.get();
        }

        String address = StringUtils.defaultIfBlank(email, username + "@" + hostname);
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO users (username, email, password_hash, created_at) VALUES (?, ?, ?, ?)")) {
            ps.setString(1, username);
            ps.setString(2, address);
            ps.setString(3, hash(password));
            ps.setLong(4, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Unable to create user " + username + ": " + e.getMessage(), e);
        }

        log.info("Created user {}", username);
        return findByUsername(username).orElseThrow(() -> new PersistenceException("User " + username + " not found after insert"));
    }

    /**
     * Seeds configured users.
     *
     * @param users List of UserConfig.
     * @throws PersistenceException Storage failure.
     */
    public void seed(List<UserConfig> users) throws PersistenceException {
        for (UserConfig user : users) {
            if (StringUtils.isAnyBlank(user.getName(), user.getPass())) {
                log.warn("Skipping seed user without name or password");
                continue;
            }
            createIfMissing(user.getName(), user.getPass(), user.getEmail());
        }
    }

    static String hash(String password) {
        byte[] salt = new byte[16];
        random.nextBytes(salt);
        return OpenBSDBCrypt.generate(password.getBytes(StandardCharsets.UTF_8), salt, COST);
    }

    private Optional<Account> findOne(String sql, StatementBinder binder) throws PersistenceException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            log.error("User lookup failed: {}", e.getMessage());
            throw new PersistenceException("User lookup failed", e);
        }
    }

    private static Account map(ResultSet rs) throws SQLException {
        return new Account(rs.getLong("id"), rs.getString("username"), rs.getString("email"));
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
