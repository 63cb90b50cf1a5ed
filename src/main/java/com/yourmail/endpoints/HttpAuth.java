package com.yourmail.endpoints;

import com.yourmail.identity.Account;
import com.yourmail.identity.IdentityResolver;
import com.yourmail.identity.TokenVerifier;
import com.yourmail.store.PersistenceException;
import com.sun.net.httpserver.HttpExchange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * HTTP authentication for API routes.
 *
 * <p>Resolves the calling account from the Authorization header.
 * <ul>
 *     <li><b>Bearer</b> - token checked by the {@link TokenVerifier}.</li>
 *     <li><b>Basic</b> - username and password checked by the {@link IdentityResolver}.</li>
 * </ul>
 * <p>Event stream requests may pass the token as a {@code token} query parameter instead,
 * since browsers cannot set headers on event sources.
 *
 * <p>Usage:
 * <pre>{@code
 * Optional<Account> caller = auth.authenticate(exchange, false);
 * if (caller.isEmpty()) {
 *     auth.sendAuthRequired(exchange);
 *     return;
 * }
 * }</pre>
 */
public class HttpAuth {
    private static final Logger log = LogManager.getLogger(HttpAuth.class);

    private final IdentityResolver identities;
    private final TokenVerifier tokens;
    private final String realm;

    /**
     * Constructs an HttpAuth instance.
     *
     * @param identities Identity resolver.
     * @param tokens     Token verifier.
     * @param realm      The authentication realm name.
     */
    public HttpAuth(IdentityResolver identities, TokenVerifier tokens, String realm) {
        this.identities = identities;
        this.tokens = tokens;
        this.realm = realm != null ? realm : "Restricted";
    }

    /**
     * Resolves the calling account.
     *
     * @param exchange        The HTTP exchange object.
     * @param allowQueryToken Accept a token query parameter.
     * @return Optional of Account, empty if unauthenticated.
     * @throws PersistenceException Lookup failure.
     */
    public Optional<Account> authenticate(HttpExchange exchange, boolean allowQueryToken) throws PersistenceException {
        String authHeader = exchange.getRequestHeaders().getFirst("Authorization");

        if (authHeader == null) {
            if (allowQueryToken) {
                String token = ApiEndpointUtils.parseQuery(exchange.getRequestURI()).get("token");
                if (token != null && !token.isBlank()) {
                    return tokens.verify(token.trim());
                }
            }
            log.debug("Authentication failed: missing Authorization header from {}", exchange.getRemoteAddress());
            return Optional.empty();
        }

        if (authHeader.regionMatches(true, 0, "Bearer ", 0, 7)) {
            Optional<Account> account = tokens.verify(authHeader.substring(7).trim());
            if (account.isEmpty()) {
                log.debug("Authentication failed: invalid Bearer token from {}", exchange.getRemoteAddress());
            }
            return account;
        }

        if (authHeader.regionMatches(true, 0, "Basic ", 0, 6)) {
            return validateBasicAuth(authHeader.substring(6).trim(), exchange);
        }

        log.debug("Authentication failed: unsupported scheme from {}", exchange.getRemoteAddress());
        return Optional.empty();
    }

    /**
     * Validates Basic authentication.
     *
     * @param encoded  Base64 credentials.
     * @param exchange HTTP exchange object.
     * @return Optional of Account.
     * @throws PersistenceException Lookup failure.
     */
    private Optional<Account> validateBasicAuth(String encoded, HttpExchange exchange) throws PersistenceException {
        String credentials;
        try {
            credentials = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Authentication failed: error decoding Basic credentials from {}: {}",
                    exchange.getRemoteAddress(), e.getMessage());
            return Optional.empty();
        }

        int colon = credentials.indexOf(':');
        if (colon <= 0) {
            return Optional.empty();
        }
        return identities.authenticate(credentials.substring(0, colon), credentials.substring(colon + 1));
    }

    /**
     * Sends a 401 Unauthorized response with authentication challenge.
     *
     * @param exchange The HTTP exchange object.
     * @throws IOException If an I/O error occurs.
     */
    public void sendAuthRequired(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("WWW-Authenticate", "Basic realm=\"" + realm + "\"");
        byte[] response = "{\"success\":false,\"error\":\"unauthorized\",\"message\":\"Authentication required\"}"
                .getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(401, response.length);
        exchange.getResponseBody().write(response);
        exchange.getResponseBody().close();
        log.debug("Sent 401 Unauthorized response to {}", exchange.getRemoteAddress());
    }
}
