/**
 * Server configuration accessors.
 *
 * <p>{@link com.yourmail.config.server.ServerConfig} is loaded from {@code server.json5} and exposes each
 * section through its own accessor class.
 */
package com.yourmail.config.server;
