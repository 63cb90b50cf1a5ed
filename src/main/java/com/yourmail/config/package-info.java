/**
 * Configuration foundation.
 *
 * <p>JSON5 configuration files are read into maps and exposed through type safe accessor classes.
 *
 * @see com.yourmail.config.server.ServerConfig
 */
package com.yourmail.config;
