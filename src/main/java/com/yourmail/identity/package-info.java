/**
 * Account resolution and credential checks.
 *
 * <p>Provides the interfaces the rest of the server authenticates and routes through,
 * with SQL and configuration backed implementations.
 */
package com.yourmail.identity;
