/**
 * Shared SQLite connection pool and schema bootstrap.
 */
package com.yourmail.db;
