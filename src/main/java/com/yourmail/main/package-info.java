/**
 * Server runnable, configuration container and bootstrap.
 */
package com.yourmail.main;
