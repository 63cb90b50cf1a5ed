/**
 * HTTP API on the JDK embedded server.
 *
 * <p>Messages, sends, threads, attachments, the live inbox event stream, inbound relay and metrics.
 */
package com.yourmail.endpoints;
