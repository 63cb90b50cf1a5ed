/**
 * Outbound relay of messages addressed to other servers.
 *
 * <p>Delivery is best effort: one attempt, no retry queue.
 */
package com.yourmail.relay;
