/**
 * Live delivery of inbox events to connected readers.
 *
 * <p>{@link com.yourmail.hub.FanoutHub} keeps subscribers per account and never performs sink I/O while
 * holding its lock. Each {@link com.yourmail.hub.Subscription} has a bounded queue drained by its own
 * connection worker, which preserves per-subscriber event order.
 */
package com.yourmail.hub;
