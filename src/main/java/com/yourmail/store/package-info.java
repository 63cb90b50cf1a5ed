/**
 * Threaded message and attachment storage.
 *
 * <h2>Threads</h2>
 * <p>Every message belongs to exactly one thread identified by a 128 bit hex id.
 * <br>The id is minted when a message arrives with neither a thread hint nor a parent hint.
 * <br>A reply to a stored parent always carries the parent's thread id.
 * <br>A reply to a parent that was never stored is accepted and logged.
 *
 * <h2>Inbox</h2>
 * <p>The inbox shows one representative per thread, the earliest message in it addressed to the reader,
 * ordered by the thread's latest activity.
 */
package com.yourmail.store;
