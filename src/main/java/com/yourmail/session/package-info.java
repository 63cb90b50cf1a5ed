/**
 * Line oriented session protocol.
 *
 * <p>Clients authenticate with CONNECT, compose with SEND, SUBJECT and BODY, and read with LIST and READ.
 * <br>Each connection runs a {@link com.yourmail.session.SessionReceipt} on the listener's pool.
 *
 * <h2>Responses</h2>
 * <ul>
 *     <li><b>2xx</b> - success, 214 for help and 221 on QUIT.</li>
 *     <li><b>451</b> - storage failure on a read path.</li>
 *     <li><b>500</b> - unknown command, state unchanged.</li>
 *     <li><b>501</b> - bad arguments.</li>
 *     <li><b>503</b> - command out of sequence.</li>
 *     <li><b>530/535</b> - not authenticated, bad credentials.</li>
 *     <li><b>550</b> - message not stored.</li>
 * </ul>
 */
package com.yourmail.session;
