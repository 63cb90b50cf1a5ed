/**
 * Message ingestion shared by every ingress path.
 *
 * @see com.yourmail.delivery.MessageSubmission
 */
package com.yourmail.delivery;
