/**
 * Micrometer metrics served in Prometheus format on the API endpoint.
 */
package com.yourmail.metrics;
