package com.yourmail.metrics;

import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

/**
 * Global access to the metric registry.
 */
public final class MetricsRegistry {
    private static volatile PrometheusMeterRegistry prometheusRegistry;

    /**
     * Private constructor for utility class.
     */
    private MetricsRegistry() {
    }

    /**
     * Creates and registers a Prometheus registry if none is registered yet.
     *
     * @return Prometheus registry.
     */
    public static synchronized PrometheusMeterRegistry initialize() {
        if (prometheusRegistry == null) {
            prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        }
        return prometheusRegistry;
    }

    /**
     * Get the Prometheus registry.
     *
     * @return Prometheus registry or null if not initialized.
     */
    public static PrometheusMeterRegistry getPrometheusRegistry() {
        return prometheusRegistry;
    }
}
