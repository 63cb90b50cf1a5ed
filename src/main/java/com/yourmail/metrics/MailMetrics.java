package com.yourmail.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for ingestion, relay and live subscriptions.
 *
 * <p>All methods are no-ops until {@link MetricsRegistry} holds a registry.
 */
public final class MailMetrics {
    private static final Logger log = LogManager.getLogger(MailMetrics.class);

    private static final AtomicInteger subscriptions = new AtomicInteger();
    private static volatile boolean gaugeRegistered = false;

    /**
     * Private constructor for utility class.
     */
    private MailMetrics() {
    }

    /**
     * Initialize metrics with zero values so they are visible before any traffic.
     */
    public static void initialize() {
        try {
            PrometheusMeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
            if (registry == null) {
                log.warn("Cannot initialize mail metrics - Prometheus registry is null");
                return;
            }
            registerGauge(registry);
            counter(registry, "mail.session.connections", "Session protocol connections accepted");
            log.info("Mail metrics initialized");
        } catch (Exception e) {
            log.error("Failed to initialize mail metrics: {}", e.getMessage(), e);
        }
    }

    /**
     * Increment the session connection counter.
     */
    public static void incrementSessionStart() {
        increment("mail.session.connections", "Session protocol connections accepted", null, null);
    }

    /**
     * Increment the session exception counter.
     *
     * @param exceptionType The simple name of the exception class.
     */
    public static void incrementSessionException(String exceptionType) {
        increment("mail.session.exceptions", "Unexpected exceptions in session workers", "exception_type", exceptionType);
    }

    /**
     * Increment the stored message counter.
     *
     * @param source Ingress path name.
     */
    public static void incrementMessageStored(String source) {
        increment("mail.messages.stored", "Messages stored", "source", source);
    }

    /**
     * Increment the relay outcome counter.
     *
     * @param outcome success or failure.
     */
    public static void incrementRelay(String outcome) {
        increment("mail.relay.attempts", "Outbound relay attempts", "outcome", outcome);
    }

    /**
     * Track a live subscription being added.
     */
    public static void subscriptionAdded() {
        subscriptions.incrementAndGet();
    }

    /**
     * Track a live subscription being removed.
     */
    public static void subscriptionRemoved() {
        subscriptions.decrementAndGet();
    }

    private static void increment(String name, String description, String tag, String value) {
        try {
            PrometheusMeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
            if (registry != null) {
                Counter.Builder builder = Counter.builder(name).description(description);
                if (tag != null) {
                    builder.tag(tag, value);
                }
                builder.register(registry).increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment {}: {}", name, e.getMessage());
        }
    }

    private static void counter(PrometheusMeterRegistry registry, String name, String description) {
        Counter.builder(name).description(description).register(registry);
    }

    private static synchronized void registerGauge(PrometheusMeterRegistry registry) {
        if (!gaugeRegistered) {
            Gauge.builder("mail.hub.subscriptions", subscriptions, AtomicInteger::get)
                    .description("Live event stream subscriptions")
                    .register(registry);
            gaugeRegistered = true;
        }
    }
}
