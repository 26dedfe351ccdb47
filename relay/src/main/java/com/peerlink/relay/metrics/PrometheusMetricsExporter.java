package com.peerlink.relay.metrics;

import com.peerlink.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Serves the relay's meters in Prometheus text format for {@code GET /metrics}.
 * <p>
 * The scrape contains the {@link MetricsService} meters (routing outcomes, offline queue appends
 * and drains, registrations, rejected frames, live sessions, Kafka publish latency), the JVM
 * and processor binders, and the HTTP server meters Reactor Netty records into the same
 * composite. Every series carries the {@code relay_id} tag so several relays can share one
 * Prometheus job.
 * </p>
 */
public class PrometheusMetricsExporter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final CompositeMeterRegistry composite;
    private final PrometheusMeterRegistry prometheusRegistry;

    /**
     * Attaches to Reactor Netty's global composite, so its HTTP meters are exported too.
     */
    public PrometheusMetricsExporter(String relayId) {
        this(relayId, (CompositeMeterRegistry) Metrics.REGISTRY);
    }

    public PrometheusMetricsExporter(String relayId, CompositeMeterRegistry composite) {
        this.composite = composite;
        this.registry = composite;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        prometheusRegistry.config().commonTags(MetricsTags.RELAY_ID, relayId);
        composite.add(prometheusRegistry);
        log.info("Prometheus exporter attached for relay {}", relayId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }

    /**
     * Detaches the Prometheus registry from the composite; meters recorded afterwards are not
     * exported.
     */
    @Override
    public void close() {
        composite.remove(prometheusRegistry);
        prometheusRegistry.close();
    }
}
