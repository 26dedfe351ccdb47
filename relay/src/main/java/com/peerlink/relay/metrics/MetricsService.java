package com.peerlink.relay.metrics;

import com.peerlink.core.metrics.MetricsNames;
import com.peerlink.core.metrics.MetricsTags;
import com.peerlink.relay.config.RelayConfig;
import com.peerlink.relay.route.RouteResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Centralized metrics service for a relay instance.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String relayId;

    private final Map<RouteResult, Counter> routeCounters = new EnumMap<>(RouteResult.class);
    private final Counter offlineEnqueued;
    private final Counter offlineDrained;
    private final Counter registrations;

    private final DistributionSummary messageSizeInbound;
    private final Timer kafkaPublishLatency;

    public MetricsService(MeterRegistry registry, RelayConfig config) {
        this.registry = registry;
        this.relayId = config.getRelayId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        for (RouteResult result : RouteResult.values()) {
            routeCounters.put(result, Counter.builder(MetricsNames.ROUTE_TOTAL)
                .tag(MetricsTags.RELAY_ID, relayId)
                .tag(MetricsTags.OUTCOME, result.getTag())
                .description("Routing decisions for client sends")
                .register(registry));
        }

        offlineEnqueued = Counter.builder(MetricsNames.OFFLINE_ENQUEUED_TOTAL)
            .tag(MetricsTags.RELAY_ID, relayId)
            .description("Messages appended to offline queues")
            .register(registry);

        offlineDrained = Counter.builder(MetricsNames.OFFLINE_DRAINED_TOTAL)
            .tag(MetricsTags.RELAY_ID, relayId)
            .description("Queued messages handed to a socket on registration")
            .register(registry);

        registrations = Counter.builder(MetricsNames.REGISTRATIONS_TOTAL)
            .tag(MetricsTags.RELAY_ID, relayId)
            .register(registry);

        messageSizeInbound = DistributionSummary.builder(MetricsNames.MESSAGE_SIZE_INBOUND)
            .tag(MetricsTags.RELAY_ID, relayId)
            .description("Inbound frame size distribution")
            .baseUnit("bytes")
            .register(registry);

        kafkaPublishLatency = Timer.builder(MetricsNames.KAFKA_PUBLISH_LATENCY)
            .tag(MetricsTags.TOPIC, "relay.forward")
            .description("Kafka federation publish latency")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(250),
                Duration.ofMillis(500)
            )
            .register(registry);
    }

    public void bindActiveSessions(Supplier<Number> activeSessions) {
        Gauge.builder(MetricsNames.ACTIVE_SESSIONS, activeSessions)
            .tag(MetricsTags.RELAY_ID, relayId)
            .description("Sockets registered on this relay")
            .register(registry);
    }

    public void recordRoute(RouteResult result) {
        routeCounters.get(result).increment();
    }

    public void recordOfflineEnqueued() {
        offlineEnqueued.increment();
    }

    public void recordOfflineDrained(long count) {
        offlineDrained.increment(count);
    }

    public void recordRegistration() {
        registrations.increment();
    }

    /**
     * @param reason malformed/unregistered/duplicate_register/invalid_did/unknown_type
     */
    public void recordRejectedFrame(String reason) {
        registry.counter(MetricsNames.REJECTED_FRAMES_TOTAL, MetricsTags.RELAY_ID, relayId, MetricsTags.REASON, reason)
            .increment();
    }

    public void recordInboundFrame(long bytes) {
        messageSizeInbound.record(bytes);
    }

    public void recordKafkaPublishLatency(long startNanos) {
        kafkaPublishLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public double getRouteCount(RouteResult result) {
        return routeCounters.get(result).count();
    }
}
