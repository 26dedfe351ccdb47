package com.peerlink.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code peerlink.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: routing decisions.
     * <p>
     * Tags: relay_id, outcome (delivered_locally/forwarded/unreachable)
     * </p>
     */
    public static final String ROUTE_TOTAL = "peerlink.relay.route.total";

    /**
     * Counter: messages appended to offline queues.
     * <p>
     * Tags: relay_id
     * </p>
     */
    public static final String OFFLINE_ENQUEUED_TOTAL = "peerlink.relay.offline.enqueued.total";

    /**
     * Counter: queued messages handed to a socket on registration.
     * <p>
     * Tags: relay_id
     * </p>
     */
    public static final String OFFLINE_DRAINED_TOTAL = "peerlink.relay.offline.drained.total";

    /**
     * Counter: successful {@code register} frames.
     * <p>
     * Tags: relay_id
     * </p>
     */
    public static final String REGISTRATIONS_TOTAL = "peerlink.relay.registrations.total";

    /**
     * Gauge: sockets currently registered on this relay.
     * <p>
     * Tags: relay_id
     * </p>
     */
    public static final String ACTIVE_SESSIONS = "peerlink.relay.sessions";

    /**
     * Counter: frames rejected before routing.
     * <p>
     * Tags: relay_id, reason (malformed/unregistered/duplicate_register/invalid_did)
     * </p>
     */
    public static final String REJECTED_FRAMES_TOTAL = "peerlink.relay.frames.rejected.total";

    /**
     * Timer: Kafka publish latency for federation forwards.
     * <p>
     * Tags: topic
     * </p>
     */
    public static final String KAFKA_PUBLISH_LATENCY = "peerlink.kafka.publish.latency";

    /**
     * Distribution Summary: inbound WebSocket frame size (bytes).
     * <p>
     * Tags: relay_id
     * </p>
     */
    public static final String MESSAGE_SIZE_INBOUND = "peerlink.relay.message.size.inbound";
}
