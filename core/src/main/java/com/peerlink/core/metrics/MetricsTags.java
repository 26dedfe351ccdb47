package com.peerlink.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String RELAY_ID = "relay_id";

    /**
     * Routing outcome: delivered_locally/forwarded/unreachable.
     */
    public static final String OUTCOME = "outcome";

    public static final String REASON = "reason";

    public static final String TOPIC = "topic";
}
