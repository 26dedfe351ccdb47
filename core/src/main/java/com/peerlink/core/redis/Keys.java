package com.peerlink.core.redis;

/**
 * Redis keyspace shared by every relay instance.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Namespace prefixes avoid collisions ({@code sess:}, {@code offline:})</li>
 *   <li>Every key has a TTL or a length cap so storage stays bounded</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Presence key for a DID: {@code sess:{did}}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b>
     * <ul>
     *   <li>{@code relayId}: relay instance holding the DID's socket</li>
     *   <li>{@code lastSeen}: epoch millis of the last registration or refresh</li>
     * </ul>
     * <b>TTL:</b> sliding, refreshed while the socket stays open.
     * </p>
     */
    public static String sess(String did) {
        return "sess:" + did;
    }

    /**
     * Offline queue of a DID: {@code offline:{did}}
     * <p>
     * <b>Type:</b> Stream (XADD with MAXLEN), entries older than the queue TTL are trimmed on
     * append and skipped on drain.
     * </p>
     */
    public static String offline(String did) {
        return "offline:" + did;
    }
}
