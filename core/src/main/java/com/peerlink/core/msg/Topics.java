package com.peerlink.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Prefix for per-relay forward topics.
     * <p>
     * Each relay instance consumes its own topic and delivers what it reads to locally
     * registered sockets. Example: {@code relay.forward.relay-eu-1}
     * </p>
     */
    public static final String FORWARD_TOPIC_PREFIX = "relay.forward.";

    public static String forwardTopicFor(String relayId) {
        return FORWARD_TOPIC_PREFIX + relayId;
    }
}
