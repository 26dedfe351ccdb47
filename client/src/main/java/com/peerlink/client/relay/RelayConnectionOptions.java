package com.peerlink.client.relay;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Settings for one {@link RelayConnection}.
 */
@Value
@Builder(toBuilder = true)
public class RelayConnectionOptions {
    /**
     * WebSocket URL of the relay, e.g. {@code ws://localhost:8080/ws}.
     */
    String url;

    /**
     * DID registered on every (re)connect.
     */
    String did;

    @Builder.Default
    Duration keepaliveInterval = Duration.ofSeconds(25);

    @Builder.Default
    Duration maxReconnectDelay = Duration.ofSeconds(30);

    @Builder.Default
    int maxFramePayloadLength = 1024 * 1024;

    /**
     * Options for a peer process: {@code RELAY_URL}, {@code KEEPALIVE_INTERVAL} and
     * {@code MAX_RECONNECT_DELAY} (milliseconds).
     */
    public static RelayConnectionOptions fromEnv(String did) {
        return fromMap(System.getenv(), did);
    }

    static RelayConnectionOptions fromMap(Map<String, String> env, String did) {
        RelayConnectionOptionsBuilder builder = RelayConnectionOptions.builder()
            .url(env.getOrDefault("RELAY_URL", "ws://localhost:8080/ws"))
            .did(did);
        if (env.containsKey("KEEPALIVE_INTERVAL")) {
            builder.keepaliveInterval(Duration.ofMillis(Long.parseLong(env.get("KEEPALIVE_INTERVAL"))));
        }
        if (env.containsKey("MAX_RECONNECT_DELAY")) {
            builder.maxReconnectDelay(Duration.ofMillis(Long.parseLong(env.get("MAX_RECONNECT_DELAY"))));
        }
        return builder.build();
    }
}
