package com.peerlink.relay.session;

import com.peerlink.relay.config.RelayConfig;
import reactor.core.publisher.Sinks;

import java.util.UUID;

/**
 * Creates sessions with a bounded outbound buffer.
 */
public class SessionFactory {
    private final RelayConfig config;

    public SessionFactory(RelayConfig config) {
        this.config = config;
    }

    public Session createSession() {
        // Frames emitted before the socket subscribes are buffered, up to the same bound
        Sinks.Many<String> sink = Sinks.many().multicast().onBackpressureBuffer(
            config.getPerConnBufferSize(), false
        );

        return new Session(UUID.randomUUID().toString(), sink);
    }
}
