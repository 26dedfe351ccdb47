package com.peerlink.relay.federation;

import reactor.core.publisher.Mono;

/**
 * Used when the relay runs standalone. Every forward fails, so the router falls back to the
 * offline queue alone.
 */
public class DisabledFederationService implements IFederationService {

    @Override
    public Mono<Void> start() {
        return Mono.empty();
    }

    @Override
    public Mono<Void> forward(String targetRelayId, ForwardedMessage message) {
        return Mono.error(new IllegalStateException("Federation is disabled"));
    }

    @Override
    public Mono<Void> stop() {
        return Mono.empty();
    }
}
