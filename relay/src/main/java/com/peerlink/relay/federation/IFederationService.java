package com.peerlink.relay.federation;

import reactor.core.publisher.Mono;

/**
 * Transport between relay instances.
 */
public interface IFederationService {
    /**
     * Starts consuming messages forwarded to this relay.
     */
    Mono<Void> start();

    /**
     * Publishes a message to the relay holding the recipient.
     *
     * @return Mono completing once the transport accepted the message; this is not a delivery
     * confirmation
     */
    Mono<Void> forward(String targetRelayId, ForwardedMessage message);

    Mono<Void> stop();
}
