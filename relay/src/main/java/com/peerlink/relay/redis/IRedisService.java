package com.peerlink.relay.redis;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis operations the relay depends on: DID presence and per-DID offline streams.
 */
public interface IRedisService {

    /**
     * Records that {@code did} is registered on {@code relayId} and refreshes the presence TTL.
     */
    Mono<Void> savePresence(String did, String relayId);

    /**
     * @return relay currently holding the DID's socket, or empty when the DID is offline everywhere
     */
    Mono<String> getPresenceRelayId(String did);

    /**
     * Removes presence, but only while it still points at {@code relayId}; a newer registration on
     * another relay is left alone.
     */
    Mono<Void> deletePresence(String did, String relayId);

    /**
     * Appends to the DID's offline stream, keeping at most {@code maxLen} entries (oldest dropped)
     * and none older than {@code ttl}.
     */
    Mono<Void> appendOffline(String did, String json, int maxLen, Duration ttl);

    /**
     * Reads and removes up to {@code maxCount} entries younger than {@code ttl}, oldest first.
     */
    Flux<String> drainOffline(String did, int maxCount, Duration ttl);

    void close();
}
