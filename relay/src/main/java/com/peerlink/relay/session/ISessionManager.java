package com.peerlink.relay.session;

import reactor.core.publisher.Mono;

/**
 * Registry of DIDs with an open socket on this relay.
 */
public interface ISessionManager {

    /**
     * Creates an unregistered session for a freshly accepted socket.
     */
    Session openSession();

    /**
     * Binds the session to {@code did}, replacing any earlier socket for the same DID, and
     * publishes presence.
     */
    Mono<Void> register(String did, Session session);

    /**
     * Removes the session if it is still the current one for its DID. A no-op for sessions that
     * never registered or were already replaced.
     */
    Mono<Void> unregister(Session session);

    /**
     * Hands a frame to the DID's local socket.
     *
     * @return false if the DID has no socket here or the socket could not take the frame
     */
    boolean deliver(String did, String frame);

    boolean isLocal(String did);

    int activeCount();

    /**
     * Closes every session (graceful shutdown).
     */
    Mono<Void> closeAll();
}
