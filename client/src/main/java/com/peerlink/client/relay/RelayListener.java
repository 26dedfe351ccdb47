package com.peerlink.client.relay;

import com.peerlink.core.event.CommunityEventEnvelope;

/**
 * Callbacks of a {@link RelayConnection}. All of them run on the connection's event loop, one
 * at a time, in frame arrival order.
 */
public interface RelayListener {

    /**
     * The relay confirmed registration; {@link IRelayConnection#sendToDid} works from now on.
     */
    default void onConnected() {
    }

    /**
     * The socket closed or failed, whether or not it had registered. A reconnect is scheduled
     * unless {@link IRelayConnection#disconnect()} was called.
     */
    default void onDisconnected() {
    }

    /**
     * A {@code message} frame whose payload is a community event envelope.
     */
    default void onEnvelope(CommunityEventEnvelope envelope, String fromDid) {
    }

    /**
     * Every {@code message} frame, envelope or not.
     */
    default void onRawMessage(String fromDid, String payload) {
    }

    default void onRelayError(String message) {
    }
}
