package com.peerlink.client.relay;

/**
 * Lifecycle of a {@link RelayConnection}.
 * <pre>
 * DISCONNECTED -> CONNECTING -> REGISTERED -> DISCONNECTED -> ...
 *       any state -> STOPPED (terminal)
 * </pre>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    REGISTERED,
    STOPPED
}
