package com.peerlink.client.relay;

/**
 * A registered, self-healing WebSocket session with a relay.
 */
public interface IRelayConnection {

    /**
     * Opens the socket and registers. Reconnects on its own until {@link #disconnect()}.
     */
    void connect();

    /**
     * Terminal: closes the socket and cancels any scheduled reconnect or keepalive.
     */
    void disconnect();

    /**
     * Queues a {@code send} frame.
     *
     * @return false unless the connection is registered; the caller decides whether to retry
     */
    boolean sendToDid(String toDid, String payload);

    boolean isConnected();

    ConnectionState getState();

    void addListener(RelayListener listener);
}
