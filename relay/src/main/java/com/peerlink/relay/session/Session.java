package com.peerlink.relay.session;

import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import javax.annotation.Nullable;

/**
 * One WebSocket connection and its outbound frame queue.
 * <p>
 * A session starts unregistered and is bound to a DID at most once. Frames are emitted from the
 * socket's own inbound loop, from the router of other connections and from the federation
 * consumer, so emission is serialized here.
 * </p>
 */
public class Session {
    @Getter
    private final String connectionId;
    private final Sinks.Many<String> sink;

    @Nullable
    private volatile String did;

    public Session(String connectionId, Sinks.Many<String> sink) {
        this.connectionId = connectionId;
        this.sink = sink;
    }

    @Nullable
    public String getDid() {
        return did;
    }

    public boolean isRegistered() {
        return did != null;
    }

    void bind(String did) {
        this.did = did;
    }

    /**
     * Queues a frame for the socket.
     *
     * @return false if the socket is gone or its buffer is full
     */
    public synchronized boolean emit(String frame) {
        return !sink.tryEmitNext(frame).isFailure();
    }

    public Flux<String> getOutboundFlux() {
        return sink.asFlux();
    }

    public synchronized void close() {
        sink.tryEmitComplete();
    }
}
