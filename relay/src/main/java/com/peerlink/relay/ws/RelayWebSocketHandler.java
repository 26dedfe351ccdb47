package com.peerlink.relay.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.peerlink.core.msg.RelayFrames;
import com.peerlink.core.util.BytesUtils;
import com.peerlink.core.util.JsonCodecException;
import com.peerlink.core.util.JsonUtils;
import com.peerlink.relay.config.RelayConfig;
import com.peerlink.relay.metrics.MetricsService;
import com.peerlink.relay.offline.OfflineQueueService;
import com.peerlink.relay.route.MessageRouter;
import com.peerlink.relay.session.ISessionManager;
import com.peerlink.relay.session.Session;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * WebSocket handler for client connections.
 * <p>
 * Protocol (client → relay):
 * <ul>
 *   <li>register: {did}; must come first, only {@code ping} is accepted before it</li>
 *   <li>send: {to_did, payload}</li>
 *   <li>ping</li>
 * </ul>
 * </p>
 * <p>
 * Protocol (relay → client):
 * <ul>
 *   <li>registered: {did}, followed by every queued message for that DID</li>
 *   <li>message: {from_did, payload, timestamp}</li>
 *   <li>pong</li>
 *   <li>error: {message}; the connection stays open</li>
 * </ul>
 * </p>
 */
public class RelayWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(RelayWebSocketHandler.class);

    static final String ERR_MUST_REGISTER = "Must register before sending other messages";
    static final String ERR_ALREADY_REGISTERED = "Already registered";
    static final String ERR_INVALID_DID = "Invalid DID format";

    private final RelayConfig config;
    private final ISessionManager sessionManager;
    private final MessageRouter router;
    private final OfflineQueueService offlineQueue;
    private final MetricsService metricsService;

    public RelayWebSocketHandler(RelayConfig config,
                                 ISessionManager sessionManager,
                                 MessageRouter router,
                                 OfflineQueueService offlineQueue,
                                 MetricsService metricsService) {
        this.config = config;
        this.sessionManager = sessionManager;
        this.router = router;
        this.offlineQueue = offlineQueue;
        this.metricsService = metricsService;
    }

    public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound) {
        Session session = sessionManager.openSession();
        log.debug("WebSocket opened: connection {}", session.getConnectionId());

        inbound.withConnection(connection -> {
            long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
            long pingIntervalInMillis = config.getPingInterval() * 1000L;

            connection.onWriteIdle(pingIntervalInMillis, () -> connection.outbound().sendObject(
                    Mono.just(new PingWebSocketFrame())
                ).then().subscribe())
                .onReadIdle(idleTimeoutInMillis, () -> outbound.sendClose().subscribe())
                .onDispose(() -> {
                    log.debug("WebSocket connection {} disposed ({})", session.getConnectionId(), session.getDid());
                    sessionManager.unregister(session).subscribe();
                });
        });

        Mono<Void> inboundLoop = inbound.aggregateFrames()
            .receive()
            .asString()
            .onBackpressureBuffer(config.getPerConnBufferSize())
            .concatMap(frame -> handleFrame(session, frame)
                .onErrorResume(err -> {
                    log.warn("Error processing frame on {}: {}", session.getConnectionId(), err.getMessage());
                    return Mono.empty();
                }))
            .doOnError(err -> {
                if (!(err instanceof AbortedException)) {
                    log.error("Fatal error in inbound stream for {}", session.getConnectionId(), err);
                }
            })
            .onErrorResume(err -> Mono.empty())
            .then(Mono.defer(() -> sessionManager.unregister(session)));

        return Mono.when(outbound.sendString(session.getOutboundFlux()), inboundLoop);
    }

    /**
     * Processes one text frame. Package-private so the protocol can be exercised without a socket.
     */
    Mono<Void> handleFrame(Session session, String text) {
        metricsService.recordInboundFrame(BytesUtils.getBytesLength(text));

        JsonNode frame;
        try {
            frame = JsonUtils.readTree(text);
        } catch (JsonCodecException e) {
            return reject(session, "malformed", "Invalid message format: " + rootMessage(e));
        }
        String type = JsonUtils.textOrNull(frame, "type");
        if (type == null) {
            return reject(session, "malformed", "Invalid message format: missing type");
        }

        if (RelayFrames.PING.equals(type)) {
            session.emit(RelayFrames.pong());
            return Mono.empty();
        }

        if (!session.isRegistered()) {
            if (RelayFrames.REGISTER.equals(type)) {
                return register(session, JsonUtils.textOrNull(frame, "did"));
            }
            return reject(session, "unregistered", ERR_MUST_REGISTER);
        }

        switch (type) {
            case RelayFrames.REGISTER:
                return reject(session, "duplicate_register", ERR_ALREADY_REGISTERED);
            case RelayFrames.SEND:
                return send(session, JsonUtils.textOrNull(frame, "to_did"), JsonUtils.textOrNull(frame, "payload"));
            default:
                log.debug("Unknown frame type '{}' from {}", type, session.getDid());
                return reject(session, "unknown_type", "Unknown message type: " + type);
        }
    }

    private Mono<Void> register(Session session, String did) {
        if (did == null || !did.startsWith("did:")) {
            return reject(session, "invalid_did", ERR_INVALID_DID);
        }

        // registered goes out before the session is visible to the router
        session.emit(RelayFrames.registered(did));
        return sessionManager.register(did, session)
            .doOnSuccess(v -> log.info("WebSocket registered: {} (connection {})", did, session.getConnectionId()))
            .then(deliverQueued(session, did));
    }

    /**
     * Drains the offline queue into the socket. A message the socket cannot take goes straight
     * back into the queue.
     */
    private Mono<Void> deliverQueued(Session session, String did) {
        return offlineQueue.drain(did)
            .concatMap(message -> {
                if (session.emit(RelayFrames.message(message.getFromDid(), message.getPayload(), message.getTimestamp()))) {
                    return Mono.just(1L);
                }
                log.warn("Socket for {} refused queued message {}, re-queueing", did, message.getId());
                return offlineQueue.enqueue(did, message).thenReturn(0L);
            })
            .reduce(0L, Long::sum)
            .doOnNext(count -> {
                if (count > 0) {
                    metricsService.recordOfflineDrained(count);
                    log.info("Delivered {} queued messages to {}", count, did);
                }
            })
            .then();
    }

    private Mono<Void> send(Session session, String toDid, String payload) {
        if (toDid == null || payload == null) {
            return reject(session, "malformed", "Invalid message format: send requires to_did and payload");
        }
        String fromDid = session.getDid();
        return router.route(fromDid, toDid, payload)
            .doOnNext(result -> log.debug("send {} -> {}: {}", fromDid, toDid, result))
            .onErrorResume(err -> {
                session.emit(RelayFrames.error("Failed to deliver or queue message for " + toDid));
                return Mono.empty();
            })
            .then();
    }

    private Mono<Void> reject(Session session, String reason, String message) {
        metricsService.recordRejectedFrame(reason);
        session.emit(RelayFrames.error(message));
        return Mono.empty();
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage();
        if (message == null) {
            return cause.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }
}
