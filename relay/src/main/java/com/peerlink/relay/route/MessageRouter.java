package com.peerlink.relay.route;

import com.peerlink.core.msg.RelayFrames;
import com.peerlink.relay.config.RelayConfig;
import com.peerlink.relay.federation.ForwardedMessage;
import com.peerlink.relay.federation.IFederationService;
import com.peerlink.relay.metrics.MetricsService;
import com.peerlink.relay.offline.OfflineQueueService;
import com.peerlink.relay.redis.IRedisService;
import com.peerlink.relay.session.ISessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Decides, per {@code send}, whether to deliver locally, forward to another relay or only queue.
 * <p>
 * A forward is a hand-off to another relay, not a delivery: the recipient may disconnect before
 * that relay reads it. Every {@link RouteResult#FORWARDED_TO_PEER} and
 * {@link RouteResult#UNREACHABLE} outcome therefore also appends the message to the recipient's
 * offline queue, and the returned Mono only completes after that append succeeded.
 * </p>
 */
public class MessageRouter {
    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final RelayConfig config;
    private final ISessionManager sessionManager;
    private final IRedisService redisService;
    private final IFederationService federationService;
    private final OfflineQueueService offlineQueue;
    private final MetricsService metricsService;
    private final Clock clock;

    public MessageRouter(RelayConfig config,
                         ISessionManager sessionManager,
                         IRedisService redisService,
                         IFederationService federationService,
                         OfflineQueueService offlineQueue,
                         MetricsService metricsService) {
        this(config, sessionManager, redisService, federationService, offlineQueue, metricsService, Clock.systemUTC());
    }

    public MessageRouter(RelayConfig config,
                         ISessionManager sessionManager,
                         IRedisService redisService,
                         IFederationService federationService,
                         OfflineQueueService offlineQueue,
                         MetricsService metricsService,
                         Clock clock) {
        this.config = config;
        this.sessionManager = sessionManager;
        this.redisService = redisService;
        this.federationService = federationService;
        this.offlineQueue = offlineQueue;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Routes one payload.
     *
     * @return the outcome; errors only if the message could neither be delivered locally nor
     * queued
     */
    public Mono<RouteResult> route(String fromDid, String toDid, String payload) {
        return Mono.defer(() -> {
            long timestamp = clock.millis();

            if (sessionManager.deliver(toDid, RelayFrames.message(fromDid, payload, timestamp))) {
                log.debug("Delivered locally from {} to {}", fromDid, toDid);
                metricsService.recordRoute(RouteResult.DELIVERED_LOCALLY);
                return Mono.just(RouteResult.DELIVERED_LOCALLY);
            }

            return tryForward(fromDid, toDid, payload, timestamp)
                .defaultIfEmpty(RouteResult.UNREACHABLE)
                .flatMap(result -> offlineQueue.enqueue(toDid, fromDid, payload, timestamp)
                    .doOnSuccess(queued -> log.debug("Routed {} -> {} as {}, queued as {}",
                        fromDid, toDid, result, queued.getId()))
                    .thenReturn(result))
                .doOnNext(metricsService::recordRoute)
                .doOnError(err -> log.error("Failed to queue message from {} to {}", fromDid, toDid, err));
        });
    }

    /**
     * @return {@link RouteResult#FORWARDED_TO_PEER} if presence names another relay and the
     * publish was accepted, {@link RouteResult#UNREACHABLE} if the publish failed, empty if the
     * recipient is not present on any other relay
     */
    private Mono<RouteResult> tryForward(String fromDid, String toDid, String payload, long timestamp) {
        return redisService.getPresenceRelayId(toDid)
            .onErrorResume(err -> {
                log.warn("Presence lookup failed for {}, treating as offline: {}", toDid, err.getMessage());
                return Mono.empty();
            })
            .filter(relayId -> !relayId.equals(config.getRelayId()))
            .flatMap(relayId -> federationService.forward(relayId, ForwardedMessage.builder()
                    .fromDid(fromDid)
                    .toDid(toDid)
                    .payload(payload)
                    .timestamp(timestamp)
                    .originRelayId(config.getRelayId())
                    .build())
                .thenReturn(RouteResult.FORWARDED_TO_PEER)
                .onErrorResume(err -> {
                    log.warn("Forward of message for {} to relay {} failed: {}", toDid, relayId, err.getMessage());
                    return Mono.just(RouteResult.UNREACHABLE);
                }));
    }
}
