package com.peerlink.relay.session;

import com.peerlink.core.msg.RelayFrames;
import com.peerlink.relay.config.RelayConfig;
import com.peerlink.relay.metrics.MetricsService;
import com.peerlink.relay.redis.IRedisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks registered sockets and keeps Redis presence in step with them.
 */
public class SessionManager implements ISessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final IRedisService redisService;
    private final RelayConfig config;
    private final MetricsService metricsService;
    private final SessionFactory sessionFactory;

    // Registered sessions: did -> Session
    private final Map<String, Session> activeSessions = new ConcurrentHashMap<>();

    public SessionManager(IRedisService redisService, RelayConfig config, MetricsService metricsService) {
        this.redisService = redisService;
        this.config = config;
        this.metricsService = metricsService;
        this.sessionFactory = new SessionFactory(config);
        metricsService.bindActiveSessions(activeSessions::size);
    }

    @Override
    public Session openSession() {
        return sessionFactory.createSession();
    }

    @Override
    public Mono<Void> register(String did, Session session) {
        return Mono.defer(() -> {
            session.bind(did);
            Session previous = activeSessions.put(did, session);
            if (previous != null && previous != session) {
                log.info("DID {} re-registered, closing previous connection {}", did, previous.getConnectionId());
                previous.emit(RelayFrames.error("Registered from another connection"));
                previous.close();
            }
            metricsService.recordRegistration();

            return redisService.savePresence(did, config.getRelayId())
                .doOnSuccess(v -> log.debug("Presence persisted for {} on {}", did, config.getRelayId()))
                .onErrorResume(err -> {
                    // Local delivery still works; remote relays will queue instead of forwarding
                    log.warn("Presence not persisted for {}: {}", did, err.getMessage());
                    return Mono.empty();
                });
        });
    }

    @Override
    public Mono<Void> unregister(Session session) {
        String did = session.getDid();
        session.close();
        if (did == null || !activeSessions.remove(did, session)) {
            return Mono.empty();
        }

        log.debug("Session removed for {}", did);
        return redisService.deletePresence(did, config.getRelayId())
            .onErrorResume(err -> {
                log.warn("Presence not removed for {}: {}", did, err.getMessage());
                return Mono.empty();
            });
    }

    @Override
    public boolean deliver(String did, String frame) {
        Session session = activeSessions.get(did);
        if (session == null) {
            log.debug("No local session for {}", did);
            return false;
        }

        if (!session.emit(frame)) {
            log.warn("Failed to emit frame to {} (connection {})", did, session.getConnectionId());
            return false;
        }
        return true;
    }

    @Override
    public boolean isLocal(String did) {
        return activeSessions.containsKey(did);
    }

    @Override
    public int activeCount() {
        return activeSessions.size();
    }

    @Override
    public Mono<Void> closeAll() {
        log.info("Closing {} active sessions", activeSessions.size());
        return Flux.fromIterable(activeSessions.values())
            .flatMap(this::unregister)
            .then();
    }
}
