package com.peerlink.relay.support;

import com.peerlink.relay.config.RelayConfig;
import com.peerlink.relay.metrics.MetricsService;
import com.peerlink.relay.offline.OfflineQueueService;
import com.peerlink.relay.route.MessageRouter;
import com.peerlink.relay.session.Session;
import com.peerlink.relay.session.SessionManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One relay instance wired with in-memory collaborators.
 */
public class RelayFixture {
    public static final String RELAY_ID = "relay-a";

    public final RelayConfig config = RelayConfig.builder()
        .relayId(RELAY_ID)
        .httpPort(0)
        .kafkaBootstrap("localhost:9092")
        .redisUrl("redis://localhost:6379")
        .federationEnabled(true)
        .offlineMaxPerDid(1000)
        .offlineTtlSec(7 * 24 * 3600)
        .presenceTtlSec(120)
        .perConnBufferSize(16)
        .pingInterval(30)
        .idleTimeout(90)
        .build();

    public final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final InMemoryRedisService redis = new InMemoryRedisService();
    public final RecordingFederationService federation = new RecordingFederationService();
    public final MetricsService metrics = new MetricsService(registry, config);
    public final SessionManager sessions = new SessionManager(redis, config, metrics);
    public final OfflineQueueService offlineQueue = new OfflineQueueService(redis, config, metrics, clock);
    public final MessageRouter router = new MessageRouter(config, sessions, redis, federation, offlineQueue, metrics, clock);

    /**
     * Opens a session and collects every frame emitted to it.
     */
    public Connected connect() {
        Session session = sessions.openSession();
        List<String> frames = new CopyOnWriteArrayList<>();
        session.getOutboundFlux().subscribe(frames::add);
        return new Connected(session, frames);
    }

    public static class Connected {
        public final Session session;
        public final List<String> frames;

        Connected(Session session, List<String> frames) {
            this.session = session;
            this.frames = frames;
        }
    }
}
