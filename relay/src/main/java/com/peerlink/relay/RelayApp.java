package com.peerlink.relay;

import com.peerlink.relay.bridge.BridgeApiHandler;
import com.peerlink.relay.bridge.BridgeConfigStore;
import com.peerlink.relay.config.RelayConfig;
import com.peerlink.relay.federation.DisabledFederationService;
import com.peerlink.relay.federation.IFederationService;
import com.peerlink.relay.federation.KafkaFederationService;
import com.peerlink.relay.http.HttpServer;
import com.peerlink.relay.metrics.MetricsService;
import com.peerlink.relay.metrics.PrometheusMetricsExporter;
import com.peerlink.relay.offline.OfflineQueueService;
import com.peerlink.relay.redis.RedisService;
import com.peerlink.relay.route.MessageRouter;
import com.peerlink.relay.session.SessionManager;
import com.peerlink.relay.ws.RelayWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Main entry point for a relay instance.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve the client WebSocket at /ws (register, send, ping)</li>
 *   <li>Route each send: local socket, federated relay, offline queue</li>
 *   <li>Keep DID presence and offline queues in Redis</li>
 *   <li>Exchange forwarded messages with other relays over Kafka</li>
 *   <li>Serve the bridge config API under /api/bridge</li>
 *   <li>Expose /healthz and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class RelayApp {
    private static final Logger log = LoggerFactory.getLogger(RelayApp.class);

    public static void main(String[] args) {
        RelayConfig config = RelayConfig.fromEnv();
        MDC.put("relayId", config.getRelayId());

        log.info("Starting relay: {}", config.getRelayId());
        log.info("  Redis: {}", config.getRedisUrl());
        log.info("  Kafka: {} (federation {})", config.getKafkaBootstrap(),
            config.isFederationEnabled() ? "enabled" : "disabled");

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getRelayId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);
        RedisService redisService = new RedisService(config);
        SessionManager sessionManager = new SessionManager(redisService, config, metricsService);
        OfflineQueueService offlineQueue = new OfflineQueueService(redisService, config, metricsService);

        IFederationService federationService = config.isFederationEnabled()
            ? new KafkaFederationService(config, sessionManager, metricsService)
            : new DisabledFederationService();
        federationService.start().block();

        MessageRouter router = new MessageRouter(
            config, sessionManager, redisService, federationService, offlineQueue, metricsService
        );

        BridgeConfigStore bridgeStore = new BridgeConfigStore(
            config.getDataDir() == null ? null : Path.of(config.getDataDir())
        );
        bridgeStore.loadFromDisk();

        HttpServer httpServer = new HttpServer(
            config,
            new RelayWebSocketHandler(config, sessionManager, router, offlineQueue, metricsService),
            new BridgeApiHandler(bridgeStore),
            metricsExporter
        );
        httpServer.start();

        log.info("Relay {} is ready", config.getRelayId());

        handleShutdown(config, sessionManager, federationService, httpServer, redisService, metricsExporter);

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(RelayConfig config,
                                       SessionManager sessionManager,
                                       IFederationService federationService,
                                       HttpServer httpServer,
                                       RedisService redisService,
                                       PrometheusMetricsExporter metricsExporter) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("relayId", config.getRelayId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            federationService.stop().block(Duration.ofSeconds(10));
            httpServer.stop();
            sessionManager.closeAll().block(Duration.ofSeconds(30));
            redisService.close();
            metricsExporter.close();

            log.info("Shutdown complete");
        }));
    }
}
