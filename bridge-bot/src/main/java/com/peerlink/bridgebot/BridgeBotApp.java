package com.peerlink.bridgebot;

import com.peerlink.bridgebot.config.BridgeBotConfig;
import com.peerlink.bridgebot.controller.BridgeController;
import com.peerlink.bridgebot.platform.discord.DiscordGatewayClient;
import com.peerlink.bridgebot.platform.discord.DiscordWebhookManager;
import com.peerlink.bridgebot.relay.RelayApiClient;
import com.peerlink.client.relay.RelayConnection;
import com.peerlink.core.identity.Identity;
import com.peerlink.core.identity.IdentityProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point for the bridge bot.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Load or create the bridge identity in {@code BRIDGE_DATA_DIR}</li>
 *   <li>Poll the relay's bridge config API and register the bridge DID in each config</li>
 *   <li>Relay guild messages to community members and community messages to guild channels</li>
 * </ul>
 * </p>
 */
public class BridgeBotApp {
    private static final Logger log = LoggerFactory.getLogger(BridgeBotApp.class);

    public static void main(String[] args) {
        BridgeBotConfig config = BridgeBotConfig.fromEnv();
        Identity identity = IdentityProvider.loadOrCreate(Path.of(config.getBridgeDataDir()));
        MDC.put("did", identity.getDid());

        log.info("Starting bridge bot: {}", identity.getDid());
        log.info("  Relay: {} (api {})", config.getRelayUrl(), config.getRelayApiUrl());
        log.info("  Config poll interval: {} ms", config.getConfigPollInterval().toMillis());

        DiscordGatewayClient gateway = new DiscordGatewayClient(
            config.getDiscordGatewayUrl(), config.getDiscordBotToken(), config.getMaxReconnectDelay());
        DiscordWebhookManager webhooks = new DiscordWebhookManager(
            config.getDiscordApiUrl(), config.getDiscordBotToken(), gateway::registerOwnWebhook);
        Scheduler eventLoop = Schedulers.newSingle("bridge-controller");

        BridgeController controller = new BridgeController(
            config,
            identity.getDid(),
            new RelayApiClient(config.getRelayApiUrl()),
            new RelayConnection(config.relayConnectionOptions(identity.getDid())),
            gateway,
            webhooks,
            eventLoop,
            Clock.systemUTC()
        );
        controller.start().block();

        handleShutdown(identity, controller, eventLoop);

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(Identity identity, BridgeController controller, Scheduler eventLoop) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("did", identity.getDid());
            log.info("Shutdown signal received, stopping bridge...");

            controller.stop().block(Duration.ofSeconds(10));
            eventLoop.dispose();

            log.info("Shutdown complete");
        }));
    }
}
