package com.peerlink.relay.http;

import com.peerlink.relay.bridge.BridgeApiHandler;
import com.peerlink.relay.config.RelayConfig;
import com.peerlink.relay.metrics.PrometheusMetricsExporter;
import com.peerlink.relay.ws.RelayWebSocketHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics, the bridge config API and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final RelayConfig config;
    private final RelayWebSocketHandler wsHandler;
    private final BridgeApiHandler bridgeApi;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                // list must be declared before the {communityId} pattern
                .get("/api/bridge/list", bridgeApi::handleList)
                .post("/api/bridge/register", bridgeApi::handleRegister)
                .get("/api/bridge/{communityId}", bridgeApi::handleGet)
                .put("/api/bridge/{communityId}/members", bridgeApi::handleUpdateMembers)
                .put("/api/bridge/{communityId}/enabled", bridgeApi::handleSetEnabled)
                .delete("/api/bridge/{communityId}", bridgeApi::handleDelete)
                .ws("/ws", wsHandler::handle)
            )
            .bind()
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        log.info("HTTP server started on port {}", server.port());
        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
