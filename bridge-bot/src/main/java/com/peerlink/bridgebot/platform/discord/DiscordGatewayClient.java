package com.peerlink.bridgebot.platform.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.peerlink.bridgebot.platform.IPlatformClient;
import com.peerlink.bridgebot.platform.PlatformMessage;
import com.peerlink.core.util.JitterBackoff;
import com.peerlink.core.util.JsonCodecException;
import com.peerlink.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.WebsocketClientSpec;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Minimal Discord gateway session: identify, heartbeat, and {@code MESSAGE_CREATE} dispatch.
 * <p>
 * Follows the same single-thread, generation-guarded lifecycle as the relay connection. A closed
 * socket or an op 7 / op 9 from Discord opens a fresh session after a backoff delay.
 * </p>
 */
public class DiscordGatewayClient implements IPlatformClient {
    private static final Logger log = LoggerFactory.getLogger(DiscordGatewayClient.class);

    static final int OP_DISPATCH = 0;
    static final int OP_HEARTBEAT = 1;
    static final int OP_IDENTIFY = 2;
    static final int OP_RECONNECT = 7;
    static final int OP_INVALID_SESSION = 9;
    static final int OP_HELLO = 10;
    static final int OP_HEARTBEAT_ACK = 11;

    /** GUILDS | GUILD_MESSAGES | MESSAGE_CONTENT */
    static final int INTENTS = 1 | (1 << 9) | (1 << 15);

    private static final Duration LOGIN_TIMEOUT = Duration.ofSeconds(30);
    private static final int MAX_FRAME_LENGTH = 4 * 1024 * 1024;

    private final String gatewayUrl;
    private final String botToken;
    private final HttpClient httpClient;
    private final JitterBackoff.Sequence backoff;
    private final Scheduler eventLoop;
    private final List<Consumer<PlatformMessage>> handlers = new CopyOnWriteArrayList<>();
    private final Set<String> ownWebhookIds = ConcurrentHashMap.newKeySet();
    private final Sinks.One<Void> ready = Sinks.one();

    private volatile boolean stopped;

    // Touched only on the event loop
    private long generation;
    @Nullable
    private Long lastSequence;
    @Nullable
    private Sinks.Many<String> outbound;
    @Nullable
    private Disposable socket;
    @Nullable
    private Disposable heartbeat;
    @Nullable
    private Disposable reconnectTimer;

    public DiscordGatewayClient(String gatewayUrl, String botToken, Duration maxReconnectDelay) {
        this.gatewayUrl = gatewayUrl;
        this.botToken = botToken;
        this.httpClient = HttpClient.create();
        this.backoff = JitterBackoff.sequence(maxReconnectDelay);
        this.eventLoop = Schedulers.newSingle("discord-gateway");
    }

    @Override
    public Mono<Void> login() {
        return Mono.defer(() -> {
            onEventLoop(this::openSocket);
            return ready.asMono();
        }).timeout(LOGIN_TIMEOUT);
    }

    @Override
    public void onMessage(Consumer<PlatformMessage> handler) {
        handlers.add(handler);
    }

    @Override
    public void registerOwnWebhook(String webhookId) {
        ownWebhookIds.add(webhookId);
    }

    @Override
    public Mono<Void> destroy() {
        return Mono.fromRunnable(() -> {
            stopped = true;
            onEventLoop(() -> {
                generation++;
                cancel(reconnectTimer);
                cancel(heartbeat);
                closeOutbound();
                cancel(socket);
                log.info("Discord gateway session closed");
                eventLoop.dispose();
            });
        });
    }

    // ---------------------------------------------------------------- session lifecycle

    private void openSocket() {
        if (stopped) {
            return;
        }
        cancel(socket);
        cancel(heartbeat);
        closeOutbound();

        long gen = ++generation;
        lastSequence = null;
        Sinks.Many<String> frames = Sinks.many().unicast().onBackpressureBuffer();
        outbound = frames;

        log.info("Connecting to Discord gateway");
        socket = httpClient
            .websocket(WebsocketClientSpec.builder().maxFramePayloadLength(MAX_FRAME_LENGTH).build())
            .uri(gatewayUrl)
            .handle((in, out) -> Mono.firstWithSignal(
                out.sendString(frames.asFlux()).then(),
                in.aggregateFrames(MAX_FRAME_LENGTH)
                    .receive()
                    .asString()
                    .publishOn(eventLoop)
                    .doOnNext(text -> onFrame(gen, text))
                    .then()))
            .then()
            .subscribe(
                v -> {
                },
                err -> onEventLoop(() -> onClosed(gen, err)),
                () -> onEventLoop(() -> onClosed(gen, null)));
    }

    private void onFrame(long gen, String text) {
        if (gen != generation || stopped) {
            return;
        }
        JsonNode frame;
        try {
            frame = JsonUtils.readTree(text);
        } catch (JsonCodecException e) {
            log.warn("Dropping unreadable gateway frame: {}", e.getMessage());
            return;
        }
        JsonNode seq = frame.get("s");
        if (seq != null && seq.isNumber()) {
            lastSequence = seq.asLong();
        }

        switch (frame.path("op").asInt(-1)) {
            case OP_HELLO:
                startHeartbeat(gen, Duration.ofMillis(frame.path("d").path("heartbeat_interval").asLong(41_250)));
                emit(identify());
                break;
            case OP_DISPATCH:
                onDispatch(JsonUtils.textOrNull(frame, "t"), frame.path("d"));
                break;
            case OP_HEARTBEAT:
                emit(heartbeatFrame());
                break;
            case OP_RECONNECT:
            case OP_INVALID_SESSION:
                log.info("Discord asked for a new session (op {})", frame.path("op").asInt());
                cancel(socket);
                onClosed(gen, null);
                break;
            case OP_HEARTBEAT_ACK:
                break;
            default:
                log.debug("Ignoring gateway op {}", frame.path("op").asInt(-1));
        }
    }

    private void onDispatch(@Nullable String type, JsonNode data) {
        if ("READY".equals(type)) {
            backoff.reset();
            log.info("Discord gateway ready as {}", data.path("user").path("username").asText("?"));
            ready.tryEmitEmpty();
        } else if ("MESSAGE_CREATE".equals(type)) {
            toPlatformMessage(data, ownWebhookIds).ifPresent(message -> {
                for (Consumer<PlatformMessage> handler : handlers) {
                    try {
                        handler.accept(message);
                    } catch (RuntimeException e) {
                        log.error("Platform message handler failed", e);
                    }
                }
            });
        }
    }

    private void onClosed(long gen, @Nullable Throwable error) {
        if (gen != generation) {
            return;
        }
        generation++;
        cancel(heartbeat);
        heartbeat = null;
        closeOutbound();
        socket = null;
        if (stopped) {
            return;
        }
        if (error != null) {
            log.warn("Discord gateway socket failed: {}", error.getMessage());
        }
        Duration delay = backoff.next();
        log.info("Reconnecting to Discord gateway in {} ms", delay.toMillis());
        cancel(reconnectTimer);
        reconnectTimer = eventLoop.schedule(this::openSocket, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void startHeartbeat(long gen, Duration interval) {
        cancel(heartbeat);
        heartbeat = Flux.interval(interval, eventLoop)
            .filter(tick -> gen == generation)
            .subscribe(tick -> emit(heartbeatFrame()));
    }

    // ---------------------------------------------------------------- frames

    private String identify() {
        ObjectNode frame = JsonUtils.mapper().createObjectNode().put("op", OP_IDENTIFY);
        ObjectNode d = frame.putObject("d")
            .put("token", botToken)
            .put("intents", INTENTS);
        d.putObject("properties")
            .put("os", System.getProperty("os.name", "linux"))
            .put("browser", "peerlink-bridge")
            .put("device", "peerlink-bridge");
        return JsonUtils.writeValueAsString(frame);
    }

    private String heartbeatFrame() {
        ObjectNode frame = JsonUtils.mapper().createObjectNode().put("op", OP_HEARTBEAT);
        if (lastSequence == null) {
            frame.putNull("d");
        } else {
            frame.put("d", lastSequence);
        }
        return JsonUtils.writeValueAsString(frame);
    }

    /**
     * Converts a {@code MESSAGE_CREATE} payload, or returns empty for anything the bridge must not
     * relay: direct messages, bot authors, and messages posted through one of our own webhooks.
     */
    static Optional<PlatformMessage> toPlatformMessage(JsonNode d, Set<String> ownWebhookIds) {
        String guildId = JsonUtils.textOrNull(d, "guild_id");
        JsonNode author = d.path("author");
        if (guildId == null || author.isMissingNode()) {
            return Optional.empty();
        }
        if (author.path("bot").asBoolean(false)) {
            return Optional.empty();
        }
        String webhookId = JsonUtils.textOrNull(d, "webhook_id");
        if (webhookId != null && ownWebhookIds.contains(webhookId)) {
            return Optional.empty();
        }

        String userId = JsonUtils.textOrNull(author, "id");
        String displayName = JsonUtils.textOrNull(d.path("member"), "nick");
        if (displayName == null) {
            displayName = JsonUtils.textOrNull(author, "global_name");
        }
        if (displayName == null) {
            displayName = JsonUtils.textOrNull(author, "username");
        }
        String avatarHash = JsonUtils.textOrNull(author, "avatar");
        String avatarUrl = avatarHash == null || userId == null
            ? null
            : "https://cdn.discordapp.com/avatars/" + userId + "/" + avatarHash + ".png";

        return Optional.of(PlatformMessage.builder()
            .guildId(guildId)
            .discordChannelId(JsonUtils.textOrNull(d, "channel_id"))
            .discordMessageId(JsonUtils.textOrNull(d, "id"))
            .discordUserId(userId)
            .discordUsername(displayName == null ? "unknown" : displayName)
            .avatarUrl(avatarUrl)
            .content(d.path("content").asText(""))
            .build());
    }

    // ---------------------------------------------------------------- helpers

    private synchronized void emit(String frame) {
        if (outbound != null) {
            outbound.tryEmitNext(frame);
        }
    }

    private synchronized void closeOutbound() {
        if (outbound != null) {
            outbound.tryEmitComplete();
            outbound = null;
        }
    }

    private void onEventLoop(Runnable task) {
        if (!eventLoop.isDisposed()) {
            eventLoop.schedule(task);
        }
    }

    private static void cancel(@Nullable Disposable disposable) {
        if (disposable != null) {
            disposable.dispose();
        }
    }
}
