package com.peerlink.bridgebot.controller;

import com.peerlink.bridgebot.bridge.EchoGuard;
import com.peerlink.bridgebot.bridge.MessageTransform;
import com.peerlink.bridgebot.bridge.ResolvedSeat;
import com.peerlink.bridgebot.config.BridgeBotConfig;
import com.peerlink.bridgebot.platform.IPlatformClient;
import com.peerlink.bridgebot.platform.IWebhookSender;
import com.peerlink.bridgebot.platform.PlatformMessage;
import com.peerlink.bridgebot.relay.IRelayApiClient;
import com.peerlink.client.relay.IRelayConnection;
import com.peerlink.client.relay.RelayListener;
import com.peerlink.core.event.CommunityEventEnvelope;
import com.peerlink.core.event.CommunityMessageSent;
import com.peerlink.core.model.BridgeConfig;
import com.peerlink.core.model.BridgeConfigSummary;
import com.peerlink.core.model.BridgeSeat;
import com.peerlink.core.model.RegisterBridgeRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Bridges platform guild channels and relay communities in both directions.
 * <p>
 * Every state change happens on {@code eventLoop}: config installs, platform messages, relay
 * envelopes, echo-guard updates. Loaded bridges are indexed by guild ID for platform traffic and
 * by canonical community ID for relay traffic; a reload swaps the {@link ActiveBridge} in both
 * indexes.
 * </p>
 */
public class BridgeController implements RelayListener {
    private static final Logger log = LoggerFactory.getLogger(BridgeController.class);

    static final Duration RELAY_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    static final String PLATFORM = "discord";
    private static final int DID_NAME_LENGTH = 16;

    private final BridgeBotConfig config;
    private final String bridgeDid;
    private final IRelayApiClient relayApi;
    private final IRelayConnection relay;
    private final IPlatformClient platform;
    private final IWebhookSender webhooks;
    private final Scheduler eventLoop;
    private final Clock clock;
    private final EchoGuard echoGuard;

    private final Map<String, ActiveBridge> bridgesByGuild = new ConcurrentHashMap<>();
    private final Map<String, ActiveBridge> bridgesByCommunity = new ConcurrentHashMap<>();
    private final Sinks.One<Void> relayConnected = Sinks.one();

    // Touched only on the event loop
    private final Set<String> inFlight = new HashSet<>();
    @Nullable
    private Disposable poll;

    public BridgeController(
        BridgeBotConfig config,
        String bridgeDid,
        IRelayApiClient relayApi,
        IRelayConnection relay,
        IPlatformClient platform,
        IWebhookSender webhooks,
        Scheduler eventLoop,
        Clock clock
    ) {
        this.config = config;
        this.bridgeDid = bridgeDid;
        this.relayApi = relayApi;
        this.relay = relay;
        this.platform = platform;
        this.webhooks = webhooks;
        this.eventLoop = eventLoop;
        this.clock = clock;
        this.echoGuard = new EchoGuard(eventLoop);
        this.echoGuard.setBridgeDid(bridgeDid);

        relay.addListener(this);
        platform.onMessage(message -> eventLoop.schedule(() -> handlePlatformMessage(message)));
    }

    /**
     * Loads configs, then logs in to the platform and connects the relay concurrently, then starts
     * the config poll. Completes even if the relay is not registered yet; the connection keeps
     * retrying in the background.
     */
    public Mono<Void> start() {
        return Mono.defer(() -> {
            log.info("Starting bridge controller as {}", bridgeDid);
            return loadConfigs()
                .onErrorResume(e -> {
                    log.error("Initial bridge config load failed, the poll will retry", e);
                    return Mono.empty();
                })
                .then(Mono.when(
                    platform.login().onErrorResume(e -> {
                        log.error("Platform login failed", e);
                        return Mono.empty();
                    }),
                    connectRelay()))
                .then(Mono.fromRunnable(() -> {
                    echoGuard.start();
                    startPolling();
                    log.info("Bridge controller started with {} bridge(s)", bridgesByCommunity.size());
                }).subscribeOn(eventLoop))
                .then();
        });
    }

    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
                log.info("Stopping bridge controller");
                if (poll != null) {
                    poll.dispose();
                    poll = null;
                }
                echoGuard.destroy();
                relay.disconnect();
            })
            .subscribeOn(eventLoop)
            .then(Mono.defer(platform::destroy))
            .doOnSuccess(v -> log.info("Bridge controller stopped"));
    }

    // ---------------------------------------------------------------- config loading

    /**
     * Refreshes the loaded bridges from the relay API. A failure in one config is logged and does
     * not stop the others.
     */
    Mono<Void> loadConfigs() {
        return relayApi.listBridges()
            .publishOn(eventLoop)
            .flatMapMany(summaries -> {
                if (summaries.isEmpty()) {
                    log.debug("No bridge configs found");
                }
                return Flux.fromIterable(summaries);
            })
            .concatMap(summary -> loadConfig(summary)
                .onErrorResume(e -> {
                    log.error("Failed to load bridge config for community {}", summary.getCommunityId(), e);
                    return Mono.empty();
                }))
            .then();
    }

    private Mono<Void> loadConfig(BridgeConfigSummary summary) {
        return Mono.defer(() -> {
            if (!summary.isEnabled()) {
                ActiveBridge removed = bridgesByCommunity.remove(summary.getCommunityId());
                bridgesByGuild.remove(summary.getGuildId());
                if (removed != null) {
                    log.info("Bridge for community {} disabled, unloading", summary.getCommunityId());
                }
                return Mono.empty();
            }

            ActiveBridge existing = bridgesByCommunity.get(summary.getCommunityId());
            if (existing != null && existing.getConfig().getUpdatedAt() >= summary.getUpdatedAt()) {
                return Mono.empty();
            }

            return relayApi.getBridge(summary.getCommunityId())
                .flatMap(this::registerSelf)
                .publishOn(eventLoop)
                .doOnNext(this::install)
                .then();
        });
    }

    /**
     * Makes sure the relay-side config names this bot as its bridge DID and lists it as a member.
     */
    private Mono<BridgeConfig> registerSelf(BridgeConfig loaded) {
        Mono<BridgeConfig> withDid;
        if (bridgeDid.equals(loaded.getBridgeDid())) {
            withDid = Mono.just(loaded);
        } else {
            log.info("Registering bridge DID {} for community {}", bridgeDid, loaded.getCommunityId());
            BridgeConfig updated = loaded.withBridgeDid(bridgeDid);
            withDid = relayApi.registerBridge(RegisterBridgeRequest.from(updated)).thenReturn(updated);
        }

        return withDid.flatMap(current -> {
            if (current.getMemberDids().contains(bridgeDid)) {
                return Mono.just(current);
            }
            List<String> members = new ArrayList<>(current.getMemberDids());
            members.add(bridgeDid);
            log.info("Adding bridge DID to member list of community {} ({} members)",
                current.getCommunityId(), members.size());
            return relayApi.updateMembers(current.getCommunityId(), members)
                .thenReturn(current.withMemberDids(List.copyOf(members)));
        });
    }

    private void install(BridgeConfig loaded) {
        ActiveBridge bridge = ActiveBridge.of(loaded, bridgeDid);
        ActiveBridge previous = bridgesByCommunity.put(loaded.getCommunityId(), bridge);
        if (previous != null && !previous.getConfig().getGuildId().equals(loaded.getGuildId())) {
            bridgesByGuild.remove(previous.getConfig().getGuildId());
        }
        bridgesByGuild.put(loaded.getGuildId(), bridge);
        log.info("Loaded bridge config: community={}, guild={}, channels={}, seats={}, members={}",
            loaded.getCommunityId(), loaded.getGuildId(), loaded.getChannels().size(),
            loaded.getSeats().size(), loaded.getMemberDids().size());
    }

    private Mono<Void> connectRelay() {
        return Mono.defer(() -> {
            relay.connect();
            return relayConnected.asMono()
                .timeout(RELAY_CONNECT_TIMEOUT, Mono.fromRunnable(
                    () -> log.warn("Relay not registered after {}s, continuing while it retries",
                        RELAY_CONNECT_TIMEOUT.toSeconds())), eventLoop);
        });
    }

    private void startPolling() {
        if (poll != null) {
            return;
        }
        poll = Flux.interval(config.getConfigPollInterval(), eventLoop)
            .onBackpressureDrop()
            .concatMap(tick -> loadConfigs()
                .onErrorResume(e -> {
                    log.error("Config poll failed", e);
                    return Mono.empty();
                }))
            .subscribe();
    }

    // ---------------------------------------------------------------- platform -> community

    void handlePlatformMessage(PlatformMessage message) {
        ActiveBridge bridge = bridgesByGuild.get(message.getGuildId());
        if (bridge == null) {
            log.debug("Message from non-bridged guild {}", message.getGuildId());
            return;
        }
        String channelId = bridge.getChannelMap().getUmbraChannelId(message.getDiscordChannelId());
        if (channelId == null) {
            log.debug("Message from non-bridged channel {}", message.getDiscordChannelId());
            return;
        }

        ResolvedSeat seat = bridge.getSeatResolver().resolveDiscordUser(
            message.getDiscordUserId(), message.getDiscordUsername(), message.getAvatarUrl());
        String content = MessageTransform.toCommunity(
            message.getContent(), bridge.getSeatResolver(), bridge.getChannelMap());
        if (content.isEmpty()) {
            return;
        }

        String messageId = UUID.randomUUID().toString();
        CommunityMessageSent event = CommunityMessageSent.builder()
            .channelId(channelId)
            .channelName(bridge.getChannelMap().getName(message.getDiscordChannelId()))
            .messageId(messageId)
            .senderDid(seat.getDid())
            .content(content)
            .senderDisplayName(seat.getDisplayName())
            .senderAvatarUrl(seat.getAvatarUrl())
            .platformUserId(message.getDiscordUserId())
            .platform(PLATFORM)
            .build();
        String payload = CommunityEventEnvelope
            .of(bridge.getConfig().getCommunityId(), event, seat.getDid(), clock.millis())
            .toJson();

        List<String> targets = bridge.getConfig().getMemberDids().stream()
            .filter(did -> !did.equals(bridgeDid))
            .collect(Collectors.toList());
        int sent = 0;
        for (String memberDid : targets) {
            if (relay.sendToDid(memberDid, payload)) {
                sent++;
            } else {
                log.warn("Failed to send bridged message {} to {} (relay {})", messageId, memberDid, relay.getState());
            }
        }
        echoGuard.recordBridged(messageId);

        if (sent == 0 && !targets.isEmpty()) {
            log.warn("Bridged message {} from guild {} channel {} reached 0 of {} members (relay {})",
                messageId, message.getGuildId(), message.getDiscordChannelId(), targets.size(), relay.getState());
        }
        log.info("Bridged platform -> community: guild={}, channel={}, sender={}, senderDid={}, ghost={}, recipients={}/{}",
            message.getGuildId(), message.getDiscordChannelId(), message.getDiscordUsername(),
            seat.getDid(), seat.isGhost(), sent, targets.size());
    }

    // ---------------------------------------------------------------- community -> platform

    /**
     * Posts a community message to its mapped platform channel. Completes empty whether or not
     * the message was bridged; failures are logged.
     */
    Mono<Void> handleRelayEvent(CommunityEventEnvelope envelope) {
        CommunityEventEnvelope.Payload payload = envelope.getPayload();
        if (!(payload.getEvent() instanceof CommunityMessageSent)) {
            return Mono.empty();
        }
        CommunityMessageSent message = (CommunityMessageSent) payload.getEvent();
        if (payload.getCommunityId() == null || message.getMessageId() == null || message.getChannelId() == null) {
            log.warn("Dropping communityMessageSent from {} without communityId, messageId or channelId", payload.getSenderDid());
            return Mono.empty();
        }
        ActiveBridge bridge = bridgesByCommunity.get(payload.getCommunityId());
        if (bridge == null) {
            return Mono.empty();
        }
        String messageId = message.getMessageId();
        if (!echoGuard.shouldBridgeToDiscord(payload.getSenderDid(), messageId) || inFlight.contains(messageId)) {
            log.debug("Echo guard skipped message {} from {}", messageId, payload.getSenderDid());
            return Mono.empty();
        }

        String discordChannelId = bridge.getChannelMap().getDiscordChannelId(message.getChannelId());
        if (discordChannelId == null) {
            return Mono.empty();
        }
        String content = MessageTransform.toDiscord(message.getContent());
        if (content.isEmpty()) {
            log.debug("Message {} has no inline content, cannot bridge", messageId);
            return Mono.empty();
        }

        BridgeSeat seat = bridge.getSeatResolver().resolveUmbraDid(payload.getSenderDid());
        String displayName = firstNonNull(
            message.getSenderDisplayName(),
            seat == null ? null : seat.getDiscordUsername(),
            abbreviateDid(payload.getSenderDid()));
        String avatarUrl = firstNonNull(
            message.getSenderAvatarUrl(),
            seat == null ? null : seat.getAvatarUrl(),
            null);

        inFlight.add(messageId);
        return webhooks.sendAsUser(discordChannelId, content, displayName, avatarUrl)
            .onErrorResume(first -> {
                log.warn("Webhook send to channel {} failed, retrying once: {}", discordChannelId, first.getMessage());
                webhooks.invalidate(discordChannelId);
                return webhooks.sendAsUser(discordChannelId, content, displayName, avatarUrl);
            })
            .publishOn(eventLoop)
            .doOnSuccess(v -> {
                echoGuard.recordBridged(messageId);
                log.info("Bridged community -> platform: community={}, channel={}, sender={}, message={}",
                    payload.getCommunityId(), message.getChannelId(), displayName, messageId);
            })
            .onErrorResume(e -> {
                log.error("Failed to bridge message {} to channel {}", messageId, discordChannelId, e);
                return Mono.empty();
            })
            .doFinally(signal -> inFlight.remove(messageId));
    }

    // ---------------------------------------------------------------- relay listener

    @Override
    public void onConnected() {
        log.info("Relay connected");
        relayConnected.tryEmitEmpty();
    }

    @Override
    public void onDisconnected() {
        log.warn("Relay disconnected");
    }

    @Override
    public void onEnvelope(CommunityEventEnvelope envelope, String fromDid) {
        Mono.defer(() -> handleRelayEvent(envelope))
            .subscribeOn(eventLoop)
            .subscribe(null, e -> log.warn("Dropping {} from {}: {}",
                envelope.getPayload().getEvent().getType(), fromDid, e.toString()));
    }

    @Override
    public void onRelayError(@Nullable String message) {
        log.error("Relay error: {}", message);
    }

    // ---------------------------------------------------------------- accessors

    @Nullable
    ActiveBridge bridgeForCommunity(String communityId) {
        return bridgesByCommunity.get(communityId);
    }

    @Nullable
    ActiveBridge bridgeForGuild(String guildId) {
        return bridgesByGuild.get(guildId);
    }

    EchoGuard getEchoGuard() {
        return echoGuard;
    }

    private static String abbreviateDid(String did) {
        return did.length() > DID_NAME_LENGTH ? did.substring(0, DID_NAME_LENGTH) : did;
    }

    @Nullable
    private static String firstNonNull(@Nullable String first, @Nullable String second, @Nullable String third) {
        if (first != null) {
            return first;
        }
        return second != null ? second : third;
    }
}
