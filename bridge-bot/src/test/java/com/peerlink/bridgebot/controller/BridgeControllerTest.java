package com.peerlink.bridgebot.controller;

import com.peerlink.bridgebot.config.BridgeBotConfig;
import com.peerlink.bridgebot.platform.PlatformMessage;
import com.peerlink.core.event.CommunityEventEnvelope;
import com.peerlink.core.event.CommunityMessageSent;
import com.peerlink.core.event.MemberLeft;
import com.peerlink.core.model.BridgeChannel;
import com.peerlink.core.model.BridgeConfig;
import com.peerlink.core.model.BridgeSeat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives {@link BridgeController} on a virtual-time event loop against in-memory collaborators.
 */
class BridgeControllerTest {
    private static final String BRIDGE_DID = "did:key:z6MkBridgeBotIdentity";
    private static final String OWNER_DID = "did:key:z6MkOwner";
    private static final String ALICE_DID = "did:key:z6MkAlice";
    private static final String STRANGER_DID = "did:key:z6MkStrangerAbcdef";
    private static final String COMMUNITY = "c-canon";
    private static final String GUILD = "g-1";
    private static final Duration POLL = Duration.ofSeconds(30);
    private static final long NOW = 1_700_000_000_000L;

    private VirtualTimeScheduler scheduler;
    private ScriptedRelayApi api;
    private RecordingRelayConnection relay;
    private StubPlatformClient platform;
    private RecordingWebhookSender webhooks;
    private BridgeController controller;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        api = new ScriptedRelayApi();
        relay = new RecordingRelayConnection();
        platform = new StubPlatformClient();
        webhooks = new RecordingWebhookSender();

        BridgeBotConfig config = BridgeBotConfig.builder()
            .discordBotToken("token")
            .relayUrl("ws://relay/ws")
            .relayApiUrl("http://relay")
            .bridgeDataDir("./data")
            .configPollInterval(POLL)
            .keepaliveInterval(Duration.ofSeconds(30))
            .maxReconnectDelay(Duration.ofSeconds(30))
            .discordApiUrl("http://discord/api")
            .discordGatewayUrl("ws://discord/gateway")
            .build();
        controller = new BridgeController(config, BRIDGE_DID, api, relay, platform, webhooks,
            scheduler, Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private static BridgeConfig registeredConfig() {
        return BridgeConfig.builder()
            .communityId(COMMUNITY)
            .guildId(GUILD)
            .bridgeDid(BRIDGE_DID)
            .channels(List.of(
                BridgeChannel.builder().discordChannelId("d-general").umbraChannelId("ch-general").name("general").build()))
            .seats(List.of(
                BridgeSeat.builder().discordUserId("100").discordUsername("alice")
                    .avatarUrl("https://cdn.example/alice.png").seatDid(ALICE_DID).build(),
                BridgeSeat.builder().discordUserId("200").discordUsername("bob").build()))
            .memberDids(List.of(OWNER_DID, BRIDGE_DID))
            .createdAt(500L)
            .updatedAt(1000L)
            .build();
    }

    private void loadRegisteredConfig() {
        api.put(registeredConfig());
        StepVerifier.create(controller.loadConfigs()).verifyComplete();
    }

    private static PlatformMessage platformMessage(String guildId, String channelId, String userId, String name, String content) {
        return PlatformMessage.builder()
            .guildId(guildId)
            .discordChannelId(channelId)
            .discordMessageId("discord-msg")
            .discordUserId(userId)
            .discordUsername(name)
            .avatarUrl("https://cdn.discordapp.com/avatars/" + userId + "/hash.png")
            .content(content)
            .build();
    }

    private static CommunityEventEnvelope communityMessage(String senderDid, String messageId, String channelId,
                                                           String content, String displayName) {
        CommunityMessageSent event = CommunityMessageSent.builder()
            .channelId(channelId)
            .channelName("general")
            .messageId(messageId)
            .senderDid(senderDid)
            .content(content)
            .senderDisplayName(displayName)
            .build();
        return CommunityEventEnvelope.of(COMMUNITY, event, senderDid, NOW);
    }

    // ========== Config Loading ==========

    @Test
    @DisplayName("Should register its DID and join the member list when the config lacks them")
    void testSelfRegistration() {
        // Given: an admin registered the bridge before the bot ever ran
        api.put(registeredConfig().toBuilder().bridgeDid(null).memberDids(List.of(OWNER_DID)).build());

        // When
        StepVerifier.create(controller.loadConfigs()).verifyComplete();

        // Then
        assertEquals(1, api.registrations.size());
        assertEquals(BRIDGE_DID, api.registrations.get(0).getBridgeDid());
        assertEquals(List.of(List.of(OWNER_DID, BRIDGE_DID)), api.memberUpdates);

        ActiveBridge bridge = controller.bridgeForCommunity(COMMUNITY);
        assertNotNull(bridge);
        assertEquals(BRIDGE_DID, bridge.getConfig().getBridgeDid());
        assertTrue(bridge.getConfig().getMemberDids().contains(BRIDGE_DID));
        assertSame(bridge, controller.bridgeForGuild(GUILD));
    }

    @Test
    @DisplayName("Should not call back into the relay when the config already names the bridge")
    void testNoRegistrationWhenPresent() {
        loadRegisteredConfig();

        assertTrue(api.registrations.isEmpty());
        assertTrue(api.memberUpdates.isEmpty());
        assertNotNull(controller.bridgeForCommunity(COMMUNITY));
    }

    @Test
    @DisplayName("Should skip configs whose updatedAt is not newer than the loaded one")
    void testSkipUnchanged() {
        loadRegisteredConfig();
        assertEquals(1, api.getCalls);

        StepVerifier.create(controller.loadConfigs()).verifyComplete();
        assertEquals(1, api.getCalls, "Unchanged config must not be fetched again");

        api.put(registeredConfig().withUpdatedAt(2000L)
            .withChannels(List.of(BridgeChannel.builder().discordChannelId("d-random").umbraChannelId("ch-random").name("random").build())));
        StepVerifier.create(controller.loadConfigs()).verifyComplete();

        assertEquals(2, api.getCalls);
        ActiveBridge reloaded = controller.bridgeForCommunity(COMMUNITY);
        assertEquals(2000L, reloaded.getConfig().getUpdatedAt());
        assertEquals("ch-random", reloaded.getChannelMap().getUmbraChannelId("d-random"));
        assertNull(reloaded.getChannelMap().getUmbraChannelId("d-general"));
    }

    @Test
    @DisplayName("Should unload a bridge once it is disabled")
    void testDisabledRemoved() {
        loadRegisteredConfig();

        api.put(registeredConfig().withEnabled(false).withUpdatedAt(2000L));
        StepVerifier.create(controller.loadConfigs()).verifyComplete();

        assertNull(controller.bridgeForCommunity(COMMUNITY));
        assertNull(controller.bridgeForGuild(GUILD));
    }

    @Test
    @DisplayName("A config that fails to load does not keep the others from loading")
    void testConfigIsolation() {
        api.put(registeredConfig().toBuilder().communityId("c-broken").guildId("g-broken").build());
        api.failingGets.add("c-broken");
        api.put(registeredConfig());

        StepVerifier.create(controller.loadConfigs()).verifyComplete();

        assertNull(controller.bridgeForCommunity("c-broken"));
        assertNotNull(controller.bridgeForCommunity(COMMUNITY));
    }

    // ========== Lifecycle ==========

    @Test
    @DisplayName("Start loads configs, logs in, connects the relay and polls for new configs")
    void testStartAndPoll() {
        api.put(registeredConfig());

        StepVerifier.create(controller.start()).verifyComplete();

        assertEquals(1, platform.loginCalls);
        assertEquals(1, relay.connectCalls);
        assertNotNull(controller.bridgeForCommunity(COMMUNITY));

        // When: a second bridge is registered on the relay
        api.put(registeredConfig().toBuilder().communityId("c-second").guildId("g-2").build());
        scheduler.advanceTimeBy(POLL);

        // Then: the next poll picks it up
        assertNotNull(controller.bridgeForGuild("g-2"));
    }

    @Test
    @DisplayName("A failing poll is logged and the next one proceeds")
    void testPollRecoversFromFailure() {
        api.put(registeredConfig());
        api.failList = true;

        StepVerifier.create(controller.start()).verifyComplete();
        assertNull(controller.bridgeForCommunity(COMMUNITY));

        scheduler.advanceTimeBy(POLL);
        assertNull(controller.bridgeForCommunity(COMMUNITY));

        api.failList = false;
        scheduler.advanceTimeBy(POLL);
        assertNotNull(controller.bridgeForCommunity(COMMUNITY));
    }

    @Test
    @DisplayName("Start completes after ten seconds when the relay does not register")
    void testRelayConnectTimeout() {
        relay.registerOnConnect = false;
        platform.failLogin = true;
        AtomicBoolean started = new AtomicBoolean();

        controller.start().doOnSuccess(v -> started.set(true)).subscribe();

        scheduler.advanceTimeBy(Duration.ofSeconds(9));
        assertFalse(started.get());
        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertTrue(started.get());
    }

    @Test
    @DisplayName("Stop cancels the poll and shuts down both connections")
    void testStop() {
        api.put(registeredConfig());
        StepVerifier.create(controller.start()).verifyComplete();
        int listCalls = api.listCalls;

        StepVerifier.create(controller.stop()).verifyComplete();
        scheduler.advanceTimeBy(POLL.multipliedBy(3));

        assertTrue(relay.disconnected);
        assertTrue(platform.destroyed);
        assertEquals(listCalls, api.listCalls, "No poll may fire after stop");
    }

    // ========== Platform To Community ==========

    @Test
    @DisplayName("A seated user's message fans out to every member except the bridge")
    void testPlatformMessageFanOut() {
        loadRegisteredConfig();

        platform.post(platformMessage(GUILD, "d-general", "100", "Alice D", "hi <@200>"));

        assertEquals(1, relay.attempts.size());
        RecordingRelayConnection.Sent sent = relay.attempts.get(0);
        assertEquals(OWNER_DID, sent.toDid);

        CommunityEventEnvelope envelope = sent.envelope();
        assertEquals(COMMUNITY, envelope.getPayload().getCommunityId());
        assertEquals(ALICE_DID, envelope.getPayload().getSenderDid());
        assertEquals(NOW, envelope.getPayload().getTimestamp());

        CommunityMessageSent event = (CommunityMessageSent) envelope.getPayload().getEvent();
        assertEquals("ch-general", event.getChannelId());
        assertEquals("general", event.getChannelName());
        assertEquals(ALICE_DID, event.getSenderDid());
        assertEquals("hi @bob", event.getContent());
        assertEquals("alice", event.getSenderDisplayName());
        assertEquals("100", event.getPlatformUserId());
        assertEquals("discord", event.getPlatform());
        assertNotNull(event.getMessageId());
    }

    @Test
    @DisplayName("Ghost seats and unseated users are authored by the bridge DID")
    void testGhostAuthorship() {
        loadRegisteredConfig();

        platform.post(platformMessage(GUILD, "d-general", "200", "Bobby", "ghost seat"));
        platform.post(platformMessage(GUILD, "d-general", "999", "stranger", "no seat"));

        assertEquals(2, relay.attempts.size());
        CommunityMessageSent ghost = (CommunityMessageSent) relay.attempts.get(0).envelope().getPayload().getEvent();
        CommunityMessageSent unseated = (CommunityMessageSent) relay.attempts.get(1).envelope().getPayload().getEvent();
        assertEquals(BRIDGE_DID, ghost.getSenderDid());
        assertEquals("bob", ghost.getSenderDisplayName());
        assertEquals(BRIDGE_DID, unseated.getSenderDid());
        assertEquals("stranger", unseated.getSenderDisplayName());
        assertEquals("https://cdn.discordapp.com/avatars/999/hash.png", unseated.getSenderAvatarUrl());
    }

    @Test
    @DisplayName("A message that reached nobody is still recorded by the echo guard")
    void testZeroRecipients() {
        loadRegisteredConfig();
        relay.offline.add(OWNER_DID);

        platform.post(platformMessage(GUILD, "d-general", "100", "alice", "anyone there?"));

        assertEquals(1, relay.attempts.size());
        CommunityMessageSent event = (CommunityMessageSent) relay.attempts.get(0).envelope().getPayload().getEvent();
        assertTrue(controller.getEchoGuard().wasBridged(event.getMessageId()));
    }

    @Test
    @DisplayName("Messages from other guilds, unmapped channels or with no text are ignored")
    void testPlatformFilters() {
        loadRegisteredConfig();

        platform.post(platformMessage("g-other", "d-general", "100", "alice", "wrong guild"));
        platform.post(platformMessage(GUILD, "d-unmapped", "100", "alice", "wrong channel"));
        platform.post(platformMessage(GUILD, "d-general", "100", "alice", "   "));

        assertTrue(relay.attempts.isEmpty());
    }

    @Test
    @DisplayName("A bridged platform message coming back from the community is not posted again")
    void testRoundTripSuppressed() {
        loadRegisteredConfig();
        platform.post(platformMessage(GUILD, "d-general", "100", "alice", "hello"));
        CommunityEventEnvelope echoed = relay.attempts.get(0).envelope();

        relay.deliver(echoed, OWNER_DID);

        assertTrue(webhooks.posts.isEmpty());
    }

    // ========== Community To Platform ==========

    @Test
    @DisplayName("Should post a community message through the channel's webhook")
    void testCommunityMessagePosted() {
        loadRegisteredConfig();

        relay.deliver(communityMessage(OWNER_DID, "m-1", "ch-general", "@everyone meeting now", "Owner"), OWNER_DID);

        assertEquals(1, webhooks.posts.size());
        RecordingWebhookSender.Post post = webhooks.posts.get(0);
        assertEquals("d-general", post.channelId);
        assertEquals("@\u200Beveryone meeting now", post.content);
        assertEquals("Owner", post.displayName);
        assertTrue(controller.getEchoGuard().wasBridged("m-1"));
    }

    @Test
    @DisplayName("Display name falls back to the claimed seat, then to the start of the DID")
    void testDisplayNameFallback() {
        loadRegisteredConfig();

        StepVerifier.create(controller.handleRelayEvent(communityMessage(ALICE_DID, "m-1", "ch-general", "from alice", null)))
            .verifyComplete();
        StepVerifier.create(controller.handleRelayEvent(communityMessage(STRANGER_DID, "m-2", "ch-general", "from stranger", null)))
            .verifyComplete();

        assertEquals("alice", webhooks.posts.get(0).displayName);
        assertEquals("https://cdn.example/alice.png", webhooks.posts.get(0).avatarUrl);
        assertEquals("did:key:z6MkStra", webhooks.posts.get(1).displayName);
        assertNull(webhooks.posts.get(1).avatarUrl);
    }

    @Test
    @DisplayName("Messages authored by the bridge itself are never posted")
    void testOwnMessagesNotPosted() {
        loadRegisteredConfig();

        relay.deliver(communityMessage(BRIDGE_DID, "m-1", "ch-general", "from a ghost seat", "bob"), OWNER_DID);

        assertTrue(webhooks.posts.isEmpty());
        assertEquals(0, webhooks.attempts);
    }

    @Test
    @DisplayName("The same message ID is posted once even when it arrives twice")
    void testDuplicatePostedOnce() {
        loadRegisteredConfig();
        CommunityEventEnvelope envelope = communityMessage(OWNER_DID, "m-1", "ch-general", "hello", "Owner");

        relay.deliver(envelope, OWNER_DID);
        relay.deliver(envelope, OWNER_DID);

        assertEquals(1, webhooks.posts.size());
    }

    @Test
    @DisplayName("A failed post invalidates the cached webhook and retries once")
    void testRetryAfterInvalidate() {
        loadRegisteredConfig();
        webhooks.failuresRemaining = 1;

        StepVerifier.create(controller.handleRelayEvent(communityMessage(OWNER_DID, "m-1", "ch-general", "hello", "Owner")))
            .verifyComplete();

        assertEquals(List.of("d-general"), webhooks.invalidated);
        assertEquals(2, webhooks.attempts);
        assertEquals(1, webhooks.posts.size());
        assertTrue(controller.getEchoGuard().wasBridged("m-1"));
    }

    @Test
    @DisplayName("A message that failed twice is not recorded and can be bridged on redelivery")
    void testDoubleFailureNotRecorded() {
        loadRegisteredConfig();
        webhooks.failuresRemaining = 2;
        CommunityEventEnvelope envelope = communityMessage(OWNER_DID, "m-1", "ch-general", "hello", "Owner");

        StepVerifier.create(controller.handleRelayEvent(envelope)).verifyComplete();

        assertEquals(2, webhooks.attempts);
        assertTrue(webhooks.posts.isEmpty());
        assertFalse(controller.getEchoGuard().wasBridged("m-1"));

        // When: the offline queue redelivers it
        StepVerifier.create(controller.handleRelayEvent(envelope)).verifyComplete();

        assertEquals(1, webhooks.posts.size());
    }

    @Test
    @DisplayName("Non-message events, unbridged communities and unmapped channels are ignored")
    void testRelayFilters() {
        loadRegisteredConfig();

        StepVerifier.create(controller.handleRelayEvent(
            CommunityEventEnvelope.of(COMMUNITY, new MemberLeft(OWNER_DID), OWNER_DID, NOW))).verifyComplete();
        StepVerifier.create(controller.handleRelayEvent(
            CommunityEventEnvelope.of("c-elsewhere", communityMessage(OWNER_DID, "m-1", "ch-general", "hi", "Owner")
                .getPayload().getEvent(), OWNER_DID, NOW))).verifyComplete();
        StepVerifier.create(controller.handleRelayEvent(
            communityMessage(OWNER_DID, "m-2", "ch-unmapped", "hi", "Owner"))).verifyComplete();

        assertEquals(0, webhooks.attempts);
    }

    @Test
    @DisplayName("A community message without channelId is dropped without an error")
    void testMissingChannelIdDropped() {
        loadRegisteredConfig();
        CommunityEventEnvelope envelope = communityMessage(OWNER_DID, "m-1", null, "hi", "Owner");

        StepVerifier.create(controller.handleRelayEvent(envelope)).verifyComplete();
        relay.deliver(envelope, OWNER_DID);

        assertEquals(0, webhooks.attempts);
        assertFalse(controller.getEchoGuard().wasBridged("m-1"));

        // Then: the bridge keeps posting well-formed messages
        relay.deliver(communityMessage(OWNER_DID, "m-2", "ch-general", "still here", "Owner"), OWNER_DID);
        assertEquals(1, webhooks.posts.size());
    }

    @Test
    @DisplayName("Channel and seat entries without IDs are skipped and the rest of the config loads")
    void testIncompleteEntriesSkipped() {
        api.put(registeredConfig().toBuilder()
            .channels(List.of(
                BridgeChannel.builder().discordChannelId("d-general").umbraChannelId("ch-general").name("general").build(),
                BridgeChannel.builder().discordChannelId("d-broken").name("broken").build()))
            .seats(List.of(
                BridgeSeat.builder().discordUsername("nobody").seatDid(STRANGER_DID).build(),
                BridgeSeat.builder().discordUserId("100").discordUsername("alice").seatDid(ALICE_DID).build()))
            .build());

        StepVerifier.create(controller.loadConfigs()).verifyComplete();

        ActiveBridge bridge = controller.bridgeForCommunity(COMMUNITY);
        assertNotNull(bridge);
        assertEquals(1, bridge.getChannelMap().size());
        assertEquals("alice", bridge.getSeatResolver().displayNameOf("100"));
        assertNull(bridge.getSeatResolver().resolveUmbraDid(STRANGER_DID));
    }
}
