package com.peerlink.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.peerlink.core.util.JsonUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CommunityEventEnvelopeTest {

    @Test
    @DisplayName("Message event serializes with type tag and canonical community ID")
    void testEnvelopeWireShape() {
        CommunityMessageSent event = CommunityMessageSent.builder()
            .channelId("ch-1")
            .channelName("general")
            .messageId("m1")
            .senderDid("did:key:zB")
            .content("hello")
            .build();

        JsonNode root = JsonUtils.readTree(CommunityEventEnvelope.of("c1", event, "did:key:zB", 42L).toJson());

        assertEquals("community_event", root.get("envelope").asText());
        assertEquals(1, root.get("version").asInt());
        assertEquals("c1", root.at("/payload/communityId").asText());
        assertEquals("did:key:zB", root.at("/payload/senderDid").asText());
        assertEquals(42L, root.at("/payload/timestamp").asLong());
        assertEquals("communityMessageSent", root.at("/payload/event/type").asText());
        assertEquals("general", root.at("/payload/event/channelName").asText());
        assertFalse(root.at("/payload/event").has("senderAvatarUrl"), "absent optionals are omitted");
    }

    @Test
    @DisplayName("Parsing dispatches known tags to their variant")
    void testParseKnownVariant() {
        String raw = "{\"envelope\":\"community_event\",\"version\":1,\"payload\":{"
            + "\"communityId\":\"c1\",\"senderDid\":\"did:key:zA\",\"timestamp\":7,"
            + "\"event\":{\"type\":\"memberJoined\",\"memberDid\":\"did:key:zA\",\"memberNickname\":\"alice\"}}}";

        CommunityEventEnvelope envelope = CommunityEventEnvelope.tryParse(raw).orElseThrow();

        assertEquals("c1", envelope.getPayload().getCommunityId());
        MemberJoined joined = assertInstanceOf(MemberJoined.class, envelope.getPayload().getEvent());
        assertEquals("alice", joined.getMemberNickname());
        assertNull(joined.getMemberAvatar());
    }

    @Test
    @DisplayName("Unknown tags keep the raw event")
    void testUnknownVariantKeepsRawPayload() {
        String raw = "{\"envelope\":\"community_event\",\"version\":1,\"payload\":{"
            + "\"communityId\":\"c1\",\"senderDid\":\"did:key:zA\",\"timestamp\":7,"
            + "\"event\":{\"type\":\"roleAssigned\",\"roleId\":\"r9\"}}}";

        CommunityEvent event = CommunityEventEnvelope.tryParse(raw).orElseThrow().getPayload().getEvent();

        UnknownCommunityEvent unknown = assertInstanceOf(UnknownCommunityEvent.class, event);
        assertEquals("roleAssigned", unknown.getType());
        assertEquals("r9", unknown.getRaw().get("roleId").asText());
        assertTrue(JsonUtils.writeValueAsString(unknown).contains("\"roleId\":\"r9\""));
    }

    @Test
    @DisplayName("Non-community payloads are ignored, not errors")
    void testTryParseRejectsOtherPayloads() {
        assertEquals(Optional.empty(), CommunityEventEnvelope.tryParse("not json"));
        assertEquals(Optional.empty(), CommunityEventEnvelope.tryParse("[1,2]"));
        assertEquals(Optional.empty(), CommunityEventEnvelope.tryParse("{\"envelope\":\"call_offer\",\"payload\":{}}"));
        assertEquals(Optional.empty(), CommunityEventEnvelope.tryParse(""));
        assertEquals(Optional.empty(), CommunityEventEnvelope.tryParse(null));
    }

    @Test
    void testTryParseRejectsBrokenEvents() {
        String noTag = "{\"envelope\":\"community_event\",\"version\":1,\"payload\":{"
            + "\"communityId\":\"c1\",\"senderDid\":\"did:key:zA\",\"event\":{\"memberDid\":\"x\"}}}";
        String noCommunity = "{\"envelope\":\"community_event\",\"version\":1,\"payload\":{"
            + "\"senderDid\":\"did:key:zA\",\"event\":{\"type\":\"memberLeft\",\"memberDid\":\"x\"}}}";

        assertTrue(CommunityEventEnvelope.tryParse(noTag).isEmpty());
        assertTrue(CommunityEventEnvelope.tryParse(noCommunity).isEmpty());
    }

    @Test
    void testWithChannelRewritesOnlyChannelFields() {
        CommunityMessageSent event = CommunityMessageSent.builder()
            .channelId("local-ch")
            .messageId("m1")
            .senderDid("did:key:zB")
            .content("hi")
            .build();

        ChannelScoped rewritten = event.withChannel("origin-ch", "general");

        CommunityMessageSent sent = assertInstanceOf(CommunityMessageSent.class, rewritten);
        assertEquals("origin-ch", sent.getChannelId());
        assertEquals("general", sent.getChannelName());
        assertEquals("m1", sent.getMessageId());
        assertEquals("hi", sent.getContent());
    }
}
