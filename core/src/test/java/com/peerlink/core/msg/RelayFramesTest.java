package com.peerlink.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import com.peerlink.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RelayFramesTest {

    @Test
    void testSendUsesSnakeCaseRecipient() {
        JsonNode frame = JsonUtils.readTree(RelayFrames.send("did:key:zB", "{\"x\":1}"));

        assertEquals("send", frame.get("type").asText());
        assertEquals("did:key:zB", frame.get("to_did").asText());
        assertEquals("{\"x\":1}", frame.get("payload").asText());
        assertFalse(frame.has("toDid"));
    }

    @Test
    void testMessageFrameParses() {
        RelayFrames.Message message = JsonUtils.readValue(
            RelayFrames.message("did:key:zA", "p", 123L), RelayFrames.Message.class);

        assertEquals("did:key:zA", message.getFromDid());
        assertEquals("p", message.getPayload());
        assertEquals(123L, message.getTimestamp());
    }

    @Test
    void testParseTypeIsDefensive() {
        assertEquals("ping", RelayFrames.parseType(RelayFrames.ping()));
        assertEquals("pong", RelayFrames.parseType("{\"type\":\"pong\"}"));
        assertNull(RelayFrames.parseType("{\"type\":5}"));
        assertNull(RelayFrames.parseType("{oops"));
        assertNull(RelayFrames.parseType("\"register\""));
    }
}
