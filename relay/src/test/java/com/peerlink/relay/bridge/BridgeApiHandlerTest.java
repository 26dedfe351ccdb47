package com.peerlink.relay.bridge;

import com.peerlink.core.model.BridgeConfig;
import com.peerlink.core.model.BridgeConfigSummary;
import com.peerlink.core.model.RegisterBridgeRequest;
import com.peerlink.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BridgeApiHandlerTest {

    private BridgeConfigStore store;
    private BridgeApiHandler handler;

    @BeforeEach
    void setUp() {
        store = new BridgeConfigStore(null);
        handler = new BridgeApiHandler(store);
    }

    @Test
    @DisplayName("Should register a bridge and answer 201 with the stored config")
    void testRegister() {
        BridgeApiHandler.Reply reply = handler.register(registerBody("community-1"));

        assertEquals(HttpResponseStatus.CREATED, reply.getStatus());
        assertTrue(reply.getBody().isOk());
        BridgeConfig stored = (BridgeConfig) reply.getBody().getData();
        assertEquals("community-1", stored.getCommunityId());
        assertTrue(stored.isEnabled());
        assertTrue(stored.getCreatedAt() > 0);
    }

    @Test
    @DisplayName("Should reject registrations without ids or channels")
    void testRegisterValidation() {
        assertBadRequest(handler.register("{\"guildId\":\"g\"}"), "communityId and guildId are required");
        assertBadRequest(handler.register("{\"communityId\":\"../x\",\"guildId\":\"g\",\"channels\":[]}"), "Invalid communityId");
        assertBadRequest(handler.register("{\"communityId\":\"c\",\"guildId\":\"g\",\"channels\":[]}"),
            "At least one channel mapping is required");
        assertBadRequest(handler.register("not json"), "Invalid request body");
        assertEquals(0, store.count());
    }

    @Test
    @DisplayName("Should answer 404 for unknown communities")
    void testNotFound() {
        assertNotFound(handler.get("missing"));
        assertNotFound(handler.delete("missing"));
        assertNotFound(handler.updateMembers("missing", "{\"memberDids\":[]}"));
        assertNotFound(handler.setEnabled("missing", "{\"enabled\":false}"));
    }

    @Test
    @DisplayName("Should list summaries and apply member and enabled updates")
    void testListAndUpdate() {
        handler.register(registerBody("community-1"));

        BridgeApiHandler.Reply members = handler.updateMembers("community-1",
            "{\"memberDids\":[\"did:key:zAlice\",\"did:key:zBob\"]}");
        assertEquals(HttpResponseStatus.OK, members.getStatus());

        BridgeApiHandler.Reply disabled = handler.setEnabled("community-1", "{\"enabled\":false}");
        assertFalse(((BridgeConfig) disabled.getBody().getData()).isEnabled());

        @SuppressWarnings("unchecked")
        List<BridgeConfigSummary> summaries = (List<BridgeConfigSummary>) handler.list().getBody().getData();
        assertEquals(1, summaries.size());
        assertEquals(2, summaries.get(0).getMemberCount());
        assertFalse(summaries.get(0).isEnabled());

        assertEquals(HttpResponseStatus.OK, handler.delete("community-1").getStatus());
        assertNotFound(handler.get("community-1"));
    }

    @Test
    @DisplayName("Should serialize replies as {ok, data} or {ok, error}")
    void testReplyShape() {
        String notFound = JsonUtils.writeValueAsString(handler.get("missing").getBody());
        assertEquals("{\"ok\":false,\"error\":\"Bridge config not found\"}", notFound);
    }

    private static String registerBody(String communityId) {
        return JsonUtils.writeValueAsString(RegisterBridgeRequest.from(BridgeConfigStoreTest.sampleConfig(communityId)));
    }

    private static void assertBadRequest(BridgeApiHandler.Reply reply, String error) {
        assertEquals(HttpResponseStatus.BAD_REQUEST, reply.getStatus());
        assertFalse(reply.getBody().isOk());
        assertEquals(error, reply.getBody().getError());
    }

    private static void assertNotFound(BridgeApiHandler.Reply reply) {
        assertEquals(HttpResponseStatus.NOT_FOUND, reply.getStatus());
        assertEquals(BridgeApiHandler.NOT_FOUND, reply.getBody().getError());
    }
}
