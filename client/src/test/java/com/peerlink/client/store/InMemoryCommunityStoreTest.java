package com.peerlink.client.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCommunityStoreTest {

    @Test
    @DisplayName("Should roll back every change of a failed transaction")
    void testRollback() {
        InMemoryCommunityStore store = new InMemoryCommunityStore();
        store.saveCommunity(community("c1"));

        assertThrows(IllegalStateException.class, () -> store.inTransaction(() -> {
            store.saveCommunity(community("c2"));
            store.saveMember(LocalMember.builder().communityLocalId("c1").did("did:key:zA").build());
            throw new IllegalStateException("boom");
        }));

        assertEquals(1, store.communities().size());
        assertTrue(store.members("c1").isEmpty());
    }

    @Test
    @DisplayName("Should commit nested transactions with the outer one")
    void testNestedTransaction() {
        InMemoryCommunityStore store = new InMemoryCommunityStore();

        store.inTransaction(() -> {
            store.saveCommunity(community("c1"));
            store.inTransaction(() -> store.saveCommunity(community("c2")));
        });

        assertEquals(2, store.communities().size());
    }

    @Test
    @DisplayName("Should find imported copies by origin id only")
    void testFindByOrigin() {
        InMemoryCommunityStore store = new InMemoryCommunityStore();
        store.saveCommunity(community("own"));
        store.saveCommunity(community("copy").toBuilder().originCommunityId("remote").build());

        assertEquals("copy", store.findCommunityByOrigin("remote").orElseThrow().getLocalId());
        assertTrue(store.findCommunityByOrigin("own").isEmpty());
    }

    @Test
    @DisplayName("Should return channel messages oldest first")
    void testMessageOrder() {
        InMemoryCommunityStore store = new InMemoryCommunityStore();
        store.saveMessage(message("m2", 20));
        store.saveMessage(message("m1", 10));

        assertEquals("m1", store.messages("ch").get(0).getMessageId());
        assertTrue(store.removeMessage("m1"));
        assertFalse(store.removeMessage("m1"));
    }

    private static LocalCommunity community(String localId) {
        return LocalCommunity.builder().localId(localId).ownerDid("did:key:zA").name(localId).build();
    }

    private static LocalMessage message(String id, long timestamp) {
        return LocalMessage.builder()
            .messageId(id)
            .communityLocalId("c1")
            .channelLocalId("ch")
            .senderDid("did:key:zA")
            .content(id)
            .timestamp(timestamp)
            .build();
    }
}
