package com.peerlink.bridgebot.bridge;

import com.peerlink.core.model.BridgeSeat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeatResolverTest {
    private static final String BRIDGE_DID = "did:key:zBridge";
    private static final String ALICE_DID = "did:key:zAlice";

    private SeatResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = SeatResolver.load(BRIDGE_DID, List.of(
            BridgeSeat.builder()
                .discordUserId("100")
                .discordUsername("alice")
                .avatarUrl("https://cdn.example/alice.png")
                .seatDid(ALICE_DID)
                .build(),
            BridgeSeat.builder()
                .discordUserId("200")
                .discordUsername("bob")
                .build()));
    }

    @Test
    @DisplayName("A claimed seat authors messages with its own DID")
    void testClaimedSeat() {
        ResolvedSeat seat = resolver.resolveDiscordUser("100", "Alice From Discord", null);

        assertEquals(ALICE_DID, seat.getDid());
        assertEquals("alice", seat.getDisplayName());
        assertEquals("https://cdn.example/alice.png", seat.getAvatarUrl());
        assertFalse(seat.isGhost());
    }

    @Test
    @DisplayName("An unclaimed seat is a ghost authored by the bridge DID")
    void testUnclaimedSeatIsGhost() {
        ResolvedSeat seat = resolver.resolveDiscordUser("200", "Bobby", "https://cdn.example/bob.png");

        assertEquals(BRIDGE_DID, seat.getDid());
        assertEquals("bob", seat.getDisplayName());
        assertEquals("https://cdn.example/bob.png", seat.getAvatarUrl(), "Seat has no avatar, message avatar is used");
        assertTrue(seat.isGhost());
    }

    @Test
    @DisplayName("An unknown user falls back to the message's own name and avatar")
    void testUnknownUserFallsBack() {
        ResolvedSeat seat = resolver.resolveDiscordUser("999", "stranger", null);

        assertEquals(BRIDGE_DID, seat.getDid());
        assertEquals("stranger", seat.getDisplayName());
        assertNull(seat.getAvatarUrl());
        assertTrue(seat.isGhost());
    }

    @Test
    @DisplayName("Reverse lookup only finds claimed seats")
    void testReverseLookup() {
        assertEquals("100", resolver.resolveUmbraDid(ALICE_DID).getDiscordUserId());
        assertNull(resolver.resolveUmbraDid(BRIDGE_DID));
        assertNull(resolver.resolveUmbraDid("did:key:zNobody"));
    }

    @Test
    @DisplayName("Display names are known for every seat, claimed or not")
    void testDisplayNameOf() {
        assertEquals("alice", resolver.displayNameOf("100"));
        assertEquals("bob", resolver.displayNameOf("200"));
        assertNull(resolver.displayNameOf("999"));
    }
}
