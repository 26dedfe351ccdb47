package com.peerlink.bridgebot.bridge;

import com.peerlink.core.model.BridgeChannel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChannelMapTest {

    private static BridgeChannel channel(String discordId, String communityId, String name) {
        return BridgeChannel.builder().discordChannelId(discordId).umbraChannelId(communityId).name(name).build();
    }

    @Test
    @DisplayName("Should look up channels in both directions")
    void testBidirectionalLookup() {
        ChannelMap map = ChannelMap.load(List.of(
            channel("111", "c-general", "general"),
            channel("222", "c-random", "random")));

        assertEquals(2, map.size());
        assertEquals("c-general", map.getUmbraChannelId("111"));
        assertEquals("222", map.getDiscordChannelId("c-random"));
        assertEquals("random", map.getName("222"));
    }

    @Test
    @DisplayName("Should return null for unmapped channels")
    void testUnmapped() {
        ChannelMap map = ChannelMap.load(List.of(channel("111", "c-general", "general")));

        assertNull(map.getUmbraChannelId("999"));
        assertNull(map.getDiscordChannelId("c-unknown"));
        assertNull(map.getName("999"));
    }

    @Test
    @DisplayName("Reloading builds a new map and leaves the old one untouched")
    void testReloadIsASnapshot() {
        ChannelMap before = ChannelMap.load(List.of(channel("111", "c-general", "general")));
        ChannelMap after = ChannelMap.load(List.of(channel("333", "c-voice", "voice")));

        assertEquals("c-general", before.getUmbraChannelId("111"));
        assertNull(after.getUmbraChannelId("111"));
        assertEquals("c-voice", after.getUmbraChannelId("333"));
    }

    @Test
    @DisplayName("Should return null for null lookups and skip entries missing an id")
    void testNullIds() {
        ChannelMap map = ChannelMap.load(List.of(
            channel("111", "c-general", "general"),
            channel(null, "c-orphan", "orphan"),
            channel("333", null, "half")));

        assertEquals(1, map.size());
        assertNull(map.getDiscordChannelId(null));
        assertNull(map.getUmbraChannelId(null));
        assertNull(map.getName(null));
        assertNull(map.getDiscordChannelId("c-orphan"));
    }
}
