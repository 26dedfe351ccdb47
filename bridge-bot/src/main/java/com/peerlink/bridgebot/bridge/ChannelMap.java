package com.peerlink.bridgebot.bridge;

import com.peerlink.core.model.BridgeChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bidirectional platform channel ID to community channel ID map of one bridge.
 * <p>
 * Immutable; a config reload builds a new instance.
 * </p>
 */
public final class ChannelMap {
    private static final Logger log = LoggerFactory.getLogger(ChannelMap.class);

    private final Map<String, BridgeChannel> byDiscordId;
    private final Map<String, BridgeChannel> byUmbraId;

    private ChannelMap(List<BridgeChannel> channels) {
        Map<String, BridgeChannel> discord = new HashMap<>();
        Map<String, BridgeChannel> umbra = new HashMap<>();
        for (BridgeChannel channel : channels) {
            if (channel.getDiscordChannelId() == null || channel.getUmbraChannelId() == null) {
                log.warn("Skipping channel mapping without both ids: {}", channel);
                continue;
            }
            discord.put(channel.getDiscordChannelId(), channel);
            umbra.put(channel.getUmbraChannelId(), channel);
        }
        this.byDiscordId = Map.copyOf(discord);
        this.byUmbraId = Map.copyOf(umbra);
    }

    public static ChannelMap load(List<BridgeChannel> channels) {
        return new ChannelMap(channels);
    }

    @Nullable
    public String getUmbraChannelId(@Nullable String discordChannelId) {
        if (discordChannelId == null) {
            return null;
        }
        BridgeChannel channel = byDiscordId.get(discordChannelId);
        return channel == null ? null : channel.getUmbraChannelId();
    }

    @Nullable
    public String getDiscordChannelId(@Nullable String umbraChannelId) {
        if (umbraChannelId == null) {
            return null;
        }
        BridgeChannel channel = byUmbraId.get(umbraChannelId);
        return channel == null ? null : channel.getDiscordChannelId();
    }

    /**
     * Channel name by platform channel ID.
     */
    @Nullable
    public String getName(@Nullable String discordChannelId) {
        if (discordChannelId == null) {
            return null;
        }
        BridgeChannel channel = byDiscordId.get(discordChannelId);
        return channel == null ? null : channel.getName();
    }

    public int size() {
        return byDiscordId.size();
    }
}
