package com.peerlink.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * List-endpoint view of a {@link BridgeConfig} without the channel, seat and member arrays.
 */
@Value
@Builder
@Jacksonized
public class BridgeConfigSummary {
    String communityId;
    String guildId;
    boolean enabled;
    int channelCount;
    int seatCount;
    int memberCount;
    long createdAt;
    long updatedAt;

    public static BridgeConfigSummary of(BridgeConfig config) {
        return BridgeConfigSummary.builder()
            .communityId(config.getCommunityId())
            .guildId(config.getGuildId())
            .enabled(config.isEnabled())
            .channelCount(config.getChannels().size())
            .seatCount(config.getSeats().size())
            .memberCount(config.getMemberDids().size())
            .createdAt(config.getCreatedAt())
            .updatedAt(config.getUpdatedAt())
            .build();
    }
}
