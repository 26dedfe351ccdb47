package com.peerlink.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Body of {@code POST /api/bridge/register}. Registering an existing community replaces its
 * config.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RegisterBridgeRequest {
    String communityId;
    String guildId;

    @Builder.Default
    List<BridgeChannel> channels = List.of();

    @Builder.Default
    List<BridgeSeat> seats = List.of();

    @Builder.Default
    List<String> memberDids = List.of();

    @Nullable
    String bridgeDid;

    public static RegisterBridgeRequest from(BridgeConfig config) {
        return RegisterBridgeRequest.builder()
            .communityId(config.getCommunityId())
            .guildId(config.getGuildId())
            .channels(config.getChannels())
            .seats(config.getSeats())
            .memberDids(config.getMemberDids())
            .bridgeDid(config.getBridgeDid())
            .build();
    }
}
