package com.peerlink.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Full bridge configuration for one community/guild pair, as stored by the relay.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class BridgeConfig {
    /**
     * Canonical community ID.
     */
    String communityId;

    String guildId;

    @Builder.Default
    boolean enabled = true;

    /**
     * DID the bridge bot authors messages with; filled in by the bot on first load if absent.
     */
    @Nullable
    String bridgeDid;

    @Builder.Default
    List<BridgeChannel> channels = List.of();

    @Builder.Default
    List<BridgeSeat> seats = List.of();

    /**
     * Fan-out list. Must contain the bridge DID once the bot has registered itself.
     */
    @Builder.Default
    List<String> memberDids = List.of();

    long createdAt;
    long updatedAt;
}
