package com.peerlink.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One-to-one mapping between a platform channel and a community channel.
 */
@Value
@Builder
@Jacksonized
public class BridgeChannel {
    String discordChannelId;

    /**
     * Canonical channel ID on the community side.
     */
    String umbraChannelId;

    String name;
}
