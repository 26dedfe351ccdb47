package com.peerlink.client.sync;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * What a community owner hands out to let a peer import the community. All IDs are canonical.
 */
@Value
@Builder
@Jacksonized
public class InvitePayload {
    String communityId;
    String ownerDid;
    String name;

    @Builder.Default
    List<InviteChannel> channels = List.of();

    @Value
    @Builder
    @Jacksonized
    public static class InviteChannel {
        String channelId;
        String name;
    }
}
