package com.peerlink.client.store;

import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;

@Value
@Builder(toBuilder = true)
public class LocalChannel {
    String localId;
    String communityLocalId;

    /**
     * The owner's channel ID for imported channels.
     */
    @Nullable
    String originChannelId;

    String name;
}
