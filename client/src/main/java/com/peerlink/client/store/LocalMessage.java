package com.peerlink.client.store;

import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;

@Value
@Builder(toBuilder = true)
public class LocalMessage {
    String messageId;
    String communityLocalId;
    String channelLocalId;
    String senderDid;
    String content;

    @Nullable
    String senderDisplayName;

    @Nullable
    String senderAvatarUrl;

    long timestamp;
}
