package com.peerlink.client.store;

import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;

@Value
@Builder(toBuilder = true)
public class LocalMember {
    String communityLocalId;
    String did;

    @Nullable
    String nickname;

    @Nullable
    String avatarUrl;

    long joinedAt;
}
