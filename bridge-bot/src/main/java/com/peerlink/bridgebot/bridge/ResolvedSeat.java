package com.peerlink.bridgebot.bridge;

import lombok.Value;

import javax.annotation.Nullable;

/**
 * Who a platform message is attributed to inside the community.
 */
@Value
public class ResolvedSeat {
    /**
     * The claimed seat's DID, or the bridge DID for ghost seats.
     */
    String did;
    String displayName;
    @Nullable
    String avatarUrl;
    boolean ghost;
}
