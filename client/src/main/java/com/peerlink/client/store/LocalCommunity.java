package com.peerlink.client.store;

import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * A community as this peer stores it.
 * <p>
 * {@code originCommunityId} is set only on imported copies and holds the creator's local ID,
 * which is the canonical ID every peer converges on. The creator's own record has none.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class LocalCommunity {
    String localId;

    @Nullable
    String originCommunityId;

    String ownerDid;
    String name;
    long createdAt;

    public boolean isImported() {
        return originCommunityId != null;
    }
}
