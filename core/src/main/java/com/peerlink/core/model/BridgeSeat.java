package com.peerlink.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import javax.annotation.Nullable;

/**
 * A platform user projected into the community.
 * <p>
 * A seat without {@link #seatDid} is a ghost seat: the user has not linked a DID, so their
 * messages are authored by the bridge's own DID and rendered with the platform identity.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class BridgeSeat {
    String discordUserId;
    String discordUsername;

    @Nullable
    String avatarUrl;

    @Nullable
    String seatDid;

    @JsonIgnore
    public boolean isClaimed() {
        return seatDid != null;
    }
}
