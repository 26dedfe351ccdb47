package com.peerlink.bridgebot.bridge;

import com.peerlink.core.model.BridgeSeat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps platform users to community identities and back.
 * <p>
 * A seat without a DID is a ghost seat: messages from that user are authored by the bridge DID
 * and rendered with the platform name and avatar. Users without any seat are treated the same
 * way, using the name and avatar of the message itself. Immutable; a config reload builds a
 * new instance.
 * </p>
 */
public final class SeatResolver {
    private static final Logger log = LoggerFactory.getLogger(SeatResolver.class);

    private final String bridgeDid;
    private final Map<String, BridgeSeat> byDiscordUser;
    private final Map<String, BridgeSeat> byDid;

    private SeatResolver(String bridgeDid, List<BridgeSeat> seats) {
        this.bridgeDid = bridgeDid;
        Map<String, BridgeSeat> discord = new HashMap<>();
        Map<String, BridgeSeat> did = new HashMap<>();
        for (BridgeSeat seat : seats) {
            if (seat.getDiscordUserId() == null) {
                log.warn("Skipping seat without discordUserId: {}", seat);
                continue;
            }
            discord.put(seat.getDiscordUserId(), seat);
            if (seat.isClaimed()) {
                did.put(seat.getSeatDid(), seat);
            }
        }
        this.byDiscordUser = Map.copyOf(discord);
        this.byDid = Map.copyOf(did);
    }

    public static SeatResolver load(String bridgeDid, List<BridgeSeat> seats) {
        return new SeatResolver(bridgeDid, seats);
    }

    public ResolvedSeat resolveDiscordUser(String discordUserId, String fallbackName, @Nullable String fallbackAvatar) {
        BridgeSeat seat = discordUserId == null ? null : byDiscordUser.get(discordUserId);
        if (seat == null) {
            return new ResolvedSeat(bridgeDid, fallbackName, fallbackAvatar, true);
        }
        return new ResolvedSeat(
            seat.isClaimed() ? seat.getSeatDid() : bridgeDid,
            seat.getDiscordUsername() != null ? seat.getDiscordUsername() : fallbackName,
            seat.getAvatarUrl() != null ? seat.getAvatarUrl() : fallbackAvatar,
            !seat.isClaimed());
    }

    /**
     * Reverse lookup of a claimed seat by its DID.
     */
    @Nullable
    public BridgeSeat resolveUmbraDid(@Nullable String did) {
        return did == null ? null : byDid.get(did);
    }

    @Nullable
    public String displayNameOf(@Nullable String discordUserId) {
        BridgeSeat seat = discordUserId == null ? null : byDiscordUser.get(discordUserId);
        return seat == null ? null : seat.getDiscordUsername();
    }
}
