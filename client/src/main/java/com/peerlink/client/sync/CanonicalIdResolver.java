package com.peerlink.client.sync;

import com.peerlink.client.store.CommunityStore;
import com.peerlink.client.store.LocalChannel;
import com.peerlink.client.store.LocalCommunity;

import javax.annotation.Nullable;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps between this peer's local IDs and the canonical IDs carried on the wire.
 * <p>
 * The canonical ID of a community is the creator's local ID. The creator's record has no origin
 * and is canonical as is; imported copies store it as {@code originCommunityId}. Channels follow
 * the same rule, with a by-name fallback for channels each peer created on its own.
 * </p>
 */
public class CanonicalIdResolver {

    private final CommunityStore store;

    public CanonicalIdResolver(CommunityStore store) {
        this.store = store;
    }

    // ---------------------------------------------------------------- outbound

    public String toCanonicalCommunityId(String localCommunityId) {
        LocalCommunity community = store.findCommunity(localCommunityId)
            .orElseThrow(() -> new ResolutionException(ResolutionException.Reason.UNKNOWN_LOCAL_COMMUNITY,
                "No local community " + localCommunityId));
        return community.isImported() ? community.getOriginCommunityId() : community.getLocalId();
    }

    public String toCanonicalChannelId(LocalChannel channel) {
        return channel.getOriginChannelId() != null ? channel.getOriginChannelId() : channel.getLocalId();
    }

    /**
     * Finds a channel of a local community by its local ID.
     */
    public LocalChannel localChannel(String localCommunityId, String channelLocalId) {
        return store.findChannel(channelLocalId)
            .filter(channel -> channel.getCommunityLocalId().equals(localCommunityId))
            .orElseThrow(() -> new ResolutionException(ResolutionException.Reason.UNKNOWN_CHANNEL,
                "No channel " + channelLocalId + " in community " + localCommunityId));
    }

    // ---------------------------------------------------------------- inbound

    /**
     * Finds this peer's record for a canonical community ID: the imported copy if there is one,
     * otherwise this peer's own community if it is the creator.
     */
    public LocalCommunity resolveCommunity(String canonicalCommunityId) {
        return store.findCommunityByOrigin(canonicalCommunityId)
            .or(() -> store.findCommunity(canonicalCommunityId).filter(c -> !c.isImported()))
            .orElseThrow(() -> new ResolutionException(ResolutionException.Reason.UNKNOWN_COMMUNITY,
                "No local community for canonical id " + canonicalCommunityId));
    }

    /**
     * Resolves a channel by ID first, then by name. Two channels with the same name are never
     * guessed between.
     */
    public LocalChannel resolveChannel(LocalCommunity community, @Nullable String channelId, @Nullable String channelName) {
        List<LocalChannel> channels = store.channels(community.getLocalId());

        if (channelId != null) {
            for (LocalChannel channel : channels) {
                if (channelId.equals(channel.getLocalId()) || channelId.equals(channel.getOriginChannelId())) {
                    return channel;
                }
            }
        }

        if (channelName != null) {
            List<LocalChannel> byName = channels.stream()
                .filter(channel -> channelName.equals(channel.getName()))
                .collect(Collectors.toList());
            if (byName.size() == 1) {
                return byName.get(0);
            }
            if (byName.size() > 1) {
                throw new ResolutionException(ResolutionException.Reason.AMBIGUOUS_CHANNEL,
                    byName.size() + " channels named '" + channelName + "' in community " + community.getLocalId());
            }
        }

        throw new ResolutionException(ResolutionException.Reason.UNKNOWN_CHANNEL,
            "No channel " + channelId + " (" + channelName + ") in community " + community.getLocalId());
    }
}
