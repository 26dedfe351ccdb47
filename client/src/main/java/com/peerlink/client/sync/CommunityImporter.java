package com.peerlink.client.sync;

import com.peerlink.client.store.CommunityStore;
import com.peerlink.client.store.LocalChannel;
import com.peerlink.client.store.LocalCommunity;
import com.peerlink.client.store.LocalMember;
import com.peerlink.core.event.MemberJoined;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Both ends of the invite flow: creating a community and its invite on the owner's side,
 * importing it on the joiner's side.
 */
public class CommunityImporter {
    private static final Logger log = LoggerFactory.getLogger(CommunityImporter.class);

    private final CommunityStore store;
    private final CanonicalIdResolver resolver;
    private final CommunityEventBroadcaster broadcaster;
    private final String selfDid;
    private final Clock clock;

    public CommunityImporter(CommunityStore store, CanonicalIdResolver resolver, CommunityEventBroadcaster broadcaster,
                             String selfDid, Clock clock) {
        this.store = store;
        this.resolver = resolver;
        this.broadcaster = broadcaster;
        this.selfDid = selfDid;
        this.clock = clock;
    }

    /**
     * Creates a community owned by this peer. Its local ID is the canonical ID.
     */
    public LocalCommunity createCommunity(String name, List<String> channelNames) {
        long now = clock.millis();
        LocalCommunity community = LocalCommunity.builder()
            .localId(UUID.randomUUID().toString())
            .ownerDid(selfDid)
            .name(name)
            .createdAt(now)
            .build();

        store.inTransaction(() -> {
            store.saveCommunity(community);
            for (String channelName : channelNames) {
                store.saveChannel(LocalChannel.builder()
                    .localId(UUID.randomUUID().toString())
                    .communityLocalId(community.getLocalId())
                    .name(channelName)
                    .build());
            }
            store.saveMember(member(community.getLocalId(), selfDid, null, null, now));
        });
        log.info("Created community {} ({})", community.getName(), community.getLocalId());
        return community;
    }

    public InvitePayload createInvite(String localCommunityId) {
        LocalCommunity community = store.findCommunity(localCommunityId)
            .orElseThrow(() -> new ResolutionException(ResolutionException.Reason.UNKNOWN_LOCAL_COMMUNITY,
                "No local community " + localCommunityId));
        return InvitePayload.builder()
            .communityId(resolver.toCanonicalCommunityId(localCommunityId))
            .ownerDid(community.getOwnerDid())
            .name(community.getName())
            .channels(store.channels(localCommunityId).stream()
                .map(channel -> InvitePayload.InviteChannel.builder()
                    .channelId(resolver.toCanonicalChannelId(channel))
                    .name(channel.getName())
                    .build())
                .collect(Collectors.toList()))
            .build();
    }

    /**
     * Imports a community from an invite. Importing the same community again returns the existing
     * copy; importing one this peer created returns the original.
     * <p>
     * After an import the joiner announces itself with {@code memberJoined}, including on repeated
     * imports, since an earlier announcement may not have reached anyone.
     * </p>
     */
    public LocalCommunity importFromInvite(InvitePayload invite, @Nullable String nickname, @Nullable String avatarUrl) {
        String canonicalId = invite.getCommunityId();

        LocalCommunity owned = store.findCommunity(canonicalId).filter(c -> !c.isImported()).orElse(null);
        if (owned != null) {
            log.info("Invite for {} points at a community this peer owns", canonicalId);
            return owned;
        }

        LocalCommunity community = store.inTransaction(() -> store.findCommunityByOrigin(canonicalId)
            .map(existing -> {
                log.info("Community {} already imported as {}", canonicalId, existing.getLocalId());
                return existing;
            })
            .orElseGet(() -> createImportedCopy(invite, nickname, avatarUrl)));

        broadcaster.broadcast(community.getLocalId(), new MemberJoined(selfDid, nickname, avatarUrl));
        return community;
    }

    private LocalCommunity createImportedCopy(InvitePayload invite, @Nullable String nickname, @Nullable String avatarUrl) {
        long now = clock.millis();
        LocalCommunity community = LocalCommunity.builder()
            .localId(UUID.randomUUID().toString())
            .originCommunityId(invite.getCommunityId())
            .ownerDid(invite.getOwnerDid())
            .name(invite.getName())
            .createdAt(now)
            .build();
        store.saveCommunity(community);

        for (InvitePayload.InviteChannel channel : invite.getChannels()) {
            store.saveChannel(LocalChannel.builder()
                .localId(UUID.randomUUID().toString())
                .communityLocalId(community.getLocalId())
                .originChannelId(channel.getChannelId())
                .name(channel.getName())
                .build());
        }

        store.saveMember(member(community.getLocalId(), invite.getOwnerDid(), null, null, now));
        store.saveMember(member(community.getLocalId(), selfDid, nickname, avatarUrl, now));

        log.info("Imported community {} as {} with {} channels",
            invite.getCommunityId(), community.getLocalId(), invite.getChannels().size());
        return community;
    }

    private static LocalMember member(String communityLocalId, String did, @Nullable String nickname,
                                      @Nullable String avatarUrl, long joinedAt) {
        return LocalMember.builder()
            .communityLocalId(communityLocalId)
            .did(did)
            .nickname(nickname)
            .avatarUrl(avatarUrl)
            .joinedAt(joinedAt)
            .build();
    }
}
