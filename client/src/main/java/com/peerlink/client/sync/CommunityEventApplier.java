package com.peerlink.client.sync;

import com.peerlink.client.relay.RelayListener;
import com.peerlink.client.store.CommunityStore;
import com.peerlink.client.store.LocalChannel;
import com.peerlink.client.store.LocalCommunity;
import com.peerlink.client.store.LocalMember;
import com.peerlink.client.store.LocalMessage;
import com.peerlink.core.event.ChannelCreated;
import com.peerlink.core.event.CommunityEvent;
import com.peerlink.core.event.CommunityEventEnvelope;
import com.peerlink.core.event.CommunityMessageDeleted;
import com.peerlink.core.event.CommunityMessageSent;
import com.peerlink.core.event.MemberJoined;
import com.peerlink.core.event.MemberLeft;
import com.peerlink.core.event.UnknownCommunityEvent;
import com.peerlink.core.event.VoiceChannelJoined;
import com.peerlink.core.event.VoiceChannelLeft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Applies community events received from other peers to the local store.
 * <p>
 * Each envelope is resolved to local IDs and applied in its own transaction. Events this peer
 * sent itself, events for unknown communities or channels, and messages already stored are
 * dropped. The same message can legitimately arrive twice: once forwarded live and once from
 * the offline queue.
 * </p>
 */
public class CommunityEventApplier implements RelayListener {
    private static final Logger log = LoggerFactory.getLogger(CommunityEventApplier.class);

    private final CommunityStore store;
    private final CanonicalIdResolver resolver;
    private final String selfDid;

    // channelLocalId -> DIDs currently in the voice channel
    private final Map<String, Set<String>> voicePresence = new ConcurrentHashMap<>();

    public CommunityEventApplier(CommunityStore store, CanonicalIdResolver resolver, String selfDid) {
        this.store = store;
        this.resolver = resolver;
        this.selfDid = selfDid;
    }

    @Override
    public void onEnvelope(CommunityEventEnvelope envelope, String fromDid) {
        apply(envelope);
    }

    /**
     * @return true if the event changed or was already reflected in the local store
     */
    public boolean apply(CommunityEventEnvelope envelope) {
        CommunityEventEnvelope.Payload payload = envelope.getPayload();
        CommunityEvent event = payload.getEvent();
        if (selfDid.equals(payload.getSenderDid())) {
            log.debug("Ignoring own {} echoed back", event.getType());
            return false;
        }

        try {
            store.inTransaction(() -> {
                LocalCommunity community = resolver.resolveCommunity(payload.getCommunityId());
                event.accept(new Applying(community, payload));
            });
            return true;
        } catch (ResolutionException e) {
            log.warn("Dropping {} from {}: {} ({})", event.getType(), payload.getSenderDid(), e.getMessage(), e.getReason());
            return false;
        }
    }

    public Set<String> voiceParticipants(String channelLocalId) {
        return Set.copyOf(voicePresence.getOrDefault(channelLocalId, Set.of()));
    }

    private class Applying implements CommunityEvent.Visitor<Void> {
        private final LocalCommunity community;
        private final CommunityEventEnvelope.Payload payload;

        Applying(LocalCommunity community, CommunityEventEnvelope.Payload payload) {
            this.community = community;
            this.payload = payload;
        }

        @Override
        public Void visitMessageSent(CommunityMessageSent event) {
            if (event.getMessageId() == null) {
                log.warn("Dropping communityMessageSent without messageId from {}", payload.getSenderDid());
                return null;
            }
            LocalChannel channel = resolver.resolveChannel(community, event.getChannelId(), event.getChannelName());
            if (store.findMessage(event.getMessageId()).isPresent()) {
                log.debug("Message {} already stored", event.getMessageId());
                return null;
            }

            store.saveMessage(LocalMessage.builder()
                .messageId(event.getMessageId())
                .communityLocalId(community.getLocalId())
                .channelLocalId(channel.getLocalId())
                .senderDid(event.getSenderDid() != null ? event.getSenderDid() : payload.getSenderDid())
                .content(event.getContent() != null ? event.getContent() : "")
                .senderDisplayName(event.getSenderDisplayName())
                .senderAvatarUrl(event.getSenderAvatarUrl())
                .timestamp(payload.getTimestamp())
                .build());
            log.debug("Stored message {} in {}/{}", event.getMessageId(), community.getLocalId(), channel.getName());
            return null;
        }

        @Override
        public Void visitMessageDeleted(CommunityMessageDeleted event) {
            store.findMessage(event.getMessageId())
                .filter(message -> message.getCommunityLocalId().equals(community.getLocalId()))
                .ifPresent(message -> store.removeMessage(message.getMessageId()));
            return null;
        }

        @Override
        public Void visitMemberJoined(MemberJoined event) {
            requireMemberDid(event.getMemberDid(), event);
            if (store.findMember(community.getLocalId(), event.getMemberDid()).isEmpty()) {
                store.saveMember(LocalMember.builder()
                    .communityLocalId(community.getLocalId())
                    .did(event.getMemberDid())
                    .nickname(event.getMemberNickname())
                    .avatarUrl(event.getMemberAvatar())
                    .joinedAt(payload.getTimestamp())
                    .build());
                log.info("{} joined community {}", event.getMemberDid(), community.getLocalId());
            }
            return null;
        }

        @Override
        public Void visitMemberLeft(MemberLeft event) {
            requireMemberDid(event.getMemberDid(), event);
            if (store.removeMember(community.getLocalId(), event.getMemberDid())) {
                log.info("{} left community {}", event.getMemberDid(), community.getLocalId());
            }
            return null;
        }

        @Override
        public Void visitChannelCreated(ChannelCreated event) {
            if (event.getChannelId() == null) {
                throw new ResolutionException(ResolutionException.Reason.UNKNOWN_CHANNEL, "channelCreated without channelId");
            }
            boolean known = store.channels(community.getLocalId()).stream()
                .anyMatch(channel -> event.getChannelId().equals(channel.getLocalId())
                    || event.getChannelId().equals(channel.getOriginChannelId())
                    || Objects.equals(event.getChannelName(), channel.getName()));
            if (known) {
                log.debug("Channel {} ({}) already present", event.getChannelId(), event.getChannelName());
                return null;
            }

            store.saveChannel(LocalChannel.builder()
                .localId(UUID.randomUUID().toString())
                .communityLocalId(community.getLocalId())
                .originChannelId(event.getChannelId())
                .name(event.getChannelName())
                .build());
            return null;
        }

        @Override
        public Void visitVoiceChannelJoined(VoiceChannelJoined event) {
            requireMemberDid(event.getMemberDid(), event);
            LocalChannel channel = resolver.resolveChannel(community, event.getChannelId(), event.getChannelName());
            voicePresence.computeIfAbsent(channel.getLocalId(), k -> ConcurrentHashMap.newKeySet()).add(event.getMemberDid());
            return null;
        }

        @Override
        public Void visitVoiceChannelLeft(VoiceChannelLeft event) {
            requireMemberDid(event.getMemberDid(), event);
            LocalChannel channel = resolver.resolveChannel(community, event.getChannelId(), event.getChannelName());
            Set<String> participants = voicePresence.get(channel.getLocalId());
            if (participants != null) {
                participants.remove(event.getMemberDid());
            }
            return null;
        }

        private void requireMemberDid(String memberDid, CommunityEvent event) {
            if (memberDid == null || memberDid.isBlank()) {
                throw new ResolutionException(ResolutionException.Reason.MISSING_FIELD, event.getType() + " without memberDid");
            }
        }

        @Override
        public Void visitUnknown(UnknownCommunityEvent event) {
            log.debug("Ignoring unknown community event type {}", event.getType());
            return null;
        }
    }
}
