package com.peerlink.client.sync;

import com.peerlink.client.relay.IRelayConnection;
import com.peerlink.client.store.CommunityStore;
import com.peerlink.client.store.LocalChannel;
import com.peerlink.client.store.LocalMember;
import com.peerlink.client.store.LocalMessage;
import com.peerlink.core.event.ChannelCreated;
import com.peerlink.core.event.ChannelScoped;
import com.peerlink.core.event.CommunityEvent;
import com.peerlink.core.event.CommunityEventEnvelope;
import com.peerlink.core.event.CommunityMessageSent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Sends community events to every known member through the relay.
 * <p>
 * Events are built with local IDs and rewritten to canonical IDs here, right before they leave
 * the peer. Channel-scoped events also carry the channel name so receivers can fall back to it.
 * </p>
 */
public class CommunityEventBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(CommunityEventBroadcaster.class);

    private final CommunityStore store;
    private final CanonicalIdResolver resolver;
    private final IRelayConnection relay;
    private final String selfDid;
    private final Clock clock;

    public CommunityEventBroadcaster(CommunityStore store, CanonicalIdResolver resolver, IRelayConnection relay,
                                     String selfDid, Clock clock) {
        this.store = store;
        this.resolver = resolver;
        this.relay = relay;
        this.selfDid = selfDid;
        this.clock = clock;
    }

    /**
     * @param localCommunityId this peer's ID of the community
     * @param event            event whose channel ID, if any, is a local channel ID
     */
    public BroadcastResult broadcast(String localCommunityId, CommunityEvent event) {
        String communityId = resolver.toCanonicalCommunityId(localCommunityId);
        CommunityEvent outbound = event;
        if (event instanceof ChannelScoped) {
            LocalChannel channel = resolver.localChannel(localCommunityId, ((ChannelScoped) event).getChannelId());
            outbound = ((ChannelScoped) event).withChannel(resolver.toCanonicalChannelId(channel), channel.getName());
        }

        String payload = CommunityEventEnvelope.of(communityId, outbound, selfDid, clock.millis()).toJson();
        List<String> targets = store.members(localCommunityId).stream()
            .map(LocalMember::getDid)
            .filter(did -> did != null && !did.equals(selfDid))
            .distinct()
            .collect(Collectors.toList());

        int sent = 0;
        for (String did : targets) {
            if (relay.sendToDid(did, payload)) {
                sent++;
            }
        }

        BroadcastResult result = new BroadcastResult(targets.size(), sent, targets.size() - sent);
        if (!targets.isEmpty() && sent == 0) {
            log.warn("{} for community {} reached none of {} members", event.getType(), communityId, targets.size());
        } else {
            log.debug("{} for community {} sent to {}/{} members", event.getType(), communityId, sent, targets.size());
        }
        return result;
    }

    /**
     * Stores a message authored by this peer and broadcasts it.
     */
    public LocalMessage sendMessage(String localCommunityId, String localChannelId, String content) {
        LocalChannel channel = resolver.localChannel(localCommunityId, localChannelId);
        LocalMessage message = LocalMessage.builder()
            .messageId(UUID.randomUUID().toString())
            .communityLocalId(localCommunityId)
            .channelLocalId(channel.getLocalId())
            .senderDid(selfDid)
            .content(content)
            .timestamp(clock.millis())
            .build();
        store.saveMessage(message);

        broadcast(localCommunityId, CommunityMessageSent.builder()
            .channelId(channel.getLocalId())
            .messageId(message.getMessageId())
            .senderDid(selfDid)
            .content(content)
            .build());
        return message;
    }

    /**
     * Creates a channel in a local community and announces it.
     */
    public LocalChannel createChannel(String localCommunityId, String name) {
        LocalChannel channel = LocalChannel.builder()
            .localId(UUID.randomUUID().toString())
            .communityLocalId(localCommunityId)
            .name(name)
            .build();
        store.saveChannel(channel);
        broadcast(localCommunityId, new ChannelCreated(channel.getLocalId(), name));
        return channel;
    }
}
