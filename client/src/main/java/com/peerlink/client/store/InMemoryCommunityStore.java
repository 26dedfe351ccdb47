package com.peerlink.client.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link CommunityStore} kept in memory. Transactions snapshot all tables and restore them if
 * the work throws.
 */
public class InMemoryCommunityStore implements CommunityStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCommunityStore.class);

    private final ReentrantLock lock = new ReentrantLock();

    private Map<String, LocalCommunity> communities = new LinkedHashMap<>();
    private Map<String, LocalChannel> channels = new LinkedHashMap<>();
    // communityLocalId -> did -> member
    private Map<String, Map<String, LocalMember>> members = new LinkedHashMap<>();
    private Map<String, LocalMessage> messages = new LinkedHashMap<>();

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        lock.lock();
        try {
            if (lock.getHoldCount() > 1) {
                // nested: the outermost transaction owns the rollback
                return work.get();
            }
            Snapshot snapshot = new Snapshot();
            try {
                return work.get();
            } catch (RuntimeException e) {
                snapshot.restore();
                log.debug("Transaction rolled back: {}", e.getMessage());
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<LocalCommunity> findCommunity(String localId) {
        return locked(() -> Optional.ofNullable(communities.get(localId)));
    }

    @Override
    public Optional<LocalCommunity> findCommunityByOrigin(String originCommunityId) {
        return locked(() -> communities.values().stream()
            .filter(c -> originCommunityId.equals(c.getOriginCommunityId()))
            .findFirst());
    }

    @Override
    public List<LocalCommunity> communities() {
        return locked(() -> new ArrayList<>(communities.values()));
    }

    @Override
    public void saveCommunity(LocalCommunity community) {
        locked(() -> communities.put(community.getLocalId(), community));
    }

    @Override
    public Optional<LocalChannel> findChannel(String channelLocalId) {
        return locked(() -> Optional.ofNullable(channels.get(channelLocalId)));
    }

    @Override
    public List<LocalChannel> channels(String communityLocalId) {
        return locked(() -> channels.values().stream()
            .filter(c -> c.getCommunityLocalId().equals(communityLocalId))
            .collect(Collectors.toList()));
    }

    @Override
    public void saveChannel(LocalChannel channel) {
        locked(() -> channels.put(channel.getLocalId(), channel));
    }

    @Override
    public List<LocalMember> members(String communityLocalId) {
        return locked(() -> new ArrayList<>(members.getOrDefault(communityLocalId, Map.of()).values()));
    }

    @Override
    public Optional<LocalMember> findMember(String communityLocalId, String did) {
        return locked(() -> Optional.ofNullable(members.getOrDefault(communityLocalId, Map.of()).get(did)));
    }

    @Override
    public void saveMember(LocalMember member) {
        locked(() -> members.computeIfAbsent(member.getCommunityLocalId(), k -> new LinkedHashMap<>())
            .put(member.getDid(), member));
    }

    @Override
    public boolean removeMember(String communityLocalId, String did) {
        return locked(() -> {
            Map<String, LocalMember> community = members.get(communityLocalId);
            return community != null && community.remove(did) != null;
        });
    }

    @Override
    public Optional<LocalMessage> findMessage(String messageId) {
        return locked(() -> Optional.ofNullable(messages.get(messageId)));
    }

    @Override
    public List<LocalMessage> messages(String channelLocalId) {
        return locked(() -> messages.values().stream()
            .filter(m -> m.getChannelLocalId().equals(channelLocalId))
            .sorted(Comparator.comparingLong(LocalMessage::getTimestamp))
            .collect(Collectors.toList()));
    }

    @Override
    public void saveMessage(LocalMessage message) {
        locked(() -> messages.put(message.getMessageId(), message));
    }

    @Override
    public boolean removeMessage(String messageId) {
        return locked(() -> messages.remove(messageId) != null);
    }

    private <T> T locked(Supplier<T> read) {
        lock.lock();
        try {
            return read.get();
        } finally {
            lock.unlock();
        }
    }

    private class Snapshot {
        private final Map<String, LocalCommunity> communities = new LinkedHashMap<>(InMemoryCommunityStore.this.communities);
        private final Map<String, LocalChannel> channels = new LinkedHashMap<>(InMemoryCommunityStore.this.channels);
        private final Map<String, Map<String, LocalMember>> members = new LinkedHashMap<>();
        private final Map<String, LocalMessage> messages = new LinkedHashMap<>(InMemoryCommunityStore.this.messages);

        Snapshot() {
            InMemoryCommunityStore.this.members.forEach((id, byDid) -> members.put(id, new LinkedHashMap<>(byDid)));
        }

        void restore() {
            InMemoryCommunityStore.this.communities = communities;
            InMemoryCommunityStore.this.channels = channels;
            InMemoryCommunityStore.this.members = members;
            InMemoryCommunityStore.this.messages = messages;
        }
    }
}
