package com.peerlink.client.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Local persistence for communities, channels, members and messages.
 * <p>
 * Every inbound event is applied inside one {@link #inTransaction(Supplier)} call, so a failure
 * half way through leaves no partial changes behind.
 * </p>
 */
public interface CommunityStore {

    <T> T inTransaction(Supplier<T> work);

    default void inTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }

    // ---------------------------------------------------------------- communities

    Optional<LocalCommunity> findCommunity(String localId);

    /**
     * Finds the imported copy of a community by its canonical ID.
     */
    Optional<LocalCommunity> findCommunityByOrigin(String originCommunityId);

    List<LocalCommunity> communities();

    void saveCommunity(LocalCommunity community);

    // ---------------------------------------------------------------- channels

    Optional<LocalChannel> findChannel(String channelLocalId);

    List<LocalChannel> channels(String communityLocalId);

    void saveChannel(LocalChannel channel);

    // ---------------------------------------------------------------- members

    List<LocalMember> members(String communityLocalId);

    Optional<LocalMember> findMember(String communityLocalId, String did);

    void saveMember(LocalMember member);

    boolean removeMember(String communityLocalId, String did);

    // ---------------------------------------------------------------- messages

    Optional<LocalMessage> findMessage(String messageId);

    /**
     * Messages of one channel, oldest first.
     */
    List<LocalMessage> messages(String channelLocalId);

    void saveMessage(LocalMessage message);

    boolean removeMessage(String messageId);
}
