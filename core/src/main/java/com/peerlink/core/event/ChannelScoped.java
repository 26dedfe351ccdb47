package com.peerlink.core.event;

import javax.annotation.Nullable;

/**
 * An event addressed to one channel of a community.
 * <p>
 * Channel IDs are generated independently by every peer, so these events also carry the channel
 * name for the receiver's by-name fallback.
 * </p>
 */
public interface ChannelScoped extends CommunityEvent {

    String getChannelId();

    @Nullable
    String getChannelName();

    /**
     * Copy of this event addressed with the given channel ID and name.
     */
    ChannelScoped withChannel(String channelId, @Nullable String channelName);
}
