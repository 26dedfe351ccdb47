package com.peerlink.core.event;

/**
 * One community mutation carried inside a {@link CommunityEventEnvelope}.
 * <p>
 * The set of variants is closed: every known {@code type} tag has its own class, and anything
 * else decodes to {@link UnknownCommunityEvent} with the raw JSON kept intact. Consumers dispatch
 * through {@link Visitor}, so adding a variant forces every consumer to handle it.
 * </p>
 */
public interface CommunityEvent {

    /**
     * Wire tag, e.g. {@code communityMessageSent}.
     */
    String getType();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitMessageSent(CommunityMessageSent event);

        R visitMessageDeleted(CommunityMessageDeleted event);

        R visitMemberJoined(MemberJoined event);

        R visitMemberLeft(MemberLeft event);

        R visitChannelCreated(ChannelCreated event);

        R visitVoiceChannelJoined(VoiceChannelJoined event);

        R visitVoiceChannelLeft(VoiceChannelLeft event);

        R visitUnknown(UnknownCommunityEvent event);
    }
}
