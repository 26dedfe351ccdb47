package com.peerlink.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * A chat message posted to a channel. {@code content} is inline so bridges and late joiners can
 * render it without a separate fetch. The sender display fields are set for platform ghost seats.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommunityMessageSent implements ChannelScoped {
    public static final String TYPE = "communityMessageSent";

    String channelId;
    @Nullable
    String channelName;
    String messageId;
    String senderDid;
    @Nullable
    String content;
    @Nullable
    String senderDisplayName;
    @Nullable
    String senderAvatarUrl;
    @Nullable
    String platformUserId;
    @Nullable
    String platform;

    @JsonCreator
    public CommunityMessageSent(
        @JsonProperty("channelId") String channelId,
        @JsonProperty("channelName") String channelName,
        @JsonProperty("messageId") String messageId,
        @JsonProperty("senderDid") String senderDid,
        @JsonProperty("content") String content,
        @JsonProperty("senderDisplayName") String senderDisplayName,
        @JsonProperty("senderAvatarUrl") String senderAvatarUrl,
        @JsonProperty("platformUserId") String platformUserId,
        @JsonProperty("platform") String platform
    ) {
        this.channelId = channelId;
        this.channelName = channelName;
        this.messageId = messageId;
        this.senderDid = senderDid;
        this.content = content;
        this.senderDisplayName = senderDisplayName;
        this.senderAvatarUrl = senderAvatarUrl;
        this.platformUserId = platformUserId;
        this.platform = platform;
    }

    @Override
    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMessageSent(this);
    }

    @Override
    public CommunityMessageSent withChannel(String channelId, String channelName) {
        return toBuilder().channelId(channelId).channelName(channelName).build();
    }
}
