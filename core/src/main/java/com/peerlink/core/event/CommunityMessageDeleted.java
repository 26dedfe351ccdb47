package com.peerlink.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommunityMessageDeleted implements ChannelScoped {
    public static final String TYPE = "communityMessageDeleted";

    String channelId;
    String channelName;
    String messageId;

    @JsonCreator
    public CommunityMessageDeleted(
        @JsonProperty("channelId") String channelId,
        @JsonProperty("channelName") String channelName,
        @JsonProperty("messageId") String messageId
    ) {
        this.channelId = channelId;
        this.channelName = channelName;
        this.messageId = messageId;
    }

    @Override
    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMessageDeleted(this);
    }

    @Override
    public CommunityMessageDeleted withChannel(String channelId, String channelName) {
        return new CommunityMessageDeleted(channelId, channelName, messageId);
    }
}
