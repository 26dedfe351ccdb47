package com.peerlink.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ChannelCreated implements ChannelScoped {
    public static final String TYPE = "channelCreated";

    String channelId;
    String channelName;

    @JsonCreator
    public ChannelCreated(
        @JsonProperty("channelId") String channelId,
        @JsonProperty("channelName") String channelName
    ) {
        this.channelId = channelId;
        this.channelName = channelName;
    }

    @Override
    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitChannelCreated(this);
    }

    @Override
    public ChannelCreated withChannel(String channelId, String channelName) {
        return new ChannelCreated(channelId, channelName);
    }
}
