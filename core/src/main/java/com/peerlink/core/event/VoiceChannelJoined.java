package com.peerlink.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VoiceChannelJoined implements ChannelScoped {
    public static final String TYPE = "voiceChannelJoined";

    String channelId;
    String channelName;
    String memberDid;

    @JsonCreator
    public VoiceChannelJoined(
        @JsonProperty("channelId") String channelId,
        @JsonProperty("channelName") String channelName,
        @JsonProperty("memberDid") String memberDid
    ) {
        this.channelId = channelId;
        this.channelName = channelName;
        this.memberDid = memberDid;
    }

    @Override
    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitVoiceChannelJoined(this);
    }

    @Override
    public VoiceChannelJoined withChannel(String channelId, String channelName) {
        return new VoiceChannelJoined(channelId, channelName, memberDid);
    }
}
