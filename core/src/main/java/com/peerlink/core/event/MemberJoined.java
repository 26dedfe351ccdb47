package com.peerlink.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * Broadcast by a peer right after it imports a community. There is no authoritative member list;
 * every peer rebuilds membership from the events it has seen.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MemberJoined implements CommunityEvent {
    public static final String TYPE = "memberJoined";

    String memberDid;
    @Nullable
    String memberNickname;
    @Nullable
    String memberAvatar;

    @JsonCreator
    public MemberJoined(
        @JsonProperty("memberDid") String memberDid,
        @JsonProperty("memberNickname") String memberNickname,
        @JsonProperty("memberAvatar") String memberAvatar
    ) {
        this.memberDid = memberDid;
        this.memberNickname = memberNickname;
        this.memberAvatar = memberAvatar;
    }

    @Override
    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMemberJoined(this);
    }
}
