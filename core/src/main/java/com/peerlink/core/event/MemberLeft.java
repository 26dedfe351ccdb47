package com.peerlink.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class MemberLeft implements CommunityEvent {
    public static final String TYPE = "memberLeft";

    String memberDid;

    @JsonCreator
    public MemberLeft(@JsonProperty("memberDid") String memberDid) {
        this.memberDid = memberDid;
    }

    @Override
    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMemberLeft(this);
    }
}
