package com.peerlink.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class UpdateMembersRequest {
    List<String> memberDids;

    @JsonCreator
    public UpdateMembersRequest(@JsonProperty("memberDids") List<String> memberDids) {
        this.memberDids = memberDids == null ? List.of() : List.copyOf(memberDids);
    }
}
