package com.peerlink.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class SetEnabledRequest {
    boolean enabled;

    @JsonCreator
    public SetEnabledRequest(@JsonProperty("enabled") boolean enabled) {
        this.enabled = enabled;
    }
}
