package com.peerlink.core.identity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.ToString;
import lombok.Value;

/**
 * Long-lived identity of one process. Only {@link #did} ever leaves the machine.
 */
@Value
public class Identity {
    String did;
    String publicKeyHex;

    @ToString.Exclude
    String privateKeyHex;

    @JsonCreator
    public Identity(
        @JsonProperty("did") String did,
        @JsonProperty("publicKeyHex") String publicKeyHex,
        @JsonProperty("privateKeyHex") String privateKeyHex
    ) {
        this.did = did;
        this.publicKeyHex = publicKeyHex;
        this.privateKeyHex = privateKeyHex;
    }
}
