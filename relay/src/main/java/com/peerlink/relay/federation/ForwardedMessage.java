package com.peerlink.relay.federation;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A send handed from the sender's relay to the relay holding the recipient's socket.
 */
@Value
@Builder
@Jacksonized
public class ForwardedMessage {
    String fromDid;
    String toDid;
    String payload;
    long timestamp;
    String originRelayId;
}
