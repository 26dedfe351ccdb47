package com.peerlink.relay.offline;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A message held for a DID that was not reachable when it was sent.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class OfflineMessage {
    String id;
    String fromDid;

    /**
     * Opaque payload exactly as the sender passed it.
     */
    String payload;

    /**
     * Epoch millis when the relay accepted the send.
     */
    long timestamp;

    /**
     * Epoch millis when the message entered the queue.
     */
    long queuedAt;
}
