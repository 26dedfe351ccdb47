package com.peerlink.relay.route;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of routing one {@code send}.
 */
@Getter
@RequiredArgsConstructor
public enum RouteResult {
    /**
     * Recipient holds a registered socket on this relay and the frame was handed to it.
     */
    DELIVERED_LOCALLY("delivered_locally"),

    /**
     * Recipient is registered on another relay and the frame was published to it. Not a delivery
     * confirmation: the message is queued offline as well.
     */
    FORWARDED_TO_PEER("forwarded"),

    /**
     * Recipient is not known to be online anywhere; the message is queued offline.
     */
    UNREACHABLE("unreachable");

    private final String tag;

    public boolean isQueued() {
        return this != DELIVERED_LOCALLY;
    }
}
