package com.peerlink.client.sync;

import lombok.Getter;

/**
 * A community or channel ID that cannot be mapped to exactly one local record. The event that
 * carried it is dropped; retrying cannot help until the missing data arrives.
 */
@Getter
public class ResolutionException extends RuntimeException {

    public enum Reason {
        UNKNOWN_LOCAL_COMMUNITY,
        UNKNOWN_COMMUNITY,
        UNKNOWN_CHANNEL,
        AMBIGUOUS_CHANNEL,
        MISSING_FIELD
    }

    private final Reason reason;

    public ResolutionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
