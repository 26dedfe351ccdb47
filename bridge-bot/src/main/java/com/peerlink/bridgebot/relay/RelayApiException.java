package com.peerlink.bridgebot.relay;

import lombok.Getter;

/**
 * The relay answered a bridge API call with a non-ok response.
 */
@Getter
public class RelayApiException extends RuntimeException {
    private final int status;

    public RelayApiException(int status, String message) {
        super("Relay API error " + status + ": " + message);
        this.status = status;
    }
}
