package com.peerlink.client.sync;

import lombok.Value;

/**
 * Outcome of one fan-out. {@code failed} sends are not lost for good: they were never handed to
 * the relay, so the caller may retry them.
 */
@Value
public class BroadcastResult {
    int targets;
    int sent;
    int failed;
}
