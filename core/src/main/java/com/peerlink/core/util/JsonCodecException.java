package com.peerlink.core.util;

/**
 * Raised when a value cannot be written to or read from JSON.
 * <p>
 * Callers at a frame boundary catch it, log and drop the single frame.
 * </p>
 */
public class JsonCodecException extends RuntimeException {
    public JsonCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
