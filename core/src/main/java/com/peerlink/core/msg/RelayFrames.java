package com.peerlink.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.peerlink.core.util.JsonCodecException;
import com.peerlink.core.util.JsonUtils;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * JSON frames exchanged between a client and the relay over one WebSocket.
 * <p>
 * Every frame carries a {@code type} tag. The {@code payload} of {@link Send} and {@link Message}
 * is an opaque string the relay never inspects; clients multiplex on the envelope inside it.
 * </p>
 */
public final class RelayFrames {
    private RelayFrames() {
    }

    public static final String REGISTER = "register";
    public static final String SEND = "send";
    public static final String PING = "ping";
    public static final String REGISTERED = "registered";
    public static final String MESSAGE = "message";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    // ---------------------------------------------------------------- client -> relay

    /**
     * Binds the connection to a DID. Must be the first frame after connecting.
     */
    @Value
    public static class Register {
        @JsonProperty("type")
        String type = REGISTER;

        @JsonProperty("did")
        String did;

        @JsonCreator
        public Register(@JsonProperty("did") String did) {
            this.did = did;
        }
    }

    /**
     * Asks the relay to deliver {@code payload} to {@code toDid}, queueing it if the DID is offline.
     */
    @Value
    public static class Send {
        @JsonProperty("type")
        String type = SEND;

        @JsonProperty("to_did")
        String toDid;

        @JsonProperty("payload")
        String payload;

        @JsonCreator
        public Send(@JsonProperty("to_did") String toDid, @JsonProperty("payload") String payload) {
            this.toDid = toDid;
            this.payload = payload;
        }
    }

    @Value
    public static class Ping {
        @JsonProperty("type")
        String type = PING;
    }

    // ---------------------------------------------------------------- relay -> client

    @Value
    public static class Registered {
        @JsonProperty("type")
        String type = REGISTERED;

        @JsonProperty("did")
        String did;

        @JsonCreator
        public Registered(@JsonProperty("did") String did) {
            this.did = did;
        }
    }

    /**
     * A payload from another DID, delivered live or drained from the offline queue.
     */
    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Message {
        @JsonProperty("type")
        String type = MESSAGE;

        @JsonProperty("from_did")
        String fromDid;

        @JsonProperty("payload")
        String payload;

        /**
         * Epoch millis when the relay accepted the send; absent on frames from older relays.
         */
        @Nullable
        @JsonProperty("timestamp")
        Long timestamp;

        @JsonCreator
        public Message(
            @JsonProperty("from_did") String fromDid,
            @JsonProperty("payload") String payload,
            @JsonProperty("timestamp") Long timestamp
        ) {
            this.fromDid = fromDid;
            this.payload = payload;
            this.timestamp = timestamp;
        }
    }

    @Value
    public static class Pong {
        @JsonProperty("type")
        String type = PONG;
    }

    @Value
    public static class Error {
        @JsonProperty("type")
        String type = ERROR;

        @JsonProperty("message")
        String message;

        @JsonCreator
        public Error(@JsonProperty("message") String message) {
            this.message = message;
        }
    }

    // ---------------------------------------------------------------- helpers

    /**
     * Reads the {@code type} tag of a frame.
     *
     * @return the tag, or {@code null} if the text is not a JSON object with a textual tag
     */
    @Nullable
    public static String parseType(String json) {
        try {
            return JsonUtils.textOrNull(JsonUtils.readTree(json), "type");
        } catch (JsonCodecException e) {
            return null;
        }
    }

    public static String register(String did) {
        return JsonUtils.writeValueAsString(new Register(did));
    }

    public static String send(String toDid, String payload) {
        return JsonUtils.writeValueAsString(new Send(toDid, payload));
    }

    public static String ping() {
        return JsonUtils.writeValueAsString(new Ping());
    }

    public static String registered(String did) {
        return JsonUtils.writeValueAsString(new Registered(did));
    }

    public static String message(String fromDid, String payload, long timestamp) {
        return JsonUtils.writeValueAsString(new Message(fromDid, payload, timestamp));
    }

    public static String pong() {
        return JsonUtils.writeValueAsString(new Pong());
    }

    public static String error(String message) {
        return JsonUtils.writeValueAsString(new Error(message));
    }
}
