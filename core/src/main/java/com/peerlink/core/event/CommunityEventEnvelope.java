package com.peerlink.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.peerlink.core.util.JsonCodecException;
import com.peerlink.core.util.JsonUtils;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Versioned wrapper that carries one {@link CommunityEvent} as the opaque payload of a relay
 * {@code send}.
 * <p>
 * The relay is shared with other payload kinds, so receivers call {@link #tryParse(String)} and
 * ignore anything that is not tagged {@value #ENVELOPE_TAG}.
 * </p>
 */
@Value
public class CommunityEventEnvelope {
    private static final Logger log = LoggerFactory.getLogger(CommunityEventEnvelope.class);

    public static final String ENVELOPE_TAG = "community_event";
    public static final int VERSION = 1;

    String envelope;
    int version;
    Payload payload;

    /**
     * Wraps an event addressed to the canonical community ID.
     */
    public static CommunityEventEnvelope of(String communityId, CommunityEvent event, String senderDid, long timestamp) {
        return new CommunityEventEnvelope(ENVELOPE_TAG, VERSION, new Payload(communityId, event, senderDid, timestamp));
    }

    public String toJson() {
        return JsonUtils.writeValueAsString(this);
    }

    /**
     * Parses a relay payload as a community event envelope.
     *
     * @return empty for non-JSON text, non-objects, other envelope tags and envelopes whose
     * payload is incomplete
     */
    public static Optional<CommunityEventEnvelope> tryParse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = JsonUtils.readTree(raw);
        } catch (JsonCodecException e) {
            return Optional.empty();
        }
        if (!root.isObject() || !ENVELOPE_TAG.equals(JsonUtils.textOrNull(root, "envelope"))) {
            return Optional.empty();
        }

        JsonNode payload = root.get("payload");
        if (payload == null || !payload.isObject()) {
            log.warn("Community envelope without payload object");
            return Optional.empty();
        }
        String communityId = JsonUtils.textOrNull(payload, "communityId");
        String senderDid = JsonUtils.textOrNull(payload, "senderDid");
        if (communityId == null || senderDid == null) {
            log.warn("Community envelope missing communityId or senderDid");
            return Optional.empty();
        }

        CommunityEvent event;
        try {
            event = CommunityEventCodec.decode(payload.get("event"));
        } catch (JsonCodecException e) {
            log.warn("Dropping community envelope for {}: {}", communityId, e.getMessage());
            return Optional.empty();
        }

        int version = root.path("version").asInt(VERSION);
        long timestamp = payload.path("timestamp").asLong(0L);
        return Optional.of(new CommunityEventEnvelope(ENVELOPE_TAG, version, new Payload(communityId, event, senderDid, timestamp)));
    }

    @Value
    public static class Payload {
        /**
         * Canonical community ID, never a receiver-local alias.
         */
        String communityId;
        CommunityEvent event;
        String senderDid;
        long timestamp;
    }
}
