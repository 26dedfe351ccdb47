package com.peerlink.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.peerlink.core.util.JsonCodecException;
import com.peerlink.core.util.JsonUtils;

/**
 * Decodes the {@code event} object of an envelope by its {@code type} tag.
 */
public final class CommunityEventCodec {
    private CommunityEventCodec() {
    }

    /**
     * @throws JsonCodecException if the node is not an object, has no tag, or a known variant
     *                            cannot be bound
     */
    public static CommunityEvent decode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new JsonCodecException("Community event must be a JSON object", null);
        }
        String type = JsonUtils.textOrNull(node, "type");
        if (type == null) {
            throw new JsonCodecException("Community event has no type tag", null);
        }

        switch (type) {
            case CommunityMessageSent.TYPE:
                return JsonUtils.treeToValue(node, CommunityMessageSent.class);
            case CommunityMessageDeleted.TYPE:
                return JsonUtils.treeToValue(node, CommunityMessageDeleted.class);
            case MemberJoined.TYPE:
                return JsonUtils.treeToValue(node, MemberJoined.class);
            case MemberLeft.TYPE:
                return JsonUtils.treeToValue(node, MemberLeft.class);
            case ChannelCreated.TYPE:
                return JsonUtils.treeToValue(node, ChannelCreated.class);
            case VoiceChannelJoined.TYPE:
                return JsonUtils.treeToValue(node, VoiceChannelJoined.class);
            case VoiceChannelLeft.TYPE:
                return JsonUtils.treeToValue(node, VoiceChannelLeft.class);
            default:
                return new UnknownCommunityEvent(type, ((ObjectNode) node).deepCopy());
        }
    }
}
