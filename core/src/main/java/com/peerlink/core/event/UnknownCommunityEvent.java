package com.peerlink.core.event;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * An event whose tag this build does not handle. The raw object is kept so the event can be
 * logged or forwarded unchanged.
 */
@Value
public class UnknownCommunityEvent implements CommunityEvent {

    String type;

    @JsonValue
    ObjectNode raw;

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnknown(this);
    }
}
