package com.questrail.tradefeed.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record describing a dispatch that delivered nothing.
 */
public record DroppedDispatchEvent(
    Instant timestamp,
    String typeName,
    Reason reason
) {
    public DroppedDispatchEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(reason, "reason");
    }

    public enum Reason {
        /** The type name is not in the receiver's registry. */
        UNKNOWN_TYPE,
        /** The type is known but nothing is registered for it. */
        NO_LISTENERS
    }
}
