package com.questrail.tradefeed.observability;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Record describing a field mapping that could not be turned into a message.
 * No listener is invoked or removed when this happens.
 */
public record MessageConstructionFailureEvent(
    Instant timestamp,
    String typeName,
    Map<String, ?> fields,
    RuntimeException cause
) {
    public MessageConstructionFailureEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(cause, "cause");
    }
}
