package com.questrail.tradefeed.observability;

import com.questrail.tradefeed.api.MessageListener;

import java.time.Instant;
import java.util.Objects;

/**
 * Record describing a listener that threw during delivery and was
 * unregistered for the offending message type.
 */
public record ListenerFaultEvent(
    Instant timestamp,
    MessageListener listener,
    String typeName,
    Throwable cause
) {
    public ListenerFaultEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(listener, "listener");
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(cause, "cause");
    }
}
