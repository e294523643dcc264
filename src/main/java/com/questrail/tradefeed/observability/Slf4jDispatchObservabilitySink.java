package com.questrail.tradefeed.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DispatchObservabilitySink that emits logs via SLF4J.
 *
 * <p>This is the receiver's default sink. Where the reports end up is decided
 * by the host's SLF4J binding. Without a binding on the classpath SLF4J falls
 * back to its no-operation logger and listener-fault reports are discarded;
 * hosts that ship no binding should configure a sink of their own through
 * {@link com.questrail.tradefeed.config.ReceiverConfig.Builder#withObservabilitySink}.</p>
 */
public final class Slf4jDispatchObservabilitySink implements DispatchObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDispatchObservabilitySink.class);

    @Override
    public void onListenerFault(ListenerFaultEvent event) {
        log.error("Exception in message dispatch. Listener {} unregistered for {}",
            event.listener(),
            event.typeName(),
            event.cause());
    }

    @Override
    public void onMessageConstructionFailure(MessageConstructionFailureEvent event) {
        log.warn("Could not build '{}' message from fields {}",
            event.typeName(),
            event.fields().keySet(),
            event.cause());
    }

    @Override
    public void onDispatchDropped(DroppedDispatchEvent event) {
        if (log.isTraceEnabled()) {
            log.trace("Dropped '{}' dispatch: {}", event.typeName(), event.reason());
        }
    }
}
