package com.questrail.tradefeed.observability;

/**
 * No-op implementation of DispatchObservabilitySink.
 */
public final class NullDispatchObservabilitySink implements DispatchObservabilitySink {
    public static final NullDispatchObservabilitySink INSTANCE = new NullDispatchObservabilitySink();

    private NullDispatchObservabilitySink() {}

    @Override
    public void onListenerFault(ListenerFaultEvent event) {}

    @Override
    public void onMessageConstructionFailure(MessageConstructionFailureEvent event) {}

    @Override
    public void onDispatchDropped(DroppedDispatchEvent event) {}
}
