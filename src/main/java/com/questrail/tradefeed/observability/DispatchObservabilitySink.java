package com.questrail.tradefeed.observability;

/**
 * Diagnostic output of the receiver.
 * Implementations can provide logging, metrics, or test recording.
 *
 * <p>Callbacks are made on the dispatching thread, outside the receiver's
 * lock. A sink that throws is logged and otherwise ignored.</p>
 */
public interface DispatchObservabilitySink {
    /**
     * Called after a faulty listener has been unregistered for a type.
     * @param event the listener, type name and failure
     */
    void onListenerFault(ListenerFaultEvent event);

    /**
     * Called when a field mapping could not be built into a message.
     * @param event the type name, the rejected fields and the failure
     */
    void onMessageConstructionFailure(MessageConstructionFailureEvent event);

    /**
     * Called when a dispatch had nothing to deliver to.
     * @param event the type name and reason
     */
    void onDispatchDropped(DroppedDispatchEvent event);
}
