package com.questrail.tradefeed.api;

/**
 * MessageListener
 * -----------------------------------------------------------------------------
 * Subscriber contract for inbound feed messages.
 *
 * <p>A listener receives exactly one {@link Message} per dispatch of a type it
 * is registered for. It may throw any {@link Exception} or {@link Error} other
 * than a {@link VirtualMachineError}; the receiver treats a throwing listener
 * as faulty, unregisters it for that message type only, and
 * continues delivering to the remaining listeners.</p>
 *
 * <p>Listener identity is {@link Object#equals(Object)} identity. Registering the
 * same instance twice for one type is a no-op.</p>
 */
@FunctionalInterface
public interface MessageListener
{
    /**
     * Called once per delivered message.
     *
     * @param message the constructed message; never {@code null}
     * @throws Exception any failure; the listener is dropped for this type
     */
    void onMessage(Message message) throws Exception;
}
