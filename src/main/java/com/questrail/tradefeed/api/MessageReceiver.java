package com.questrail.tradefeed.api;

import java.util.Map;

/**
 * MessageReceiver
 * -----------------------------------------------------------------------------
 * The registration and dispatch boundary between the feed reader and the
 * application code that consumes typed messages.
 *
 * <h2>Type arguments</h2>
 * Every operation that accepts a message type accepts either the type's name
 * (a {@link String}) or the message type object itself. Both normalize to the
 * same key, so {@code register(l, "tickPrice")} and
 * {@code register(l, StandardMessageTypes.TICK_PRICE)} are interchangeable.
 *
 * <h2>Failure contract</h2>
 * <ul>
 *   <li>Registration operations never fail for unknown or repeated types</li>
 *   <li>{@link #dispatch(Object, Map)} returns normally for unknown types,
 *       types without listeners, and listeners that throw</li>
 *   <li>A listener that throws is unregistered for the offending type only</li>
 * </ul>
 */
public interface MessageReceiver
{
    /**
     * Associates {@code listener} with each given type. Idempotent.
     *
     * @param listener callable to receive messages
     * @param types zero or more type names or type objects
     */
    void register(MessageListener listener, Object... types);

    /**
     * Associates {@code listener} with every type known to this receiver.
     */
    void registerAll(MessageListener listener);

    /**
     * Disassociates {@code listener} from each given type. Types the listener
     * is not registered for are ignored.
     *
     * @param listener callable to no longer receive messages
     * @param types zero or more type names or type objects
     */
    void unregister(MessageListener listener, Object... types);

    /**
     * Disassociates {@code listener} from every type known to this receiver.
     */
    void unregisterAll(MessageListener listener);

    /**
     * Builds one message of the named type and delivers it to every listener
     * registered for that type, in registration order.
     *
     * <p>Returns normally for every runtime outcome: unknown type, no
     * listeners, an unbuildable field mapping, or a throwing listener. Both
     * arguments are preconditions, not runtime input.</p>
     *
     * @param type type name or type object; must not be {@code null}
     * @param fields field values keyed by field name; must not be {@code null}
     * @throws NullPointerException if {@code type} or {@code fields} is
     *         {@code null}
     */
    void dispatch(Object type, Map<String, ?> fields);
}
