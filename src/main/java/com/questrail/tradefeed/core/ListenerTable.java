package com.questrail.tradefeed.core;

import com.questrail.tradefeed.api.MessageListener;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ListenerTable
 * -----------------------------------------------------------------------------
 * Type key to listener list mapping owned by a {@link Receiver}.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Each list is in registration order</li>
 *   <li>A listener appears at most once per type key</li>
 *   <li>Entries are created on first registration and removed once empty</li>
 * </ul>
 *
 * <h2>Threading model</h2>
 * This class is not thread-safe. The owning receiver guards every call with
 * its own lock.
 */
final class ListenerTable
{
    private final Map<String, List<MessageListener>> listenersByKey = new HashMap<>();

    /**
     * @return {@code true} if the listener was not already registered for the key
     */
    boolean add(String key, MessageListener listener) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(listener, "listener");

        List<MessageListener> listeners = listenersByKey.computeIfAbsent(key, k -> new ArrayList<>());
        if (listeners.contains(listener)) {
            return false;
        }
        listeners.add(listener);
        return true;
    }

    /**
     * @return {@code true} if the listener was registered for the key
     */
    boolean remove(String key, MessageListener listener) {
        List<MessageListener> listeners = listenersByKey.get(key);
        if (listeners == null) {
            return false;
        }
        boolean removed = listeners.remove(listener);
        if (listeners.isEmpty()) {
            listenersByKey.remove(key);
        }
        return removed;
    }

    /**
     * Returns an immutable copy of the key's listeners; empty if none.
     */
    List<MessageListener> snapshot(String key) {
        List<MessageListener> listeners = listenersByKey.get(key);
        return listeners == null ? List.of() : List.copyOf(listeners);
    }
}
