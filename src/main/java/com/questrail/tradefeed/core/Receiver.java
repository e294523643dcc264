package com.questrail.tradefeed.core;

import com.questrail.tradefeed.api.Message;
import com.questrail.tradefeed.api.MessageEntryPoint;
import com.questrail.tradefeed.api.MessageListener;
import com.questrail.tradefeed.api.MessageReceiver;
import com.questrail.tradefeed.config.ReceiverConfig;
import com.questrail.tradefeed.error.ErrorDispatchAdapter;
import com.questrail.tradefeed.observability.DispatchObservabilitySink;
import com.questrail.tradefeed.observability.DroppedDispatchEvent;
import com.questrail.tradefeed.observability.ListenerFaultEvent;
import com.questrail.tradefeed.observability.MessageConstructionFailureEvent;
import com.questrail.tradefeed.registry.MessageType;
import com.questrail.tradefeed.registry.MessageTypeRegistry;
import com.questrail.tradefeed.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Receiver
 * -----------------------------------------------------------------------------
 * Dispatches inbound feed events to interested listeners.
 *
 * <h2>Inbound path</h2>
 *
 * <pre>
 *   reader (name, args...)
 *        → accept(...)                per-type entry point or error adapter
 *            → dispatch(type, fields) registry lookup
 *                → MessageType.newMessage
 *                    → each listener, in registration order
 * </pre>
 *
 * <h2>Fault isolation</h2>
 * A listener that throws is unregistered for the type being dispatched (and
 * only that type), reported to the {@link DispatchObservabilitySink}, and
 * skipped; delivery continues with the next listener. Unknown types and types
 * without listeners are silent no-ops. Nothing in the dispatch path
 * propagates an exception to the caller.
 * <p>
 * Anything a listener throws is a fault, {@link Error}s included, except a
 * {@link VirtualMachineError}, which is rethrown as is.
 *
 * <h2>Threading model</h2>
 * Intended to be driven from the reader's single event thread. All listener
 * table access is nevertheless guarded by one private lock, so registration
 * from other threads is safe. Listeners are invoked outside the lock against
 * a snapshot taken at dispatch start: every listener registered at that point
 * is invoked exactly once, even if an earlier listener is removed or
 * unregisters others during the same dispatch.
 */
public final class Receiver implements MessageReceiver
{
    private static final Logger log = LoggerFactory.getLogger(Receiver.class);

    private final MessageTypeRegistry types;
    private final DispatchObservabilitySink sink;
    private final WallClock clock;

    private final Object lock = new Object();
    private final ListenerTable listeners = new ListenerTable();

    private final ErrorDispatchAdapter errors;
    private final Map<String, MessageEntryPoint> entryPoints;

    /**
     * Creates a receiver over the standard message catalogue, logging via SLF4J.
     */
    public Receiver() {
        this(ReceiverConfig.defaults());
    }

    public Receiver(ReceiverConfig config) {
        Objects.requireNonNull(config, "config");
        this.types = config.types();
        this.sink = config.observabilitySink();
        this.clock = config.clock();

        config.initialListeners().forEach((key, seeded) -> seeded.forEach(l -> listeners.add(key, l)));

        this.errors = new ErrorDispatchAdapter(this);
        this.entryPoints = buildEntryPoints(types);
    }

    private Map<String, MessageEntryPoint> buildEntryPoints(MessageTypeRegistry registry) {
        Map<String, MessageEntryPoint> points = new LinkedHashMap<>();
        for (MessageType type : registry.types()) {
            if (ErrorDispatchAdapter.ERROR_TYPE.equals(type.name())) {
                points.put(type.name(), errors::dispatchError);
            } else {
                List<String> fieldNames = type.fieldNames();
                String name = type.name();
                points.put(name, args -> dispatch(name, zip(fieldNames, args)));
            }
        }
        return Collections.unmodifiableMap(points);
    }

    /**
     * Pairs positional arguments with field names up to the shorter of the two.
     */
    static Map<String, Object> zip(List<String> fieldNames, Object[] args) {
        Map<String, Object> fields = new HashMap<>();
        if (args == null) {
            return fields;
        }
        int n = Math.min(fieldNames.size(), args.length);
        for (int i = 0; i < n; i++) {
            fields.put(fieldNames.get(i), args[i]);
        }
        return fields;
    }

    /**
     * Generates the lookup key for a message type reference.
     *
     * @param obj a type name or {@link MessageType}
     * @return the type's name, or the object's string form
     */
    public static String key(Object obj) {
        return MessageType.keyOf(obj);
    }

    // -------------------------------------------------------------------------
    // Registration
    // -------------------------------------------------------------------------

    @Override
    public void register(MessageListener listener, Object... types) {
        Objects.requireNonNull(listener, "listener");
        Objects.requireNonNull(types, "types");
        synchronized (lock) {
            for (Object type : types) {
                listeners.add(key(type), listener);
            }
        }
    }

    @Override
    public void registerAll(MessageListener listener) {
        register(listener, types.names().toArray());
    }

    @Override
    public void unregister(MessageListener listener, Object... types) {
        Objects.requireNonNull(listener, "listener");
        Objects.requireNonNull(types, "types");
        synchronized (lock) {
            for (Object type : types) {
                listeners.remove(key(type), listener);
            }
        }
    }

    @Override
    public void unregisterAll(MessageListener listener) {
        unregister(listener, types.names().toArray());
    }

    /**
     * Returns the listeners currently registered for a type, in registration order.
     */
    public List<MessageListener> listenersFor(Object type) {
        String key = key(type);
        synchronized (lock) {
            return listeners.snapshot(key);
        }
    }

    // -------------------------------------------------------------------------
    // Dispatch
    // -------------------------------------------------------------------------

    @Override
    public void dispatch(Object type, Map<String, ?> fields) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(fields, "fields");

        Optional<MessageType> found = types.lookup(type);
        if (found.isEmpty()) {
            String name = key(type);
            report(s -> s.onDispatchDropped(
                    new DroppedDispatchEvent(clock.now(), name, DroppedDispatchEvent.Reason.UNKNOWN_TYPE)));
            return;
        }
        MessageType messageType = found.get();
        String name = messageType.name();

        final List<MessageListener> snapshot;
        synchronized (lock) {
            snapshot = listeners.snapshot(name);
        }
        if (snapshot.isEmpty()) {
            report(s -> s.onDispatchDropped(
                    new DroppedDispatchEvent(clock.now(), name, DroppedDispatchEvent.Reason.NO_LISTENERS)));
            return;
        }

        final Message message;
        try {
            message = messageType.newMessage(fields);
        } catch (RuntimeException e) {
            report(s -> s.onMessageConstructionFailure(
                    new MessageConstructionFailureEvent(clock.now(), name, fields, e)));
            return;
        }

        for (MessageListener listener : snapshot) {
            try {
                listener.onMessage(message);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                synchronized (lock) {
                    listeners.remove(name, listener);
                }
                report(s -> s.onListenerFault(new ListenerFaultEvent(clock.now(), listener, name, e)));
            }
        }
    }

    private void report(Consumer<DispatchObservabilitySink> emission) {
        try {
            emission.accept(sink);
        } catch (RuntimeException e) {
            log.error("Observability sink {} failed", sink, e);
        }
    }

    // -------------------------------------------------------------------------
    // Reader-facing entry points
    // -------------------------------------------------------------------------

    /**
     * Accepts one raw event from the reader.
     *
     * <p>Routes {@code error} through the error adapter and every other known
     * name through its positional entry point. Unknown names are dropped.</p>
     *
     * @param name reader method name
     * @param args positional arguments in field order
     */
    public void accept(String name, Object... args) {
        Objects.requireNonNull(name, "name");
        MessageEntryPoint entryPoint = entryPoints.get(name);
        if (entryPoint == null) {
            report(s -> s.onDispatchDropped(
                    new DroppedDispatchEvent(clock.now(), name, DroppedDispatchEvent.Reason.UNKNOWN_TYPE)));
            return;
        }
        entryPoint.invoke(args);
    }

    public Optional<MessageEntryPoint> entryPoint(String name) {
        return Optional.ofNullable(entryPoints.get(name));
    }

    public Set<String> entryPointNames() {
        return entryPoints.keySet();
    }

    /**
     * Dispatches an error given an id, code and message.
     */
    public void error(int id, int errorCode, String errorMsg) {
        errors.error(id, errorCode, errorMsg);
    }

    /**
     * Dispatches an error given only a message.
     */
    public void error(String errorMsg) {
        errors.error(errorMsg);
    }

    /**
     * Dispatches an error given some value.
     */
    public void error(Object value) {
        errors.error(value);
    }
}
