package com.questrail.tradefeed.config;

import com.questrail.tradefeed.api.MessageListener;
import com.questrail.tradefeed.observability.DispatchObservabilitySink;
import com.questrail.tradefeed.observability.Slf4jDispatchObservabilitySink;
import com.questrail.tradefeed.registry.MessageType;
import com.questrail.tradefeed.registry.MessageTypeRegistry;
import com.questrail.tradefeed.registry.StandardMessageTypes;
import com.questrail.tradefeed.time.SystemWallClock;
import com.questrail.tradefeed.time.WallClock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated configuration for a receiver.
 *
 * <p>{@code initialListeners} seeds the listener table. Keys are type keys as
 * produced by {@link MessageType#keyOf(Object)}; each list is in registration
 * order and holds no duplicates.</p>
 *
 * <p>The default sink logs through SLF4J and is only as visible as the host's
 * SLF4J binding makes it.</p>
 */
public record ReceiverConfig(
    MessageTypeRegistry types,
    DispatchObservabilitySink observabilitySink,
    WallClock clock,
    Map<String, List<MessageListener>> initialListeners
) {
    public ReceiverConfig {
        Objects.requireNonNull(types, "types");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(initialListeners, "initialListeners");

        Map<String, List<MessageListener>> copy = new LinkedHashMap<>();
        initialListeners.forEach((key, listeners) -> {
            Objects.requireNonNull(listeners, "listeners for " + key);
            List<MessageListener> deduplicated = new ArrayList<>();
            for (MessageListener listener : listeners) {
                Objects.requireNonNull(listener, "listener for " + key);
                if (!deduplicated.contains(listener)) {
                    deduplicated.add(listener);
                }
            }
            copy.put(MessageType.keyOf(key), Collections.unmodifiableList(deduplicated));
        });
        initialListeners = Collections.unmodifiableMap(copy);
    }

    public static ReceiverConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MessageTypeRegistry types = StandardMessageTypes.registry();
        private DispatchObservabilitySink observabilitySink = new Slf4jDispatchObservabilitySink();
        private WallClock clock = SystemWallClock.INSTANCE;
        private final Map<String, List<MessageListener>> listeners = new LinkedHashMap<>();

        public Builder withTypes(MessageTypeRegistry types) {
            this.types = types;
            return this;
        }

        public Builder withObservabilitySink(DispatchObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Pre-registers {@code listener} for the given type names or type objects.
         */
        public Builder withListener(MessageListener listener, Object... types) {
            Objects.requireNonNull(listener, "listener");
            for (Object type : Objects.requireNonNull(types, "types")) {
                List<MessageListener> forType =
                        listeners.computeIfAbsent(MessageType.keyOf(type), k -> new ArrayList<>());
                if (!forType.contains(listener)) {
                    forType.add(listener);
                }
            }
            return this;
        }

        public ReceiverConfig build() {
            return new ReceiverConfig(types, observabilitySink, clock, listeners);
        }
    }
}
