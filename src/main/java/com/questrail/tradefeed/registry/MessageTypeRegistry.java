package com.questrail.tradefeed.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * MessageTypeRegistry
 * -----------------------------------------------------------------------------
 * Immutable catalogue of the message types a receiver understands.
 *
 * A registry is built once at startup and handed to each receiver explicitly;
 * there is no shared global instance. Iteration order is registration order.
 */
public final class MessageTypeRegistry
{
    private final Map<String, MessageType> byName;

    private MessageTypeRegistry(Map<String, MessageType> byName) {
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
    }

    public static MessageTypeRegistry of(MessageType... types) {
        Builder builder = builder();
        for (MessageType type : Objects.requireNonNull(types, "types")) {
            builder.add(type);
        }
        return builder.build();
    }

    /**
     * Looks up a type by name or by type object.
     */
    public Optional<MessageType> lookup(Object type) {
        return Optional.ofNullable(byName.get(MessageType.keyOf(type)));
    }

    public boolean contains(Object type) {
        return byName.containsKey(MessageType.keyOf(type));
    }

    /**
     * Returns all known types in registration order.
     */
    public Collection<MessageType> types() {
        return byName.values();
    }

    public Set<String> names() {
        return byName.keySet();
    }

    public int size() {
        return byName.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, MessageType> types = new LinkedHashMap<>();

        public Builder add(MessageType type) {
            Objects.requireNonNull(type, "type");
            if (types.putIfAbsent(type.name(), type) != null) {
                throw new IllegalArgumentException("Duplicate message type: " + type.name());
            }
            return this;
        }

        public Builder add(String name, String... fieldNames) {
            return add(MessageType.of(name, fieldNames));
        }

        public Builder addAll(MessageTypeRegistry registry) {
            Objects.requireNonNull(registry, "registry");
            registry.types().forEach(this::add);
            return this;
        }

        public MessageTypeRegistry build() {
            return new MessageTypeRegistry(types);
        }
    }
}
