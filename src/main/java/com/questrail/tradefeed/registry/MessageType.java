package com.questrail.tradefeed.registry;

import com.questrail.tradefeed.api.Message;
import com.questrail.tradefeed.api.MessageConstructionException;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * MessageType
 * -----------------------------------------------------------------------------
 * Identity, field shape and constructor of one kind of inbound feed message.
 *
 * <h2>Identity</h2>
 * A message type is identified by its name. {@link #keyOf(Object)} maps both a
 * name string and the type object to the same key, which is what allows
 * listeners to be registered by either.
 *
 * <h2>Field shape</h2>
 * The ordered field names define how positional arguments from the reader
 * map onto named fields. Field names are unique within a type.
 */
public final class MessageType
{
    private final String name;
    private final List<String> fieldNames;

    private MessageType(String name, List<String> fieldNames) {
        this.name = name;
        this.fieldNames = fieldNames;
    }

    /**
     * Creates a message type.
     *
     * @param name non-blank type name
     * @param fieldNames field names in positional order; may be empty
     * @throws IllegalArgumentException if the name is blank or a field name is
     *         blank or repeated
     */
    public static MessageType of(String name, String... fieldNames) {
        Objects.requireNonNull(fieldNames, "fieldNames");
        return of(name, Arrays.asList(fieldNames));
    }

    public static MessageType of(String name, List<String> fieldNames) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fieldNames, "fieldNames");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Message type name must not be blank");
        }

        Set<String> seen = new HashSet<>();
        for (String field : fieldNames) {
            Objects.requireNonNull(field, "field name in " + name);
            if (field.isBlank()) {
                throw new IllegalArgumentException("Blank field name in message type " + name);
            }
            if (!seen.add(field)) {
                throw new IllegalArgumentException(
                        "Duplicate field '" + field + "' in message type " + name);
            }
        }
        return new MessageType(name, List.copyOf(fieldNames));
    }

    /**
     * Derives the lookup key for a message type reference.
     *
     * @param obj a {@link MessageType}, or any object whose string form is a
     *            type name
     * @return the type's name, or {@code obj.toString()} otherwise
     */
    public static String keyOf(Object obj) {
        Objects.requireNonNull(obj, "obj");
        if (obj instanceof MessageType type) {
            return type.name;
        }
        return obj.toString();
    }

    public String name() {
        return name;
    }

    public List<String> fieldNames() {
        return fieldNames;
    }

    /**
     * Builds a message of this type from named field values.
     *
     * @param fields supplied values; undeclared fields are rejected, missing
     *               fields read as {@code null}
     * @throws MessageConstructionException if {@code fields} names an
     *         undeclared field
     */
    public Message newMessage(Map<String, ?> fields) {
        return new Message(name, fieldNames, fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageType that)) return false;
        return name.equals(that.name) && fieldNames.equals(that.fieldNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fieldNames);
    }

    @Override
    public String toString() {
        return name;
    }
}
