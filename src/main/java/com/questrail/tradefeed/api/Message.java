package com.questrail.tradefeed.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Message
 * -----------------------------------------------------------------------------
 * Immutable value for one inbound feed event.
 *
 * <h2>Shape</h2>
 * A message is tagged with its type name and carries the ordered field names
 * of that type. Only the fields that were actually supplied are held as
 * values; a declared field that was not supplied reads as {@code null}.
 * Field values themselves may be {@code null}.
 *
 * <h2>Lifecycle</h2>
 * A fresh instance is built for every dispatch and shared by all listeners of
 * that dispatch. Nothing mutates it after construction, so listeners may keep
 * it.
 */
public final class Message
{
    private final String typeName;
    private final List<String> fieldNames;
    private final Map<String, Object> values;

    /**
     * Creates a message.
     *
     * @param typeName the message type name
     * @param fieldNames the declared field names in positional order
     * @param values supplied field values keyed by field name
     * @throws MessageConstructionException if {@code values} names a field
     *         that is not declared
     */
    public Message(String typeName, List<String> fieldNames, Map<String, ?> values) {
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.fieldNames = List.copyOf(Objects.requireNonNull(fieldNames, "fieldNames"));
        Objects.requireNonNull(values, "values");

        for (String supplied : values.keySet()) {
            if (supplied == null || !this.fieldNames.contains(supplied)) {
                throw new MessageConstructionException(
                        "Message type '" + typeName + "' has no field '" + supplied
                                + "' (declared: " + this.fieldNames + ")");
            }
        }

        // Keep declaration order regardless of the caller's map ordering.
        Map<String, Object> copy = new LinkedHashMap<>();
        for (String field : this.fieldNames) {
            if (values.containsKey(field)) {
                copy.put(field, values.get(field));
            }
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public String typeName() {
        return typeName;
    }

    public List<String> fieldNames() {
        return fieldNames;
    }

    /**
     * Returns the supplied field values, in declaration order.
     */
    public Map<String, Object> values() {
        return values;
    }

    /**
     * Returns whether {@code field} was supplied when this message was built.
     */
    public boolean isSupplied(String field) {
        return values.containsKey(field);
    }

    /**
     * Returns the value of a declared field.
     *
     * @throws IllegalArgumentException if the field is not declared by this
     *         message type
     */
    public Object get(String field) {
        requireDeclared(field);
        return values.get(field);
    }

    /**
     * Returns the value of a declared field cast to {@code type}.
     *
     * @throws ClassCastException if the value is not an instance of {@code type}
     */
    public <T> T get(String field, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return type.cast(get(field));
    }

    private void requireDeclared(String field) {
        Objects.requireNonNull(field, "field");
        if (!fieldNames.contains(field)) {
            throw new IllegalArgumentException(
                    "Message type '" + typeName + "' has no field '" + field + "'");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message that)) return false;
        return typeName.equals(that.typeName)
                && fieldNames.equals(that.fieldNames)
                && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeName, fieldNames, values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("<").append(typeName);
        String sep = " ";
        for (String field : fieldNames) {
            sb.append(sep).append(field).append('=').append(values.get(field));
            sep = ", ";
        }
        return sb.append('>').toString();
    }
}
