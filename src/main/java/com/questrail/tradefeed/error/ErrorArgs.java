package com.questrail.tradefeed.error;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ErrorArgs
 * -----------------------------------------------------------------------------
 * The three argument shapes in which the feed reports an error, as one closed
 * set of variants.
 *
 * <h2>Shapes</h2>
 * <ul>
 *   <li>{@link Coded}: {@code (id, errorCode, errorMsg)}, the current shape</li>
 *   <li>{@link Text}: a bare message string</li>
 *   <li>{@link Opaque}: any other single value, e.g. an exception or a code</li>
 * </ul>
 *
 * All three normalize to field mappings of the {@code error} message type via
 * {@link #toFields()}. The legacy shapes only populate {@code errorMsg}.
 */
public sealed interface ErrorArgs
        permits ErrorArgs.Coded, ErrorArgs.Text, ErrorArgs.Opaque
{
    String ID = "id";
    String ERROR_CODE = "errorCode";
    String ERROR_MSG = "errorMsg";

    /**
     * Returns the canonical {@code error} field mapping for these arguments.
     */
    Map<String, Object> toFields();

    /**
     * Classifies raw positional arguments.
     *
     * <p>Checked in order: exactly {@code (Integer, Integer, String)} is
     * {@link Coded}; a single {@code String} is {@link Text}; a single value
     * of any other type is {@link Opaque}. Any other combination is treated as
     * one opaque value holding the whole argument list.</p>
     *
     * @param args raw arguments, as delivered by the reader
     * @return the matching variant; never {@code null}
     */
    static ErrorArgs resolve(Object... args) {
        if (args == null) {
            return new Opaque(null);
        }
        if (args.length == 3
                && args[0] instanceof Integer id
                && args[1] instanceof Integer errorCode
                && args[2] instanceof String errorMsg) {
            return new Coded(id, errorCode, errorMsg);
        }
        if (args.length == 1) {
            if (args[0] instanceof String text) {
                return new Text(text);
            }
            return new Opaque(args[0]);
        }
        return new Opaque(Collections.unmodifiableList(Arrays.asList(args.clone())));
    }

    record Coded(int id, int errorCode, String errorMsg) implements ErrorArgs {
        @Override
        public Map<String, Object> toFields() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put(ID, id);
            fields.put(ERROR_CODE, errorCode);
            fields.put(ERROR_MSG, errorMsg);
            return Collections.unmodifiableMap(fields);
        }
    }

    record Text(String errorMsg) implements ErrorArgs {
        @Override
        public Map<String, Object> toFields() {
            return Collections.singletonMap(ERROR_MSG, errorMsg);
        }
    }

    /**
     * A value of no recognized shape. When built from several unmatched
     * arguments, {@code value} is the unmodifiable {@link List} of them.
     */
    record Opaque(Object value) implements ErrorArgs {
        @Override
        public Map<String, Object> toFields() {
            return Collections.singletonMap(ERROR_MSG, value);
        }
    }
}
