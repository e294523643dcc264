package com.questrail.tradefeed.api;

/**
 * Indicates that a {@link Message} could not be built from the supplied
 * field mapping.
 *
 * This typically reflects:
 * <ul>
 *   <li>A field name the message type does not declare</li>
 *   <li>A {@code null} field name in the mapping</li>
 * </ul>
 */
public final class MessageConstructionException extends RuntimeException
{
    public MessageConstructionException(String message) {
        super(message);
    }
}
