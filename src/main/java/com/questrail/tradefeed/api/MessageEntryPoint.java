package com.questrail.tradefeed.api;

/**
 * Positional entry point for one message type.
 *
 * <p>Pairs the supplied arguments with the type's field names, in order, and
 * hands the resulting mapping to the receiver's dispatch path. Arguments past
 * the last field are ignored; fields past the last argument read as
 * {@code null}.</p>
 */
@FunctionalInterface
public interface MessageEntryPoint
{
    void invoke(Object... args);
}
