package com.questrail.tradefeed.core;

import com.questrail.tradefeed.api.Message;
import com.questrail.tradefeed.api.MessageEntryPoint;
import com.questrail.tradefeed.config.ReceiverConfig;
import com.questrail.tradefeed.observability.DroppedDispatchEvent;
import com.questrail.tradefeed.observability.RecordingDispatchObservabilitySink;
import com.questrail.tradefeed.registry.StandardMessageTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the positional, reader-facing side of {@link Receiver}.
 */
class ReceiverEntryPointTests
{
    private RecordingDispatchObservabilitySink sink;
    private Receiver receiver;
    private final List<Message> received = new ArrayList<>();

    @BeforeEach
    void setUp() {
        sink = new RecordingDispatchObservabilitySink();
        receiver = new Receiver(ReceiverConfig.builder()
                .withObservabilitySink(sink)
                .build());
        receiver.registerAll(received::add);
    }

    @Test
    void oneEntryPointPerKnownType() {
        assertEquals(StandardMessageTypes.registry().names(), receiver.entryPointNames());
        assertTrue(receiver.entryPoint("tickPrice").isPresent());
        assertTrue(receiver.entryPoint("fill").isEmpty());
    }

    @Test
    void entryPointZipsArgumentsWithFieldNames() {
        MessageEntryPoint tickSize = receiver.entryPoint("tickSize").orElseThrow();

        tickSize.invoke(17, 0, 500);

        assertEquals(1, received.size());
        assertEquals(Map.of("tickerId", 17, "field", 0, "size", 500), received.get(0).values());
    }

    @Test
    void surplusArgumentsAreIgnoredAndMissingFieldsReadNull() {
        receiver.accept("tickSize", 17, 0, 500, "extra");
        receiver.accept("tickSize", 18);

        assertEquals(Map.of("tickerId", 17, "field", 0, "size", 500), received.get(0).values());
        assertEquals(18, received.get(1).get("tickerId"));
        assertNull(received.get(1).get("size"));
    }

    @Test
    void fieldlessEventsDispatchWithNoArguments() {
        receiver.accept("connectionClosed");

        assertEquals(1, received.size());
        assertEquals("connectionClosed", received.get(0).typeName());
        assertTrue(received.get(0).values().isEmpty());
    }

    @Test
    void acceptDropsUnknownNames() {
        assertDoesNotThrow(() -> receiver.accept("tickOptionComputation", 1, 2, 3.0));

        assertTrue(received.isEmpty());
        assertEquals(DroppedDispatchEvent.Reason.UNKNOWN_TYPE, sink.getDroppedDispatches().get(0).reason());
    }

    @Test
    void errorEntryPointGoesThroughTheAdapter() {
        receiver.accept("error", "bad feed");
        receiver.accept("error", 7, 504, "timeout");

        assertEquals(Map.of("errorMsg", "bad feed"), received.get(0).values());
        assertEquals(Map.of("id", 7, "errorCode", 504, "errorMsg", "timeout"), received.get(1).values());
    }

    @Test
    void entryPointNamesAreUnmodifiable() {
        Set<String> names = receiver.entryPointNames();
        assertThrows(UnsupportedOperationException.class, () -> names.remove("error"));
    }
}
