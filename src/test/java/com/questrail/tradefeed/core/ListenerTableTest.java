package com.questrail.tradefeed.core;

import com.questrail.tradefeed.api.MessageListener;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListenerTableTest
{
    private final ListenerTable table = new ListenerTable();
    private final MessageListener a = m -> {};
    private final MessageListener b = m -> {};

    @Test
    void addKeepsRegistrationOrderAndDeduplicates() {
        assertTrue(table.add("tickPrice", a));
        assertTrue(table.add("tickPrice", b));
        assertFalse(table.add("tickPrice", a));

        assertEquals(List.of(a, b), table.snapshot("tickPrice"));
    }

    @Test
    void removeOnlyAffectsTheGivenKey() {
        table.add("tickPrice", a);
        table.add("tickSize", a);

        assertTrue(table.remove("tickPrice", a));
        assertFalse(table.remove("tickPrice", a));

        assertEquals(List.of(), table.snapshot("tickPrice"));
        assertEquals(List.of(a), table.snapshot("tickSize"));
    }

    @Test
    void removeFromUnknownKeyIsNoOp() {
        assertFalse(table.remove("never", a));
    }

    @Test
    void snapshotIsDetachedFromLaterChanges() {
        table.add("error", a);
        List<MessageListener> snapshot = table.snapshot("error");

        table.add("error", b);
        table.remove("error", a);

        assertEquals(List.of(a), snapshot);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(b));
    }
}
