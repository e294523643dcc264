package com.questrail.tradefeed.api;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageTest
{
    private static final List<String> TICK_FIELDS = List.of("tickerId", "field", "price");

    @Test
    void suppliedFieldsAreReadableByName() {
        Message m = new Message("tickPrice", TICK_FIELDS, Map.of("tickerId", 1, "field", 4, "price", 101.25));

        assertEquals("tickPrice", m.typeName());
        assertEquals(1, m.get("tickerId"));
        assertEquals(101.25, m.get("price", Double.class));
        assertEquals(Map.of("tickerId", 1, "field", 4, "price", 101.25), m.values());
    }

    @Test
    void missingDeclaredFieldReadsAsNull() {
        Message m = new Message("tickPrice", TICK_FIELDS, Map.of("tickerId", 1));

        assertNull(m.get("price"));
        assertFalse(m.isSupplied("price"));
        assertTrue(m.isSupplied("tickerId"));
        assertEquals(Map.of("tickerId", 1), m.values());
    }

    @Test
    void nullValuesArePreserved() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("tickerId", null);

        Message m = new Message("tickPrice", TICK_FIELDS, fields);

        assertTrue(m.isSupplied("tickerId"));
        assertNull(m.get("tickerId"));
    }

    @Test
    void undeclaredFieldIsRejectedAtConstruction() {
        MessageConstructionException e = assertThrows(MessageConstructionException.class,
                () -> new Message("tickPrice", TICK_FIELDS, Map.of("volume", 3)));
        assertTrue(e.getMessage().contains("volume"));
    }

    @Test
    void readingUndeclaredFieldIsRejected() {
        Message m = new Message("tickPrice", TICK_FIELDS, Map.of());
        assertThrows(IllegalArgumentException.class, () -> m.get("volume"));
    }

    @Test
    void valuesFollowDeclarationOrderAndAreImmutable() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("price", 3.0);
        fields.put("tickerId", 9);

        Message m = new Message("tickPrice", TICK_FIELDS, fields);
        fields.put("field", 1);

        assertEquals(List.of("tickerId", "price"), List.copyOf(m.values().keySet()));
        assertFalse(m.isSupplied("field"));
        assertThrows(UnsupportedOperationException.class, () -> m.values().put("field", 2));
    }

    @Test
    void equalityIsByTypeAndValues() {
        Message a = new Message("tickPrice", TICK_FIELDS, Map.of("tickerId", 1));
        Message b = new Message("tickPrice", TICK_FIELDS, Map.of("tickerId", 1));
        Message c = new Message("tickPrice", TICK_FIELDS, Map.of("tickerId", 2));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void toStringListsEveryDeclaredField() {
        Message m = new Message("tickPrice", TICK_FIELDS, Map.of("tickerId", 1, "price", 2.5));
        assertEquals("<tickPrice tickerId=1, field=null, price=2.5>", m.toString());
    }
}
