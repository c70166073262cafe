package com.triagedesk.support.desk.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriorityTest {

    @Test
    void ladder_moves_one_rung_and_stops_at_urgent() {
        assertEquals(Priority.MEDIUM, Priority.LOW.next());
        assertEquals(Priority.HIGH, Priority.MEDIUM.next());
        assertEquals(Priority.URGENT, Priority.HIGH.next());
        assertEquals(Priority.URGENT, Priority.URGENT.next());
        assertTrue(Priority.URGENT.isTerminal());
        assertFalse(Priority.HIGH.isTerminal());
    }

    @Test
    void ladder_never_lowers_rank() {
        for (var p : Priority.values()) {
            assertTrue(p.next().rank() >= p.rank());
        }
    }

    @Test
    void codes_round_trip_and_reject_unknown() {
        assertEquals(Priority.HIGH, Priority.fromCode(" High "));
        assertEquals("urgent", Priority.URGENT.code());
        var ex = assertThrows(IllegalArgumentException.class, () -> Priority.fromCode("critical"));
        assertEquals("invalid_priority", ex.getMessage());
        assertEquals("priority_required",
                assertThrows(IllegalArgumentException.class, () -> Priority.fromCode(" ")).getMessage());
    }

    @Test
    void status_lifecycle_is_forward_only() {
        assertTrue(ItemStatus.NEW.canMoveTo(ItemStatus.RESOLVED));
        assertTrue(ItemStatus.ASSIGNED.canMoveTo(ItemStatus.ASSIGNED));
        assertFalse(ItemStatus.RESOLVED.canMoveTo(ItemStatus.IN_PROGRESS));
        assertFalse(ItemStatus.CLOSED.canMoveTo(ItemStatus.NEW));
        assertTrue(ItemStatus.IN_PROGRESS.isActive());
        assertFalse(ItemStatus.RESOLVED.isActive());
        assertEquals(ItemStatus.IN_PROGRESS, ItemStatus.fromCode("in-progress"));
    }
}
