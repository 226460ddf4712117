package org.fleetroute.planning;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Route Planning Exception Tests")
class RoutePlanningExceptionTest {

    @Test
    @DisplayName("Message carries the reason code prefix")
    void testMessagePrefix() {
        RoutePlanningException ex = new RoutePlanningException("VRP_TEST", "broken input");

        assertEquals("VRP_TEST", ex.reasonCode());
        assertEquals("[VRP_TEST] broken input", ex.getMessage());
        assertEquals("broken input", ex.detail());
    }

    @Test
    @DisplayName("Cause is preserved")
    void testCausePreserved() {
        IllegalStateException cause = new IllegalStateException("inner");
        RoutePlanningException ex = new RoutePlanningException("VRP_TEST", "outer", cause);

        assertSame(cause, ex.getCause());
        assertNull(new RoutePlanningException("VRP_TEST", "no cause").getCause());
    }

    @Test
    @DisplayName("Blank reason codes are rejected")
    void testBlankReasonCodeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RoutePlanningException("  ", "message"));
        assertThrows(NullPointerException.class, () -> new RoutePlanningException(null, "message"));
    }
}
