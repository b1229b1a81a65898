package net.spookly.routekv.route;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RouteAuditLoggerTest {
    @Test
    void formatsOneLinePerEventAndSkipsNulls() {
        RouteEvent event = new RouteEvent(
                RouteEventType.DELETE_MISSING,
                Instant.parse("2024-01-01T00:00:00Z"),
                "jupyterhub/routes/_2Fa_2F",
                null,
                0,
                true
        );

        assertEquals(
                "route_event type=DELETE_MISSING key=jupyterhub/routes/_2Fa_2F actions=0 succeeded=true"
                        + " timestamp=2024-01-01T00:00:00Z",
                RouteAuditLogger.format(event)
        );
        assertDoesNotThrow(() -> RouteAuditLogger.INSTANCE.onEvent(event));
    }
}
