package net.spookly.routekv.route;

import lombok.Value;
import lombok.experimental.Accessors;

import java.time.Instant;

/**
 * Snapshot of a route table write for audit logging.
 */
@Value
@Accessors(fluent = true)
public class RouteEvent {
    RouteEventType type;
    Instant timestamp;
    String key;
    String target;
    int actions;
    boolean succeeded;
}
