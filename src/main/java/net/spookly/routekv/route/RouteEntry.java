package net.spookly.routekv.route;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * A stored route with its target and the raw data kept for that target.
 * {@code data} is {@code null} when the target has no data entry.
 */
@Value
@Accessors(fluent = true)
public class RouteEntry {
    String routespec;
    String target;
    byte[] data;

    public byte[] data() {
        return data == null ? null : data.clone();
    }
}
