package net.spookly.routekv.route;

import java.util.Map;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * A route as seen by callers of {@link RouteTable}, with its target data decoded from JSON.
 */
@Value
@Accessors(fluent = true)
public class Route {
    String routespec;
    String target;
    Map<String, Object> data;
}
