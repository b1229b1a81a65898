package net.spookly.routekv.route;

/**
 * Listener for route table write events.
 */
@FunctionalInterface
public interface RouteEventListener {
    RouteEventListener NOOP = event -> {
    };

    void onEvent(RouteEvent event);
}
