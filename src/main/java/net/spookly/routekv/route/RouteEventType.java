package net.spookly.routekv.route;

public enum RouteEventType {
    ADD,
    DELETE,
    DELETE_MISSING,
    PERSIST_CONFIG
}
