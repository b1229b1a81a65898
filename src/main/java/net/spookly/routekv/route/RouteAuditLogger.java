package net.spookly.routekv.route;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default audit logger that emits one line per route table write.
 */
public final class RouteAuditLogger implements RouteEventListener {
    public static final RouteAuditLogger INSTANCE = new RouteAuditLogger();

    private static final Logger LOG = LoggerFactory.getLogger("routekv.audit");

    private RouteAuditLogger() {
    }

    @Override
    public void onEvent(RouteEvent event) {
        if (!LOG.isInfoEnabled()) {
            return;
        }
        LOG.info(format(event));
    }

    static String format(RouteEvent event) {
        StringBuilder builder = new StringBuilder("route_event");
        append(builder, "type", event.type());
        append(builder, "key", event.key());
        append(builder, "target", event.target());
        append(builder, "actions", event.actions());
        append(builder, "succeeded", event.succeeded());
        append(builder, "timestamp", event.timestamp());
        return builder.toString();
    }

    private static void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
