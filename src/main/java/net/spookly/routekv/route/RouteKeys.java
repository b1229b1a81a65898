package net.spookly.routekv.route;

import lombok.NonNull;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Traefik router and service keys that accompany one route.
 * <p>
 * {@code serviceUrlPath} holds the target URL, {@code routerServicePath} binds the router to
 * {@code serviceAlias} and {@code routerRulePath} holds the match rule.
 */
@Value
@Accessors(fluent = true)
public class RouteKeys {
    String serviceAlias;
    String serviceUrlPath;
    String routerServicePath;
    String routerRulePath;

    /**
     * Derive the keys for a normalized routespec under the Traefik prefix.
     */
    public static RouteKeys forRoutespec(@NonNull String traefikPrefix, @NonNull String routespec) {
        String escaped = KeyCodec.escape(routespec);
        String serviceAlias = "service" + escaped;
        String routerAlias = "router" + escaped;
        return new RouteKeys(
                serviceAlias,
                KeyCodec.join(traefikPrefix, "http", "services", serviceAlias, "loadBalancer", "servers", "server1", "url"),
                KeyCodec.join(traefikPrefix, "http", "routers", routerAlias, "service"),
                KeyCodec.join(traefikPrefix, "http", "routers", routerAlias, "rule")
        );
    }
}
