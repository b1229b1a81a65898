package net.spookly.routekv.route;

/**
 * Routespec validation and the Traefik match rule derived from it.
 * <p>
 * A routespec is {@code /path/} for path-only routing or {@code host.tld/path/} for
 * host-based routing, and always ends with {@code /}.
 */
public final class Routespecs {
    private Routespecs() {
    }

    /**
     * Validate a routespec and append the trailing slash when missing.
     */
    public static String normalize(String routespec) {
        if (routespec == null || routespec.isBlank()) {
            throw new IllegalArgumentException("routespec is required");
        }
        for (int i = 0; i < routespec.length(); i++) {
            if (Character.isWhitespace(routespec.charAt(i))) {
                throw new IllegalArgumentException("routespec must not contain whitespace: " + routespec);
            }
        }
        if (routespec.startsWith("//")) {
            throw new IllegalArgumentException("routespec must not start with '//': " + routespec);
        }
        if (!routespec.endsWith("/")) {
            return routespec + "/";
        }
        return routespec;
    }

    public static boolean isHostBased(String routespec) {
        return !routespec.startsWith("/");
    }

    public static String host(String routespec) {
        if (!isHostBased(routespec)) {
            return null;
        }
        return routespec.substring(0, routespec.indexOf('/'));
    }

    public static String path(String routespec) {
        if (!isHostBased(routespec)) {
            return routespec;
        }
        return routespec.substring(routespec.indexOf('/'));
    }

    /**
     * Traefik rule matching requests for the routespec.
     */
    public static String rule(String routespec) {
        String normalized = normalize(routespec);
        String pathRule = "PathPrefix(`" + path(normalized) + "`)";
        if (isHostBased(normalized)) {
            return "Host(`" + host(normalized) + "`) && " + pathRule;
        }
        return pathRule;
    }
}
