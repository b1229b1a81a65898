package net.spookly.routekv.route;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.routekv.kv.KvEntry;
import net.spookly.routekv.kv.TxnResult;

/**
 * Route operations in terms of plain routespecs.
 * <p>
 * Normalizes routespecs, derives the route key, the Traefik keys and the match rule, and
 * stores target data as JSON. Writes the store rejects fail with
 * {@code TransactionFailedException}.
 */
public final class RouteTable {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> DATA_TYPE = new TypeReference<>() {
    };

    private final RouteStore store;

    public RouteTable(RouteStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public CompletableFuture<TxnResult> addRoute(String routespec, String target, Map<String, ?> data) {
        String normalized = Routespecs.normalize(routespec);
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target is required");
        }
        byte[] encoded = encode(data == null ? Map.of() : data);
        return store.addRoute(
                routeKey(normalized),
                target,
                encoded,
                routeKeys(normalized),
                Routespecs.rule(normalized)
        ).thenApply(TxnResult::requireSucceeded);
    }

    public CompletableFuture<TxnResult> deleteRoute(String routespec) {
        String normalized = Routespecs.normalize(routespec);
        return store.deleteRoute(routeKey(normalized), routeKeys(normalized))
                .thenApply(TxnResult::requireSucceeded);
    }

    public CompletableFuture<Optional<Route>> getRoute(String routespec) {
        String normalized = Routespecs.normalize(routespec);
        return store.getTarget(routeKey(normalized)).thenCompose(target -> {
            if (target.isEmpty()) {
                return CompletableFuture.completedFuture(Optional.<Route>empty());
            }
            return store.getData(target.get())
                    .thenApply(data -> Optional.of(new Route(normalized, target.get(), decode(data.orElse(null)))));
        });
    }

    /**
     * Every stored route keyed by routespec.
     */
    public CompletableFuture<Map<String, Route>> getAllRoutes() {
        return store.listRoutes().thenCompose(entries -> {
            List<CompletableFuture<RouteEntry>> decoded = new ArrayList<>(entries.size());
            for (KvEntry entry : entries) {
                decoded.add(store.decodeRouteEntry(entry));
            }
            return CompletableFuture.allOf(decoded.toArray(new CompletableFuture<?>[0])).thenApply(ignored -> {
                Map<String, Route> routes = new LinkedHashMap<>();
                for (CompletableFuture<RouteEntry> future : decoded) {
                    RouteEntry entry = future.join();
                    routes.put(entry.routespec(), new Route(entry.routespec(), entry.target(), decode(entry.data())));
                }
                return routes;
            });
        });
    }

    public CompletableFuture<TxnResult> persistDynamicConfig(Map<String, ?> dynamicConfig) {
        return store.persistDynamicConfig(dynamicConfig).thenApply(TxnResult::requireSucceeded);
    }

    public RouteKeys routeKeys(String normalizedRoutespec) {
        return RouteKeys.forRoutespec(store.traefikPrefix(), normalizedRoutespec);
    }

    public String routeKey(String normalizedRoutespec) {
        return KeyCodec.routeKey(store.jupyterhubPrefix(), normalizedRoutespec);
    }

    private static byte[] encode(Map<String, ?> data) {
        try {
            return MAPPER.writeValueAsBytes(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Route data is not serializable as JSON", e);
        }
    }

    private static Map<String, Object> decode(byte[] data) {
        if (data == null || data.length == 0) {
            return Collections.emptyMap();
        }
        try {
            return MAPPER.readValue(data, DATA_TYPE);
        } catch (IOException e) {
            throw new DecodeException("Target data is not a JSON object", e);
        }
    }
}
