package net.spookly.routekv.route;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import net.spookly.routekv.config.RouteKvConfig;
import net.spookly.routekv.kv.KvAction;
import net.spookly.routekv.kv.KvClient;
import net.spookly.routekv.kv.KvEntry;
import net.spookly.routekv.kv.TxnResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the route table as atomic transactions against a {@link KvClient}.
 * <p>
 * Every backend call runs on one worker thread, so this process never has two store
 * operations in flight at once. Each method returns immediately with a future completed by
 * that worker; failures complete the future exceptionally with the backend's exception
 * ({@code KvBackendException}) or a {@link DecodeException}. Nothing is retried.
 * <p>
 * Route keys passed in are full keys as built by {@link KeyCodec#routeKey(String, String)}.
 */
public final class RouteStore implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RouteStore.class);
    private static final long CLOSE_TIMEOUT_SECONDS = 10;

    private final KvClient client;
    private final String jupyterhubPrefix;
    private final String traefikPrefix;
    private final TargetDataPolicy targetDataPolicy;
    private final RouteEventListener eventListener;
    private final ExecutorService worker;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RouteStore(KvClient client, String jupyterhubPrefix, String traefikPrefix) {
        this(client, jupyterhubPrefix, traefikPrefix, TargetDataPolicy.UNCONDITIONAL, RouteEventListener.NOOP);
    }

    public RouteStore(KvClient client,
                      String jupyterhubPrefix,
                      String traefikPrefix,
                      TargetDataPolicy targetDataPolicy,
                      RouteEventListener eventListener) {
        this.client = Objects.requireNonNull(client, "client");
        this.jupyterhubPrefix = Objects.requireNonNull(jupyterhubPrefix, "jupyterhubPrefix");
        this.traefikPrefix = Objects.requireNonNull(traefikPrefix, "traefikPrefix");
        this.targetDataPolicy = targetDataPolicy == null ? TargetDataPolicy.UNCONDITIONAL : targetDataPolicy;
        this.eventListener = eventListener == null ? RouteEventListener.NOOP : eventListener;
        this.worker = Executors.newSingleThreadExecutor(threadFactory());
    }

    /**
     * Build a store with prefixes and policy taken from config.
     */
    public static RouteStore fromConfig(RouteKvConfig config, KvClient client, RouteEventListener eventListener) {
        return new RouteStore(
                client,
                config.jupyterhub.prefix,
                config.traefik.prefix,
                TargetDataPolicy.fromConfig(config.store == null ? null : config.store.sharedTargetPolicy),
                eventListener
        );
    }

    /**
     * Write a route, its target data and its three Traefik keys in one transaction.
     * No guard is applied: the last writer wins.
     */
    public CompletableFuture<TxnResult> addRoute(String routespecKey,
                                                 String target,
                                                 byte[] data,
                                                 RouteKeys routeKeys,
                                                 String rule) {
        Objects.requireNonNull(routespecKey, "routespecKey");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(routeKeys, "routeKeys");
        Objects.requireNonNull(rule, "rule");
        return submit(() -> {
            List<KvAction> actions = List.of(
                    KvAction.put(routespecKey, target),
                    KvAction.put(KeyCodec.targetKey(jupyterhubPrefix, target), data),
                    KvAction.put(routeKeys.serviceUrlPath(), target),
                    KvAction.put(routeKeys.routerServicePath(), routeKeys.serviceAlias()),
                    KvAction.put(routeKeys.routerRulePath(), rule)
            );
            TxnResult result = client.transaction(actions);
            emit(RouteEventType.ADD, routespecKey, target, actions.size(), result.succeeded());
            return result;
        });
    }

    /**
     * Delete a route and its companion keys in one transaction.
     * Deleting a route that does not exist succeeds without writing anything.
     */
    public CompletableFuture<TxnResult> deleteRoute(String routespecKey, RouteKeys routeKeys) {
        Objects.requireNonNull(routespecKey, "routespecKey");
        Objects.requireNonNull(routeKeys, "routeKeys");
        return submit(() -> {
            Optional<byte[]> current = client.get(routespecKey);
            if (current.isEmpty()) {
                LOG.warn("Route {} doesn't exist. Nothing to delete", routespecKey);
                emit(RouteEventType.DELETE_MISSING, routespecKey, null, 0, true);
                return TxnResult.noop();
            }
            String target = KeyCodec.decodeValue(current.get(), routespecKey);
            List<KvAction> actions = new ArrayList<>(5);
            actions.add(KvAction.delete(routespecKey));
            if (shouldDeleteTargetData(routespecKey, target)) {
                actions.add(KvAction.delete(KeyCodec.targetKey(jupyterhubPrefix, target)));
            }
            actions.add(KvAction.delete(routeKeys.serviceUrlPath()));
            actions.add(KvAction.delete(routeKeys.routerServicePath()));
            actions.add(KvAction.delete(routeKeys.routerRulePath()));
            TxnResult result = client.transaction(actions);
            emit(RouteEventType.DELETE, routespecKey, target, actions.size(), result.succeeded());
            return result;
        });
    }

    public CompletableFuture<Optional<String>> getTarget(String routespecKey) {
        Objects.requireNonNull(routespecKey, "routespecKey");
        return submit(() -> client.get(routespecKey).map(value -> KeyCodec.decodeValue(value, routespecKey)));
    }

    /**
     * Data stored for a target URL.
     */
    public CompletableFuture<Optional<byte[]>> getData(String target) {
        Objects.requireNonNull(target, "target");
        return getDataByKey(KeyCodec.targetKey(jupyterhubPrefix, target));
    }

    public CompletableFuture<Optional<byte[]>> getDataByKey(String targetKey) {
        Objects.requireNonNull(targetKey, "targetKey");
        return submit(() -> client.get(targetKey));
    }

    /**
     * Snapshot of every raw route entry. Pass each through {@link #decodeRouteEntry(KvEntry)}.
     */
    public CompletableFuture<List<KvEntry>> listRoutes() {
        return submit(() -> List.copyOf(client.getPrefix(KeyCodec.routesPrefix(jupyterhubPrefix))));
    }

    /**
     * Recover routespec, target and target data from one entry of {@link #listRoutes()}.
     */
    public CompletableFuture<RouteEntry> decodeRouteEntry(KvEntry entry) {
        Objects.requireNonNull(entry, "entry");
        return submit(() -> {
            KeyCodec.DecodedRoute decoded = KeyCodec.decodeRouteEntry(entry.key(), entry.value(), jupyterhubPrefix);
            byte[] data = client.get(decoded.targetKey()).orElse(null);
            return new RouteEntry(decoded.routespec(), decoded.target(), data);
        });
    }

    /**
     * Write every leaf of the nested config under the Traefik prefix in one transaction.
     * Keys from earlier configs that are absent now are left in place.
     */
    public CompletableFuture<TxnResult> persistDynamicConfig(Map<String, ?> dynamicConfig) {
        Objects.requireNonNull(dynamicConfig, "dynamicConfig");
        return submit(() -> {
            Map<String, String> flat = DynamicConfigFlattener.flatten(dynamicConfig, traefikPrefix);
            List<KvAction> actions = new ArrayList<>(flat.size());
            for (Map.Entry<String, String> entry : flat.entrySet()) {
                actions.add(KvAction.put(entry.getKey(), entry.getValue()));
            }
            TxnResult result = client.transaction(actions);
            emit(RouteEventType.PERSIST_CONFIG, traefikPrefix, null, actions.size(), result.succeeded());
            return result;
        });
    }

    public String jupyterhubPrefix() {
        return jupyterhubPrefix;
    }

    public String traefikPrefix() {
        return traefikPrefix;
    }

    public TargetDataPolicy targetDataPolicy() {
        return targetDataPolicy;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Let queued operations finish, then close the client. Only the first call has an effect.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        worker.shutdown();
        try {
            if (!worker.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Route store worker did not finish within {}s, interrupting", CLOSE_TIMEOUT_SECONDS);
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            client.close();
            LOG.info("Route store closed");
        }
    }

    private boolean shouldDeleteTargetData(String routespecKey, String target) {
        if (targetDataPolicy == TargetDataPolicy.UNCONDITIONAL) {
            return true;
        }
        for (KvEntry entry : client.getPrefix(KeyCodec.routesPrefix(jupyterhubPrefix))) {
            if (!entry.key().equals(routespecKey) && target.equals(KeyCodec.decodeValue(entry.value(), entry.key()))) {
                LOG.debug("Keeping data of target {} still used by {}", target, entry.key());
                return false;
            }
        }
        return true;
    }

    private <T> CompletableFuture<T> submit(Supplier<T> operation) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("route store is closed"));
        }
        try {
            return CompletableFuture.supplyAsync(operation, worker);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("route store is closed", e));
        }
    }

    private void emit(RouteEventType type, String key, String target, int actions, boolean succeeded) {
        if (!succeeded) {
            LOG.warn("{} transaction for {} was not applied", type, key);
        }
        try {
            eventListener.onEvent(new RouteEvent(type, Instant.now(), key, target, actions, succeeded));
        } catch (RuntimeException e) {
            LOG.warn("Failed to emit route audit event: {}", e.getMessage());
        }
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "routekv-kv");
            thread.setDaemon(true);
            return thread;
        };
    }
}
