package net.spookly.routekv.kv;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local transactional store. Transactions are applied under one lock, so readers
 * never observe a partially applied transaction.
 */
public final class InMemoryKvClient implements KvClient {
    private final NavigableMap<String, byte[]> entries = new TreeMap<>();
    private final AtomicLong revision = new AtomicLong();
    private boolean closed;

    @Override
    public synchronized Optional<byte[]> get(String key) {
        ensureOpen();
        byte[] value = entries.get(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public synchronized List<KvEntry> getPrefix(String prefix) {
        ensureOpen();
        List<KvEntry> result = new ArrayList<>();
        for (Map.Entry<String, byte[]> entry : entries.tailMap(prefix, true).entrySet()) {
            if (!entry.getKey().startsWith(prefix)) {
                break;
            }
            result.add(new KvEntry(entry.getKey(), entry.getValue().clone()));
        }
        return result;
    }

    @Override
    public synchronized TxnResult transaction(List<KvAction> actions) {
        ensureOpen();
        for (KvAction action : actions) {
            if (action.isPut()) {
                entries.put(action.key(), action.value());
            } else {
                entries.remove(action.key());
            }
        }
        return TxnResult.of(true, new Response(revision.incrementAndGet(), actions.size()));
    }

    /**
     * Copy of every stored entry, ordered by key.
     */
    public synchronized Map<String, byte[]> snapshot() {
        Map<String, byte[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
            copy.put(entry.getKey(), entry.getValue().clone());
        }
        return Collections.unmodifiableMap(copy);
    }

    public long revision() {
        return revision.get();
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new KvBackendException("in-memory store is closed");
        }
    }

    /**
     * Raw response of an in-memory transaction.
     */
    public record Response(long revision, int actions) {
    }
}
