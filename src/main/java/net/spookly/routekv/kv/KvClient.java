package net.spookly.routekv.kv;

import java.util.List;
import java.util.Optional;

/**
 * Synchronous client for a transactional key-value store.
 * <p>
 * Implementations may block on network I/O. Failures reaching the store are reported as
 * {@link KvBackendException}.
 */
public interface KvClient extends AutoCloseable {
    /**
     * Read a single key.
     */
    Optional<byte[]> get(String key);

    /**
     * Read every entry whose key starts with the given prefix, ordered by key.
     */
    List<KvEntry> getPrefix(String prefix);

    /**
     * Apply all actions as one atomic unit.
     */
    TxnResult transaction(List<KvAction> actions);

    /**
     * Release the underlying connection.
     */
    @Override
    void close();
}
