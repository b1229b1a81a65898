package net.spookly.routekv.kv;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * {@link KvClient} backed by etcd v3. Every call blocks until etcd answers.
 */
public final class EtcdKvClient implements KvClient {
    private static final Logger LOG = LoggerFactory.getLogger(EtcdKvClient.class);

    private final Client client;
    private final KV kv;

    public EtcdKvClient(Client client) {
        this.client = Objects.requireNonNull(client, "client");
        this.kv = client.getKVClient();
    }

    @Override
    public Optional<byte[]> get(String key) {
        GetResponse response = await(kv.get(bytes(key)), "get " + key);
        if (response.getKvs().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(response.getKvs().get(0).getValue().getBytes());
    }

    @Override
    public List<KvEntry> getPrefix(String prefix) {
        GetResponse response = await(kv.get(bytes(prefix), prefixOption()), "get prefix " + prefix);
        List<KvEntry> entries = new ArrayList<>(response.getKvs().size());
        for (KeyValue keyValue : response.getKvs()) {
            entries.add(new KvEntry(keyValue.getKey().toString(UTF_8), keyValue.getValue().getBytes()));
        }
        return entries;
    }

    @Override
    public TxnResult transaction(List<KvAction> actions) {
        Op[] ops = new Op[actions.size()];
        for (int i = 0; i < ops.length; i++) {
            ops[i] = toOp(actions.get(i));
        }
        TxnResponse response = await(kv.txn().Then(ops).commit(), "transaction of " + ops.length + " actions");
        LOG.debug("etcd transaction of {} actions succeeded={}", ops.length, response.isSucceeded());
        return TxnResult.of(response.isSucceeded(), response);
    }

    @Override
    public void close() {
        client.close();
    }

    static Op toOp(KvAction action) {
        if (action.isPut()) {
            return Op.put(bytes(action.key()), ByteSequence.from(action.value()), PutOption.DEFAULT);
        }
        return Op.delete(bytes(action.key()), DeleteOption.DEFAULT);
    }

    static GetOption prefixOption() {
        return GetOption.newBuilder().isPrefix(true).build();
    }

    private static ByteSequence bytes(String value) {
        return ByteSequence.from(value, UTF_8);
    }

    static <T> T await(CompletableFuture<T> future, String description) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KvBackendException("Interrupted during etcd " + description, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new KvBackendException("etcd " + description + " failed: " + cause.getMessage(), cause);
        }
    }
}
