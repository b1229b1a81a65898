package net.spookly.routekv.kv;

import java.util.concurrent.CompletableFuture;

import io.etcd.jetcd.op.Op;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EtcdKvClientTest {
    @Test
    void mapsActionsToTransactionOps() {
        assertInstanceOf(Op.PutOp.class, EtcdKvClient.toOp(KvAction.put("jupyterhub/routes/_2F", "http://hub:8081")));
        assertInstanceOf(Op.DeleteOp.class, EtcdKvClient.toOp(KvAction.delete("jupyterhub/routes/_2F")));
    }

    @Test
    void rangeReadsUsePrefixOption() {
        assertTrue(EtcdKvClient.prefixOption().isPrefix());
    }

    @Test
    void wrapsClientFailuresAsBackendErrors() {
        IllegalStateException cause = new IllegalStateException("connection refused");

        KvBackendException error = assertThrows(KvBackendException.class,
                () -> EtcdKvClient.await(CompletableFuture.failedFuture(cause), "get k"));

        assertSame(cause, error.getCause());
        assertTrue(error.getMessage().contains("get k"));
        assertEquals("v", EtcdKvClient.await(CompletableFuture.completedFuture("v"), "get k"));
    }
}
