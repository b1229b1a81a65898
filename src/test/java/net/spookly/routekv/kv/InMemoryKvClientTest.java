package net.spookly.routekv.kv;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryKvClientTest {
    @Test
    void appliesPutsAndDeletesTogether() {
        InMemoryKvClient client = new InMemoryKvClient();
        client.transaction(List.of(KvAction.put("a/1", "one"), KvAction.put("a/2", "two")));

        TxnResult result = client.transaction(List.of(KvAction.delete("a/1"), KvAction.put("a/3", "three")));

        assertTrue(result.succeeded());
        assertEquals(new InMemoryKvClient.Response(2, 2), result.response());
        assertTrue(client.get("a/1").isEmpty());
        assertEquals("three", new String(client.get("a/3").orElseThrow(), StandardCharsets.UTF_8));
    }

    @Test
    void prefixReadIsOrderedAndBounded() {
        InMemoryKvClient client = new InMemoryKvClient();
        client.transaction(List.of(
                KvAction.put("routes/b", "2"),
                KvAction.put("routes/a", "1"),
                KvAction.put("routesX", "x"),
                KvAction.put("other", "o")
        ));

        List<String> keys = client.getPrefix("routes/").stream().map(KvEntry::key).collect(Collectors.toList());

        assertEquals(List.of("routes/a", "routes/b"), keys);
    }

    @Test
    void storedValuesAreCopied() {
        InMemoryKvClient client = new InMemoryKvClient();
        byte[] value = "abc".getBytes(StandardCharsets.UTF_8);
        client.transaction(List.of(KvAction.put("k", value)));
        value[0] = 'z';

        byte[] read = client.get("k").orElseThrow();
        read[1] = 'z';

        assertEquals("abc", new String(client.get("k").orElseThrow(), StandardCharsets.UTF_8));
    }

    @Test
    void entriesAndActionsHandOutCopies() {
        byte[] value = "abc".getBytes(StandardCharsets.UTF_8);
        KvAction action = KvAction.put("k", value);
        value[0] = 'z';
        action.value()[1] = 'z';

        KvEntry entry = new KvEntry("k", "abc".getBytes(StandardCharsets.UTF_8));
        entry.value()[0] = 'z';

        assertEquals("abc", new String(action.value(), StandardCharsets.UTF_8));
        assertEquals("abc", new String(entry.value(), StandardCharsets.UTF_8));
    }

    @Test
    void rejectsUseAfterClose() {
        InMemoryKvClient client = new InMemoryKvClient();
        client.close();

        assertThrows(KvBackendException.class, () -> client.get("k"));
        assertThrows(KvBackendException.class, () -> client.transaction(List.of(KvAction.delete("k"))));
    }

    @Test
    void failedTransactionRaisesOnRequire() {
        TxnResult failed = TxnResult.of(false, "raw");

        TransactionFailedException error = assertThrows(TransactionFailedException.class, failed::requireSucceeded);

        assertEquals("raw", error.result().response());
        assertTrue(TxnResult.noop().isNoop());
    }
}
