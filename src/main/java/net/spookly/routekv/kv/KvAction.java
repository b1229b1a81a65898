package net.spookly.routekv.kv;

import java.nio.charset.StandardCharsets;

import lombok.NonNull;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * A single put or delete inside a transaction.
 */
@Value
@Accessors(fluent = true)
public class KvAction {
    Type type;
    String key;
    byte[] value;

    public enum Type {
        PUT,
        DELETE
    }

    public static KvAction put(@NonNull String key, @NonNull byte[] value) {
        return new KvAction(Type.PUT, key, value.clone());
    }

    public static KvAction put(@NonNull String key, @NonNull String value) {
        return put(key, value.getBytes(StandardCharsets.UTF_8));
    }

    public static KvAction delete(@NonNull String key) {
        return new KvAction(Type.DELETE, key, null);
    }

    /**
     * Copy of the value to put, {@code null} for a delete.
     */
    public byte[] value() {
        return value == null ? null : value.clone();
    }

    public boolean isPut() {
        return type == Type.PUT;
    }
}
