package net.spookly.routekv.kv;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Key and raw value returned by a range read. The value is copied on the way out.
 */
@Value
@Accessors(fluent = true)
public class KvEntry {
    String key;
    byte[] value;

    public byte[] value() {
        return value.clone();
    }
}
