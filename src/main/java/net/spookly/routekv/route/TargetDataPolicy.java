package net.spookly.routekv.route;

import java.util.Locale;

/**
 * What a route delete does with the data entry of its target.
 */
public enum TargetDataPolicy {
    /**
     * Always delete the target data, even when other routes still point at the same target.
     * This is the layout other writers of the store expect.
     */
    UNCONDITIONAL,
    /**
     * Keep the target data while another route still maps to the same target. The check is a
     * read before the transaction, so a concurrent add from another process can still race it.
     */
    REFERENCE_COUNTED;

    public static TargetDataPolicy fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return UNCONDITIONAL;
        }
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
