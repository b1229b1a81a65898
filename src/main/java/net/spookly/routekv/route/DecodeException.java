package net.spookly.routekv.route;

/**
 * A stored key or value does not follow the key layout or escaping scheme.
 * <p>
 * Points at corrupted data or at a writer using a different scheme version.
 */
public class DecodeException extends RuntimeException {
    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
