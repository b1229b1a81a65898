package net.spookly.routekv.kv;

/**
 * The key-value store could not be reached, rejected our credentials, or the client is closed.
 */
public class KvBackendException extends RuntimeException {
    public KvBackendException(String message) {
        super(message);
    }

    public KvBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
