package net.spookly.routekv.kv;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Outcome of a transaction: the store's success flag and its raw response.
 * <p>
 * The response is whatever the backend returned and is kept for diagnostics only. It is
 * {@code null} when no transaction was submitted.
 */
@Value
@Accessors(fluent = true)
public class TxnResult {
    private static final TxnResult NOOP = new TxnResult(true, null);

    boolean succeeded;
    Object response;

    public static TxnResult of(boolean succeeded, Object response) {
        return new TxnResult(succeeded, response);
    }

    /**
     * Successful result for an operation that had nothing to write.
     */
    public static TxnResult noop() {
        return NOOP;
    }

    public boolean isNoop() {
        return succeeded && response == null;
    }

    /**
     * Return this result, or throw when the store rejected the transaction.
     */
    public TxnResult requireSucceeded() {
        if (!succeeded) {
            throw new TransactionFailedException(this);
        }
        return this;
    }
}
