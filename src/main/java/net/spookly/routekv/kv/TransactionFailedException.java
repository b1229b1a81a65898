package net.spookly.routekv.kv;

/**
 * The store reported {@code success=false} for a submitted transaction. No change was applied.
 */
public class TransactionFailedException extends RuntimeException {
    private final transient TxnResult result;

    public TransactionFailedException(TxnResult result) {
        super("Transaction was not applied: " + result.response());
        this.result = result;
    }

    public TxnResult result() {
        return result;
    }
}
