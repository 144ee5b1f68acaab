package edu.stanford.futuredata.shardgate.tabletconn;

/**
 * A failed tablet call.  When a begin-execute call began a transaction before failing, the
 * exception carries the transaction id so the caller can still roll it back.
 */
public abstract class TabletConnException extends Exception {

    private final long transactionId;

    protected TabletConnException(String message, Throwable cause, long transactionId) {
        super(message, cause);
        this.transactionId = transactionId;
    }

    // Zero unless a transaction was begun by the failed call.
    public long getTransactionId() {
        return transactionId;
    }
}
