package edu.stanford.futuredata.shardgate.tabletconn;

/** The call never got an answer from the tablet. */
public class OperationalException extends TabletConnException {

    public enum Kind {
        // The connection was closed before or during the call.
        CONNECTION_CLOSED,
        // The caller's context was cancelled or its deadline elapsed.
        CANCELLED,
        // Transport failure.
        NETWORK
    }

    private final Kind kind;

    public OperationalException(Kind kind, String message) {
        this(kind, message, null);
    }

    public OperationalException(Kind kind, String message, Throwable cause) {
        super(String.format("%s: %s", kind, message), cause, 0);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
