package edu.stanford.futuredata.shardgate.tabletconn;

/** Application error codes reported by a tablet. */
public enum ErrorCode {
    SUCCESS(0),
    CANCELLED(1),
    UNKNOWN_ERROR(2),
    BAD_INPUT(3),
    DEADLINE_EXCEEDED(4),
    INTEGRITY_ERROR(5),
    PERMISSION_DENIED(6),
    RESOURCE_EXHAUSTED(7),
    QUERY_NOT_SERVED(8),
    NOT_IN_TX(9),
    INTERNAL_ERROR(10),
    TRANSIENT_ERROR(11),
    UNAUTHENTICATED(12);

    private final int number;

    ErrorCode(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    // Codes this client does not know decode to UNKNOWN_ERROR.
    public static ErrorCode forNumber(int number) {
        for (ErrorCode c: values()) {
            if (c.number == number) {
                return c;
            }
        }
        return UNKNOWN_ERROR;
    }

    /** Whether the same request may succeed if sent again, possibly to another tablet. */
    public boolean isRetriable() {
        return this == QUERY_NOT_SERVED || this == TRANSIENT_ERROR || this == RESOURCE_EXHAUSTED;
    }
}
