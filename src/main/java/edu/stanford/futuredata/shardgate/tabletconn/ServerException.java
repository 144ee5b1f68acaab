package edu.stanford.futuredata.shardgate.tabletconn;

/** The tablet answered with an error. */
public class ServerException extends TabletConnException {

    private final ErrorCode code;
    private final String serverMessage;

    public ServerException(ErrorCode code, String message) {
        this(code, message, 0, null);
    }

    public ServerException(ErrorCode code, String message, Throwable cause) {
        this(code, message, 0, cause);
    }

    public ServerException(ErrorCode code, String message, long transactionId) {
        this(code, message, transactionId, null);
    }

    public ServerException(ErrorCode code, String message, long transactionId, Throwable cause) {
        super(String.format("%s: %s", code, message), cause, transactionId);
        this.code = code;
        this.serverMessage = message;
    }

    public ErrorCode getCode() {
        return code;
    }

    // The message without the code prefix.
    public String getServerMessage() {
        return serverMessage;
    }

    public boolean isRetriable() {
        return code.isRetriable();
    }

    /** The same error, now attributed to a transaction begun by the failed call. */
    public ServerException withTransactionId(long transactionId) {
        return new ServerException(code, serverMessage, transactionId, getCause());
    }
}
