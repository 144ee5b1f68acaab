package edu.stanford.futuredata.shardgate.vindexes;

/**
 * The lookup store behind a vindex could not be reached or failed the request.  An id that
 * is simply absent from the store is not an error.
 */
public class BackingStoreException extends VindexException {

    public BackingStoreException(String message) {
        super(message);
    }

    public BackingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
