package edu.stanford.futuredata.shardgate.vindexes;

/** A local, synchronous failure to map or verify an id. */
public class VindexException extends Exception {

    public VindexException(String message) {
        super(message);
    }

    public VindexException(String message, Throwable cause) {
        super(message, cause);
    }
}
