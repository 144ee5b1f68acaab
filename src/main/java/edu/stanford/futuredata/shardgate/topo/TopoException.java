package edu.stanford.futuredata.shardgate.topo;

/** The topology service failed or holds no answer for a request that needs one. */
public class TopoException extends RuntimeException {

    public TopoException(String message) {
        super(message);
    }

    public TopoException(String message, Throwable cause) {
        super(message, cause);
    }
}
