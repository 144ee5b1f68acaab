package edu.stanford.futuredata.shardgate.vindexes;

/** The id has a representation the vindex does not support. */
public class MappingException extends VindexException {

    public MappingException(String message) {
        super(message);
    }

    public MappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
