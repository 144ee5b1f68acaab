package edu.stanford.futuredata.shardgate.utilities;

/**
 * A deployment or configuration defect found at startup: duplicate registrations, unknown
 * vindex types or protocols, missing parameters.  Never retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
