package edu.stanford.futuredata.shardgate.vindexes;

import java.util.Map;

/**
 * Builds a vindex from its declared name and parameters.  Missing or malformed parameters
 * raise a {@link edu.stanford.futuredata.shardgate.utilities.ConfigurationException}.
 */
@FunctionalInterface
public interface VindexFactory {
    Vindex create(String name, Map<String, Object> params);
}
