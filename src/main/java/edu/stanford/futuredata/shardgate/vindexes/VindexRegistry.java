package edu.stanford.futuredata.shardgate.vindexes;

import edu.stanford.futuredata.shardgate.utilities.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Catalog of vindex factories by type name.  Populated once through a {@link Builder} during
 * startup and read-only afterwards, so lookups need no locking.
 */
public final class VindexRegistry {

    private static final Logger logger = LoggerFactory.getLogger(VindexRegistry.class);

    private final Map<String, VindexFactory> factories;

    private VindexRegistry(Map<String, VindexFactory> factories) {
        this.factories = Map.copyOf(factories);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @throws ConfigurationException if no factory is registered for type */
    public VindexFactory get(String type) {
        VindexFactory factory = factories.get(type);
        if (factory == null) {
            logger.error("No vindex registered for type {}", type);
            throw new ConfigurationException(String.format("vindex type %s not found", type));
        }
        return factory;
    }

    public Vindex create(String type, String name, Map<String, Object> params) {
        Vindex vindex = get(type).create(name, params == null ? Map.of() : params);
        logger.debug("Created vindex {} of type {}", name, type);
        return vindex;
    }

    public Set<String> types() {
        return factories.keySet();
    }

    public static final class Builder {
        private final Map<String, VindexFactory> factories = new HashMap<>();

        private Builder() {}

        /** @throws ConfigurationException if type is already registered */
        public Builder register(String type, VindexFactory factory) {
            if (factories.putIfAbsent(type, factory) != null) {
                logger.error("Vindex type {} already registered", type);
                throw new ConfigurationException(String.format("vindex type %s already registered", type));
            }
            return this;
        }

        // The vindexes that need no collaborators.
        public Builder withBuiltins() {
            register(BinaryMd5.TYPE, BinaryMd5::create);
            register(Hash.TYPE, Hash::create);
            register(Numeric.TYPE, Numeric::create);
            return this;
        }

        public VindexRegistry build() {
            return new VindexRegistry(factories);
        }
    }
}
