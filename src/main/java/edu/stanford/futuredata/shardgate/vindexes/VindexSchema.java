package edu.stanford.futuredata.shardgate.vindexes;

import edu.stanford.futuredata.shardgate.utilities.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The vindexes of a keyspace, instantiated from their declarations and addressed by name.
 */
public final class VindexSchema {

    private static final Logger logger = LoggerFactory.getLogger(VindexSchema.class);

    private final Map<String, Vindex> vindexes;

    private VindexSchema(Map<String, Vindex> vindexes) {
        this.vindexes = Map.copyOf(vindexes);
    }

    /**
     * @param declarations map from vindex name to its declaration
     * @throws ConfigurationException on unknown types or bad parameters
     */
    public static VindexSchema load(VindexRegistry registry, Map<String, Declaration> declarations) {
        Map<String, Vindex> vindexes = new HashMap<>();
        for (Map.Entry<String, Declaration> e: declarations.entrySet()) {
            Declaration d = e.getValue();
            vindexes.put(e.getKey(), registry.create(d.type, e.getKey(), d.params));
        }
        logger.info("Loaded {} vindexes", vindexes.size());
        return new VindexSchema(vindexes);
    }

    public Optional<Vindex> get(String name) {
        return Optional.ofNullable(vindexes.get(name));
    }

    /** The lowest-cost vindex among names, ignoring names that are not declared. */
    public Optional<Vindex> cheapest(Collection<String> names) {
        return names.stream()
                .map(vindexes::get)
                .filter(v -> v != null)
                .min(Comparator.comparingInt(Vindex::getCost));
    }

    public static final class Declaration {
        public final String type;
        public final Map<String, Object> params;

        public Declaration(String type, Map<String, Object> params) {
            this.type = type;
            this.params = params == null ? Map.of() : Map.copyOf(params);
        }
    }
}
