package edu.stanford.futuredata.shardgate.tabletconn;

import edu.stanford.futuredata.shardgate.utilities.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Dialers by protocol name, and the protocol this process uses.  Built once at startup and
 * read-only afterwards.
 */
public final class TabletDialerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(TabletDialerRegistry.class);

    public static final String DEFAULT_PROTOCOL = "grpc";

    // Map from protocol name to dialer.
    private final Map<String, TabletDialer> dialers;
    private final String protocol;

    private TabletDialerRegistry(Map<String, TabletDialer> dialers, String protocol) {
        this.dialers = Map.copyOf(dialers);
        this.protocol = protocol;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getProtocol() {
        return protocol;
    }

    /** @throws ConfigurationException if no dialer is registered for the configured protocol */
    public TabletDialer getDialer() {
        return getDialer(protocol);
    }

    /** @throws ConfigurationException if no dialer is registered for protocol */
    public TabletDialer getDialer(String protocol) {
        TabletDialer dialer = dialers.get(protocol);
        if (dialer == null) {
            logger.error("No dialer for tablet protocol {}", protocol);
            throw new ConfigurationException(String.format("no dialer registered for protocol %s", protocol));
        }
        return dialer;
    }

    public Set<String> protocols() {
        return dialers.keySet();
    }

    public static final class Builder {
        private final Map<String, TabletDialer> dialers = new HashMap<>();

        private Builder() {}

        /** @throws ConfigurationException if protocol is already registered */
        public Builder register(String protocol, TabletDialer dialer) {
            if (dialers.putIfAbsent(protocol, dialer) != null) {
                logger.error("Dialer for tablet protocol {} already registered", protocol);
                throw new ConfigurationException(String.format("dialer %s already registered", protocol));
            }
            return this;
        }

        public TabletDialerRegistry build() {
            return build(DEFAULT_PROTOCOL);
        }

        public TabletDialerRegistry build(String protocol) {
            return new TabletDialerRegistry(dialers, protocol);
        }
    }
}
