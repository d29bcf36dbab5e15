package io.natspresence.client;

import io.natspresence.core.PresenceException;
import io.natspresence.kv.spi.KvConnector;
import io.natspresence.kv.spi.KvConnectorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Locates the KV binding installed on the classpath.
 */
final class KvConnectors {
    private static final Logger log = LoggerFactory.getLogger(KvConnectors.class);

    private KvConnectors() {}

    static KvConnector discover() {
        return discover(ServiceLoader.load(KvConnectorProvider.class));
    }

    static KvConnector discover(Iterable<KvConnectorProvider> providers) {
        Iterator<KvConnectorProvider> it = providers.iterator();
        if (!it.hasNext()) {
            throw new PresenceException.Configuration(
                    "no KV binding found on the classpath; add nats-presence-kv-jnats or pass a connector to the builder");
        }
        KvConnectorProvider provider = it.next();
        if (it.hasNext()) {
            log.debug("Several KV bindings installed, using {}", provider.name());
        }
        return provider.connector();
    }
}
