package io.natspresence.kv.jnats;

import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import io.natspresence.kv.spi.KvConnection;
import io.natspresence.kv.spi.KvConnector;
import io.natspresence.kv.spi.KvException;

import java.time.Duration;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * {@link KvConnector} implementation using the NATS Java client and JetStream key-value buckets.
 *
 * <p>Requires {@code io.nats:jnats} on the classpath and a server with JetStream enabled.
 */
public final class JnatsKvConnector implements KvConnector {

    private final UnaryOperator<Options.Builder> customizer;

    public JnatsKvConnector() {
        this(UnaryOperator.identity());
    }

    /**
     * @param customizer applied to the options builder after url and timeout are set
     *                   (credentials, TLS, connection name)
     */
    public JnatsKvConnector(UnaryOperator<Options.Builder> customizer) {
        this.customizer = Objects.requireNonNull(customizer, "customizer");
    }

    @Override
    public KvConnection connect(String url, Duration timeout) throws KvException {
        if (url == null || url.isBlank()) throw new KvException("url must not be empty");
        Objects.requireNonNull(timeout, "timeout");
        try {
            // Options.Builder.server rejects a malformed url with IllegalArgumentException.
            Options options = customizer.apply(new Options.Builder()
                            .server(url)
                            .connectionTimeout(timeout))
                    .build();
            Connection nc = Nats.connect(options);
            return new JnatsKvConnection(nc, url);
        } catch (Exception e) {
            throw JnatsErrors.wrap("connect to " + url, e);
        }
    }
}
