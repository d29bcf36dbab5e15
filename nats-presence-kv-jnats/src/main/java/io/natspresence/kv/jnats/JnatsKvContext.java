package io.natspresence.kv.jnats;

import io.nats.client.JetStreamApiException;
import io.nats.client.KeyValueManagement;
import io.nats.client.api.KeyValueConfiguration;
import io.natspresence.kv.spi.BucketConfig;
import io.natspresence.kv.spi.KvBucket;
import io.natspresence.kv.spi.KvContext;
import io.natspresence.kv.spi.KvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

final class JnatsKvContext implements KvContext {
    private static final Logger log = LoggerFactory.getLogger(JnatsKvContext.class);

    private final JnatsKvConnection connection;
    private final KeyValueManagement kvm;

    JnatsKvContext(JnatsKvConnection connection, KeyValueManagement kvm) {
        this.connection = connection;
        this.kvm = kvm;
    }

    @Override
    public KvBucket createOrAttach(BucketConfig config) throws KvException {
        Objects.requireNonNull(config, "config");
        connection.ensureOpen();

        KeyValueConfiguration kvc = KeyValueConfiguration.builder()
                .name(config.name())
                .ttl(config.ttl())
                .maximumValueSize(config.maxValueSize())
                .build();
        try {
            kvm.create(kvc);
            log.debug("Created bucket {} (ttl={}, maxValueSize={})", config.name(), config.ttl(), config.maxValueSize());
        } catch (JetStreamApiException createError) {
            // The bucket usually exists already, possibly with another configuration.
            attachExisting(config.name(), createError);
        } catch (Exception e) {
            throw JnatsErrors.wrap("create bucket " + config.name(), e);
        }
        return new JnatsKvBucket(connection, config.name());
    }

    private void attachExisting(String name, JetStreamApiException createError) throws KvException {
        try {
            kvm.getStatus(name);
            log.debug("Attached to existing bucket {}", name);
        } catch (Exception e) {
            KvException failure = JnatsErrors.wrap("create or attach bucket " + name
                    + " (create: " + JnatsErrors.describe(createError) + "), attach", e);
            failure.addSuppressed(createError);
            throw failure;
        }
    }
}
