package io.natspresence.kv.jnats;

import io.natspresence.kv.spi.KvConnector;
import io.natspresence.kv.spi.KvConnectorProvider;

public final class JnatsKvConnectorProvider implements KvConnectorProvider {
    @Override
    public String name() {
        return "jnats";
    }

    @Override
    public KvConnector connector() {
        return new JnatsKvConnector();
    }
}
