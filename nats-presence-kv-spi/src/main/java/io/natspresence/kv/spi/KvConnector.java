package io.natspresence.kv.spi;

import java.time.Duration;

/**
 * Entry point of a KV substrate binding.
 *
 * <p>Implementations should be thread-safe and reusable.
 */
public interface KvConnector {

    /**
     * Opens a connection to the substrate at {@code url}.
     *
     * @param url server url (e.g., {@code nats://localhost:4222})
     * @param timeout longest wait for the connection to be established
     * @throws KvTimeoutException if the server does not answer in time
     * @throws KvException if the server is unreachable or rejects the client
     */
    KvConnection connect(String url, Duration timeout) throws KvException;
}
