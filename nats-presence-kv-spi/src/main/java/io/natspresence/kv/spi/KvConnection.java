package io.natspresence.kv.spi;

import java.time.Duration;

/**
 * One transport connection to the KV substrate.
 */
public interface KvConnection extends AutoCloseable {

    Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Acquires a context capable of KV operations.
     *
     * @throws KvException if the server does not offer KV support or the connection is closed
     */
    KvContext keyValueContext() throws KvException;

    /**
     * Whether the connection is currently usable.
     */
    boolean isOpen();

    /**
     * Closes the connection, waiting at most {@code timeout} for in-flight work to finish.
     * Idempotent and safe on an already severed connection; never throws.
     */
    void close(Duration timeout);

    @Override
    default void close() {
        close(DEFAULT_CLOSE_TIMEOUT);
    }
}
