package io.natspresence.kv.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Handle to one named bucket.
 *
 * <p>All calls block for at most the given timeout. Handles are owned by a single user and are
 * not meant to be shared without external synchronization.
 */
public interface KvBucket extends AutoCloseable {

    /**
     * Bucket name.
     */
    String name();

    /**
     * Unconditionally writes {@code value} under {@code key}, resetting the key's expiry.
     *
     * @return the revision assigned to this write; strictly greater than any earlier revision in the bucket
     * @throws KvTimeoutException if no acknowledgement arrives in time
     * @throws KvException if the write is rejected (e.g., value too large) or the bucket is unreachable
     */
    long put(String key, byte[] value, Duration timeout) throws KvException;

    /**
     * Reads the latest value of {@code key}.
     *
     * @return the entry, or empty if the key was never written, was deleted, or has expired
     * @throws KvTimeoutException if no response arrives in time
     * @throws KvException for any failure other than not-found
     */
    Optional<KvEntry> get(String key, Duration timeout) throws KvException;

    /**
     * Enumerates the live entries of the bucket.
     *
     * @param idleTimeout longest wait for the next entry before the sequence ends
     * @param timeout longest wait for the enumeration to start
     * @throws KvException if the enumeration cannot be started
     */
    EntrySequence watchAll(Duration idleTimeout, Duration timeout) throws KvException;

    /**
     * Releases the handle. Never deletes the bucket or its keys. Idempotent.
     */
    @Override
    void close();
}
