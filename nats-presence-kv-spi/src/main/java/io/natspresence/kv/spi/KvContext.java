package io.natspresence.kv.spi;

/**
 * Bucket management capability acquired from a {@link KvConnection}.
 */
public interface KvContext {

    /**
     * Creates the bucket described by {@code config}, or attaches to it if it already exists.
     *
     * <p>Both outcomes are success. An existing bucket keeps the TTL and size bound it was created
     * with, so two processes racing to create the same bucket both end up attached to it.
     *
     * @throws KvException if the bucket can neither be created nor attached to
     */
    KvBucket createOrAttach(BucketConfig config) throws KvException;
}
