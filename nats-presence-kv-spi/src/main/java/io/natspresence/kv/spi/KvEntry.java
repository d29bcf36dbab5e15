package io.natspresence.kv.spi;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One key/value/revision record read from a bucket.
 *
 * <p>Entries are detached copies: they hold no substrate resources and need no release.
 *
 * @param bucket the bucket the entry was read from
 * @param key the entry key
 * @param value the stored bytes
 * @param revision the substrate revision of the write that produced this value
 * @param created the time the value was written
 */
public record KvEntry(String bucket, String key, byte[] value, long revision, Instant created) {
    public KvEntry {
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(key, "key");
        value = value == null ? new byte[0] : value.clone();
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KvEntry other)) return false;
        return revision == other.revision
                && bucket.equals(other.bucket)
                && key.equals(other.key)
                && Arrays.equals(value, other.value)
                && Objects.equals(created, other.created);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucket, key, revision, created) * 31 + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "KvEntry{bucket=" + bucket + ", key=" + key + ", revision=" + revision + ", created=" + created + "}";
    }
}
