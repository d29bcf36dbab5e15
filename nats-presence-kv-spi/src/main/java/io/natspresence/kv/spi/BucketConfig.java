package io.natspresence.kv.spi;

import java.time.Duration;
import java.util.Objects;

/**
 * Bucket configuration as requested at creation time.
 *
 * <p>TTL and maximum value size are bucket-wide. A bucket that already exists keeps the
 * configuration it was created with.
 */
public final class BucketConfig {
    private final String name;
    private final Duration ttl;
    private final int maxValueSize;

    public BucketConfig(String name, Duration ttl, int maxValueSize) {
        this.name = Objects.requireNonNull(name, "name");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        if (name.isEmpty()) throw new IllegalArgumentException("bucket name must not be empty");
        if (ttl.isZero() || ttl.isNegative()) throw new IllegalArgumentException("ttl must be positive");
        if (maxValueSize <= 0) throw new IllegalArgumentException("maxValueSize must be positive");
        this.maxValueSize = maxValueSize;
    }

    /**
     * Bucket name (e.g., "app_presence").
     */
    public String name() {
        return name;
    }

    /**
     * Time after which a key becomes unreadable unless rewritten.
     */
    public Duration ttl() {
        return ttl;
    }

    /**
     * Largest value, in bytes, a put may store.
     */
    public int maxValueSize() {
        return maxValueSize;
    }

    @Override
    public String toString() {
        return "BucketConfig{name=" + name + ", ttl=" + ttl + ", maxValueSize=" + maxValueSize + "}";
    }
}
