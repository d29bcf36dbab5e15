package io.natspresence.core;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Presence tracker configuration.
 *
 * <p>Immutable. TTL and maximum value size apply to the bucket as a whole and only take effect when
 * this tracker is the one that creates the bucket; attaching to an existing bucket keeps the
 * values it was created with.
 *
 * <p>Can be read from properties:
 * <pre>
 * nats-presence.url=nats://localhost:4222
 * nats-presence.bucket=app_presence
 * nats-presence.client-id=worker-1
 * nats-presence.ttl-seconds=10
 * </pre>
 */
public final class TrackerSettings {
    public static final String PROPERTY_PREFIX = "nats-presence.";

    public static final int DEFAULT_MAX_VALUE_SIZE = 256;
    public static final long DEFAULT_TTL_SECONDS = 10;
    public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_LIST_IDLE_TIMEOUT = Duration.ofMillis(100);

    private final String url;
    private final String bucketName;
    private final String clientId;
    private final Duration ttl;
    private final int maxValueSize;
    private final Duration operationTimeout;
    private final Duration connectTimeout;
    private final Duration listIdleTimeout;

    private TrackerSettings(Builder b) {
        this.url = b.url;
        this.bucketName = b.bucketName;
        this.clientId = b.clientId;
        this.ttl = b.ttl;
        this.maxValueSize = b.maxValueSize;
        this.operationTimeout = b.operationTimeout;
        this.connectTimeout = b.connectTimeout;
        this.listIdleTimeout = b.listIdleTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings from {@code nats-presence.*} properties. Missing optional keys fall back to
     * the defaults; missing required keys fail validation in {@link Builder#build()}.
     */
    public static TrackerSettings fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        Builder b = builder()
                .url(props.getProperty(PROPERTY_PREFIX + "url"))
                .bucketName(props.getProperty(PROPERTY_PREFIX + "bucket"))
                .clientId(props.getProperty(PROPERTY_PREFIX + "client-id"));

        Long ttlSeconds = longProperty(props, "ttl-seconds");
        if (ttlSeconds != null) b.ttlSeconds(ttlSeconds);
        Long maxValueSize = longProperty(props, "max-value-size");
        if (maxValueSize != null) {
            if (maxValueSize > Integer.MAX_VALUE) {
                throw new PresenceException.Configuration("max-value-size too large: " + maxValueSize);
            }
            b.maxValueSize(maxValueSize.intValue());
        }
        Long opMillis = longProperty(props, "operation-timeout-ms");
        if (opMillis != null) b.operationTimeout(Duration.ofMillis(opMillis));
        Long connectMillis = longProperty(props, "connect-timeout-ms");
        if (connectMillis != null) b.connectTimeout(Duration.ofMillis(connectMillis));
        Long idleMillis = longProperty(props, "list-idle-timeout-ms");
        if (idleMillis != null) b.listIdleTimeout(Duration.ofMillis(idleMillis));
        return b.build();
    }

    /** Server url, e.g. {@code nats://localhost:4222}. */
    public String url() {
        return url;
    }

    /** Name of the shared bucket, one per presence domain. */
    public String bucketName() {
        return bucketName;
    }

    /** Identity this tracker heartbeats for. */
    public String clientId() {
        return clientId;
    }

    public Duration ttl() {
        return ttl;
    }

    public int maxValueSize() {
        return maxValueSize;
    }

    public Duration operationTimeout() {
        return operationTimeout;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration listIdleTimeout() {
        return listIdleTimeout;
    }

    public Builder toBuilder() {
        return builder()
                .url(url)
                .bucketName(bucketName)
                .clientId(clientId)
                .ttl(ttl)
                .maxValueSize(maxValueSize)
                .operationTimeout(operationTimeout)
                .connectTimeout(connectTimeout)
                .listIdleTimeout(listIdleTimeout);
    }

    @Override
    public String toString() {
        return "TrackerSettings{url=" + url + ", bucket=" + bucketName + ", clientId=" + clientId
                + ", ttl=" + ttl + ", maxValueSize=" + maxValueSize + "}";
    }

    private static Long longProperty(Properties props, String name) {
        String raw = props.getProperty(PROPERTY_PREFIX + name);
        if (raw == null || raw.isBlank()) return null;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new PresenceException.Configuration("invalid " + PROPERTY_PREFIX + name + ": '" + raw + "'", e);
        }
    }

    public static final class Builder {
        private String url;
        private String bucketName;
        private String clientId;
        private Duration ttl = Duration.ofSeconds(DEFAULT_TTL_SECONDS);
        private int maxValueSize = DEFAULT_MAX_VALUE_SIZE;
        private Duration operationTimeout = DEFAULT_OPERATION_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration listIdleTimeout = DEFAULT_LIST_IDLE_TIMEOUT;

        private Builder() {}

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder bucketName(String bucketName) {
            this.bucketName = bucketName;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder ttlSeconds(long ttlSeconds) {
            if (ttlSeconds <= 0) {
                throw new PresenceException.Configuration("ttl must be a positive number of seconds, got " + ttlSeconds);
            }
            this.ttl = Duration.ofSeconds(ttlSeconds);
            return this;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder maxValueSize(int maxValueSize) {
            this.maxValueSize = maxValueSize;
            return this;
        }

        public Builder operationTimeout(Duration operationTimeout) {
            this.operationTimeout = operationTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder listIdleTimeout(Duration listIdleTimeout) {
            this.listIdleTimeout = listIdleTimeout;
            return this;
        }

        /**
         * @throws PresenceException.Configuration if any value is missing or invalid
         */
        public TrackerSettings build() {
            if (url == null || url.isBlank()) {
                throw new PresenceException.Configuration("url must not be empty");
            }
            PresenceKeys.requireBucketName(bucketName);
            PresenceKeys.requireClientId(clientId);
            requirePositive(ttl, "ttl");
            if (maxValueSize <= 0) {
                throw new PresenceException.Configuration("max value size must be positive, got " + maxValueSize);
            }
            requirePositive(operationTimeout, "operation timeout");
            requirePositive(connectTimeout, "connect timeout");
            requirePositive(listIdleTimeout, "list idle timeout");
            return new TrackerSettings(this);
        }

        private static void requirePositive(Duration d, String what) {
            if (d == null || d.isZero() || d.isNegative()) {
                throw new PresenceException.Configuration(what + " must be positive, got " + d);
            }
        }
    }
}
