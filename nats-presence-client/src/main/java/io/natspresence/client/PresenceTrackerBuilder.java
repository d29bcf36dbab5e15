package io.natspresence.client;

import io.natspresence.core.TrackerSettings;
import io.natspresence.kv.spi.KvConnector;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public final class PresenceTrackerBuilder {
    private final TrackerSettings.Builder settingsBuilder = TrackerSettings.builder();
    private TrackerSettings settings;
    private KvConnector connector;
    private Clock clock = Clock.systemUTC();

    public PresenceTrackerBuilder url(String url) {
        settingsBuilder.url(url);
        return this;
    }

    public PresenceTrackerBuilder bucketName(String bucketName) {
        settingsBuilder.bucketName(bucketName);
        return this;
    }

    public PresenceTrackerBuilder clientId(String clientId) {
        settingsBuilder.clientId(clientId);
        return this;
    }

    public PresenceTrackerBuilder ttlSeconds(long ttlSeconds) {
        settingsBuilder.ttlSeconds(ttlSeconds);
        return this;
    }

    public PresenceTrackerBuilder ttl(Duration ttl) {
        settingsBuilder.ttl(ttl);
        return this;
    }

    public PresenceTrackerBuilder maxValueSize(int maxValueSize) {
        settingsBuilder.maxValueSize(maxValueSize);
        return this;
    }

    public PresenceTrackerBuilder operationTimeout(Duration timeout) {
        settingsBuilder.operationTimeout(timeout);
        return this;
    }

    public PresenceTrackerBuilder connectTimeout(Duration timeout) {
        settingsBuilder.connectTimeout(timeout);
        return this;
    }

    public PresenceTrackerBuilder listIdleTimeout(Duration timeout) {
        settingsBuilder.listIdleTimeout(timeout);
        return this;
    }

    /**
     * Uses complete settings, e.g. from {@link TrackerSettings#fromProperties}. Overrides the
     * individual setters.
     */
    public PresenceTrackerBuilder settings(TrackerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        return this;
    }

    /**
     * KV binding to use. Defaults to the binding registered through
     * {@link io.natspresence.kv.spi.KvConnectorProvider}.
     */
    public PresenceTrackerBuilder connector(KvConnector connector) {
        this.connector = Objects.requireNonNull(connector, "connector");
        return this;
    }

    /**
     * Clock used for heartbeat timestamps.
     */
    public PresenceTrackerBuilder clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    /**
     * Validates the settings, connects and creates or attaches to the bucket.
     *
     * @throws io.natspresence.core.PresenceException.Configuration for invalid settings
     * @throws io.natspresence.core.PresenceException.Connection if the server cannot be reached
     * @throws io.natspresence.core.PresenceException.Bucket if the bucket cannot be created or attached to
     */
    public PresenceTracker build() {
        TrackerSettings resolved = settings != null ? settings : settingsBuilder.build();
        KvConnector resolvedConnector = connector != null ? connector : KvConnectors.discover();
        return KvPresenceTracker.open(resolved, resolvedConnector, clock);
    }
}
