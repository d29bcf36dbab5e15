package io.natspresence.client;

import io.natspresence.core.PresenceException;
import io.natspresence.core.PresenceKeys;
import io.natspresence.core.TrackerSettings;
import io.natspresence.kv.spi.BucketConfig;
import io.natspresence.kv.spi.EntrySequence;
import io.natspresence.kv.spi.KvBucket;
import io.natspresence.kv.spi.KvConnection;
import io.natspresence.kv.spi.KvConnector;
import io.natspresence.kv.spi.KvContext;
import io.natspresence.kv.spi.KvEntry;
import io.natspresence.kv.spi.KvException;
import io.natspresence.kv.spi.KvTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link PresenceTracker} backed by a {@link KvBucket}.
 *
 * <p>Holds exactly one connection and one bucket handle; neither is shared with other trackers.
 */
public final class KvPresenceTracker implements PresenceTracker {
    private static final Logger log = LoggerFactory.getLogger(KvPresenceTracker.class);

    private final TrackerSettings settings;
    private final Clock clock;
    private final KvConnection connection;
    private final KvBucket bucket;
    private final String ownKey;
    private final AtomicBoolean closed = new AtomicBoolean();

    private KvPresenceTracker(TrackerSettings settings, Clock clock, KvConnection connection, KvBucket bucket) {
        this.settings = settings;
        this.clock = clock;
        this.connection = connection;
        this.bucket = bucket;
        this.ownKey = PresenceKeys.keyFor(settings.clientId());
    }

    static KvPresenceTracker open(TrackerSettings settings, KvConnector connector, Clock clock) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(connector, "connector");
        Objects.requireNonNull(clock, "clock");

        KvConnection connection;
        try {
            connection = connector.connect(settings.url(), settings.connectTimeout());
        } catch (KvException e) {
            throw new PresenceException.Connection("connect to " + settings.url() + ": " + e.getMessage(), e, isTimeout(e));
        }

        try {
            KvContext context;
            try {
                context = connection.keyValueContext();
            } catch (KvException e) {
                throw new PresenceException.Connection("acquire key-value context on " + settings.url() + ": " + e.getMessage(), e, isTimeout(e));
            }

            BucketConfig config = new BucketConfig(settings.bucketName(), settings.ttl(), settings.maxValueSize());
            KvBucket bucket;
            try {
                bucket = context.createOrAttach(config);
            } catch (KvException e) {
                throw new PresenceException.Bucket("create or attach bucket " + settings.bucketName() + ": " + e.getMessage(), e, isTimeout(e));
            }

            log.debug("Presence tracker {} ready on bucket {}", settings.clientId(), settings.bucketName());
            return new KvPresenceTracker(settings, clock, connection, bucket);
        } catch (RuntimeException e) {
            connection.close(settings.operationTimeout());
            throw e;
        }
    }

    @Override
    public String bucketName() {
        return settings.bucketName();
    }

    @Override
    public String clientId() {
        return settings.clientId();
    }

    @Override
    public TrackerSettings settings() {
        return settings;
    }

    @Override
    public long sendHeartbeat() {
        return sendHeartbeat(settings.operationTimeout());
    }

    @Override
    public long sendHeartbeat(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        ensureOpen();
        String timestamp = Long.toString(clock.instant().getEpochSecond());
        try {
            long revision = bucket.put(ownKey, timestamp.getBytes(StandardCharsets.UTF_8), timeout);
            log.debug("Heartbeat {}/{} at {} (revision {})", bucket.name(), ownKey, timestamp, revision);
            return revision;
        } catch (KvException e) {
            throw new PresenceException.Heartbeat("heartbeat " + bucket.name() + "/" + ownKey + ": " + e.getMessage(), e, isTimeout(e));
        }
    }

    @Override
    public boolean isPresent(String clientId) {
        return isPresent(clientId, settings.operationTimeout());
    }

    @Override
    public boolean isPresent(String clientId, Duration timeout) {
        return read(clientId, timeout).isPresent();
    }

    @Override
    public Optional<Instant> lastHeartbeat(String clientId) {
        return lastHeartbeat(clientId, settings.operationTimeout());
    }

    @Override
    public Optional<Instant> lastHeartbeat(String clientId, Duration timeout) {
        Optional<KvEntry> entry = read(clientId, timeout);
        if (entry.isEmpty()) return Optional.empty();
        String raw = new String(entry.get().value(), StandardCharsets.UTF_8).trim();
        try {
            return Optional.of(Instant.ofEpochSecond(Long.parseLong(raw)));
        } catch (NumberFormatException e) {
            log.debug("Unreadable heartbeat value '{}' under {}", raw, entry.get().key());
            return Optional.empty();
        }
    }

    @Override
    public Set<String> listPresent() {
        return listPresent(settings.listIdleTimeout());
    }

    @Override
    public Set<String> listPresent(Duration idleTimeout) {
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        ensureOpen();
        Set<String> present = new TreeSet<>();
        try (EntrySequence entries = bucket.watchAll(idleTimeout, settings.operationTimeout())) {
            while (entries.hasNext()) {
                PresenceKeys.clientIdOf(entries.next().key()).ifPresent(present::add);
            }
        } catch (KvException e) {
            throw listFailure(e);
        } catch (EntrySequence.EntrySequenceException e) {
            throw listFailure(e.getCause());
        }
        return Collections.unmodifiableSet(present);
    }

    @Override
    public void close() {
        close(settings.operationTimeout());
    }

    @Override
    public void close(Duration timeout) {
        if (!closed.compareAndSet(false, true)) return;
        try {
            bucket.close();
        } catch (RuntimeException e) {
            log.warn("Failed to release bucket {}: {}", settings.bucketName(), e.toString());
        }
        try {
            connection.close(timeout);
        } catch (RuntimeException e) {
            log.warn("Failed to close connection to {}: {}", settings.url(), e.toString());
        }
        log.debug("Presence tracker {} closed", settings.clientId());
    }

    private Optional<KvEntry> read(String clientId, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        String key = PresenceKeys.keyFor(clientId);
        ensureOpen();
        try {
            return bucket.get(key, timeout);
        } catch (KvException e) {
            throw new PresenceException.PresenceCheck("presence check " + bucket.name() + "/" + key + ": " + e.getMessage(), e, isTimeout(e));
        }
    }

    private PresenceException listFailure(KvException e) {
        return new PresenceException.PresenceCheck("list present in " + bucket.name() + ": " + e.getMessage(), e, isTimeout(e));
    }

    private void ensureOpen() {
        if (closed.get()) throw new IllegalStateException("presence tracker " + settings.clientId() + " is closed");
    }

    private static boolean isTimeout(KvException e) {
        return e instanceof KvTimeoutException;
    }
}
