package io.natspresence.kv.spi;

import io.natspresence.core.PresenceKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory KV substrate with bucket-wide TTL.
 *
 * <p>Every {@link #connect} returns a new connection onto the same buckets, so several trackers
 * created from one store behave like several processes sharing one server. Expiry is evaluated
 * against the supplied {@link Clock}: a value written at {@code t} is invisible from
 * {@code t + ttl} on and is purged on the next read or enumeration.
 */
public final class ReferenceKvStore implements KvConnector {
    private static final Logger log = LoggerFactory.getLogger(ReferenceKvStore.class);

    private final Clock clock;
    private final Map<String, BucketState> buckets = new ConcurrentHashMap<>();

    public ReferenceKvStore() {
        this(Clock.systemUTC());
    }

    public ReferenceKvStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public KvConnection connect(String url, Duration timeout) throws KvException {
        if (url == null || url.isBlank()) throw new KvException("url must not be empty");
        Objects.requireNonNull(timeout, "timeout");
        return new ReferenceConnection(url);
    }

    /**
     * Configuration the bucket was created with, if it exists.
     */
    public Optional<BucketConfig> bucketConfig(String name) {
        BucketState s = buckets.get(name);
        return s == null ? Optional.empty() : Optional.of(s.config);
    }

    private final class ReferenceConnection implements KvConnection {
        private final String url;
        private final AtomicBoolean closed = new AtomicBoolean();

        private ReferenceConnection(String url) {
            this.url = url;
        }

        @Override
        public KvContext keyValueContext() throws KvException {
            ensureOpen();
            return this::createOrAttach;
        }

        private KvBucket createOrAttach(BucketConfig config) throws KvException {
            Objects.requireNonNull(config, "config");
            ensureOpen();
            if (!PresenceKeys.isValidBucketName(config.name())) {
                throw new KvException("invalid bucket name: " + config.name());
            }
            BucketState state = buckets.computeIfAbsent(config.name(), n -> {
                log.debug("Created bucket {} (ttl={}, maxValueSize={})", n, config.ttl(), config.maxValueSize());
                return new BucketState(config);
            });
            return new ReferenceBucket(state, this);
        }

        @Override
        public boolean isOpen() {
            return !closed.get();
        }

        @Override
        public void close(Duration timeout) {
            closed.set(true);
        }

        void ensureOpen() throws KvException {
            if (closed.get()) throw new KvException("connection to " + url + " is closed");
        }
    }

    private final class ReferenceBucket implements KvBucket {
        private final BucketState state;
        private final ReferenceConnection connection;
        private final AtomicBoolean closed = new AtomicBoolean();

        private ReferenceBucket(BucketState state, ReferenceConnection connection) {
            this.state = state;
            this.connection = connection;
        }

        @Override
        public String name() {
            return state.config.name();
        }

        @Override
        public long put(String key, byte[] value, Duration timeout) throws KvException {
            ensureUsable();
            if (!PresenceKeys.isValidKey(key)) throw new KvException("invalid key: " + key);
            byte[] bytes = value == null ? new byte[0] : value;
            if (bytes.length > state.config.maxValueSize()) {
                throw new KvException("message size exceeds maximum allowed (" + bytes.length + " > "
                        + state.config.maxValueSize() + ") for key " + key);
            }
            return state.put(key, bytes, clock.instant());
        }

        @Override
        public Optional<KvEntry> get(String key, Duration timeout) throws KvException {
            ensureUsable();
            if (!PresenceKeys.isValidKey(key)) throw new KvException("invalid key: " + key);
            return state.get(key, clock.instant());
        }

        @Override
        public EntrySequence watchAll(Duration idleTimeout, Duration timeout) throws KvException {
            ensureUsable();
            return new SnapshotSequence(state.liveEntries(clock.instant()));
        }

        @Override
        public void close() {
            closed.set(true);
        }

        private void ensureUsable() throws KvException {
            if (closed.get()) throw new KvException("bucket handle " + name() + " is closed");
            connection.ensureOpen();
        }
    }

    private static final class BucketState {
        private final ReentrantLock lock = new ReentrantLock();
        private final BucketConfig config;
        private final Map<String, Stored> entries = new LinkedHashMap<>();
        private long lastRevision;

        private BucketState(BucketConfig config) {
            this.config = config;
        }

        long put(String key, byte[] value, Instant now) {
            lock.lock();
            try {
                long revision = ++lastRevision;
                // Re-insert so enumeration order follows write order.
                entries.remove(key);
                entries.put(key, new Stored(value.clone(), revision, now));
                return revision;
            } finally {
                lock.unlock();
            }
        }

        Optional<KvEntry> get(String key, Instant now) {
            lock.lock();
            try {
                Stored s = entries.get(key);
                if (s == null) return Optional.empty();
                if (isExpired(s, now)) {
                    entries.remove(key);
                    return Optional.empty();
                }
                return Optional.of(toEntry(key, s));
            } finally {
                lock.unlock();
            }
        }

        List<KvEntry> liveEntries(Instant now) {
            lock.lock();
            try {
                List<KvEntry> out = new ArrayList<>(entries.size());
                Iterator<Map.Entry<String, Stored>> it = entries.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<String, Stored> e = it.next();
                    if (isExpired(e.getValue(), now)) {
                        it.remove();
                    } else {
                        out.add(toEntry(e.getKey(), e.getValue()));
                    }
                }
                return out;
            } finally {
                lock.unlock();
            }
        }

        private boolean isExpired(Stored s, Instant now) {
            return !now.isBefore(s.created.plus(config.ttl()));
        }

        private KvEntry toEntry(String key, Stored s) {
            return new KvEntry(config.name(), key, s.value, s.revision, s.created);
        }
    }

    private record Stored(byte[] value, long revision, Instant created) {}

    private static final class SnapshotSequence implements EntrySequence {
        private final Iterator<KvEntry> it;
        private boolean closed;

        private SnapshotSequence(List<KvEntry> entries) {
            this.it = entries.iterator();
        }

        @Override
        public boolean hasNext() {
            return !closed && it.hasNext();
        }

        @Override
        public KvEntry next() {
            if (!hasNext()) throw new NoSuchElementException();
            return it.next();
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
