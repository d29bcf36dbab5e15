package io.natspresence.kv.jnats;

import io.nats.client.JetStreamOptions;
import io.nats.client.KeyValue;
import io.nats.client.KeyValueOptions;
import io.nats.client.api.KeyValueEntry;
import io.nats.client.api.KeyValueWatchOption;
import io.natspresence.kv.spi.EntrySequence;
import io.natspresence.kv.spi.KvBucket;
import io.natspresence.kv.spi.KvEntry;
import io.natspresence.kv.spi.KvException;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bucket handle over a JetStream key-value bucket.
 *
 * <p>The NATS client fixes the request timeout per {@link KeyValue} view, so views are cached by
 * timeout. The cache holds the {@value #MAX_CACHED_VIEWS} most recently used timeouts; callers
 * normally pass one or two fixed values.
 */
final class JnatsKvBucket implements KvBucket {
    private final JnatsKvConnection connection;
    private final String name;
    static final int MAX_CACHED_VIEWS = 4;

    private final Map<Duration, KeyValue> views = new LinkedHashMap<>(8, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<Duration, KeyValue> eldest) {
            return size() > MAX_CACHED_VIEWS;
        }
    };
    private final AtomicBoolean closed = new AtomicBoolean();

    JnatsKvBucket(JnatsKvConnection connection, String name) {
        this.connection = connection;
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public long put(String key, byte[] value, Duration timeout) throws KvException {
        Objects.requireNonNull(key, "key");
        KeyValue kv = view(timeout);
        try {
            return kv.put(key, value == null ? new byte[0] : value);
        } catch (Exception e) {
            throw JnatsErrors.wrap("put " + name + "/" + key, e);
        }
    }

    @Override
    public Optional<KvEntry> get(String key, Duration timeout) throws KvException {
        Objects.requireNonNull(key, "key");
        KeyValue kv = view(timeout);
        KeyValueEntry kve;
        try {
            kve = kv.get(key);
        } catch (Exception e) {
            throw JnatsErrors.wrap("get " + name + "/" + key, e);
        }
        // null covers never written, deleted, purged and aged out
        return kve == null ? Optional.empty() : Optional.of(toEntry(kve));
    }

    @Override
    public EntrySequence watchAll(Duration idleTimeout, Duration timeout) throws KvException {
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        KeyValue kv = view(timeout);
        JnatsEntrySequence sequence = new JnatsEntrySequence(name, idleTimeout);
        try {
            sequence.start(kv.watchAll(sequence, KeyValueWatchOption.IGNORE_DELETE));
        } catch (Exception e) {
            sequence.close();
            throw JnatsErrors.wrap("watch " + name, e);
        }
        return sequence;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            synchronized (views) {
                views.clear();
            }
        }
    }

    static KvEntry toEntry(KeyValueEntry kve) {
        Instant created = kve.getCreated() == null ? null : kve.getCreated().toInstant();
        return new KvEntry(kve.getBucket(), kve.getKey(), kve.getValue(), kve.getRevision(), created);
    }

    private KeyValue view(Duration timeout) throws KvException {
        Objects.requireNonNull(timeout, "timeout");
        if (closed.get()) throw new KvException("bucket handle " + name + " is closed");
        connection.ensureOpen();
        KeyValue kv;
        synchronized (views) {
            kv = views.get(timeout);
        }
        if (kv != null) return kv;
        try {
            KeyValueOptions options = KeyValueOptions.builder()
                    .jetStreamOptions(JetStreamOptions.builder().requestTimeout(timeout).build())
                    .build();
            kv = connection.nats().keyValue(name, options);
        } catch (Exception e) {
            throw JnatsErrors.wrap("open bucket " + name, e);
        }
        synchronized (views) {
            KeyValue raced = views.putIfAbsent(timeout, kv);
            return raced == null ? kv : raced;
        }
    }

    int cachedViewCount() {
        synchronized (views) {
            return views.size();
        }
    }
}
