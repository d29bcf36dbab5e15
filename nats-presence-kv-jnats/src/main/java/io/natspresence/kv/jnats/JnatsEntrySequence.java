package io.natspresence.kv.jnats;

import io.nats.client.api.KeyValueEntry;
import io.nats.client.api.KeyValueOperation;
import io.nats.client.api.KeyValueWatcher;
import io.nats.client.impl.NatsKeyValueWatchSubscription;
import io.natspresence.kv.spi.EntrySequence;
import io.natspresence.kv.spi.KvEntry;
import io.natspresence.kv.spi.KvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded view over a key-value watch.
 *
 * <p>The client's dispatch thread only copies each entry into a queue; the caller's thread drains
 * it. The sequence ends at the watch's end-of-data marker or after one idle interval without an
 * entry, and unsubscribes the watch when it ends.
 */
final class JnatsEntrySequence implements EntrySequence, KeyValueWatcher {
    private static final Logger log = LoggerFactory.getLogger(JnatsEntrySequence.class);
    private static final Object END = new Object();

    private final String bucket;
    private final long idleNanos;
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();

    private volatile NatsKeyValueWatchSubscription subscription;
    private KvEntry next;
    private boolean finished;
    private volatile boolean closed;

    JnatsEntrySequence(String bucket, Duration idleTimeout) {
        this.bucket = bucket;
        this.idleNanos = idleTimeout.toNanos();
    }

    void start(NatsKeyValueWatchSubscription subscription) {
        this.subscription = subscription;
        if (closed) unsubscribe();
    }

    @Override
    public void watch(KeyValueEntry kve) {
        offer(kve.getOperation(), JnatsKvBucket.toEntry(kve));
    }

    /**
     * Queues {@code entry} if it is a live value; delete and purge markers are dropped.
     */
    void offer(KeyValueOperation operation, KvEntry entry) {
        if (operation == KeyValueOperation.PUT && !closed) {
            queue.offer(entry);
        }
    }

    @Override
    public void endOfData() {
        queue.offer(END);
    }

    @Override
    public boolean hasNext() {
        if (next != null) return true;
        if (finished || closed) return false;
        Object item;
        try {
            item = queue.poll(idleNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new EntrySequenceException(new KvException("watch " + bucket + " interrupted", e));
        }
        if (item == null || item == END) {
            finished = true;
            close();
            return false;
        }
        next = (KvEntry) item;
        return true;
    }

    @Override
    public KvEntry next() {
        if (!hasNext()) throw new NoSuchElementException();
        KvEntry out = next;
        next = null;
        return out;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        unsubscribe();
        queue.clear();
    }

    private void unsubscribe() {
        NatsKeyValueWatchSubscription sub = subscription;
        if (sub == null) return;
        subscription = null;
        try {
            sub.unsubscribe();
        } catch (RuntimeException e) {
            log.warn("Failed to stop watch on bucket {}: {}", bucket, e.toString());
        }
    }
}
