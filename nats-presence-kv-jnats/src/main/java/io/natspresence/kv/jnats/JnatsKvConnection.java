package io.natspresence.kv.jnats;

import io.nats.client.Connection;
import io.nats.client.KeyValueManagement;
import io.natspresence.kv.spi.KvConnection;
import io.natspresence.kv.spi.KvContext;
import io.natspresence.kv.spi.KvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

final class JnatsKvConnection implements KvConnection {
    private static final Logger log = LoggerFactory.getLogger(JnatsKvConnection.class);

    private final Connection nc;
    private final String url;
    private final AtomicBoolean closed = new AtomicBoolean();

    JnatsKvConnection(Connection nc, String url) {
        this.nc = nc;
        this.url = url;
    }

    @Override
    public KvContext keyValueContext() throws KvException {
        ensureOpen();
        try {
            KeyValueManagement kvm = nc.keyValueManagement();
            return new JnatsKvContext(this, kvm);
        } catch (Exception e) {
            throw JnatsErrors.wrap("acquire key-value context on " + url, e);
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && nc.getStatus() != Connection.Status.CLOSED;
    }

    /**
     * Drains the connection within {@code timeout}, then closes it outright if draining did not finish.
     */
    @Override
    public void close(Duration timeout) {
        if (!closed.compareAndSet(false, true)) return;
        if (nc.getStatus() == Connection.Status.CLOSED) return;
        try {
            CompletableFuture<Boolean> drained = nc.drain(timeout);
            if (Boolean.TRUE.equals(drained.get(timeout.toMillis(), TimeUnit.MILLISECONDS))) {
                return;
            }
            log.debug("Drain of connection to {} did not complete within {}", url, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining connection to {}", url);
        } catch (Exception e) {
            log.warn("Failed to drain connection to {}: {}", url, e.toString());
        }
        closeNow();
    }

    private void closeNow() {
        try {
            nc.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing connection to {}", url);
        } catch (RuntimeException e) {
            log.warn("Failed to close connection to {}: {}", url, e.toString());
        }
    }

    Connection nats() {
        return nc;
    }

    String url() {
        return url;
    }

    void ensureOpen() throws KvException {
        if (!isOpen()) throw new KvException("connection to " + url + " is closed");
    }
}
