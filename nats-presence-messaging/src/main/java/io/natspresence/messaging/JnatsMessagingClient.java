package io.natspresence.messaging;

import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.Message;
import io.nats.client.Nats;
import io.nats.client.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link MessagingClient} over the NATS Java client.
 *
 * <p>All subscriptions share one {@link Dispatcher}, created on first use.
 */
final class JnatsMessagingClient implements MessagingClient {
    private static final Logger log = LoggerFactory.getLogger(JnatsMessagingClient.class);

    private final Connection nc;
    private final String url;
    private final Map<String, List<JnatsSubscription>> subscriptions = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Object dispatcherLock = new Object();
    private Dispatcher dispatcher;

    private JnatsMessagingClient(Connection nc, String url) {
        this.nc = nc;
        this.url = url;
    }

    static JnatsMessagingClient connect(String url, Duration timeout) {
        if (url == null || url.isBlank()) {
            throw new MessagingException.Connection("url must not be empty", null);
        }
        Objects.requireNonNull(timeout, "timeout");
        try {
            Options options = new Options.Builder()
                    .server(url)
                    .connectionTimeout(timeout)
                    .build();
            Connection nc = Nats.connect(options);
            log.debug("Connected to {}", url);
            return new JnatsMessagingClient(nc, url);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingException.Connection("connect to " + url + " interrupted", e);
        } catch (Exception e) {
            throw new MessagingException.Connection("connect to " + url + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void publish(String subject, byte[] data) {
        Subjects.require(subject);
        ensureOpen();
        try {
            nc.publish(subject, data == null ? new byte[0] : data);
        } catch (RuntimeException e) {
            throw new MessagingException.Publish("publish to " + subject + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void publish(String subject, String data) {
        publish(subject, data == null ? null : data.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Subscription subscribe(String subject, MessageHandler handler) {
        Subjects.require(subject);
        Objects.requireNonNull(handler, "handler");
        ensureOpen();
        try {
            io.nats.client.Subscription sub = dispatcher().subscribe(subject, msg -> deliver(subject, handler, msg));
            JnatsSubscription subscription = new JnatsSubscription(subject, sub);
            subscriptions.computeIfAbsent(subject, s -> new CopyOnWriteArrayList<>()).add(subscription);
            log.debug("Subscribed to {}", subject);
            return subscription;
        } catch (RuntimeException e) {
            throw new MessagingException.Subscribe("subscribe to " + subject + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void unsubscribe(String subject) {
        Subjects.require(subject);
        List<JnatsSubscription> subs = subscriptions.remove(subject);
        if (subs == null) return;
        for (JnatsSubscription sub : subs) {
            sub.close();
        }
    }

    @Override
    public byte[] request(String subject, byte[] data, Duration timeout) {
        Subjects.require(subject);
        Objects.requireNonNull(timeout, "timeout");
        ensureOpen();
        Message reply;
        try {
            reply = nc.request(subject, data == null ? new byte[0] : data, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingException.Request("request to " + subject + " interrupted", e);
        } catch (RuntimeException e) {
            throw new MessagingException.Request("request to " + subject + " failed: " + e.getMessage(), e);
        }
        // jnats reports both a timeout and "no responders" as a missing reply.
        if (reply == null) {
            throw new MessagingException.RequestTimeout("no reply on " + subject + " within " + timeout);
        }
        byte[] body = reply.getData();
        return body == null ? new byte[0] : body.clone();
    }

    @Override
    public void reply(ReceivedMessage request, byte[] data) {
        Objects.requireNonNull(request, "request");
        String replyTo = request.reply().orElseThrow(() -> new MessagingException.Publish(
                "message on " + request.subject() + " has no reply subject", null));
        publish(replyTo, data);
    }

    @Override
    public void flush(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        ensureOpen();
        try {
            nc.flush(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingException.Publish("flush to " + url + " interrupted", e);
        } catch (TimeoutException e) {
            throw new MessagingException.Publish("flush to " + url + " timed out after " + timeout, e);
        } catch (RuntimeException e) {
            throw new MessagingException.Publish("flush to " + url + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isConnected() {
        return !closed.get() && nc.getStatus() == Connection.Status.CONNECTED;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        List<String> subjects = new ArrayList<>(subscriptions.keySet());
        for (String subject : subjects) {
            unsubscribe(subject);
        }
        try {
            nc.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing connection to {}", url);
        } catch (RuntimeException e) {
            log.warn("Failed to close connection to {}: {}", url, e.toString());
        }
        log.debug("Closed connection to {}", url);
    }

    private Dispatcher dispatcher() {
        synchronized (dispatcherLock) {
            if (dispatcher == null) {
                dispatcher = nc.createDispatcher();
            }
            return dispatcher;
        }
    }

    private void deliver(String subscribedSubject, MessageHandler handler, Message msg) {
        ReceivedMessage copy = new ReceivedMessage(msg.getSubject(), msg.getReplyTo(), msg.getData());
        try {
            handler.onMessage(copy);
        } catch (RuntimeException e) {
            log.warn("Handler for {} failed on message from {}", subscribedSubject, copy.subject(), e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) throw new MessagingException.Closed("client for " + url + " is closed");
    }

    private final class JnatsSubscription implements Subscription {
        private final String subject;
        private final io.nats.client.Subscription sub;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private JnatsSubscription(String subject, io.nats.client.Subscription sub) {
            this.subject = subject;
            this.sub = sub;
        }

        @Override
        public String subject() {
            return subject;
        }

        @Override
        public boolean isActive() {
            return active.get() && sub.isActive();
        }

        @Override
        public void close() {
            if (!active.compareAndSet(true, false)) return;
            List<JnatsSubscription> subs = subscriptions.get(subject);
            if (subs != null) subs.remove(this);
            try {
                dispatcher().unsubscribe(sub);
            } catch (RuntimeException e) {
                log.warn("Failed to unsubscribe from {}: {}", subject, e.toString());
            }
        }
    }
}
