package io.natspresence.messaging;

import java.time.Duration;

/**
 * Blocking publish, subscribe and request/reply over one NATS connection.
 *
 * <p>A thin layer over the transport: no retries, no buffering beyond what the client library
 * does. Closing the client closes every subscription made through it.
 */
public interface MessagingClient extends AutoCloseable {

    Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    static MessagingClient connect(String url) {
        return connect(url, DEFAULT_CONNECT_TIMEOUT);
    }

    /**
     * @throws MessagingException.Connection if the server cannot be reached within {@code timeout}
     */
    static MessagingClient connect(String url, Duration timeout) {
        return JnatsMessagingClient.connect(url, timeout);
    }

    void publish(String subject, byte[] data);

    void publish(String subject, String data);

    Subscription subscribe(String subject, MessageHandler handler);

    /**
     * Closes every subscription on {@code subject} made through this client. Unknown subjects are ignored.
     */
    void unsubscribe(String subject);

    /**
     * Sends a request and waits for the first reply.
     *
     * @throws MessagingException.RequestTimeout if no reply arrives within {@code timeout}
     */
    byte[] request(String subject, byte[] data, Duration timeout);

    /**
     * Publishes {@code data} to the reply subject of {@code request}.
     *
     * @throws MessagingException.Publish if the request carries no reply subject
     */
    void reply(ReceivedMessage request, byte[] data);

    /**
     * Waits until the server has processed everything published so far.
     */
    void flush(Duration timeout);

    boolean isConnected();

    @Override
    void close();
}
