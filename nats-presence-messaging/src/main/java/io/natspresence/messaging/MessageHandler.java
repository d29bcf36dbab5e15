package io.natspresence.messaging;

/**
 * Receives messages for a subscription.
 *
 * <p>Called on the client's dispatch thread, one message at a time per client. A handler that
 * throws has its exception logged; delivery of later messages continues.
 */
@FunctionalInterface
public interface MessageHandler {
    void onMessage(ReceivedMessage message);
}
