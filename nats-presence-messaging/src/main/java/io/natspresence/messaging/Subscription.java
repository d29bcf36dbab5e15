package io.natspresence.messaging;

/**
 * An active interest in a subject. Closing it stops delivery; closing twice is a no-op.
 */
public interface Subscription extends AutoCloseable {
    String subject();

    boolean isActive();

    @Override
    void close();
}
