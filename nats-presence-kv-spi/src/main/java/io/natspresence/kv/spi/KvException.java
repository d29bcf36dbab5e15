package io.natspresence.kv.spi;

/**
 * Exception thrown when a KV substrate operation fails.
 * Wraps the substrate's own exceptions and keeps its diagnostic text.
 */
public class KvException extends Exception {

    public KvException(String message) {
        super(message);
    }

    public KvException(String message, Throwable cause) {
        super(message, cause);
    }
}
