package io.natspresence.kv.spi;

/**
 * Exception thrown when the substrate gives no response within the call's timeout.
 * Allows callers to distinguish "could not determine" from other failures and from not-found.
 */
public class KvTimeoutException extends KvException {

    public KvTimeoutException(String message) {
        super(message);
    }

    public KvTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
