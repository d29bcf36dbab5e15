package io.natspresence.core;

/**
 * Base class for presence tracking failures.
 *
 * <p>Each subclass names the stage that failed. Messages carry the operation, the bucket or key
 * involved and the substrate's diagnostic text; the original cause is preserved.
 *
 * <p>A key that does not exist is never reported through this hierarchy: absence is a normal
 * result of a presence query.
 */
public abstract class PresenceException extends RuntimeException {

    private final boolean timeout;

    protected PresenceException(String message) {
        super(message);
        this.timeout = false;
    }

    protected PresenceException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    /**
     * Whether the substrate gave no response within the call's timeout.
     *
     * <p>A timed out presence check means "could not determine", not "absent".
     */
    public boolean isTimeout() {
        return timeout;
    }

    /**
     * Raised when a url, bucket name, client id, ttl or size bound is invalid.
     */
    public static class Configuration extends PresenceException {
        public Configuration(String message) {
            super(message);
        }

        public Configuration(String message, Throwable cause) {
            super(message, cause, false);
        }
    }

    /**
     * Raised when the transport is unreachable, rejects the client, or cannot provide a KV context.
     */
    public static class Connection extends PresenceException {
        public Connection(String message, Throwable cause, boolean timeout) {
            super(message, cause, timeout);
        }
    }

    /**
     * Raised when the named bucket can neither be created nor attached to.
     */
    public static class Bucket extends PresenceException {
        public Bucket(String message, Throwable cause, boolean timeout) {
            super(message, cause, timeout);
        }
    }

    /**
     * Raised when a heartbeat write fails.
     */
    public static class Heartbeat extends PresenceException {
        public Heartbeat(String message, Throwable cause, boolean timeout) {
            super(message, cause, timeout);
        }
    }

    /**
     * Raised when a presence read or enumeration fails for a reason other than not-found.
     */
    public static class PresenceCheck extends PresenceException {
        public PresenceCheck(String message, Throwable cause, boolean timeout) {
            super(message, cause, timeout);
        }
    }
}
