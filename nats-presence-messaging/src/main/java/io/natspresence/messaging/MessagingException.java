package io.natspresence.messaging;

/**
 * Base class for publish/subscribe/request failures.
 *
 * <p>Messages name the operation and subject together with the transport's diagnostic text.
 */
public abstract class MessagingException extends RuntimeException {

    protected MessagingException(String message) {
        super(message);
    }

    protected MessagingException(String message, Throwable cause) {
        super(message, cause);
    }

    public static class Connection extends MessagingException {
        public Connection(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class Publish extends MessagingException {
        public Publish(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class Subscribe extends MessagingException {
        public Subscribe(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class Request extends MessagingException {
        public Request(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * No reply arrived within the request timeout.
     */
    public static class RequestTimeout extends Request {
        public RequestTimeout(String message) {
            super(message, null);
        }
    }

    /**
     * The client was already closed.
     */
    public static class Closed extends MessagingException {
        public Closed(String message) {
            super(message);
        }
    }

    /**
     * A subject was empty or contained whitespace.
     */
    public static class InvalidSubject extends MessagingException {
        public InvalidSubject(String message) {
            super(message);
        }
    }
}
