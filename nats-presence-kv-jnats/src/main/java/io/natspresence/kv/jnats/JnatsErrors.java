package io.natspresence.kv.jnats;

import io.nats.client.JetStreamApiException;
import io.natspresence.kv.spi.KvException;
import io.natspresence.kv.spi.KvTimeoutException;

import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps NATS client exceptions onto the SPI's {@link KvException} hierarchy.
 */
final class JnatsErrors {
    private JnatsErrors() {}

    static KvException wrap(String operation, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new KvException(operation + " interrupted", e);
        }
        if (isTimeout(e)) {
            return new KvTimeoutException(operation + " timed out: " + describe(e), e);
        }
        return new KvException(operation + " failed: " + describe(e), e);
    }

    /**
     * The NATS client reports request timeouts as plain {@code IOException}s, so the cause chain
     * and the message text are both checked.
     */
    static boolean isTimeout(Throwable t) {
        for (Throwable cur = t; cur != null; cur = cur.getCause()) {
            if (cur instanceof TimeoutException || cur instanceof java.net.SocketTimeoutException) {
                return true;
            }
            String msg = cur.getMessage();
            if (msg != null) {
                String lower = msg.toLowerCase(Locale.ROOT);
                if (lower.contains("timeout") || lower.contains("timed out")) return true;
            }
            if (cur.getCause() == cur) break;
        }
        return false;
    }

    static String describe(Throwable t) {
        if (t instanceof JetStreamApiException api) {
            return api.getMessage() + " [api error " + api.getApiErrorCode() + "]";
        }
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getSimpleName() : msg;
    }
}
