package io.natspresence.core;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Presence key schema and name validation.
 *
 * <p>The key convention {@code presence.<clientId>} is the only schema this library imposes on the
 * bucket. Everything else in the bucket is ignored by presence queries.
 */
public final class PresenceKeys {
    private PresenceKeys() {}

    /** Prefix shared by every presence key. */
    public static final String PREFIX = "presence.";

    private static final Pattern BUCKET_NAME = Pattern.compile("[A-Za-z0-9_-]+");
    private static final Pattern KEY = Pattern.compile("[-/_=.A-Za-z0-9]+");

    /**
     * Presence key for a client.
     *
     * @throws PresenceException.Configuration if the client id is not a valid key token
     */
    public static String keyFor(String clientId) {
        requireClientId(clientId);
        return PREFIX + clientId;
    }

    /**
     * Client id encoded in a presence key, or empty when the key is outside the presence domain.
     */
    public static Optional<String> clientIdOf(String key) {
        if (key == null || !key.startsWith(PREFIX) || key.length() == PREFIX.length()) {
            return Optional.empty();
        }
        return Optional.of(key.substring(PREFIX.length()));
    }

    public static boolean isValidBucketName(String name) {
        return name != null && BUCKET_NAME.matcher(name).matches();
    }

    /**
     * Keys use dot-separated tokens; wildcards and empty tokens are rejected.
     */
    public static boolean isValidKey(String key) {
        if (key == null || !KEY.matcher(key).matches()) return false;
        if (key.startsWith(".") || key.endsWith(".")) return false;
        return !key.contains("..");
    }

    public static boolean isValidClientId(String clientId) {
        return clientId != null && !clientId.isEmpty() && isValidKey(PREFIX + clientId);
    }

    public static String requireBucketName(String name) {
        if (name == null || name.isEmpty()) {
            throw new PresenceException.Configuration("bucket name must not be empty");
        }
        if (!isValidBucketName(name)) {
            throw new PresenceException.Configuration("invalid bucket name '" + name + "': only A-Z, a-z, 0-9, '_' and '-' are allowed");
        }
        return name;
    }

    public static String requireClientId(String clientId) {
        if (clientId == null || clientId.isEmpty()) {
            throw new PresenceException.Configuration("client id must not be empty");
        }
        if (!isValidClientId(clientId)) {
            throw new PresenceException.Configuration("invalid client id '" + clientId + "': not usable as a key token");
        }
        return clientId;
    }
}
