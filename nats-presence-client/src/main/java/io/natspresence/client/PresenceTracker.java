package io.natspresence.client;

import io.natspresence.core.TrackerSettings;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Heartbeat-based presence over a key-value bucket with a bucket-wide TTL.
 *
 * <p>A participant is present while its key {@code presence.<clientId>} exists. Heartbeats rewrite
 * the key and so restart its expiry; the TTL is the only eviction policy, and the bucket is the
 * only source of truth. Nothing is cached locally.
 *
 * <p>The tracker never schedules heartbeats: callers must send them more often than the TTL to
 * stay continuously visible. All calls block for a bounded time. A tracker owns its connection
 * and must be closed on every exit path, typically with try-with-resources.
 */
public interface PresenceTracker extends AutoCloseable {

    String bucketName();

    String clientId();

    TrackerSettings settings();

    /**
     * Writes this tracker's presence key with the current Unix time as value.
     *
     * @return the substrate revision of the write
     * @throws io.natspresence.core.PresenceException.Heartbeat if the write fails or times out
     */
    long sendHeartbeat();

    long sendHeartbeat(Duration timeout);

    /**
     * Whether {@code clientId}'s presence key currently exists.
     *
     * <p>{@code false} covers both "never heartbeated" and "heartbeat expired"; the two are
     * indistinguishable by design.
     *
     * @throws io.natspresence.core.PresenceException.PresenceCheck if the state could not be determined
     */
    boolean isPresent(String clientId);

    boolean isPresent(String clientId, Duration timeout);

    /**
     * Point-in-time snapshot of every client present in the bucket.
     *
     * <p>Two consecutive calls may differ without any heartbeat in between when a key expires in
     * the meantime.
     *
     * @throws io.natspresence.core.PresenceException.PresenceCheck if the bucket cannot be enumerated
     */
    Set<String> listPresent();

    /**
     * @param idleTimeout how long to wait for a further entry before the snapshot is considered complete
     */
    Set<String> listPresent(Duration idleTimeout);

    /**
     * Time of {@code clientId}'s latest live heartbeat, as recorded by its writer.
     */
    Optional<Instant> lastHeartbeat(String clientId);

    Optional<Instant> lastHeartbeat(String clientId, Duration timeout);

    /**
     * Releases the bucket handle and the connection. The bucket and its keys are left in place.
     * Idempotent; never throws.
     */
    @Override
    void close();

    void close(Duration timeout);

    /**
     * Connects, then creates the bucket or attaches to it if another participant already created it.
     */
    static PresenceTracker initialize(String url, String bucketName, String clientId, long ttlSeconds) {
        return builder()
                .url(url)
                .bucketName(bucketName)
                .clientId(clientId)
                .ttlSeconds(ttlSeconds)
                .build();
    }

    static PresenceTrackerBuilder builder() {
        return new PresenceTrackerBuilder();
    }
}
