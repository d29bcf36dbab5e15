package io.natspresence.example;

import io.natspresence.client.PresenceTracker;
import io.natspresence.core.PresenceException;
import io.natspresence.core.TrackerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;
import java.util.Set;

/**
 * Heartbeat presence demo.
 *
 * <p>Run with: {@code java -Dnats-presence.url=nats://host:4222 io.natspresence.example.PresenceExample}
 *
 * <p>Phases:
 * <ul>
 *   <li>Active heartbeats at half the TTL, listing everyone present after each one</li>
 *   <li>Heartbeats stopped until this process drops out of the bucket</li>
 *   <li>Heartbeats resumed</li>
 * </ul>
 */
public final class PresenceExample {
    private static final Logger log = LoggerFactory.getLogger(PresenceExample.class);

    static final String CONFIG_RESOURCE = "nats-presence.properties";

    private static final int ACTIVE_ROUNDS = 6;
    private static final int EXPIRY_CHECKS = 3;
    private static final int RESUME_ROUNDS = 3;

    private PresenceExample() {}

    public static void main(String[] args) throws InterruptedException {
        TrackerSettings settings;
        try {
            settings = loadSettings(System.getProperties());
        } catch (PresenceException.Configuration e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        try (PresenceTracker tracker = PresenceTracker.builder().settings(settings).build()) {
            run(tracker);
        } catch (PresenceException e) {
            log.error("Presence demo failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Classpath defaults overlaid with {@code nats-presence.*} entries from {@code overrides}.
     * The client id defaults to {@code presence-demo_<pid>}.
     */
    static TrackerSettings loadSettings(Properties overrides) {
        Properties props = new Properties();
        try (InputStream in = PresenceExample.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + CONFIG_RESOURCE, e);
        }
        for (String name : overrides.stringPropertyNames()) {
            if (name.startsWith(TrackerSettings.PROPERTY_PREFIX)) {
                props.setProperty(name, overrides.getProperty(name));
            }
        }
        String clientIdKey = TrackerSettings.PROPERTY_PREFIX + "client-id";
        if (props.getProperty(clientIdKey, "").isBlank()) {
            props.setProperty(clientIdKey, "presence-demo_" + ProcessHandle.current().pid());
        }
        return TrackerSettings.fromProperties(props);
    }

    static void run(PresenceTracker tracker) throws InterruptedException {
        String self = tracker.clientId();
        Duration ttl = tracker.settings().ttl();
        Duration interval = ttl.dividedBy(2);
        log.info("Started presence tracking for {} in bucket {} (ttl {}s)", self, tracker.bucketName(), ttl.toSeconds());

        log.info("=== Phase 1: active heartbeats ===");
        for (int i = 1; i <= ACTIVE_ROUNDS; i++) {
            tracker.sendHeartbeat();
            Set<String> present = tracker.listPresent();
            log.info("Sent heartbeat #{}; currently present: {}", i, present);
            Thread.sleep(interval.toMillis());
        }

        log.info("=== Phase 2: TTL expiration ===");
        log.info("Stopping heartbeats; {} present: {}", self, tracker.isPresent(self));
        for (int i = 1; i <= EXPIRY_CHECKS; i++) {
            Thread.sleep(interval.toMillis());
            boolean stillPresent = tracker.isPresent(self);
            log.info("After {}s without heartbeat, present: {}", interval.multipliedBy(i).toSeconds(), stillPresent);
            if (!stillPresent) {
                log.info("Presence expired");
                break;
            }
        }

        log.info("=== Phase 3: resuming heartbeats ===");
        for (int i = 1; i <= RESUME_ROUNDS; i++) {
            tracker.sendHeartbeat();
            log.info("Sent heartbeat #{}; present again: {} (last heartbeat {})",
                    i, tracker.isPresent(self), tracker.lastHeartbeat(self).orElse(null));
            Thread.sleep(Math.min(interval.toMillis(), 3_000));
        }

        log.info("Presence demo completed");
    }
}
