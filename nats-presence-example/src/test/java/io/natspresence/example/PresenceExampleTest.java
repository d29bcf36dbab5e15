package io.natspresence.example;

import io.natspresence.client.PresenceTracker;
import io.natspresence.core.PresenceException;
import io.natspresence.core.TrackerSettings;
import io.natspresence.kv.spi.ReferenceKvStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PresenceExampleTest {

    @Test
    void defaultsComeFromClasspath() {
        TrackerSettings settings = PresenceExample.loadSettings(new Properties());

        assertThat(settings.url()).isEqualTo("nats://localhost:4222");
        assertThat(settings.bucketName()).isEqualTo("presence_demo");
        assertThat(settings.ttl()).isEqualTo(Duration.ofSeconds(10));
        assertThat(settings.clientId()).isEqualTo("presence-demo_" + ProcessHandle.current().pid());
    }

    @Test
    void prefixedOverridesWin() {
        Properties overrides = new Properties();
        overrides.setProperty("nats-presence.url", "nats://nats.internal:4222");
        overrides.setProperty("nats-presence.client-id", "demo-7");
        overrides.setProperty("nats-presence.ttl-seconds", "4");
        overrides.setProperty("user.name", "ignored");

        TrackerSettings settings = PresenceExample.loadSettings(overrides);

        assertThat(settings.url()).isEqualTo("nats://nats.internal:4222");
        assertThat(settings.clientId()).isEqualTo("demo-7");
        assertThat(settings.ttl()).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void badOverrideIsConfigurationError() {
        Properties overrides = new Properties();
        overrides.setProperty("nats-presence.ttl-seconds", "soon");

        assertThatThrownBy(() -> PresenceExample.loadSettings(overrides))
                .isInstanceOf(PresenceException.Configuration.class)
                .hasMessageContaining("ttl-seconds");
    }

    @Test
    void demoRunsAgainstInMemoryStore() throws Exception {
        ReferenceKvStore store = new ReferenceKvStore();
        try (PresenceTracker tracker = PresenceTracker.builder()
                .connector(store)
                .url("nats://localhost:4222")
                .bucketName("presence_demo")
                .clientId("demo-run")
                .ttlSeconds(1)
                .build()) {

            PresenceExample.run(tracker);

            assertThat(tracker.isPresent("demo-run")).isTrue();
        }
    }
}
