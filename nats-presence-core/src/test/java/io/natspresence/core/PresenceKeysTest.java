package io.natspresence.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PresenceKeysTest {

    @Test
    void keyForPrefixesClientId() {
        assertThat(PresenceKeys.keyFor("worker-1")).isEqualTo("presence.worker-1");
    }

    @Test
    void clientIdOfStripsPrefix() {
        assertThat(PresenceKeys.clientIdOf("presence.worker-1")).contains("worker-1");
        assertThat(PresenceKeys.clientIdOf("presence.a.b")).contains("a.b");
    }

    @Test
    void clientIdOfIgnoresForeignKeys() {
        assertThat(PresenceKeys.clientIdOf("config.worker-1")).isEmpty();
        assertThat(PresenceKeys.clientIdOf("presence.")).isEmpty();
        assertThat(PresenceKeys.clientIdOf(null)).isEmpty();
    }

    @Test
    void bucketNamesRejectWildcardsAndDots() {
        assertThat(PresenceKeys.isValidBucketName("app_presence-1")).isTrue();
        assertThat(PresenceKeys.isValidBucketName("app.presence")).isFalse();
        assertThat(PresenceKeys.isValidBucketName("app*")).isFalse();
        assertThat(PresenceKeys.isValidBucketName("app>")).isFalse();
        assertThat(PresenceKeys.isValidBucketName("")).isFalse();
    }

    @Test
    void clientIdsMustBeKeyTokens() {
        assertThat(PresenceKeys.isValidClientId("node_42")).isTrue();
        assertThat(PresenceKeys.isValidClientId("region.node")).isTrue();
        assertThat(PresenceKeys.isValidClientId("node*")).isFalse();
        assertThat(PresenceKeys.isValidClientId("node>")).isFalse();
        assertThat(PresenceKeys.isValidClientId("node.")).isFalse();
        assertThat(PresenceKeys.isValidClientId(".node")).isFalse();
        assertThat(PresenceKeys.isValidClientId("has space")).isFalse();
    }

    @Test
    void requireClientIdFailsWithConfigurationError() {
        assertThatThrownBy(() -> PresenceKeys.requireClientId(""))
                .isInstanceOf(PresenceException.Configuration.class)
                .hasMessageContaining("client id");
        assertThatThrownBy(() -> PresenceKeys.keyFor("bad>id"))
                .isInstanceOf(PresenceException.Configuration.class);
    }

    @Test
    void requireBucketNameFailsWithConfigurationError() {
        assertThatThrownBy(() -> PresenceKeys.requireBucketName("a.b"))
                .isInstanceOf(PresenceException.Configuration.class)
                .hasMessageContaining("a.b");
    }
}
