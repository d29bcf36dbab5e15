package io.natspresence.kv.spi;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceKvStoreTest {

    private static final String URL = "nats://localhost:4222";
    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private ReferenceKvStore store;
    private KvConnection connection;
    private KvBucket bucket;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        store = new ReferenceKvStore(clock);
        connection = store.connect(URL, TIMEOUT);
        bucket = connection.keyValueContext().createOrAttach(new BucketConfig("presence_test", Duration.ofSeconds(3), 256));
    }

    @AfterEach
    void tearDown() {
        bucket.close();
        connection.close();
    }

    @Test
    void getReturnsLatestValue() throws Exception {
        bucket.put("presence.a", bytes("1"), TIMEOUT);
        bucket.put("presence.a", bytes("2"), TIMEOUT);

        Optional<KvEntry> entry = bucket.get("presence.a", TIMEOUT);

        assertThat(entry).isPresent();
        assertThat(new String(entry.get().value(), StandardCharsets.UTF_8)).isEqualTo("2");
        assertThat(entry.get().bucket()).isEqualTo("presence_test");
    }

    @Test
    void getOfUnknownKeyIsEmpty() throws Exception {
        assertThat(bucket.get("presence.nobody", TIMEOUT)).isEmpty();
    }

    @Test
    void revisionsIncreaseAcrossKeys() throws Exception {
        long r1 = bucket.put("presence.a", bytes("1"), TIMEOUT);
        long r2 = bucket.put("presence.b", bytes("1"), TIMEOUT);
        long r3 = bucket.put("presence.a", bytes("2"), TIMEOUT);

        assertThat(r2).isGreaterThan(r1);
        assertThat(r3).isGreaterThan(r2);
        assertThat(bucket.get("presence.a", TIMEOUT).get().revision()).isEqualTo(r3);
    }

    @Test
    void entriesExpireAfterTtl() throws Exception {
        bucket.put("presence.a", bytes("1"), TIMEOUT);

        clock.advance(Duration.ofMillis(2999));
        assertThat(bucket.get("presence.a", TIMEOUT)).isPresent();

        clock.advance(Duration.ofMillis(1));
        assertThat(bucket.get("presence.a", TIMEOUT)).isEmpty();
    }

    @Test
    void rewriteResetsExpiry() throws Exception {
        bucket.put("presence.a", bytes("1"), TIMEOUT);
        clock.advance(Duration.ofSeconds(2));
        bucket.put("presence.a", bytes("2"), TIMEOUT);
        clock.advance(Duration.ofSeconds(2));

        assertThat(bucket.get("presence.a", TIMEOUT)).isPresent();
    }

    @Test
    void oversizedValueIsRejected() {
        byte[] big = new byte[257];

        assertThatThrownBy(() -> bucket.put("presence.a", big, TIMEOUT))
                .isInstanceOf(KvException.class)
                .hasMessageContaining("exceeds maximum");
    }

    @Test
    void invalidKeyIsRejected() {
        assertThatThrownBy(() -> bucket.put("presence.*", bytes("1"), TIMEOUT))
                .isInstanceOf(KvException.class);
        assertThatThrownBy(() -> bucket.get("presence.>", TIMEOUT))
                .isInstanceOf(KvException.class);
    }

    @Test
    void watchAllSkipsExpiredEntries() throws Exception {
        bucket.put("presence.a", bytes("1"), TIMEOUT);
        clock.advance(Duration.ofSeconds(2));
        bucket.put("presence.b", bytes("1"), TIMEOUT);
        clock.advance(Duration.ofSeconds(2));

        List<String> keys = new ArrayList<>();
        try (EntrySequence seq = bucket.watchAll(Duration.ofMillis(100), TIMEOUT)) {
            while (seq.hasNext()) {
                keys.add(seq.next().key());
            }
        }

        assertThat(keys).containsExactly("presence.b");
    }

    @Test
    void secondCreateAttachesAndKeepsOriginalConfig() throws Exception {
        try (KvConnection other = store.connect(URL, TIMEOUT)) {
            KvBucket attached = other.keyValueContext()
                    .createOrAttach(new BucketConfig("presence_test", Duration.ofSeconds(60), 1024));
            bucket.put("presence.a", bytes("1"), TIMEOUT);

            assertThat(attached.get("presence.a", TIMEOUT)).isPresent();
            assertThat(store.bucketConfig("presence_test")).isPresent();
            assertThat(store.bucketConfig("presence_test").get().ttl()).isEqualTo(Duration.ofSeconds(3));
            attached.close();
        }
    }

    @Test
    void closedHandlesRejectOperations() throws Exception {
        bucket.close();
        bucket.close();

        assertThatThrownBy(() -> bucket.get("presence.a", TIMEOUT))
                .isInstanceOf(KvException.class)
                .hasMessageContaining("closed");
    }

    @Test
    void closedConnectionRejectsBucketOperations() throws Exception {
        connection.close();
        connection.close();

        assertThat(connection.isOpen()).isFalse();
        assertThatThrownBy(() -> bucket.put("presence.a", bytes("1"), TIMEOUT))
                .isInstanceOf(KvException.class);
        assertThatThrownBy(() -> connection.keyValueContext())
                .isInstanceOf(KvException.class);
    }

    @Test
    void emptyUrlIsRejected() {
        assertThatThrownBy(() -> store.connect("", TIMEOUT)).isInstanceOf(KvException.class);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
