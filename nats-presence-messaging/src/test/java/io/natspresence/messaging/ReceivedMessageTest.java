package io.natspresence.messaging;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReceivedMessageTest {

    @Test
    void payloadIsCopied() {
        byte[] raw = "hello".getBytes(StandardCharsets.UTF_8);
        ReceivedMessage message = new ReceivedMessage("greet", null, raw);

        raw[0] = 'j';
        message.data()[1] = 'a';

        assertThat(message.dataAsString()).isEqualTo("hello");
    }

    @Test
    void missingPayloadIsEmpty() {
        ReceivedMessage message = new ReceivedMessage("greet", null, null);

        assertThat(message.data()).isEmpty();
        assertThat(message.reply()).isEmpty();
    }

    @Test
    void replySubjectIsExposed() {
        ReceivedMessage message = new ReceivedMessage("svc.echo", "_INBOX.abc", new byte[0]);

        assertThat(message.reply()).contains("_INBOX.abc");
    }

    @Test
    void equalityComparesPayload() {
        ReceivedMessage a = new ReceivedMessage("s", "r", new byte[]{1, 2});
        ReceivedMessage b = new ReceivedMessage("s", "r", new byte[]{1, 2});

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(new ReceivedMessage("s", "r", new byte[]{1}));
    }

    @Test
    void subjectIsRequired() {
        assertThatThrownBy(() -> new ReceivedMessage(null, null, new byte[0]))
                .isInstanceOf(NullPointerException.class);
    }
}
