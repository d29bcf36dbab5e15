package io.natspresence.messaging;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A delivered message, copied out of the transport before the handler sees it.
 *
 * @param subject the subject the message was published to
 * @param replyTo the reply subject, or {@code null} when the sender expects no reply
 * @param data the payload
 */
public record ReceivedMessage(String subject, String replyTo, byte[] data) {
    public ReceivedMessage {
        Objects.requireNonNull(subject, "subject");
        data = data == null ? new byte[0] : data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public String dataAsString() {
        return new String(data, StandardCharsets.UTF_8);
    }

    public Optional<String> reply() {
        return Optional.ofNullable(replyTo);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReceivedMessage other)) return false;
        return subject.equals(other.subject)
                && Objects.equals(replyTo, other.replyTo)
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, replyTo) * 31 + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ReceivedMessage{subject=" + subject + ", replyTo=" + replyTo + ", size=" + data.length + "}";
    }
}
