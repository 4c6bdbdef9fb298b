package com.umitunal.leaseq.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class JobMessageTest {

    @Test
    @DisplayName("Should apply defaults for unset fields")
    void testDefaults() {
        // When
        JobMessage message = JobMessage.builder("email", "json", "{}".getBytes(UTF_8)).build();

        // Then
        assertThat(message.getQueue()).isEqualTo(JobMessage.DEFAULT_QUEUE);
        assertThat(message.getPriority()).isEqualTo(JobPriority.NORMAL);
        assertThat(message.getMaxRetries()).isEqualTo(JobMessage.DEFAULT_MAX_RETRIES);
        assertThat(message.getRunAt()).isNull();
        assertThat(message.getIdempotencyKey()).isNull();
    }

    @Test
    @DisplayName("Should treat a blank idempotency key as none")
    void testBlankIdempotencyKey() {
        JobMessage message = JobMessage.builder("t", "string", new byte[0]).idempotencyKey("  ").build();

        assertThat(message.getIdempotencyKey()).isNull();
    }

    @Test
    @DisplayName("Should protect the payload from outside mutation")
    void testPayloadCopied() {
        // Given
        byte[] payload = {1, 2, 3};
        JobMessage message = JobMessage.builder("t", "bytes", payload).build();

        // When
        payload[0] = 9;
        message.getPayload()[1] = 9;

        // Then
        assertThat(message.getPayload()).isEqualTo(new byte[]{1, 2, 3});
        assertThat(message.getPayloadSize()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should copy every field through toBuilder")
    void testToBuilder() {
        // Given
        Instant runAt = Instant.parse("2024-01-01T00:00:00Z");
        JobMessage original = JobMessage.builder("t", "string", "x".getBytes(UTF_8))
                .queue("q")
                .priority(JobPriority.CRITICAL)
                .maxRetries(0)
                .runAt(runAt)
                .idempotencyKey("k")
                .build();

        // When
        JobMessage later = original.withRunAt(runAt.plusSeconds(60));

        // Then
        assertThat(original.toBuilder().build()).isEqualTo(original);
        assertThat(later.getRunAt()).isEqualTo(runAt.plusSeconds(60));
        assertThat(later.getQueue()).isEqualTo("q");
        assertThat(later.getIdempotencyKey()).isEqualTo("k");
        assertThat(later).isNotEqualTo(original);
    }

    @Test
    @DisplayName("Should reject invalid input")
    void testValidation() {
        assertThatThrownBy(() -> JobMessage.builder("", "json", new byte[0]).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JobMessage.builder("t", "json", new byte[0]).queue(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JobMessage.builder("t", "json", new byte[0]).maxRetries(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JobMessage.builder("t", "json", null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should map priorities to and from values and names")
    void testPriorityParsing() {
        assertThat(JobPriority.fromValue(4)).isEqualTo(JobPriority.CRITICAL);
        assertThat(JobPriority.parse(" high ")).isEqualTo(JobPriority.HIGH);
        assertThat(JobPriority.LOW.value()).isLessThan(JobPriority.NORMAL.value());
        assertThatThrownBy(() -> JobPriority.fromValue(7)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JobPriority.parse("urgent")).isInstanceOf(IllegalArgumentException.class);
    }
}
