package com.umitunal.leaseq.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class QueueCtxTest {

    @Test
    @DisplayName("Should return copies from with-methods")
    void testImmutability() {
        // Given
        QueueCtx base = QueueCtx.of("tenant-a");

        // When
        QueueCtx traced = base.withTraceId("trace-1").withRequestId("req-1").withTag("region", "eu");

        // Then
        assertThat(base.getTraceId()).isNull();
        assertThat(base.getTags()).isEmpty();
        assertThat(traced.getTenantId()).isEqualTo("tenant-a");
        assertThat(traced.getTraceId()).isEqualTo("trace-1");
        assertThat(traced.getRequestId()).isEqualTo("req-1");
        assertThat(traced.getTag("region")).isEqualTo("eu");
        assertThatThrownBy(() -> traced.getTags().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should require a tenant id")
    void testTenantRequired() {
        assertThatThrownBy(() -> QueueCtx.of(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QueueCtx.of(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should build event dedup keys from job, kind and time")
    void testEventDedupKey() {
        // Given
        JobId jobId = JobId.of("job-1");
        Instant at = Instant.parse("2024-01-01T00:00:00.000000500Z");

        // When
        JobEvent completed = JobEvent.completed(jobId, "t", "q", "type", at);
        JobEvent again = JobEvent.completed(jobId, "t", "q", "type", at);
        JobEvent failed = JobEvent.failed(jobId, "t", "q", "type", at, "boom");

        // Then
        assertThat(completed.dedupKey()).isEqualTo(again.dedupKey());
        assertThat(completed.dedupKey()).isNotEqualTo(failed.dedupKey());
        assertThat(completed.dedupKey()).isNotEqualTo(
                JobEvent.completed(jobId, "t", "q", "type", at.plusNanos(1)).dedupKey());
        assertThat(failed.getError()).isEqualTo("boom");
    }

    @Test
    @DisplayName("Should classify error kinds")
    void testErrorKinds() {
        assertThat(QueueException.jobCanceled(JobId.of("j")).is(QueueErrorKind.JOB_CANCELED)).isTrue();
        assertThat(QueueErrorKind.PAYLOAD_TOO_LARGE.isPermanentForJob()).isTrue();
        assertThat(QueueErrorKind.INTERNAL.isPermanentForJob()).isFalse();
        assertThat(JobException.permanent("bad").isRetryable()).isFalse();
        assertThat(JobException.retryable("later").isRetryable()).isTrue();
    }
}
