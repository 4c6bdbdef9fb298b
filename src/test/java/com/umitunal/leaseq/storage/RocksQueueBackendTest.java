package com.umitunal.leaseq.storage;

import com.umitunal.leaseq.config.BackendConfig;
import com.umitunal.leaseq.config.StorageConfig;
import com.umitunal.leaseq.core.JobEvent;
import com.umitunal.leaseq.core.JobId;
import com.umitunal.leaseq.core.JobMessage;
import com.umitunal.leaseq.core.JobPriority;
import com.umitunal.leaseq.core.JobStatus;
import com.umitunal.leaseq.core.LeaseToken;
import com.umitunal.leaseq.core.LeasedJob;
import com.umitunal.leaseq.core.QueueCapabilities;
import com.umitunal.leaseq.core.QueueCtx;
import com.umitunal.leaseq.core.QueueErrorKind;
import com.umitunal.leaseq.core.QueueMetrics;
import com.umitunal.leaseq.events.JobEventSubscription;
import com.umitunal.leaseq.model.JobRecord;
import com.umitunal.leaseq.support.MutableClock;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;

import static com.umitunal.leaseq.support.Messages.message;
import static com.umitunal.leaseq.support.QueueAssertions.assertQueueError;
import static org.assertj.core.api.Assertions.*;

class RocksQueueBackendTest {

    private static final List<String> DEFAULT_QUEUES = List.of(JobMessage.DEFAULT_QUEUE);
    private static final Duration LEASE = Duration.ofSeconds(30);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private StorageConfig storage;
    private BackendConfig config;
    private RocksQueueBackend backend;
    private QueueCtx ctx;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.startingNow();
        storage = StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .withBlockCacheSize(8)
                .build();
        config = BackendConfig.newBuilder()
                .withClock(clock)
                .withLeaseDuration(LEASE)
                .build();
        backend = new RocksQueueBackend(storage, config);
        ctx = QueueCtx.of("tenant-a");
    }

    @AfterEach
    void tearDown() {
        if (backend != null) {
            backend.close();
        }
    }

    private void reopen() throws Exception {
        backend.close();
        backend = new RocksQueueBackend(storage, config);
    }

    @Test
    @DisplayName("Should enqueue, lease and complete a job")
    void testBasicLifecycle() throws Exception {
        // Given
        JobId jobId = backend.enqueue(ctx, message(clock, "email"));

        // When
        LeasedJob leased = backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow();
        backend.ackComplete(ctx, jobId, leased.getLeaseToken(), "ok");

        // Then
        assertThat(leased.getJobId()).isEqualTo(jobId);
        assertThat(leased.getAttemptCount()).isEqualTo(1);
        JobRecord record = backend.getRecord(ctx, jobId);
        assertThat(record.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(record.getResultRef()).isEqualTo("ok");
    }

    @Test
    @DisplayName("Should lease by priority, then age")
    void testDequeueOrdering() throws Exception {
        // Given
        JobId normal = backend.enqueue(ctx, message(clock, "t"));
        clock.advance(Duration.ofMillis(1));
        JobId high = backend.enqueue(ctx, message(clock, "t", "h").priority(JobPriority.HIGH).build());
        JobId normalLater = backend.enqueue(ctx, message(clock, "t"));

        // Then
        assertThat(backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow().getJobId()).isEqualTo(high);
        assertThat(backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow().getJobId()).isEqualTo(normal);
        assertThat(backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow().getJobId()).isEqualTo(normalLater);
        assertThat(backend.dequeue(ctx, DEFAULT_QUEUES)).isEmpty();
    }

    @Test
    @DisplayName("Should keep jobs and their state across a reopen")
    void testPersistenceAcrossReopen() throws Exception {
        // Given
        JobId done = backend.enqueue(ctx, message(clock, "t"));
        LeasedJob leased = backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow();
        backend.ackComplete(ctx, done, leased.getLeaseToken(), null);
        JobId waiting = backend.enqueue(ctx, message(clock, "t"));

        // When
        reopen();

        // Then
        assertThat(backend.getStatus(ctx, done)).isEqualTo(JobStatus.COMPLETED);
        assertThat(backend.getStatus(ctx, waiting)).isEqualTo(JobStatus.PENDING);
        assertThat(backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow().getJobId()).isEqualTo(waiting);
    }

    @Test
    @DisplayName("Should continue the enqueue sequence after a reopen")
    void testSequenceRestored() throws Exception {
        // Given
        JobId first = backend.enqueue(ctx, message(clock, "t"));
        long firstSequence = backend.getRecord(ctx, first).getSequence();

        // When
        reopen();
        JobId second = backend.enqueue(ctx, message(clock, "t"));

        // Then
        assertThat(backend.getRecord(ctx, second).getSequence()).isGreaterThan(firstSequence);
        assertThat(backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow().getJobId()).isEqualTo(first);
    }

    @Test
    @DisplayName("Should keep idempotency keys across a reopen")
    void testIdempotencyPersisted() throws Exception {
        // Given
        JobMessage withKey = message(clock, "charge", "p").idempotencyKey("order-7").build();
        JobId original = backend.enqueue(ctx, withKey);

        // When
        reopen();

        // Then
        assertThat(backend.enqueue(ctx, withKey)).isEqualTo(original);
        assertThat(backend.metrics(ctx, DEFAULT_QUEUES).getTotalJobs()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should validate lease tokens and let cancellation win")
    void testAckValidation() throws Exception {
        // Given
        JobId jobId = backend.enqueue(ctx, message(clock, "t"));
        LeasedJob leased = backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow();

        // Then
        assertQueueError(() -> backend.ackComplete(ctx, jobId, LeaseToken.random(), null),
                QueueErrorKind.INVALID_LEASE_TOKEN);
        assertThat(backend.cancel(ctx, jobId)).isTrue();
        assertQueueError(() -> backend.ackComplete(ctx, jobId, leased.getLeaseToken(), null),
                QueueErrorKind.JOB_CANCELED);
        assertQueueError(() -> backend.getRecord(ctx, JobId.random()), QueueErrorKind.JOB_NOT_FOUND);
    }

    @Test
    @DisplayName("Should retry, then fail once retries are used up")
    void testRetryThenFail() throws Exception {
        // Given
        JobId jobId = backend.enqueue(ctx, message(clock, "t", "x").maxRetries(1).build());

        // When
        LeasedJob first = backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow();
        backend.ackFail(ctx, jobId, first.getLeaseToken(), "first", clock.instant().plusSeconds(1));

        // Then
        assertThat(backend.getStatus(ctx, jobId)).isEqualTo(JobStatus.RETRYING);
        assertThat(backend.dequeue(ctx, DEFAULT_QUEUES)).isEmpty();

        clock.advance(Duration.ofSeconds(1));
        LeasedJob second = backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow();
        assertThat(second.getAttemptCount()).isEqualTo(2);
        backend.ackFail(ctx, jobId, second.getLeaseToken(), "second", clock.instant());
        assertThat(backend.getStatus(ctx, jobId)).isEqualTo(JobStatus.FAILED);
    }

    @Test
    @DisplayName("Should reclaim expired leases lazily and eagerly")
    void testLeaseExpiry() throws Exception {
        // Given
        JobId lazy = backend.enqueue(ctx, message(clock, "t", "a").queue("lazy").build());
        JobId eager = backend.enqueue(ctx, message(clock, "t", "b").queue("eager").build());
        LeasedJob lazyLease = backend.dequeue(ctx, List.of("lazy")).orElseThrow();
        backend.dequeue(ctx, List.of("eager")).orElseThrow();

        // When
        clock.advance(LEASE);
        LeasedJob relapsed = backend.dequeue(ctx, List.of("lazy")).orElseThrow();
        int recovered = backend.recoverExpiredLeases();

        // Then
        assertThat(relapsed.getJobId()).isEqualTo(lazy);
        assertThat(relapsed.getAttemptCount()).isEqualTo(2);
        assertQueueError(() -> backend.ackComplete(ctx, lazy, lazyLease.getLeaseToken(), null),
                QueueErrorKind.INVALID_LEASE_TOKEN);
        assertThat(recovered).isEqualTo(1);
        assertThat(backend.getStatus(ctx, eager)).isEqualTo(JobStatus.RETRYING);
    }

    @Test
    @DisplayName("Should extend a lease with a heartbeat")
    void testHeartbeat() throws Exception {
        // Given
        JobId jobId = backend.enqueue(ctx, message(clock, "t"));
        LeasedJob leased = backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow();

        // When
        backend.heartbeatExtend(ctx, jobId, leased.getLeaseToken(), Duration.ofSeconds(30));
        clock.advance(LEASE.plusSeconds(5));

        // Then
        backend.ackComplete(ctx, jobId, leased.getLeaseToken(), null);
        assertThat(backend.getStatus(ctx, jobId)).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    @DisplayName("Should not expose dead-letter operations")
    void testDeadLettersUnsupported() {
        assertThat(backend.capabilities().supports(QueueCapabilities.Capability.DEAD_LETTER_QUEUE)).isFalse();
        assertThat(backend.capabilities().supports(QueueCapabilities.Capability.IDEMPOTENCY)).isTrue();
        assertQueueError(() -> backend.deadLetters(ctx), QueueErrorKind.BACKEND_UNSUPPORTED);
        assertQueueError(() -> backend.replayDeadLetter(ctx, JobId.random()), QueueErrorKind.BACKEND_UNSUPPORTED);
    }

    @Test
    @DisplayName("Should keep tenants apart, including tenants sharing an id prefix")
    void testTenantIsolation() throws Exception {
        // Given
        QueueCtx prefixed = QueueCtx.of("tenant-a/sub");
        backend.enqueue(prefixed, message(clock, "t"));
        JobId own = backend.enqueue(ctx, message(clock, "t"));

        // When
        QueueMetrics metrics = backend.metrics(ctx, DEFAULT_QUEUES);

        // Then
        assertThat(metrics.getTotalJobs()).isEqualTo(1);
        assertThat(backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow().getJobId()).isEqualTo(own);
        assertThat(backend.dequeue(ctx, DEFAULT_QUEUES)).isEmpty();
        assertThat(backend.dequeue(QueueCtx.of("tenant-b"), DEFAULT_QUEUES)).isEmpty();
    }

    @Test
    @DisplayName("Should purge terminal jobs and free their idempotency keys")
    void testPurgeTerminal() throws Exception {
        // Given
        JobMessage withKey = message(clock, "t", "p").idempotencyKey("k").build();
        JobId done = backend.enqueue(ctx, withKey);
        LeasedJob leased = backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow();
        backend.ackComplete(ctx, done, leased.getLeaseToken(), null);
        JobId waiting = backend.enqueue(ctx, message(clock, "t"));

        // When
        long purged = backend.purgeTerminal(ctx);

        // Then
        assertThat(purged).isEqualTo(1);
        assertQueueError(() -> backend.getRecord(ctx, done), QueueErrorKind.JOB_NOT_FOUND);
        assertThat(backend.getStatus(ctx, waiting)).isEqualTo(JobStatus.PENDING);
        assertThat(backend.enqueue(ctx, withKey)).isNotEqualTo(done);
    }

    @Test
    @DisplayName("Should publish events for each transition")
    void testEvents() throws Exception {
        // Given
        JobEventSubscription events = backend.eventStream(ctx);

        // When
        JobId jobId = backend.enqueue(ctx, message(clock, "t"));
        LeasedJob leased = backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow();
        backend.ackFail(ctx, jobId, leased.getLeaseToken(), "boom", clock.instant());

        // Then
        assertThat(events.drain()).extracting(JobEvent::getKind)
                .containsExactly(JobEvent.Kind.ENQUEUED, JobEvent.Kind.LEASED, JobEvent.Kind.RETRYING);
    }

    @Test
    @DisplayName("Should not resolve another tenant's job through an id containing a slash")
    void testCrossTenantLookupThroughSlashedId() throws Exception {
        // Given
        QueueCtx victim = QueueCtx.of("acme/sub");
        QueueCtx other = QueueCtx.of("acme");
        JobId victimJob = backend.enqueue(victim, message(clock, "t"));
        JobId forged = JobId.of("sub/" + victimJob.value());

        // When / Then
        assertQueueError(() -> backend.getRecord(other, forged), QueueErrorKind.JOB_NOT_FOUND);
        assertQueueError(() -> backend.getStatus(other, forged), QueueErrorKind.JOB_NOT_FOUND);
        assertQueueError(() -> backend.cancel(other, forged), QueueErrorKind.JOB_NOT_FOUND);
        assertQueueError(() -> backend.ackComplete(other, forged, LeaseToken.random(), null),
                QueueErrorKind.JOB_NOT_FOUND);
        assertThat(backend.getStatus(victim, victimJob)).isEqualTo(JobStatus.PENDING);
    }

    @Test
    @DisplayName("Should keep idempotency scopes apart when names contain separator characters")
    void testIdempotencyScopeWithSeparators() throws Exception {
        // Given
        JobMessage first = message(clock, "b/c", "one").queue("a").idempotencyKey("k").build();
        JobMessage second = message(clock, "c", "two").queue("a/b").idempotencyKey("k").build();
        JobMessage third = message(clock, "b:c", "three").queue("a").idempotencyKey("k").build();
        JobMessage fourth = message(clock, "c", "four").queue("a:b").idempotencyKey("k").build();

        // When
        List<JobId> ids = List.of(
                backend.enqueue(ctx, first), backend.enqueue(ctx, second),
                backend.enqueue(ctx, third), backend.enqueue(ctx, fourth));
        reopen();

        // Then
        assertThat(new HashSet<>(ids)).hasSize(4);
        assertThat(backend.getRecord(ctx, ids.get(1)).getQueue()).isEqualTo("a/b");
        assertThat(backend.enqueue(ctx, second)).isEqualTo(ids.get(1));
        assertThat(backend.enqueue(ctx, first)).isEqualTo(ids.get(0));
    }

    @Test
    @DisplayName("Should make a message without runAt eligible at the backend clock's time")
    void testDefaultRunAtUsesBackendClock() throws Exception {
        // Given
        clock.set(Instant.parse("2020-01-01T00:00:00Z"));
        JobMessage message = JobMessage.builder("email", "bytes", new byte[]{1}).build();

        // When
        JobId jobId = backend.enqueue(ctx, message);
        reopen();

        // Then
        assertThat(backend.getRecord(ctx, jobId).getEligibleAt()).isEqualTo(clock.instant());
        assertThat(backend.dequeue(ctx, DEFAULT_QUEUES).orElseThrow().getJobId()).isEqualTo(jobId);
    }
}
