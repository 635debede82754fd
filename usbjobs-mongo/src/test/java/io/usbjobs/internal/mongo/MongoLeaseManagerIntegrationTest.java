package io.usbjobs.internal.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.usbjobs.core.JobLogEntry;
import io.usbjobs.core.JobLogWriter;
import io.usbjobs.core.JobStatus;
import io.usbjobs.core.JobSubmission;
import io.usbjobs.core.LogCategory;
import io.usbjobs.core.ProcessingJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoLeaseManagerIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Duration LEASE = Duration.ofSeconds(300);

    private MongoClient client;
    private MongoTemplate mongoTemplate;
    private MutableClock clock;
    private MongoJobLogSink logSink;
    private MongoJobStore store;
    private MongoLeaseManager leases;

    @BeforeEach
    void setUp() {
        client = MongoClients.create(MONGO.getReplicaSetUrl());
        mongoTemplate = new MongoTemplate(client, "usbjobs_test");
        dropAll();

        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        logSink = new MongoJobLogSink(mongoTemplate, clock);
        JobLogWriter jobLog = new JobLogWriter(logSink);
        store = new MongoJobStore(mongoTemplate, new MongoSequenceGenerator(mongoTemplate), jobLog, clock);
        leases = new MongoLeaseManager(mongoTemplate, jobLog, 3, clock);
    }

    @AfterEach
    void tearDown() {
        dropAll();
        client.close();
    }

    private void dropAll() {
        mongoTemplate.dropCollection(ProcessingJobDocument.class);
        mongoTemplate.dropCollection(JobLogDocument.class);
        mongoTemplate.dropCollection(SequenceDocument.class);
    }

    @Test
    void acquireShouldLeaseOldestWaitingJobFirst() {
        long first = createJob("order-1");
        clock.advance(Duration.ofSeconds(1));
        long second = createJob("order-2");
        clock.advance(Duration.ofSeconds(1));
        long third = createJob("order-3");

        ProcessingJob leased = leases.acquireLease("worker-a", LEASE).orElseThrow();

        assertEquals(first, leased.id());
        assertEquals(JobStatus.PROCESSING, leased.status());
        assertEquals("worker-a", leased.lockedBy());
        assertEquals(clock.instant().plus(LEASE), leased.lockedUntil());
        assertEquals(1, leased.attempts());

        assertEquals(second, leases.acquireLease("worker-b", LEASE).orElseThrow().id());
        assertEquals(third, leases.acquireLease("worker-a", LEASE).orElseThrow().id());
        assertTrue(leases.acquireLease("worker-c", LEASE).isEmpty());
    }

    @Test
    void concurrentWorkersShouldNeverShareAJob() throws Exception {
        for (int i = 0; i < 20; i++) {
            createJob("order-" + i);
        }

        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch go = new CountDownLatch(1);
        Set<Long> leased = ConcurrentHashMap.newKeySet();
        AtomicInteger acquisitions = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < workers; w++) {
            String workerId = "worker-" + w;
            futures.add(pool.submit(() -> {
                go.await();
                Optional<ProcessingJob> job;
                while ((job = leases.acquireLease(workerId, LEASE)).isPresent()) {
                    acquisitions.incrementAndGet();
                    leased.add(job.get().id());
                }
                return null;
            }));
        }
        go.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(20, acquisitions.get());
        assertEquals(20, leased.size());
    }

    @Test
    void extendShouldOnlySucceedForOwnerOfLiveLease() {
        long id = createJob("order-1");
        leases.acquireLease("worker-a", LEASE).orElseThrow();

        clock.advance(Duration.ofSeconds(100));
        assertFalse(leases.extendLease(id, "worker-b", LEASE));
        assertTrue(leases.extendLease(id, "worker-a", LEASE));
        assertEquals(clock.instant().plus(LEASE), store.findById(id).orElseThrow().lockedUntil());

        clock.advance(LEASE.plusSeconds(1));
        assertFalse(leases.extendLease(id, "worker-a", LEASE));
    }

    @Test
    void releaseShouldRequireOwnership() {
        long id = createJob("order-1");
        leases.acquireLease("worker-a", LEASE).orElseThrow();

        assertFalse(leases.releaseLease(id, "worker-b", JobStatus.DONE, null));
        assertEquals(JobStatus.PROCESSING, store.findById(id).orElseThrow().status());

        clock.advance(Duration.ofMinutes(2));
        assertTrue(leases.releaseLease(id, "worker-a", JobStatus.DONE, null));

        ProcessingJob done = store.findById(id).orElseThrow();
        assertEquals(JobStatus.DONE, done.status());
        assertEquals(100, done.progress());
        assertEquals(clock.instant(), done.finishedAt());
        assertNull(done.lockedBy());
        assertNull(done.lockedUntil());
        assertFalse(leases.releaseLease(id, "worker-a", JobStatus.FAILED, "late"));
    }

    @Test
    void failedReleaseShouldRecordReason() {
        long id = createJob("order-1");
        leases.acquireLease("worker-a", LEASE).orElseThrow();

        assertTrue(leases.releaseLease(id, "worker-a", JobStatus.RETRY, "COPY_FAILED: usb unplugged"));

        ProcessingJob retry = store.findById(id).orElseThrow();
        assertEquals(JobStatus.RETRY, retry.status());
        assertEquals("COPY_FAILED: usb unplugged", retry.lastError());
        assertNull(retry.finishedAt());
        assertNull(retry.lockedBy());
    }

    @Test
    void crashedWorkerLeaseShouldBeReclaimedByAnotherWorker() {
        long id = createJob("order-1");
        leases.acquireLease("worker-a", LEASE).orElseThrow();

        assertEquals(0, leases.resetExpiredLeases());

        clock.advance(LEASE.plusSeconds(1));
        assertEquals(1, leases.resetExpiredLeases());

        ProcessingJob reset = store.findById(id).orElseThrow();
        assertEquals(JobStatus.RETRY, reset.status());
        assertNull(reset.lockedBy());
        assertTrue(reset.lastError().contains(MongoLeaseManager.LEASE_EXPIRED_MESSAGE));

        ProcessingJob again = leases.acquireLease("worker-b", LEASE).orElseThrow();
        assertEquals(id, again.id());
        assertEquals(2, again.attempts());

        Instant leasedUntil = store.findById(id).orElseThrow().lockedUntil();
        clock.advance(Duration.ofSeconds(30));
        assertFalse(leases.extendLease(id, "worker-a", LEASE));
        assertEquals(leasedUntil, store.findById(id).orElseThrow().lockedUntil());

        assertFalse(leases.releaseLease(id, "worker-a", JobStatus.DONE, null));
        ProcessingJob stillOwned = store.findById(id).orElseThrow();
        assertEquals("worker-b", stillOwned.lockedBy());
        assertEquals(JobStatus.PROCESSING, stillOwned.status());

        boolean warned = logSink.findByJobId(id, 50).stream()
                .map(JobLogEntry::message)
                .anyMatch("Lease expired - job reset for retry"::equals);
        assertTrue(warned);
    }

    @Test
    void expiredLeaseOnLastAttemptShouldFailTheJob() {
        long id = createJob("order-1");

        for (int attempt = 1; attempt <= 3; attempt++) {
            ProcessingJob job = leases.acquireLease("worker-" + attempt, LEASE).orElseThrow();
            assertEquals(attempt, job.attempts());
            clock.advance(LEASE.plusSeconds(1));
            assertEquals(1, leases.resetExpiredLeases());
        }

        ProcessingJob failed = store.findById(id).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertNotNull(failed.finishedAt());
        assertEquals(3, failed.attempts());
        assertTrue(leases.acquireLease("worker-x", LEASE).isEmpty());
    }

    @Test
    void waitingJobWithNoAttemptsLeftShouldBeFailedByReaper() {
        long id = createJob("order-1");
        mongoTemplate.updateFirst(
                Query.query(Criteria.where("_id").is(id)),
                new Update()
                        .set("status", JobStatus.RETRY)
                        .set("attempts", 3),
                ProcessingJobDocument.class);

        assertTrue(leases.acquireLease("worker-a", LEASE).isEmpty());
        assertEquals(1, leases.resetExpiredLeases());

        ProcessingJob failed = store.findById(id).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(MongoLeaseManager.ATTEMPTS_EXHAUSTED_MESSAGE, failed.failReason());
    }

    @Test
    void progressAndStatusWritesShouldBeGuardedByOwnership() {
        long id = createJob("order-1");
        leases.acquireLease("worker-a", LEASE).orElseThrow();

        assertFalse(leases.advanceStatus(id, "worker-b", JobStatus.WRITING));
        assertTrue(leases.advanceStatus(id, "worker-a", JobStatus.WRITING));
        assertFalse(leases.reportProgress(id, "worker-b", 40, null));
        assertTrue(leases.reportProgress(id, "worker-a", 40, "Copied 4/10 files"));

        ProcessingJob job = store.findById(id).orElseThrow();
        assertEquals(JobStatus.WRITING, job.status());
        assertEquals(40, job.progress());

        boolean logged = logSink.findByJobId(id, 50).stream()
                .anyMatch(e -> e.category().equals(LogCategory.PROGRESS) && e.message().equals("Copied 4/10 files"));
        assertTrue(logged);
    }

    @Test
    void expiredWritingJobShouldAlsoBeReclaimed() {
        long id = createJob("order-1");
        leases.acquireLease("worker-a", LEASE).orElseThrow();
        leases.advanceStatus(id, "worker-a", JobStatus.VERIFYING);

        clock.advance(LEASE.plusSeconds(1));

        assertEquals(1, leases.resetExpiredLeases());
        assertEquals(JobStatus.RETRY, store.findById(id).orElseThrow().status());
    }

    private long createJob(String orderRef) {
        return store.create(new JobSubmission("job-" + orderRef, orderRef, "32GB", null, null, null, null));
    }
}
