package io.usbjobs.internal.mongo;

import io.usbjobs.core.JobLogEntry;
import io.usbjobs.core.JobLogWriter;
import io.usbjobs.core.JobStatus;
import io.usbjobs.core.LeaseManager;
import io.usbjobs.core.LogCategory;
import io.usbjobs.core.LogLevel;
import io.usbjobs.core.ProcessingJob;
import io.usbjobs.core.StorageStatus;
import com.mongodb.client.result.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lease protocol on top of {@code processing_jobs}.
 *
 * <p>Every transition is a single conditional write, so two workers racing for the same job cannot both win:
 * <ul>
 *   <li>acquire: findAndModify on the oldest waiting job whose lease is absent or expired</li>
 *   <li>extend/release/progress: update guarded by {@code lockedBy == workerId}</li>
 *   <li>reset: per-job compare-and-set on the owner and expiry that were observed as expired</li>
 * </ul>
 */
public class MongoLeaseManager implements LeaseManager {
    private static final Logger log = LoggerFactory.getLogger(MongoLeaseManager.class);

    static final String LEASE_EXPIRED_MESSAGE = "Lease expired - worker crashed or timed out";
    static final String ATTEMPTS_EXHAUSTED_MESSAGE = "Retry attempts exhausted";

    private final MongoTemplate mongoTemplate;
    private final JobLogWriter jobLog;
    private final int maxAttempts;
    private final Clock clock;

    public MongoLeaseManager(MongoTemplate mongoTemplate, JobLogWriter jobLog, int maxAttempts) {
        this(mongoTemplate, jobLog, maxAttempts, Clock.systemUTC());
    }

    public MongoLeaseManager(MongoTemplate mongoTemplate, JobLogWriter jobLog, int maxAttempts, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.jobLog = Objects.requireNonNull(jobLog, "jobLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be a positive number");
        }
        this.maxAttempts = maxAttempts;
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Atomically lease the oldest waiting job.
     *
     * <p>Eligible: status pending or retry, lease absent or expired, attempts below the ceiling.
     * The winner moves the job to processing, stamps owner and expiry and counts the attempt.
     */
    @Override
    public Optional<ProcessingJob> acquireLease(String workerId, Duration leaseDuration) {
        requireWorker(workerId);
        requirePositive(leaseDuration);

        Instant now = now();
        Instant until = now.plus(leaseDuration);

        Query q = new Query(
                Criteria.where("status").in(JobStatus.acquirable())
                        .and("attempts").lt(maxAttempts)
                        .andOperator(new Criteria().orOperator(
                                Criteria.where("lockedUntil").is(null),
                                Criteria.where("lockedUntil").lte(now)
                        ))
        );
        q.with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));

        Update u = new Update()
                .set("lockedBy", workerId)
                .set("lockedUntil", until)
                .set("status", JobStatus.PROCESSING)
                .set("storageStatus", StorageStatus.from(JobStatus.PROCESSING).value())
                .set("startedAt", now)
                .set("updatedAt", now)
                .inc("attempts", 1);

        ProcessingJobDocument doc = mongoTemplate.findAndModify(
                q,
                u,
                FindAndModifyOptions.options().returnNew(true),
                ProcessingJobDocument.class
        );
        if (doc == null) {
            return Optional.empty();
        }

        ProcessingJob job = JobDocuments.toJob(doc);
        log.debug("usbjobs lease acquired jobId={} workerId={} lockedUntil={} attempt={}",
                job.id(), workerId, until, job.attempts());
        jobLog.write(JobLogEntry.builder(job.id(), LogLevel.INFO, LogCategory.LEASE,
                        "Lease acquired by worker " + workerId)
                .detail("workerId", workerId)
                .detail("leaseUntil", until.toString())
                .detail("attempt", job.attempts()));
        return Optional.of(job);
    }

    /**
     * Push the expiry out. Only the current owner of a still-valid lease succeeds.
     */
    @Override
    public boolean extendLease(long jobId, String workerId, Duration additional) {
        requireWorker(workerId);
        requirePositive(additional);

        Instant now = now();
        Query q = new Query(Criteria.where("_id").is(jobId)
                .and("lockedBy").is(workerId)
                .and("lockedUntil").gt(now));
        Update u = new Update()
                .set("lockedUntil", now.plus(additional))
                .set("updatedAt", now);

        UpdateResult r = mongoTemplate.updateFirst(q, u, ProcessingJobDocument.class);
        boolean extended = r.getMatchedCount() > 0;
        if (extended) {
            log.debug("usbjobs lease extended jobId={} workerId={} by={}", jobId, workerId, additional);
        }
        return extended;
    }

    @Override
    public boolean releaseLease(long jobId, String workerId, JobStatus finalStatus, String error) {
        requireWorker(workerId);
        Objects.requireNonNull(finalStatus, "finalStatus must not be null");
        if (finalStatus.isActive()) {
            throw new IllegalArgumentException("finalStatus must not be an in-progress status: " + finalStatus);
        }

        Instant now = now();
        Query q = new Query(Criteria.where("_id").is(jobId).and("lockedBy").is(workerId));

        Update u = new Update()
                .set("lockedBy", null)
                .set("lockedUntil", null)
                .set("status", finalStatus)
                .set("storageStatus", StorageStatus.from(finalStatus).value())
                .set("updatedAt", now);
        if (error != null) {
            u.set("lastError", error);
        } else {
            u.unset("lastError");
        }
        if (finalStatus.isTerminal()) {
            u.set("finishedAt", now);
        }
        if (finalStatus == JobStatus.DONE) {
            u.set("progress", 100);
        }
        if (finalStatus == JobStatus.FAILED) {
            u.set("failReason", error != null ? error : "Processing failed");
        }

        UpdateResult r = mongoTemplate.updateFirst(q, u, ProcessingJobDocument.class);
        if (r.getMatchedCount() == 0) {
            log.debug("usbjobs release ignored, lease not held jobId={} workerId={}", jobId, workerId);
            return false;
        }

        LogLevel level = finalStatus == JobStatus.FAILED ? LogLevel.ERROR : LogLevel.INFO;
        jobLog.write(JobLogEntry.builder(jobId, level, LogCategory.LEASE,
                        "Lease released with status " + finalStatus.value())
                .detail("workerId", workerId)
                .detail("finalStatus", finalStatus.value())
                .detail("error", error));
        return true;
    }

    /**
     * Reclaim jobs whose holder stopped renewing.
     *
     * <p>Expired in-progress jobs go back to retry, or to failed once they have used every attempt.
     * Waiting jobs that have used every attempt are failed as well, since no worker can lease them again.
     *
     * @return number of jobs whose state changed
     */
    @Override
    public int resetExpiredLeases() {
        Instant now = now();

        Query q = new Query(Criteria.where("status").in(JobStatus.active())
                .and("lockedUntil").ne(null).lte(now));
        q.fields().include("_id", "lockedBy", "lockedUntil", "attempts", "lastError");
        List<ProcessingJobDocument> expired = mongoTemplate.find(q, ProcessingJobDocument.class);

        int changed = 0;
        for (ProcessingJobDocument doc : expired) {
            if (resetExpired(doc, now)) {
                changed++;
            }
        }
        changed += failExhausted(now);

        if (changed > 0) {
            log.info("usbjobs reset expired leases count={}", changed);
        }
        return changed;
    }

    private boolean resetExpired(ProcessingJobDocument doc, Instant now) {
        boolean exhausted = doc.getAttempts() >= maxAttempts;
        JobStatus next = exhausted ? JobStatus.FAILED : JobStatus.RETRY;

        Query cas = new Query(Criteria.where("_id").is(doc.getId())
                .and("status").in(JobStatus.active())
                .and("lockedBy").is(doc.getLockedBy())
                .and("lockedUntil").is(doc.getLockedUntil()));

        Update u = new Update()
                .set("lockedBy", null)
                .set("lockedUntil", null)
                .set("status", next)
                .set("storageStatus", StorageStatus.from(next).value())
                .set("lastError", JobDocuments.appendError(doc.getLastError(), LEASE_EXPIRED_MESSAGE))
                .set("updatedAt", now);
        if (exhausted) {
            u.set("finishedAt", now);
            u.set("failReason", "Lease expired after " + doc.getAttempts() + " attempts");
        }

        if (mongoTemplate.updateFirst(cas, u, ProcessingJobDocument.class).getModifiedCount() == 0) {
            return false;
        }

        log.warn("usbjobs lease expired jobId={} previousOwner={} attempts={} next={}",
                doc.getId(), doc.getLockedBy(), doc.getAttempts(), next.value());
        jobLog.write(JobLogEntry.builder(doc.getId(), LogLevel.WARNING, LogCategory.LEASE,
                        exhausted ? "Lease expired - job marked failed" : "Lease expired - job reset for retry")
                .detail("resetReason", "expired_lease")
                .detail("previousOwner", doc.getLockedBy())
                .detail("attempts", doc.getAttempts())
                .detail("newStatus", next.value()));
        return true;
    }

    private int failExhausted(Instant now) {
        Query q = new Query(Criteria.where("status").in(JobStatus.acquirable())
                .and("attempts").gte(maxAttempts)
                .andOperator(new Criteria().orOperator(
                        Criteria.where("lockedUntil").is(null),
                        Criteria.where("lockedUntil").lte(now)
                )));
        q.fields().include("_id", "attempts");
        List<ProcessingJobDocument> stuck = mongoTemplate.find(q, ProcessingJobDocument.class);

        int failed = 0;
        for (ProcessingJobDocument doc : stuck) {
            Query cas = new Query(Criteria.where("_id").is(doc.getId())
                    .and("status").in(JobStatus.acquirable())
                    .and("attempts").is(doc.getAttempts()));
            Update u = new Update()
                    .set("status", JobStatus.FAILED)
                    .set("storageStatus", StorageStatus.from(JobStatus.FAILED).value())
                    .set("failReason", ATTEMPTS_EXHAUSTED_MESSAGE)
                    .set("finishedAt", now)
                    .set("updatedAt", now);
            if (mongoTemplate.updateFirst(cas, u, ProcessingJobDocument.class).getModifiedCount() > 0) {
                failed++;
                jobLog.write(JobLogEntry.builder(doc.getId(), LogLevel.ERROR, LogCategory.LEASE,
                                ATTEMPTS_EXHAUSTED_MESSAGE)
                        .detail("attempts", doc.getAttempts())
                        .detail("maxAttempts", maxAttempts));
            }
        }
        return failed;
    }

    /**
     * Record progress under the caller's lease.
     */
    @Override
    public boolean reportProgress(long jobId, String workerId, int progress, String message) {
        requireWorker(workerId);
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be between 0 and 100");
        }

        Query q = new Query(Criteria.where("_id").is(jobId).and("lockedBy").is(workerId));
        Update u = new Update()
                .set("progress", progress)
                .set("updatedAt", now());

        if (mongoTemplate.updateFirst(q, u, ProcessingJobDocument.class).getMatchedCount() == 0) {
            return false;
        }
        if (message != null) {
            jobLog.write(JobLogEntry.builder(jobId, LogLevel.INFO, LogCategory.PROGRESS, message)
                    .detail("progress", progress));
        }
        return true;
    }

    /**
     * Move a leased job between the in-progress states (processing, writing, verifying).
     */
    @Override
    public boolean advanceStatus(long jobId, String workerId, JobStatus status) {
        requireWorker(workerId);
        Objects.requireNonNull(status, "status must not be null");
        if (!status.isActive()) {
            throw new IllegalArgumentException("status must be an in-progress status: " + status);
        }

        Query q = new Query(Criteria.where("_id").is(jobId)
                .and("lockedBy").is(workerId)
                .and("status").in(JobStatus.active()));
        Update u = new Update()
                .set("status", status)
                .set("storageStatus", StorageStatus.from(status).value())
                .set("updatedAt", now());

        if (mongoTemplate.updateFirst(q, u, ProcessingJobDocument.class).getMatchedCount() == 0) {
            return false;
        }
        jobLog.write(JobLogEntry.info(jobId, LogCategory.SYSTEM, "Job status updated to " + status.value()));
        return true;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static void requireWorker(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
    }

    private static void requirePositive(Duration d) {
        Objects.requireNonNull(d, "leaseDuration must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("leaseDuration must be a positive duration");
        }
    }
}
