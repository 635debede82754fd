package io.usbjobs.internal.mongo;

import io.usbjobs.core.JobFilter;
import io.usbjobs.core.JobLogEntry;
import io.usbjobs.core.JobLogWriter;
import io.usbjobs.core.JobStatistics;
import io.usbjobs.core.JobStatus;
import io.usbjobs.core.JobStore;
import io.usbjobs.core.JobSubmission;
import io.usbjobs.core.LogCategory;
import io.usbjobs.core.LogLevel;
import io.usbjobs.core.ProcessingJob;
import io.usbjobs.core.StorageStatus;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.ArithmeticOperators;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for processing jobs.
 *
 * <p>Lease transitions live in {@link MongoLeaseManager}; this class covers creation, lookup, listing,
 * statistics, cancellation and retention.
 */
public class MongoJobStore implements JobStore {

    private final MongoTemplate mongoTemplate;
    private final MongoSequenceGenerator sequences;
    private final JobLogWriter jobLog;
    private final Clock clock;

    public MongoJobStore(MongoTemplate mongoTemplate, MongoSequenceGenerator sequences, JobLogWriter jobLog) {
        this(mongoTemplate, sequences, jobLog, Clock.systemUTC());
    }

    public MongoJobStore(MongoTemplate mongoTemplate, MongoSequenceGenerator sequences, JobLogWriter jobLog,
                         Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.sequences = Objects.requireNonNull(sequences, "sequences must not be null");
        this.jobLog = Objects.requireNonNull(jobLog, "jobLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Insert a new pending job.
     *
     * @return the allocated job id
     */
    @Override
    public long create(JobSubmission submission) {
        Objects.requireNonNull(submission, "submission must not be null");
        if (isBlank(submission.orderRef())) {
            throw new IllegalArgumentException("orderRef must not be blank");
        }
        if (isBlank(submission.capacity())) {
            throw new IllegalArgumentException("capacity must not be blank");
        }

        Instant now = now();
        ProcessingJobDocument doc = new ProcessingJobDocument();
        doc.setId(sequences.next(MongoSequenceGenerator.JOB_SEQUENCE));
        doc.setJobToken(submission.jobToken());
        doc.setOrderRef(submission.orderRef());
        doc.setCapacity(submission.capacity());
        doc.setPreferences(submission.preferences());
        doc.setContentPlanId(submission.contentPlanId());
        doc.setVolumeLabel(submission.volumeLabel());
        doc.setAssignedDeviceId(submission.assignedDeviceId());
        doc.setStatus(JobStatus.PENDING);
        doc.setStorageStatus(StorageStatus.from(JobStatus.PENDING).value());
        doc.setProgress(0);
        doc.setAttempts(0);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);

        mongoTemplate.insert(doc);

        jobLog.write(JobLogEntry.builder(doc.getId(), LogLevel.INFO, LogCategory.SYSTEM,
                        "Processing job created for order " + submission.orderRef())
                .detail("jobToken", submission.jobToken())
                .detail("capacity", submission.capacity()));
        return doc.getId();
    }

    @Override
    public Optional<ProcessingJob> findById(long id) {
        ProcessingJobDocument doc = mongoTemplate.findById(id, ProcessingJobDocument.class);
        return Optional.ofNullable(doc).map(JobDocuments::toJob);
    }

    @Override
    public Optional<ProcessingJob> findByJobToken(String jobToken) {
        if (isBlank(jobToken)) {
            return Optional.empty();
        }
        Query q = new Query(Criteria.where("jobToken").is(jobToken));
        return Optional.ofNullable(mongoTemplate.findOne(q, ProcessingJobDocument.class)).map(JobDocuments::toJob);
    }

    @Override
    public Optional<ProcessingJob> findLatestByOrderRef(String orderRef) {
        if (isBlank(orderRef)) {
            return Optional.empty();
        }
        Query q = new Query(Criteria.where("orderRef").is(orderRef));
        q.with(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("_id")));
        return Optional.ofNullable(mongoTemplate.findOne(q, ProcessingJobDocument.class)).map(JobDocuments::toJob);
    }

    @Override
    public List<ProcessingJob> list(JobFilter filter, int limit) {
        JobFilter f = filter == null ? JobFilter.all() : filter;

        Criteria c = buildCriteria(f);
        Query q = c == null ? new Query() : new Query(c);
        q.with(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("_id")));
        q.limit(JobStore.clampLimit(limit));

        return toJobs(mongoTemplate.find(q, ProcessingJobDocument.class));
    }

    private static Criteria buildCriteria(JobFilter f) {
        List<Criteria> parts = new ArrayList<>(5);

        if (!f.statuses().isEmpty()) {
            parts.add(JobDocuments.statusIn(f.statuses()));
        }
        if (f.orderRef() != null) {
            parts.add(Criteria.where("orderRef").is(f.orderRef()));
        }
        if (f.assignedDeviceId() != null) {
            parts.add(Criteria.where("assignedDeviceId").is(f.assignedDeviceId()));
        }
        if (f.createdFrom() != null || f.createdTo() != null) {
            Criteria created = Criteria.where("createdAt");
            if (f.createdFrom() != null) {
                created = created.gte(f.createdFrom());
            }
            if (f.createdTo() != null) {
                created = created.lte(f.createdTo());
            }
            parts.add(created);
        }

        if (parts.isEmpty()) {
            return null;
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new Criteria().andOperator(parts.toArray(new Criteria[0]));
    }

    @Override
    public JobStatistics statistics() {
        Aggregation byStatus = Aggregation.newAggregation(
                Aggregation.group("status", "storageStatus").count().as("count")
        );
        List<Document> groups = mongoTemplate
                .aggregate(byStatus, ProcessingJobDocument.class, Document.class)
                .getMappedResults();

        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        long total = 0;
        for (Document g : groups) {
            JobStatus status = groupStatus(g);
            long n = ((Number) g.get("count")).longValue();
            counts.merge(status, n, Long::sum);
            total += n;
        }

        Aggregation duration = Aggregation.newAggregation(
                Aggregation.match(Criteria.where("status").is(JobStatus.DONE.name())
                        .and("startedAt").ne(null)
                        .and("finishedAt").ne(null)),
                Aggregation.project()
                        .and(ArithmeticOperators.Subtract.valueOf("finishedAt").subtract("startedAt"))
                        .as("durationMs"),
                Aggregation.group().avg("durationMs").as("avgMs")
        );
        Document avg = mongoTemplate
                .aggregate(duration, ProcessingJobDocument.class, Document.class)
                .getUniqueMappedResult();

        double avgMinutes = 0.0;
        if (avg != null && avg.get("avgMs") instanceof Number ms) {
            avgMinutes = ms.doubleValue() / 60_000.0;
        }
        return new JobStatistics(total, counts, avgMinutes);
    }

    private static JobStatus groupStatus(Document group) {
        Object id = group.get("_id");
        Document key = id instanceof Document d ? d : group;
        String fine = key.getString("status");
        if (fine != null) {
            return JobStatus.valueOf(fine);
        }
        return StorageStatus.fromValue(key.getString("storageStatus")).toJobStatus();
    }

    /**
     * Jobs currently held under an unexpired lease, soonest expiry first.
     */
    @Override
    public List<ProcessingJob> activeLeases() {
        Query q = new Query(Criteria.where("lockedBy").ne(null).and("lockedUntil").gt(now()));
        q.with(Sort.by(Sort.Order.asc("lockedUntil")));
        return toJobs(mongoTemplate.find(q, ProcessingJobDocument.class));
    }

    @Override
    public List<ProcessingJob> expiredLeases() {
        Query q = new Query(Criteria.where("lockedBy").ne(null).and("lockedUntil").ne(null).lte(now()));
        q.with(Sort.by(Sort.Order.asc("lockedUntil")));
        return toJobs(mongoTemplate.find(q, ProcessingJobDocument.class));
    }

    /**
     * Cancel a waiting job. Jobs that are leased or already past the waiting states are left alone.
     */
    @Override
    public boolean cancel(long id) {
        Instant now = now();
        Query q = new Query(Criteria.where("_id").is(id)
                .and("status").in(JobStatus.acquirable())
                .orOperator(Criteria.where("lockedUntil").is(null), Criteria.where("lockedUntil").lte(now)));

        Update u = new Update()
                .set("status", JobStatus.CANCELED)
                .set("storageStatus", StorageStatus.from(JobStatus.CANCELED).value())
                .set("finishedAt", now)
                .set("updatedAt", now)
                .set("lockedBy", null)
                .set("lockedUntil", null);

        UpdateResult r = mongoTemplate.updateFirst(q, u, ProcessingJobDocument.class);
        if (r.getModifiedCount() == 0) {
            return false;
        }
        jobLog.write(JobLogEntry.info(id, LogCategory.SYSTEM, "Job canceled"));
        return true;
    }

    /**
     * Hard delete terminal jobs that finished before {@code cutoff}.
     *
     * @return deleted count
     */
    @Override
    public long deleteFinishedBefore(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        Query q = new Query(Criteria.where("status").in(EnumSet.of(JobStatus.DONE, JobStatus.FAILED, JobStatus.CANCELED))
                .and("finishedAt").lt(cutoff));
        return mongoTemplate.remove(q, ProcessingJobDocument.class).getDeletedCount();
    }

    private static List<ProcessingJob> toJobs(List<ProcessingJobDocument> docs) {
        List<ProcessingJob> jobs = new ArrayList<>(docs.size());
        for (ProcessingJobDocument d : docs) {
            jobs.add(JobDocuments.toJob(d));
        }
        return jobs;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
