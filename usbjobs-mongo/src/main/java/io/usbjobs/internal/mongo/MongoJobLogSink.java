package io.usbjobs.internal.mongo;

import io.usbjobs.core.JobErrorSummary;
import io.usbjobs.core.JobLogEntry;
import io.usbjobs.core.JobLogFilter;
import io.usbjobs.core.JobLogSink;
import io.usbjobs.core.JobStore;
import io.usbjobs.core.LogLevel;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only job log in {@code processing_job_logs}.
 */
public class MongoJobLogSink implements JobLogSink {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoJobLogSink(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    public MongoJobLogSink(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void append(JobLogEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        mongoTemplate.insert(toDocument(entry, now()));
    }

    /**
     * Store a batch in one round trip. Entries of one batch share a timestamp and keep their order.
     */
    @Override
    public void appendAll(List<JobLogEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return;
        }
        Instant now = now();
        List<JobLogDocument> docs = new ArrayList<>(entries.size());
        for (JobLogEntry e : entries) {
            docs.add(toDocument(Objects.requireNonNull(e, "entry must not be null"), now));
        }
        mongoTemplate.insert(docs, JobLogDocument.class);
    }

    @Override
    public List<JobLogEntry> findByJobId(long jobId, int limit) {
        Query q = new Query(Criteria.where("jobId").is(jobId));
        q.with(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("_id")));
        q.limit(JobStore.clampLimit(limit));
        return toEntries(mongoTemplate.find(q, JobLogDocument.class));
    }

    @Override
    public List<JobLogEntry> findByCorrelationId(String correlationId, int limit) {
        if (correlationId == null || correlationId.isBlank()) {
            return List.of();
        }
        Query q = new Query(Criteria.where("correlationId").is(correlationId));
        q.with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));
        q.limit(JobStore.clampLimit(limit));
        return toEntries(mongoTemplate.find(q, JobLogDocument.class));
    }

    @Override
    public List<JobLogEntry> find(JobLogFilter filter, int limit) {
        Objects.requireNonNull(filter, "filter must not be null");

        List<Criteria> parts = new ArrayList<>(6);
        if (filter.jobId() != null) {
            parts.add(Criteria.where("jobId").is(filter.jobId()));
        }
        if (filter.level() != null) {
            parts.add(Criteria.where("level").is(filter.level()));
        }
        if (filter.category() != null) {
            parts.add(Criteria.where("category").is(filter.category()));
        }
        if (filter.errorCode() != null) {
            parts.add(Criteria.where("errorCode").is(filter.errorCode()));
        }
        if (filter.correlationId() != null) {
            parts.add(Criteria.where("correlationId").is(filter.correlationId()));
        }
        if (filter.from() != null || filter.to() != null) {
            Criteria created = Criteria.where("createdAt");
            if (filter.from() != null) {
                created = created.gte(filter.from());
            }
            if (filter.to() != null) {
                created = created.lte(filter.to());
            }
            parts.add(created);
        }

        Query q = parts.isEmpty()
                ? new Query()
                : new Query(new Criteria().andOperator(parts.toArray(new Criteria[0])));
        q.with(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("_id")));
        q.limit(JobStore.clampLimit(limit));
        return toEntries(mongoTemplate.find(q, JobLogDocument.class));
    }

    /**
     * Count error entries of a job by category and by error code.
     */
    @Override
    public JobErrorSummary errorSummary(long jobId) {
        Criteria errors = Criteria.where("jobId").is(jobId).and("level").is(LogLevel.ERROR.name());

        Map<String, Long> byCategory = countBy(errors, "category");
        if (byCategory.isEmpty()) {
            return JobErrorSummary.empty();
        }
        Map<String, Long> byErrorCode = countBy(
                Criteria.where("jobId").is(jobId).and("level").is(LogLevel.ERROR.name()).and("errorCode").ne(null),
                "errorCode");

        long total = 0;
        for (long n : byCategory.values()) {
            total += n;
        }
        return new JobErrorSummary(total, byCategory, byErrorCode);
    }

    private Map<String, Long> countBy(Criteria match, String field) {
        Aggregation agg = Aggregation.newAggregation(
                Aggregation.match(match),
                Aggregation.group(field).count().as("count"),
                Aggregation.sort(Sort.Direction.DESC, "count")
        );
        List<Document> rows = mongoTemplate.aggregate(agg, JobLogDocument.class, Document.class).getMappedResults();

        Map<String, Long> counts = new LinkedHashMap<>();
        for (Document row : rows) {
            Object key = row.get("_id");
            counts.put(String.valueOf(key), ((Number) row.get("count")).longValue());
        }
        return counts;
    }

    @Override
    public long deleteByJobId(long jobId) {
        Query q = new Query(Criteria.where("jobId").is(jobId));
        return mongoTemplate.remove(q, JobLogDocument.class).getDeletedCount();
    }

    @Override
    public long deleteOlderThan(Duration age) {
        Objects.requireNonNull(age, "age must not be null");
        if (age.isNegative()) {
            throw new IllegalArgumentException("age must not be negative");
        }
        Query q = new Query(Criteria.where("createdAt").lt(now().minus(age)));
        return mongoTemplate.remove(q, JobLogDocument.class).getDeletedCount();
    }

    private static JobLogDocument toDocument(JobLogEntry e, Instant createdAt) {
        JobLogDocument doc = new JobLogDocument();
        doc.setJobId(e.jobId());
        doc.setLevel(e.level());
        doc.setCategory(e.category());
        doc.setMessage(e.message());
        doc.setDetails(e.details() == null ? null : new LinkedHashMap<>(e.details()));
        doc.setFilePath(e.filePath());
        doc.setFileSize(e.fileSize());
        doc.setErrorCode(e.errorCode());
        doc.setCorrelationId(e.correlationId());
        doc.setCreatedAt(e.createdAt() != null ? e.createdAt() : createdAt);
        return doc;
    }

    private static List<JobLogEntry> toEntries(List<JobLogDocument> docs) {
        List<JobLogEntry> entries = new ArrayList<>(docs.size());
        for (JobLogDocument d : docs) {
            entries.add(new JobLogEntry(
                    d.getJobId(),
                    d.getLevel(),
                    d.getCategory(),
                    d.getMessage(),
                    d.getDetails(),
                    d.getFilePath(),
                    d.getFileSize(),
                    d.getErrorCode(),
                    d.getCorrelationId(),
                    d.getCreatedAt()
            ));
        }
        return entries;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
