package io.usbjobs.config;

import io.usbjobs.internal.mongo.JobLogDocument;
import io.usbjobs.internal.mongo.ProcessingJobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the job pipeline.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code usbjobs.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Collection {@code processing_jobs}</h3>
 * <ul>
 *   <li><b>idx_lease_acquire</b>: { status: 1, lockedUntil: 1, attempts: 1, createdAt: 1 }
 *       <br/>Used by lease acquisition and the expired-lease reaper.</li>
 *   <li><b>idx_order_ref</b>: { orderRef: 1, createdAt: -1 }
 *       <br/>Used by latest-job-for-order lookup.</li>
 *   <li><b>ux_job_token</b> (unique): { jobToken: 1 }</li>
 * </ul>
 *
 * <h3>Collection {@code processing_job_logs}</h3>
 * <ul>
 *   <li><b>idx_log_job</b>: { jobId: 1, createdAt: -1 }</li>
 *   <li><b>idx_log_correlation</b>: { correlationId: 1, createdAt: 1 }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.processing_jobs.createIndex({ status: 1, lockedUntil: 1, attempts: 1, createdAt: 1 }, { name: "idx_lease_acquire" });
 * db.processing_jobs.createIndex({ orderRef: 1, createdAt: -1 }, { name: "idx_order_ref" });
 * db.processing_jobs.createIndex({ jobToken: 1 }, { name: "ux_job_token", unique: true });
 * db.processing_job_logs.createIndex({ jobId: 1, createdAt: -1 }, { name: "idx_log_job" });
 * db.processing_job_logs.createIndex({ correlationId: 1, createdAt: 1 }, { name: "idx_log_correlation" });
 * </pre>
 */
public class UsbJobsMongoIndexConfig {

    public static final String IDX_LEASE_ACQUIRE = "idx_lease_acquire";
    public static final String IDX_ORDER_REF = "idx_order_ref";
    public static final String UX_JOB_TOKEN = "ux_job_token";
    public static final String IDX_LOG_JOB = "idx_log_job";
    public static final String IDX_LOG_CORRELATION = "idx_log_correlation";

    private final MongoTemplate mongoTemplate;

    public UsbJobsMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ProcessingJobDocument.class).createIndex(leaseAcquireIndex());
        mongoTemplate.indexOps(ProcessingJobDocument.class).createIndex(orderRefIndex());
        mongoTemplate.indexOps(ProcessingJobDocument.class).createIndex(jobTokenUniqueIndex());
        mongoTemplate.indexOps(JobLogDocument.class).createIndex(logJobIndex());
        mongoTemplate.indexOps(JobLogDocument.class).createIndex(logCorrelationIndex());
    }

    public static Index leaseAcquireIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("lockedUntil", Sort.Direction.ASC)
                .on("attempts", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_LEASE_ACQUIRE);
    }

    public static Index orderRefIndex() {
        return new Index()
                .on("orderRef", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_ORDER_REF);
    }

    public static Index jobTokenUniqueIndex() {
        return new Index()
                .on("jobToken", Sort.Direction.ASC)
                .unique()
                .named(UX_JOB_TOKEN);
    }

    public static Index logJobIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_LOG_JOB);
    }

    public static Index logCorrelationIndex() {
        return new Index()
                .on("correlationId", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_LOG_CORRELATION);
    }
}
