package io.usbjobs.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One append-only audit record for a job.
 *
 * <p>{@code createdAt} is assigned by the sink when the entry is stored; it is null on entries that have
 * not been persisted yet.
 */
public record JobLogEntry(
        long jobId,
        LogLevel level,
        String category,
        String message,
        Map<String, Object> details,
        String filePath,
        Long fileSize,
        String errorCode,
        String correlationId,
        Instant createdAt
) {

    public JobLogEntry {
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(message, "message must not be null");
        details = (details == null || details.isEmpty())
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static Builder builder(long jobId, LogLevel level, String category, String message) {
        return new Builder(jobId, level, category, message);
    }

    public static JobLogEntry info(long jobId, String category, String message) {
        return builder(jobId, LogLevel.INFO, category, message).build();
    }

    public static JobLogEntry warning(long jobId, String category, String message) {
        return builder(jobId, LogLevel.WARNING, category, message).build();
    }

    public static JobLogEntry error(long jobId, String category, String message) {
        return builder(jobId, LogLevel.ERROR, category, message).build();
    }

    /**
     * Copy of this entry stamped with a storage time.
     */
    public JobLogEntry withCreatedAt(Instant createdAt) {
        return new JobLogEntry(jobId, level, category, message, details, filePath, fileSize, errorCode,
                correlationId, createdAt);
    }

    public static final class Builder {
        private final long jobId;
        private final LogLevel level;
        private final String category;
        private final String message;
        private final Map<String, Object> details = new LinkedHashMap<>();
        private String filePath;
        private Long fileSize;
        private String errorCode;
        private String correlationId;

        private Builder(long jobId, LogLevel level, String category, String message) {
            this.jobId = jobId;
            this.level = Objects.requireNonNull(level, "level must not be null");
            this.category = Objects.requireNonNull(category, "category must not be null");
            this.message = Objects.requireNonNull(message, "message must not be null");
        }

        /**
         * Add a single structured detail (e.g. key="workerId", value="worker-a"). Null values are skipped.
         */
        public Builder detail(String key, Object value) {
            Objects.requireNonNull(key, "key must not be null");
            if (value != null) {
                details.put(key, value);
            }
            return this;
        }

        public Builder details(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::detail);
            }
            return this;
        }

        public Builder file(String path, Long size) {
            this.filePath = path;
            this.fileSize = size;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public JobLogEntry build() {
            return new JobLogEntry(jobId, level, category, message, details, filePath, fileSize, errorCode,
                    correlationId, null);
        }
    }
}
